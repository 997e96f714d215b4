package com.docgen.structure.tree;

import com.docgen.structure.declaration.Declaration;
import com.docgen.structure.lexing.LineIndex;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the indentation/declaration event stream into a node tree with an explicit stack of
 * open frames. Every event opens a frame and each frame owns the text from its line up to the
 * next event's line. A dedent of {@code delta} folds {@code 1 - delta} frames first, so the new
 * frame always ends up one level below the block it belongs to.
 *
 * <p>A folded frame without a declaration and without children is a plain statement. Its text
 * joins the enclosing node when nothing else of that node's body comes before it, joins the
 * plain statements right before it in the same block, and otherwise stays as an unnamed leaf
 * of the enclosing node. Unnamed frames that hold children are kept to preserve nesting depth.
 * Decorator lines open no node; the declaration after them starts at the first decorator.
 */
public final class TreeBuilder {

  public Node build(LineIndex index, List<DeclarationEvent> events) {
    String text = index.text();
    Frame root = new Frame(0, Declaration.none(), false, null, 0);
    Deque<Frame> open = new ArrayDeque<>();
    open.push(root);
    Frame current = root;

    for (DeclarationEvent event : events) {
      int boundary = index.lineStart(event.line());
      current.end = boundary;
      Frame previous = current;
      int start = boundary;
      if (event.delta() == 0 && current.decorator && open.size() > 1) {
        open.pop();
        previous = current.previous;
        start = current.start;
      } else if (event.delta() <= 0) {
        for (int i = 0; i < 1 - event.delta() && open.size() > 1; i++) {
          fold(open);
        }
      } else if (current == root) {
        // Indented first line: hold it in an empty block so its depth matches its indentation.
        Frame block = new Frame(event.line(), Declaration.none(), false, root, boundary);
        open.push(block);
        previous = block;
      }
      Frame frame =
          new Frame(event.line(), event.declaration(), event.decorator(), previous, start);
      open.push(frame);
      current = frame;
    }

    current.end = text.length();
    while (open.size() > 1) {
      fold(open);
    }
    return freeze(root, text);
  }

  private static void fold(Deque<Frame> open) {
    Frame frame = open.pop();
    Frame parent = open.peek();
    if (!frame.declaration.isPresent() && frame.children.isEmpty()) {
      Frame predecessor = frame.previous.resolve();
      if (predecessor == parent || isTrailingStatement(predecessor, parent)) {
        predecessor.end = frame.end;
        frame.absorbedInto = predecessor;
        return;
      }
    }
    parent.children.add(frame);
  }

  private static boolean isTrailingStatement(Frame candidate, Frame parent) {
    return !parent.children.isEmpty()
        && parent.children.get(parent.children.size() - 1) == candidate
        && !candidate.declaration.isPresent()
        && candidate.children.isEmpty();
  }

  private static Node freeze(Frame root, String text) {
    List<Frame> order = new ArrayList<>();
    Deque<Frame> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      Frame frame = pending.pop();
      order.add(frame);
      frame.children.forEach(pending::push);
    }
    Map<Frame, Node> built = new IdentityHashMap<>();
    for (int i = order.size() - 1; i >= 0; i--) {
      Frame frame = order.get(i);
      List<Node> children = new ArrayList<>(frame.children.size());
      for (Frame child : frame.children) {
        children.add(built.get(child));
      }
      built.put(
          frame,
          new Node(
              frame.line,
              frame.declaration.name(),
              frame.declaration.isPresent() ? frame.declaration.kind() : null,
              new SourceSlice(text, frame.start, frame.end),
              children));
    }
    return built.get(root);
  }

  private static final class Frame {
    private final int line;
    private final Declaration declaration;
    private final boolean decorator;
    private final Frame previous;
    private final int start;
    private final List<Frame> children = new ArrayList<>();
    private int end;
    private Frame absorbedInto;

    private Frame(int line, Declaration declaration, boolean decorator, Frame previous, int start) {
      this.line = line;
      this.declaration = declaration;
      this.decorator = decorator;
      this.previous = previous;
      this.start = start;
      this.end = start;
    }

    private Frame resolve() {
      Frame frame = this;
      while (frame.absorbedInto != null) {
        frame = frame.absorbedInto;
      }
      return frame;
    }
  }
}
