package com.docgen.structure.tree;

import com.docgen.structure.declaration.DeclarationKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One block of the extracted structure. The root stands for the module and carries no name or
 * kind; unnamed inner nodes are blocks (for example an {@code if} body) that hold declarations.
 *
 * @param lineno 0-based line of the declaration
 * @param name declared name, {@code null} for the root and unnamed blocks
 * @param kind declaration kind, {@code null} for the root and unnamed blocks
 * @param source text from the declaration line up to the next node's line
 * @param children nested nodes in document order
 */
public record Node(
    int lineno, String name, DeclarationKind kind, SourceSlice source, List<Node> children) {

  public Node {
    Objects.requireNonNull(source, "source");
    children = children == null ? List.of() : List.copyOf(children);
  }

  public Optional<String> declaredName() {
    return Optional.ofNullable(name);
  }

  public Optional<DeclarationKind> declaredKind() {
    return Optional.ofNullable(kind);
  }

  public boolean isNamed() {
    return name != null;
  }

  /** This node followed by all descendants in document order. */
  public List<Node> preorder() {
    List<Node> ordered = new ArrayList<>();
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(this);
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      ordered.add(node);
      for (int i = node.children.size() - 1; i >= 0; i--) {
        pending.push(node.children.get(i));
      }
    }
    return ordered;
  }

  /** Concatenation of every slice in the subtree. */
  public String fullSource() {
    StringBuilder builder = new StringBuilder();
    for (Node node : preorder()) {
      builder.append(node.source);
    }
    return builder.toString();
  }

  public Optional<Node> findChild(String childName) {
    return children.stream().filter(child -> Objects.equals(child.name, childName)).findFirst();
  }
}
