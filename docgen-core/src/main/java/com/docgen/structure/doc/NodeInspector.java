package com.docgen.structure.doc;

import com.docgen.structure.declaration.DeclarationKind;
import com.docgen.structure.lexing.Atom;
import com.docgen.structure.lexing.AtomKind;
import com.docgen.structure.lexing.BracketMatcher;
import com.docgen.structure.lexing.Tokenizer;
import com.docgen.structure.tree.Node;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the declaration header, parameter list, assigned value and docstring of a node by
 * re-tokenizing its source slice. A docstring is the string literal that forms the first
 * statement after the header (or the first statement of a module). Decorator lines at the start
 * of a slice are skipped.
 */
public final class NodeInspector {

  private static final Pattern STRING_PREFIX = Pattern.compile("[rRuUbB]{0,2}");
  private static final Pattern CONTINUATION = Pattern.compile("\\\\\\r?\\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final char DECORATOR = '@';

  private final Tokenizer tokenizer;
  private final BracketMatcher bracketMatcher = new BracketMatcher();

  public NodeInspector(Tokenizer tokenizer) {
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
  }

  public static NodeInspector python() {
    return new NodeInspector(Tokenizer.python());
  }

  public NodeDetails inspectModule(Node root) {
    String source = root.source().toString();
    List<Atom> atoms = bracketMatcher.match(tokenizer.tokenize(source));
    return new NodeDetails("", null, null, docstring(source, atoms, 0));
  }

  public NodeDetails inspect(Node node) {
    String source = node.source().toString();
    List<Atom> atoms = bracketMatcher.match(tokenizer.tokenize(source));
    int headerStart = declarationStart(source, atoms);
    int headerEnd = headerEnd(source, atoms, headerStart);
    String rawHeader = withoutComments(source, atoms, headerStart, headerEnd);
    String header = collapse(rawHeader);
    String parameters = null;
    String value = null;
    DeclarationKind kind = node.kind();
    if (kind == DeclarationKind.FUNCTION || kind == DeclarationKind.CLASS) {
      parameters = parameters(source, atoms, node.name(), headerStart, headerEnd);
    } else if (kind == DeclarationKind.ASSIGNMENT) {
      int equals = rawHeader.indexOf('=');
      value = equals >= 0 ? collapse(rawHeader.substring(equals + 1)) : null;
    }
    return new NodeDetails(header, parameters, value, docstring(source, atoms, headerEnd));
  }

  /** Start of the line holding the declaration, after any decorators. */
  static int declarationStart(String source, List<Atom> atoms) {
    boolean decorated = false;
    int position = skipInsignificant(source, atoms, 0);
    while (position < source.length() && source.charAt(position) == DECORATOR) {
      decorated = true;
      position = skipInsignificant(source, atoms, headerEnd(source, atoms, position));
    }
    if (!decorated) {
      return 0;
    }
    return source.lastIndexOf('\n', position - 1) + 1;
  }

  /**
   * End (exclusive) of the logical line starting at {@code from}, including continuations and
   * open brackets.
   */
  static int headerEnd(String source, List<Atom> atoms, int from) {
    int position = from;
    while (position < source.length()) {
      int newline = source.indexOf('\n', position);
      if (newline < 0) {
        return source.length();
      }
      Atom spanning = spanningAtom(atoms, newline);
      if (spanning != null) {
        position = spanning.end();
        continue;
      }
      if (continuedBefore(source, atoms, newline)) {
        position = newline + 1;
        continue;
      }
      return newline + 1;
    }
    return source.length();
  }

  private static Atom spanningAtom(List<Atom> atoms, int offset) {
    for (Atom atom : atoms) {
      if ((atom.kind() == AtomKind.STRING || atom.kind().isMatched()) && atom.contains(offset)) {
        return atom;
      }
    }
    return null;
  }

  private static boolean continuedBefore(String source, List<Atom> atoms, int newline) {
    for (Atom atom : atoms) {
      if (atom.kind() == AtomKind.LINE_CONTINUATION
          && atom.end() <= newline
          && source.substring(atom.end(), newline).replace("\r", "").isEmpty()) {
        return true;
      }
    }
    return false;
  }

  private static String withoutComments(String source, List<Atom> atoms, int start, int end) {
    StringBuilder builder = new StringBuilder(end - start);
    int position = start;
    for (Atom atom : atoms) {
      if (atom.end() <= start) {
        continue;
      }
      if (atom.start() >= end) {
        break;
      }
      if (atom.kind() == AtomKind.COMMENT) {
        if (atom.start() > position) {
          builder.append(source, position, atom.start());
        }
        position = Math.max(position, Math.min(atom.end(), end));
      }
    }
    if (position < end) {
      builder.append(source, position, end);
    }
    return CONTINUATION.matcher(builder).replaceAll(" ");
  }

  private static String parameters(
      String source, List<Atom> atoms, String name, int headerStart, int headerEnd) {
    Matcher matcher =
        Pattern.compile("(?:def|class)[ \\t]+" + Pattern.quote(name) + "(?![\\p{L}\\p{N}_])")
            .matcher(source);
    matcher.region(headerStart, source.length());
    if (!matcher.find() || matcher.end() > headerEnd) {
      return null;
    }
    int nameEnd = matcher.end();
    for (Atom atom : atoms) {
      if (atom.start() < nameEnd) {
        continue;
      }
      if (atom.kind() == AtomKind.MATCHED_PAREN
          && source.substring(nameEnd, atom.start()).isBlank()) {
        return collapse(atom.text(source)).replace("( ", "(").replace(" )", ")");
      }
      return null;
    }
    return null;
  }

  private static String docstring(String source, List<Atom> atoms, int bodyStart) {
    int position = skipInsignificant(source, atoms, bodyStart);
    Matcher prefix = STRING_PREFIX.matcher(source);
    prefix.region(position, source.length());
    int literalStart = prefix.lookingAt() ? prefix.end() : position;
    for (Atom atom : atoms) {
      if (atom.start() == literalStart && atom.kind() == AtomKind.STRING) {
        return DocstringCleaner.clean(unquote(atom.text(source)));
      }
      if (atom.start() > literalStart) {
        break;
      }
    }
    return null;
  }

  private static int skipInsignificant(String source, List<Atom> atoms, int from) {
    int position = from;
    while (position < source.length()) {
      if (Character.isWhitespace(source.charAt(position))) {
        position++;
        continue;
      }
      Atom comment = commentAt(atoms, position);
      if (comment == null) {
        break;
      }
      position = comment.end();
    }
    return position;
  }

  private static Atom commentAt(List<Atom> atoms, int offset) {
    for (Atom atom : atoms) {
      if (atom.kind() == AtomKind.COMMENT && atom.contains(offset)) {
        return atom;
      }
    }
    return null;
  }

  private static String unquote(String literal) {
    if (literal.length() >= 6 && (literal.startsWith("\"\"\"") || literal.startsWith("'''"))) {
      return literal.substring(3, literal.length() - 3);
    }
    return literal.substring(1, literal.length() - 1);
  }

  private static String collapse(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }
}
