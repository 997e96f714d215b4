package com.docgen.structure.lexing;

import java.util.List;

/** Atom patterns for Python and its superset dialects. */
public final class PythonAtoms {

  static final String BLANK_LINE = "(?md)^([ \\t\\f\\r]*)$";

  // A comment plus every directly following line that is itself only a comment.
  static final String COMMENT_PARAGRAPH =
      "([ \\t\\f]*+#[^\\n]*+(?:\\n[ \\t\\f]*+#[^\\n]*+)*+)";

  static final String LINE_CONTINUATION = "(\\\\)(?=\\r?\\n)";

  static final String TRIPLE_DOUBLE_QUOTED =
      "(?s)(\"\"\"(?:[^\"\\\\]++|\\\\.|\"{1,2}+(?!\"))*+\"\"\")";

  static final String TRIPLE_SINGLE_QUOTED = "(?s)('''(?:[^'\\\\]++|\\\\.|'{1,2}+(?!'))*+''')";

  static final String DOUBLE_QUOTED = "(?s)(\"(?:[^\"\\\\\\n]++|\\\\.)*+\")";

  static final String SINGLE_QUOTED = "(?s)('(?:[^'\\\\\\n]++|\\\\.)*+')";

  private PythonAtoms() {}

  /** Default finders in registration order; copy the list to reorder or extend it. */
  public static List<PatternFinder<AtomKind>> finders() {
    return List.of(
        PatternFinder.of(AtomKind.OPEN_PAREN, "(\\()"),
        PatternFinder.of(AtomKind.CLOSE_PAREN, "(\\))"),
        PatternFinder.of(AtomKind.OPEN_BRACKET, "(\\[)"),
        PatternFinder.of(AtomKind.CLOSE_BRACKET, "(\\])"),
        PatternFinder.of(AtomKind.OPEN_BRACE, "(\\{)"),
        PatternFinder.of(AtomKind.CLOSE_BRACE, "(\\})"),
        PatternFinder.of(AtomKind.BLANKLINE, BLANK_LINE),
        PatternFinder.of(AtomKind.COMMENT, COMMENT_PARAGRAPH),
        PatternFinder.of(AtomKind.LINE_CONTINUATION, LINE_CONTINUATION),
        PatternFinder.of(AtomKind.STRING, TRIPLE_DOUBLE_QUOTED),
        PatternFinder.of(AtomKind.STRING, TRIPLE_SINGLE_QUOTED),
        PatternFinder.of(AtomKind.STRING, DOUBLE_QUOTED),
        PatternFinder.of(AtomKind.STRING, SINGLE_QUOTED));
  }
}
