package com.docgen.structure.lexing;

import java.util.BitSet;
import java.util.List;

/**
 * Collects the lines whose leading whitespace carries no block structure: lines that continue a
 * string, a comment paragraph, a bracketed expression or an explicit backslash continuation,
 * plus blank lines. The first physical line of a multi-line construct keeps its indentation.
 */
public final class LineSuppressor {

  public LineSet suppressedLines(List<Atom> atoms, LineIndex index) {
    BitSet suppressed = new BitSet(index.lineCount());
    for (Atom atom : atoms) {
      int first = index.lineOf(atom.start());
      int last = index.lineOf(Math.max(atom.start(), atom.end() - 1));
      switch (atom.kind()) {
        case BLANKLINE -> suppressed.set(first);
        case COMMENT -> {
          int from = index.columnOf(atom.start()) == 0 ? first : first + 1;
          setRange(suppressed, from, last);
        }
        case LINE_CONTINUATION -> suppressed.set(first + 1);
        case STRING, MATCHED_PAREN, MATCHED_BRACKET, MATCHED_BRACE ->
            setRange(suppressed, first + 1, last);
        default -> {
          // unmatched brackets leave indentation alone
        }
      }
    }
    // Nothing follows a trailing line feed; that empty last line is not a statement.
    String text = index.text();
    if (text.isEmpty() || text.charAt(text.length() - 1) == '\n') {
      suppressed.set(index.lineCount() - 1);
    }
    return new LineSet(suppressed);
  }

  private static void setRange(BitSet bits, int fromInclusive, int toInclusive) {
    if (fromInclusive <= toInclusive) {
      bits.set(fromInclusive, toInclusive + 1);
    }
  }
}
