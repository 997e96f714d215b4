package com.docgen.structure.lexing;

import java.util.Objects;

/** A lexical atom covering {@code [start, end)} of the source text. */
public record Atom(AtomKind kind, int start, int end) {

  public Atom {
    Objects.requireNonNull(kind, "kind");
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid atom span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }

  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  public String text(CharSequence source) {
    return source.subSequence(start, end).toString();
  }
}
