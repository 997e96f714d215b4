package com.docgen.structure.tree;

import java.util.Objects;

/**
 * Read-only view of {@code [start, end)} of a shared source text. Slices never copy the
 * underlying buffer; {@link #toString()} materialises the characters on demand.
 */
public final class SourceSlice implements CharSequence {

  private final String text;
  private final int start;
  private final int end;

  public SourceSlice(String text, int start, int end) {
    this.text = Objects.requireNonNull(text, "text");
    if (start < 0 || end < start || end > text.length()) {
      throw new IndexOutOfBoundsException(
          "Slice [" + start + ", " + end + ") outside text of length " + text.length());
    }
    this.start = start;
    this.end = end;
  }

  public int start() {
    return start;
  }

  public int end() {
    return end;
  }

  @Override
  public int length() {
    return end - start;
  }

  @Override
  public char charAt(int index) {
    Objects.checkIndex(index, length());
    return text.charAt(start + index);
  }

  @Override
  public CharSequence subSequence(int from, int to) {
    Objects.checkFromToIndex(from, to, length());
    return new SourceSlice(text, start + from, start + to);
  }

  @Override
  public String toString() {
    return text.substring(start, end);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SourceSlice that)) {
      return false;
    }
    return length() == that.length()
        && text.regionMatches(start, that.text, that.start, length());
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (int i = start; i < end; i++) {
      hash = 31 * hash + text.charAt(i);
    }
    return hash;
  }
}
