package com.docgen.structure.lexing;

import java.util.BitSet;
import java.util.List;

/** Immutable set of 0-based line numbers. */
public final class LineSet {

  private final BitSet lines;

  LineSet(BitSet lines) {
    this.lines = (BitSet) lines.clone();
  }

  public static LineSet of(int... lines) {
    BitSet bits = new BitSet();
    for (int line : lines) {
      bits.set(line);
    }
    return new LineSet(bits);
  }

  public boolean contains(int line) {
    return line >= 0 && lines.get(line);
  }

  public int size() {
    return lines.cardinality();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public List<Integer> toList() {
    return lines.stream().boxed().toList();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof LineSet that && lines.equals(that.lines);
  }

  @Override
  public int hashCode() {
    return lines.hashCode();
  }

  @Override
  public String toString() {
    return lines.toString();
  }
}
