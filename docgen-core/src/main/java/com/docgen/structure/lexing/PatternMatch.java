package com.docgen.structure.lexing;

import java.util.Comparator;

/**
 * Span of the capturing group of a {@link PatternFinder} hit, tagged with the finder's kind.
 *
 * @param <K> kind enumeration of the finder that produced the match
 */
public record PatternMatch<K extends Enum<K>>(K kind, int start, int end) {

  /**
   * Earliest start wins; among equal starts the longest span wins. The kind ordinal only
   * separates identical spans so the outcome never depends on registration order.
   */
  public static <K extends Enum<K>> Comparator<PatternMatch<K>> firstThenLongest() {
    return Comparator.<PatternMatch<K>>comparingInt(PatternMatch::start)
        .thenComparing(Comparator.<PatternMatch<K>>comparingInt(PatternMatch::end).reversed())
        .thenComparingInt(match -> match.kind().ordinal());
  }

  public int length() {
    return end - start;
  }
}
