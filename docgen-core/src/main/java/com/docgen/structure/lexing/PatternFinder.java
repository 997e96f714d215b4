package com.docgen.structure.lexing;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the next occurrence of one named atom. The regular expression must declare exactly
 * one capturing group; the group's span is what gets reported.
 */
public final class PatternFinder<K extends Enum<K>> {

  private final K kind;
  private final Pattern pattern;

  public PatternFinder(K kind, Pattern pattern) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.pattern = Objects.requireNonNull(pattern, "pattern");
    int groups = pattern.matcher("").groupCount();
    if (groups != 1) {
      throw new IllegalArgumentException(
          "Pattern for " + kind + " must have exactly one capturing group but has " + groups);
    }
  }

  public static <K extends Enum<K>> PatternFinder<K> of(K kind, String regex) {
    return new PatternFinder<>(kind, Pattern.compile(regex));
  }

  public K kind() {
    return kind;
  }

  public Pattern pattern() {
    return pattern;
  }

  public Optional<PatternMatch<K>> find(CharSequence text, int from) {
    if (from < 0 || from > text.length()) {
      return Optional.empty();
    }
    Matcher matcher = pattern.matcher(text);
    int position = from;
    while (position <= text.length() && matcher.find(position)) {
      if (matcher.start(1) >= 0) {
        return Optional.of(new PatternMatch<>(kind, matcher.start(1), matcher.end(1)));
      }
      position = matcher.end() > matcher.start() ? matcher.end() : matcher.end() + 1;
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "PatternFinder[" + kind + ": " + pattern.pattern() + "]";
  }
}
