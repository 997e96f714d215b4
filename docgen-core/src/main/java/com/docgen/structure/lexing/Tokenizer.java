package com.docgen.structure.lexing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Splits a source text into non-overlapping atoms by repeatedly running every registered
 * {@link PatternFinder} from a cursor and keeping the first, then longest, candidate. Atoms
 * that start inside an earlier winner are never produced, so a comment marker inside a string
 * (or a quote inside a comment) cannot split the enclosing atom.
 *
 * <p>Instances hold no per-call state and can be shared.
 */
public final class Tokenizer {

  private static final Comparator<PatternMatch<AtomKind>> ORDER = PatternMatch.firstThenLongest();

  private final List<PatternFinder<AtomKind>> finders;

  public Tokenizer(List<PatternFinder<AtomKind>> finders) {
    Objects.requireNonNull(finders, "finders");
    this.finders = List.copyOf(finders);
  }

  public static Tokenizer python() {
    return new Tokenizer(PythonAtoms.finders());
  }

  public List<PatternFinder<AtomKind>> finders() {
    return finders;
  }

  public List<Atom> tokenize(String text) {
    Objects.requireNonNull(text, "text");
    List<Atom> atoms = new ArrayList<>();
    int count = finders.size();
    // Next known hit per finder; still valid while it starts at or after the cursor.
    List<PatternMatch<AtomKind>> lookahead = new ArrayList<>(count);
    boolean[] exhausted = new boolean[count];
    for (int i = 0; i < count; i++) {
      lookahead.add(null);
    }

    int cursor = 0;
    while (cursor <= text.length()) {
      PatternMatch<AtomKind> winner = null;
      for (int i = 0; i < count; i++) {
        if (exhausted[i]) {
          continue;
        }
        PatternMatch<AtomKind> candidate = lookahead.get(i);
        if (candidate == null || candidate.start() < cursor) {
          candidate = finders.get(i).find(text, cursor).orElse(null);
          lookahead.set(i, candidate);
          if (candidate == null) {
            exhausted[i] = true;
            continue;
          }
        }
        if (winner == null || ORDER.compare(candidate, winner) < 0) {
          winner = candidate;
        }
      }
      if (winner == null) {
        break;
      }
      atoms.add(new Atom(winner.kind(), winner.start(), winner.end()));
      cursor = winner.length() > 0 ? winner.end() : winner.end() + 1;
    }
    return atoms;
  }
}
