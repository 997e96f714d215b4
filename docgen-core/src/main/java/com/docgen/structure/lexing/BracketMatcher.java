package com.docgen.structure.lexing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs bracket atoms last-in-first-out and replaces each pair, together with everything
 * between, by a single MATCHED_* atom. Brackets that cannot be paired are passed through.
 */
public final class BracketMatcher {

  private static final Logger log = LoggerFactory.getLogger(BracketMatcher.class);

  public List<Atom> match(List<Atom> atoms) {
    List<Atom> output = new ArrayList<>(atoms.size());
    Deque<PendingOpen> pending = new ArrayDeque<>();
    int unmatchedCloses = 0;

    for (Atom atom : atoms) {
      AtomKind kind = atom.kind();
      if (kind.isOpening()) {
        pending.push(new PendingOpen(kind.closingKind(), atom.start(), output.size()));
        output.add(atom);
      } else if (kind.isClosing()) {
        PendingOpen top = pending.peek();
        if (top != null && top.expectedClose() == kind) {
          pending.pop();
          output.subList(top.outputIndex(), output.size()).clear();
          output.add(new Atom(kind.matchedKind(), top.start(), atom.end()));
        } else {
          unmatchedCloses++;
          output.add(atom);
        }
      } else {
        output.add(atom);
      }
    }

    if (unmatchedCloses > 0 || !pending.isEmpty()) {
      log.debug(
          "Tolerating unmatched brackets: unmatchedCloses={}, unclosedOpens={}",
          unmatchedCloses,
          pending.size());
    }
    return output;
  }

  private record PendingOpen(AtomKind expectedClose, int start, int outputIndex) {}
}
