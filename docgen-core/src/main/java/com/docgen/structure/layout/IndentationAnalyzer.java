package com.docgen.structure.layout;

import com.docgen.structure.lexing.LineIndex;
import com.docgen.structure.lexing.LineSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes indentation deltas from a stack of whitespace prefixes. Each opened level pushes
 * the exact whitespace that extends the enclosing one, so tabs and spaces are compared
 * literally and never expanded.
 */
public final class IndentationAnalyzer {

  public List<IndentEvent> analyze(LineIndex index, LineSet suppressed) {
    List<String> prefixes = new ArrayList<>();
    List<IndentEvent> events = new ArrayList<>();
    for (int line = 0; line < index.lineCount(); line++) {
      if (suppressed.contains(line)) {
        continue;
      }
      String text = index.lineText(line);
      String whitespace = leadingWhitespace(text);
      events.add(new IndentEvent(line, step(prefixes, whitespace, line, text)));
    }
    return events;
  }

  private static int step(List<String> prefixes, String whitespace, int line, String text) {
    int matched = 0;
    int position = 0;
    while (matched < prefixes.size() && whitespace.startsWith(prefixes.get(matched), position)) {
      position += prefixes.get(matched).length();
      matched++;
    }
    boolean remaining = position < whitespace.length();
    if (matched == prefixes.size()) {
      if (remaining) {
        prefixes.add(whitespace.substring(position));
        return 1;
      }
      return 0;
    }
    if (remaining) {
      throw new IndentationInconsistencyException(line, text);
    }
    int delta = matched - prefixes.size();
    prefixes.subList(matched, prefixes.size()).clear();
    return delta;
  }

  static String leadingWhitespace(String text) {
    int end = 0;
    while (end < text.length()) {
      char c = text.charAt(end);
      if (c != ' ' && c != '\t' && c != '\f') {
        break;
      }
      end++;
    }
    return text.substring(0, end);
  }
}
