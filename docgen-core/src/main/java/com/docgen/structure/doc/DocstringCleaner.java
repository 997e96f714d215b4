package com.docgen.structure.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Normalises docstring indentation the way Python's {@code inspect.cleandoc} does: tabs are
 * expanded, the first line is left-stripped, the common margin of the remaining lines is
 * removed and blank lines at either end are dropped.
 */
public final class DocstringCleaner {

  private static final int TAB_SIZE = 8;

  private DocstringCleaner() {}

  public static String clean(String docstring) {
    if (docstring == null) {
      return "";
    }
    List<String> lines = new ArrayList<>(Arrays.asList(expandTabs(docstring).split("\n", -1)));
    int margin = Integer.MAX_VALUE;
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i);
      String stripped = line.stripLeading();
      if (!stripped.isEmpty()) {
        margin = Math.min(margin, line.length() - stripped.length());
      }
    }
    lines.set(0, lines.get(0).stripLeading());
    if (margin < Integer.MAX_VALUE) {
      for (int i = 1; i < lines.size(); i++) {
        String line = lines.get(i);
        lines.set(i, line.length() > margin ? line.substring(margin) : "");
      }
    }
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    while (!lines.isEmpty() && lines.get(0).isEmpty()) {
      lines.remove(0);
    }
    return String.join("\n", lines);
  }

  static String expandTabs(String text) {
    if (text.indexOf('\t') < 0) {
      return text;
    }
    StringBuilder builder = new StringBuilder(text.length() + 16);
    int column = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\t') {
        int spaces = TAB_SIZE - (column % TAB_SIZE);
        builder.append(" ".repeat(spaces));
        column += spaces;
      } else {
        builder.append(c);
        column = c == '\n' || c == '\r' ? 0 : column + 1;
      }
    }
    return builder.toString();
  }
}
