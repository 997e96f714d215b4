package com.docgen.structure.lexing;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maps absolute character offsets of a source text to 0-based (line, column) pairs and back.
 * Lines are split on line feed only; a carriage return stays part of the line it ends.
 * Out-of-range arguments are clamped to the nearest boundary.
 */
public final class LineIndex {

  private final String text;
  private final int[] offsets;

  public LineIndex(String text) {
    this.text = Objects.requireNonNull(text, "text");
    int lines = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        lines++;
      }
    }
    offsets = new int[lines];
    int line = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        offsets[line++] = i + 1;
      }
    }
  }

  public String text() {
    return text;
  }

  public int lineCount() {
    return offsets.length;
  }

  public LineCol toLineCol(int offset) {
    int normalized = clampOffset(offset);
    int line = lineOf(normalized);
    return new LineCol(line, normalized - offsets[line]);
  }

  public int toOffset(int line, int column) {
    if (line < 0) {
      return 0;
    }
    if (line >= offsets.length) {
      return text.length();
    }
    int width = lineEnd(line) - offsets[line];
    return offsets[line] + Math.max(0, Math.min(column, width));
  }

  public int lineOf(int offset) {
    int normalized = clampOffset(offset);
    int position = Arrays.binarySearch(offsets, normalized);
    if (position >= 0) {
      return position;
    }
    int insertionPoint = -position - 2;
    return Math.max(insertionPoint, 0);
  }

  public int columnOf(int offset) {
    return toLineCol(offset).column();
  }

  /** Offset of the first character of {@code line}. */
  public int lineStart(int line) {
    if (line < 0) {
      return 0;
    }
    if (line >= offsets.length) {
      return text.length();
    }
    return offsets[line];
  }

  /** Offset of the line feed that ends {@code line}, or the text length for the last line. */
  public int lineEnd(int line) {
    if (line < 0) {
      return lineEnd(0);
    }
    if (line >= offsets.length - 1) {
      return text.length();
    }
    return offsets[line + 1] - 1;
  }

  public String lineText(int line) {
    if (line < 0 || line >= offsets.length) {
      return "";
    }
    return text.substring(offsets[line], lineEnd(line));
  }

  private int clampOffset(int offset) {
    return Math.max(0, Math.min(offset, text.length()));
  }

  public record LineCol(int line, int column) {}
}
