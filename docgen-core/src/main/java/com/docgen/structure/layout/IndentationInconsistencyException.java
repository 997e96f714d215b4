package com.docgen.structure.layout;

/**
 * Raised when a line's leading whitespace diverges from an established indentation prefix, so
 * the block structure of the input cannot be recovered.
 */
public class IndentationInconsistencyException extends RuntimeException {

  private final int line;
  private final String lineText;

  public IndentationInconsistencyException(int line, String lineText) {
    super("Inconsistent indentation at line " + (line + 1) + ": " + lineText);
    this.line = line;
    this.lineText = lineText;
  }

  /** 0-based number of the offending line. */
  public int getLine() {
    return line;
  }

  public String getLineText() {
    return lineText;
  }
}
