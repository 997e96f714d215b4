package com.docgen.structure.lexing;

public enum AtomKind {
  OPEN_PAREN,
  CLOSE_PAREN,
  OPEN_BRACKET,
  CLOSE_BRACKET,
  OPEN_BRACE,
  CLOSE_BRACE,
  BLANKLINE,
  COMMENT,
  LINE_CONTINUATION,
  STRING,
  MATCHED_PAREN,
  MATCHED_BRACKET,
  MATCHED_BRACE;

  public boolean isOpening() {
    return this == OPEN_PAREN || this == OPEN_BRACKET || this == OPEN_BRACE;
  }

  public boolean isClosing() {
    return this == CLOSE_PAREN || this == CLOSE_BRACKET || this == CLOSE_BRACE;
  }

  public boolean isMatched() {
    return this == MATCHED_PAREN || this == MATCHED_BRACKET || this == MATCHED_BRACE;
  }

  /** The close kind an opening bracket waits for. */
  public AtomKind closingKind() {
    return switch (this) {
      case OPEN_PAREN -> CLOSE_PAREN;
      case OPEN_BRACKET -> CLOSE_BRACKET;
      case OPEN_BRACE -> CLOSE_BRACE;
      default -> throw new IllegalStateException(this + " is not an opening bracket");
    };
  }

  /** The spanning kind produced when this closing bracket completes a pair. */
  public AtomKind matchedKind() {
    return switch (this) {
      case CLOSE_PAREN -> MATCHED_PAREN;
      case CLOSE_BRACKET -> MATCHED_BRACKET;
      case CLOSE_BRACE -> MATCHED_BRACE;
      default -> throw new IllegalStateException(this + " is not a closing bracket");
    };
  }
}
