package com.docgen.mcp.outline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutlineKind {
  MODULE("module"),
  FUNCTION("function"),
  CLASS("class"),
  ASSIGNMENT("assignment");

  private final String label;

  OutlineKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
