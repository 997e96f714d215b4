package com.docgen.structure.declaration;

import java.util.Objects;

public record Declaration(DeclarationKind kind, String name) {

  private static final Declaration NONE = new Declaration(DeclarationKind.NONE, null);

  public Declaration {
    Objects.requireNonNull(kind, "kind");
    if (kind != DeclarationKind.NONE && (name == null || name.isBlank())) {
      throw new IllegalArgumentException(kind + " declaration requires a name");
    }
  }

  public static Declaration none() {
    return NONE;
  }

  public boolean isPresent() {
    return kind != DeclarationKind.NONE;
  }
}
