package com.docgen.structure.declaration;

public enum DeclarationKind {
  FUNCTION,
  CLASS,
  ASSIGNMENT,
  NONE
}
