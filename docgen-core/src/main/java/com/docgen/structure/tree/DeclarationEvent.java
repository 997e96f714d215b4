package com.docgen.structure.tree;

import com.docgen.structure.declaration.Declaration;
import java.util.Objects;

/**
 * An indentation-bearing line with its depth delta and the declaration it introduces. A
 * decorator line carries no declaration of its own; its text goes to the declaration after it.
 */
public record DeclarationEvent(int line, int delta, Declaration declaration, boolean decorator) {

  public DeclarationEvent {
    Objects.requireNonNull(declaration, "declaration");
  }

  public DeclarationEvent(int line, int delta, Declaration declaration) {
    this(line, delta, declaration, false);
  }
}
