package com.docgen.structure;

import com.docgen.structure.layout.IndentationInconsistencyException;
import com.docgen.structure.tree.Node;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link StructureExtractor#tryExtract(String)}: either the structure tree or the
 * indentation inconsistency that prevented it.
 */
public record ExtractionResult(Node root, IndentationInconsistencyException failure) {

  public ExtractionResult {
    if ((root == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of root and failure must be set");
    }
  }

  public static ExtractionResult success(Node root) {
    return new ExtractionResult(Objects.requireNonNull(root, "root"), null);
  }

  public static ExtractionResult failure(IndentationInconsistencyException failure) {
    return new ExtractionResult(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return root != null;
  }

  public Optional<Node> rootNode() {
    return Optional.ofNullable(root);
  }

  public Optional<IndentationInconsistencyException> inconsistency() {
    return Optional.ofNullable(failure);
  }
}
