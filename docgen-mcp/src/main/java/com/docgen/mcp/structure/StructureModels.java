package com.docgen.mcp.structure;

import com.docgen.structure.ExtractionResult;
import com.docgen.structure.layout.IndentationInconsistencyException;
import com.docgen.structure.tree.Node;
import java.util.List;

public final class StructureModels {

  private StructureModels() {}

  public record ExtractStructureRequest(String path, String source, String sourceName) {}

  public record RenderOutlineRequest(
      String path, String source, String sourceName, String format) {}

  public record StructureReport(
      String sourceName,
      boolean success,
      StructureEntry root,
      StructureFailure failure,
      int lineCount,
      int nodeCount) {}

  /** Lines are 1-based; {@code endLine} is the last line the node's own text touches. */
  public record StructureEntry(
      int lineno,
      String name,
      String kind,
      int startLine,
      int endLine,
      List<StructureEntry> children) {}

  public record StructureFailure(int line, String lineText, String message) {

    public static StructureFailure from(IndentationInconsistencyException ex) {
      return new StructureFailure(ex.getLine() + 1, ex.getLineText(), ex.getMessage());
    }
  }

  public record RenderOutlineResponse(
      String sourceName,
      String format,
      boolean success,
      String content,
      StructureFailure failure) {}

  /** Decoded source together with its extraction outcome. */
  public record ExtractedDocument(String sourceName, String text, ExtractionResult result) {

    public boolean isSuccess() {
      return result.isSuccess();
    }

    public Node root() {
      return result.rootNode()
          .orElseThrow(() -> new IllegalStateException("No structure for " + sourceName));
    }

    public StructureFailure failure() {
      return result.inconsistency().map(StructureFailure::from).orElse(null);
    }
  }
}
