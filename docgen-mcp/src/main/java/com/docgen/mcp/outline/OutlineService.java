package com.docgen.mcp.outline;

import com.docgen.mcp.structure.StructureExtractionService;
import com.docgen.mcp.structure.StructureModels.ExtractedDocument;
import com.docgen.mcp.structure.StructureModels.RenderOutlineRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OutlineService {

  private static final Logger log = LoggerFactory.getLogger(OutlineService.class);

  private final StructureExtractionService extractionService;
  private final OutlineAssembler assembler;
  private final MarkdownOutlineRenderer markdownRenderer;
  private final JsonOutlineWriter jsonWriter;

  public OutlineService(
      StructureExtractionService extractionService,
      OutlineAssembler assembler,
      MarkdownOutlineRenderer markdownRenderer,
      JsonOutlineWriter jsonWriter) {
    this.extractionService = Objects.requireNonNull(extractionService, "extractionService");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.markdownRenderer = Objects.requireNonNull(markdownRenderer, "markdownRenderer");
    this.jsonWriter = Objects.requireNonNull(jsonWriter, "jsonWriter");
  }

  public RenderOutlineResponse render(RenderOutlineRequest request) {
    Objects.requireNonNull(request, "request");
    OutlineFormat format = OutlineFormat.from(request.format());
    ExtractedDocument document =
        extractionService.extractDocument(request.path(), request.source(), request.sourceName());
    if (!document.isSuccess()) {
      return new RenderOutlineResponse(
          document.sourceName(), format.label(), false, null, document.failure());
    }
    OutlineNode outline =
        assembler.assemble(OutlineAssembler.moduleName(document.sourceName()), document.root());
    String content =
        switch (format) {
          case MARKDOWN -> markdownRenderer.render(outline);
          case JSON -> jsonWriter.write(outline);
        };
    log.debug(
        "Rendered {} outline of {} ({} top-level items)",
        format.label(),
        document.sourceName(),
        outline.children().size());
    return new RenderOutlineResponse(document.sourceName(), format.label(), true, content, null);
  }
}
