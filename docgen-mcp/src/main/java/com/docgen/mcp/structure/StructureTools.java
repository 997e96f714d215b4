package com.docgen.mcp.structure;

import com.docgen.mcp.outline.OutlineService;
import com.docgen.mcp.structure.StructureModels.ExtractStructureRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineResponse;
import com.docgen.mcp.structure.StructureModels.StructureReport;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

@Component
public class StructureTools {

  private final StructureExtractionService extractionService;
  private final OutlineService outlineService;

  StructureTools(StructureExtractionService extractionService, OutlineService outlineService) {
    this.extractionService = extractionService;
    this.outlineService = outlineService;
  }

  @Tool(
      name = "docgen.extract_structure",
      description =
          "Extracts the block structure of a Python module: functions, classes and assignments "
              + "nested by indentation, with 1-based line ranges. Pass either path (resolved "
              + "against the configured source root) or source with the module text. "
              + "Inconsistent indentation is reported in failure with the offending line.")
  StructureReport extractStructure(ExtractStructureRequest request) {
    return extractionService.extract(request);
  }

  @Tool(
      name = "docgen.render_outline",
      description =
          "Renders the documentation outline of a Python module as markdown (default) or json. "
              + "Each function, class and assignment gets a heading with its signature or value "
              + "and its cleaned docstring. Pass path or source; format is markdown|json.")
  RenderOutlineResponse renderOutline(RenderOutlineRequest request) {
    return outlineService.render(request);
  }
}
