package com.docgen.mcp.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.docgen.mcp.outline.OutlineService;
import com.docgen.mcp.structure.StructureModels.ExtractStructureRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineResponse;
import com.docgen.mcp.structure.StructureModels.StructureReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class StructureToolsTest {

  @Mock private StructureExtractionService extractionService;
  @Mock private OutlineService outlineService;

  private StructureTools tools;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    tools = new StructureTools(extractionService, outlineService);
  }

  @Test
  void extractStructureDelegatesToService() {
    ExtractStructureRequest request = new ExtractStructureRequest("pkg/mod.py", null, null);
    StructureReport report = new StructureReport("pkg/mod.py", true, null, null, 3, 0);
    when(extractionService.extract(request)).thenReturn(report);

    assertThat(tools.extractStructure(request)).isSameAs(report);
    verify(extractionService).extract(request);
  }

  @Test
  void renderOutlineDelegatesToService() {
    RenderOutlineRequest request = new RenderOutlineRequest(null, "x = 1\n", null, "json");
    RenderOutlineResponse response =
        new RenderOutlineResponse("inline.py", "json", true, "{}", null);
    when(outlineService.render(request)).thenReturn(response);

    assertThat(tools.renderOutline(request)).isSameAs(response);
    verify(outlineService).render(request);
  }
}
