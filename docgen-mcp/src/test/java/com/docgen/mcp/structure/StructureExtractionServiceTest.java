package com.docgen.mcp.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docgen.mcp.config.DocgenProperties;
import com.docgen.mcp.structure.StructureModels.ExtractStructureRequest;
import com.docgen.mcp.structure.StructureModels.ExtractedDocument;
import com.docgen.mcp.structure.StructureModels.StructureEntry;
import com.docgen.mcp.structure.StructureModels.StructureReport;
import com.docgen.structure.StructureExtractor;
import com.docgen.structure.tree.Node;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StructureExtractionServiceTest {

  @TempDir Path tempDir;

  private DocgenProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private StructureExtractionService service;

  @BeforeEach
  void setUp() {
    properties = new DocgenProperties();
    properties.getSource().setRoot(tempDir.toString());
    meterRegistry = new SimpleMeterRegistry();
    service =
        new StructureExtractionService(StructureExtractor.python(), properties, meterRegistry);
  }

  @Test
  void extractsFileRelativeToSourceRoot() throws IOException {
    Files.createDirectories(tempDir.resolve("pkg"));
    Files.writeString(
        tempDir.resolve("pkg/mod.py"), "class A:\n    def m(self):\n        pass\n");

    StructureReport report = service.extractFromFile("pkg/mod.py");

    assertThat(report.success()).isTrue();
    assertThat(report.failure()).isNull();
    assertThat(report.sourceName()).isEqualTo("pkg/mod.py");
    assertThat(report.lineCount()).isEqualTo(4);
    assertThat(report.nodeCount()).isEqualTo(2);

    StructureEntry root = report.root();
    assertThat(root.name()).isNull();
    assertThat(root.kind()).isNull();
    StructureEntry classA = root.children().get(0);
    assertThat(classA.name()).isEqualTo("A");
    assertThat(classA.kind()).isEqualTo("class");
    assertThat(classA.lineno()).isEqualTo(1);
    assertThat(classA.endLine()).isEqualTo(1);
    StructureEntry method = classA.children().get(0);
    assertThat(method.name()).isEqualTo("m");
    assertThat(method.kind()).isEqualTo("function");
    assertThat(method.startLine()).isEqualTo(2);
    assertThat(method.endLine()).isEqualTo(3);

    assertThat(meterRegistry.counter("docgen_structure_extract_success_total").count())
        .isEqualTo(1.0d);
    assertThat(meterRegistry.timer("docgen_structure_extract_duration").count()).isEqualTo(1L);
  }

  @Test
  void reportsInconsistentIndentationAsFailure() {
    StructureReport report = service.extractFromSource(null, "def f():\n    a = 1\n\tb = 2\n");

    assertThat(report.success()).isFalse();
    assertThat(report.root()).isNull();
    assertThat(report.sourceName()).isEqualTo(StructureExtractionService.DEFAULT_SOURCE_NAME);
    assertThat(report.lineCount()).isEqualTo(4);
    assertThat(report.failure().line()).isEqualTo(3);
    assertThat(report.failure().lineText()).isEqualTo("\tb = 2");
    assertThat(report.failure().message()).contains("line 3");
    assertThat(meterRegistry.counter("docgen_structure_extract_failure_total").count())
        .isEqualTo(1.0d);
  }

  @Test
  void moduleStatementsAfterAFunctionAreReportedSeparately() {
    StructureReport report =
        service.extractFromSource("inline.py", "def f():\n    return 1\nprint(f())\n");

    assertThat(report.nodeCount()).isEqualTo(2);
    StructureEntry f = report.root().children().get(0);
    assertThat(f.name()).isEqualTo("f");
    assertThat(f.startLine()).isEqualTo(1);
    assertThat(f.endLine()).isEqualTo(2);
    StructureEntry statement = report.root().children().get(1);
    assertThat(statement.name()).isNull();
    assertThat(statement.kind()).isNull();
    assertThat(statement.startLine()).isEqualTo(3);
    assertThat(statement.endLine()).isEqualTo(3);
  }

  @Test
  void inlineSourceKeepsGivenName() {
    StructureReport report =
        service.extract(new ExtractStructureRequest(null, "x = 1\n", "snippets/config.py"));

    assertThat(report.sourceName()).isEqualTo("snippets/config.py");
    assertThat(report.root().children()).extracting(StructureEntry::name).containsExactly("x");
  }

  @Test
  void requiresPathOrSource() {
    assertThatThrownBy(() -> service.extract(new ExtractStructureRequest(" ", null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("path or source");
  }

  @Test
  void rejectsPathsOutsideSourceRoot() {
    assertThatThrownBy(() -> service.extractFromFile("../outside.py"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("within source root");
  }

  @Test
  void rejectsMissingFilesAndDirectories() throws IOException {
    Files.createDirectories(tempDir.resolve("pkg"));

    assertThatThrownBy(() -> service.extractFromFile("missing.py"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not exist");
    assertThatThrownBy(() -> service.extractFromFile("pkg"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not a regular file");
  }

  @Test
  void rejectsFilesAboveTheSizeLimit() throws IOException {
    properties.getSource().setMaxFileBytes(16);
    Files.writeString(tempDir.resolve("big.py"), "x = 1\n".repeat(10));

    assertThatThrownBy(() -> service.extractFromFile("big.py"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("max bytes");
  }

  @Test
  void decodesLeniently() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.write(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
    bytes.write("x = 1  # caf".getBytes(StandardCharsets.UTF_8));
    bytes.write(0xFF);
    bytes.write("\n".getBytes(StandardCharsets.UTF_8));
    Files.write(tempDir.resolve("latin.py"), bytes.toByteArray());

    ExtractedDocument document = service.extractDocument("latin.py", null, null);

    assertThat(document.isSuccess()).isTrue();
    assertThat(document.text()).startsWith("x = 1").contains("\uFFFD");
    assertThat(document.root().children()).extracting(Node::name).containsExactly("x");
  }
}
