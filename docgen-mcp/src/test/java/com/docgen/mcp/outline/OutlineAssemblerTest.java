package com.docgen.mcp.outline;

import static org.assertj.core.api.Assertions.assertThat;

import com.docgen.mcp.config.DocgenProperties;
import com.docgen.structure.StructureExtractor;
import com.docgen.structure.doc.NodeInspector;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutlineAssemblerTest {

  private final StructureExtractor extractor = StructureExtractor.python();
  private DocgenProperties properties;
  private OutlineAssembler assembler;

  @BeforeEach
  void setUp() {
    properties = new DocgenProperties();
    assembler = new OutlineAssembler(NodeInspector.python(), properties);
  }

  @Test
  void describesPublicMembersOfTheModule() throws IOException {
    OutlineNode module = assemble(sampleModule());

    assertThat(module.kind()).isEqualTo(OutlineKind.MODULE);
    assertThat(module.name()).isEqualTo("sample_module");
    assertThat(module.docstring())
        .isEqualTo(
            "Sample module used by the extractor tests.\n\n"
                + "It mixes every construct the scanner has to see through.");
    assertThat(module.children())
        .extracting(OutlineNode::name)
        .containsExactly("VERSION", "Greeter", "main");

    OutlineNode version = module.children().get(0);
    assertThat(version.kind()).isEqualTo(OutlineKind.ASSIGNMENT);
    assertThat(version.value()).isEqualTo("\"1.0\"");
    assertThat(version.lineno()).isEqualTo(9);

    OutlineNode greeter = module.children().get(1);
    assertThat(greeter.signature()).isEqualTo("Greeter(object)");
    assertThat(greeter.docstring()).isEqualTo("Greets people.");
    assertThat(greeter.children())
        .extracting(OutlineNode::signature)
        .containsExactly("greeting", "__init__(self, name, punctuation=\"!\")", "greet(self)");
    assertThat(greeter.children().get(2).children()).isEmpty();

    assertThat(module.children().get(2).signature()).isEqualTo("main()");
    assertThat(module.children().get(2).lineno()).isEqualTo(38);
  }

  @Test
  void privateNamesAreShownOnRequest() throws IOException {
    properties.getOutline().setIncludePrivate(true);

    assertThat(assemble(sampleModule()).children())
        .extracting(OutlineNode::name)
        .containsExactly("VERSION", "Greeter", "_helper", "main");
  }

  @Test
  void assignmentsCanBeLeftOut() throws IOException {
    properties.getOutline().setIncludeAssignments(false);

    OutlineNode module = assemble(sampleModule());

    assertThat(module.children()).extracting(OutlineNode::name).containsExactly("Greeter", "main");
    assertThat(module.children().get(0).children())
        .extracting(OutlineNode::name)
        .containsExactly("__init__", "greet");
  }

  @Test
  void hidesInterpreterManagedDunders() {
    OutlineNode module = assemble("__doc__ = 'x'\n__all__ = ['f']\n_cache = {}\n");

    assertThat(module.children()).extracting(OutlineNode::name).containsExactly("__all__");
  }

  @Test
  void laterBindingReplacesEarlierOne() {
    OutlineNode module = assemble("x = 1\ndef x():\n    pass\n");

    assertThat(module.children())
        .singleElement()
        .satisfies(
            x -> {
              assertThat(x.kind()).isEqualTo(OutlineKind.FUNCTION);
              assertThat(x.lineno()).isEqualTo(2);
            });
  }

  @Test
  void decoratedMethodsKeepTheirSignature() {
    OutlineNode module =
        assemble(
            "class Box:\n"
                + "    @property\n"
                + "    def size(self):\n"
                + "        \"\"\"Number of items.\"\"\"\n"
                + "        return 1\n"
                + "    if DEBUG:\n"
                + "        label = 'box'\n");

    OutlineNode box = module.children().get(0);
    assertThat(box.children()).extracting(OutlineNode::name).containsExactly("size", "label");
    OutlineNode size = box.children().get(0);
    assertThat(size.signature()).isEqualTo("size(self)");
    assertThat(size.docstring()).isEqualTo("Number of items.");
    assertThat(size.lineno()).isEqualTo(3);
  }

  @Test
  void abbreviatesLongValues() {
    properties.getOutline().setMaxValueLength(8);

    assertThat(assemble("x = 'abcdefghijkl'\n").children().get(0).value()).isEqualTo("'abcd...");
  }

  @Test
  void derivesModuleNamesFromPaths() {
    assertThat(OutlineAssembler.moduleName("pkg/util.py")).isEqualTo("util");
    assertThat(OutlineAssembler.moduleName("pkg/__init__.py")).isEqualTo("pkg");
    assertThat(OutlineAssembler.moduleName("C:\\src\\mod.py")).isEqualTo("mod");
    assertThat(OutlineAssembler.moduleName("inline.py")).isEqualTo("inline");
    assertThat(OutlineAssembler.moduleName("")).isEqualTo("module");
  }

  private OutlineNode assemble(String text) {
    return assembler.assemble("sample_module", extractor.extractStructure(text));
  }

  static String sampleModule() throws IOException {
    try (InputStream in =
        OutlineAssemblerTest.class.getResourceAsStream("/fixtures/sample_module.py")) {
      assertThat(in).as("fixture on classpath").isNotNull();
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
