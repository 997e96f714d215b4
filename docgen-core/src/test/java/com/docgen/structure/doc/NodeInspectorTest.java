package com.docgen.structure.doc;

import static org.assertj.core.api.Assertions.assertThat;

import com.docgen.structure.StructureExtractor;
import com.docgen.structure.tree.Node;
import org.junit.jupiter.api.Test;

class NodeInspectorTest {

  private final StructureExtractor extractor = StructureExtractor.python();
  private final NodeInspector inspector = NodeInspector.python();

  @Test
  void describesFunctionHeaderParametersAndDocstring() {
    String text =
        "def f(a, b=2):\n"
            + "    \"\"\"Summary line.\n"
            + "\n"
            + "        Indented detail.\n"
            + "    Last line.\n"
            + "    \"\"\"\n"
            + "    return a\n";

    NodeDetails details = inspector.inspect(only(text));

    assertThat(details.header()).isEqualTo("def f(a, b=2):");
    assertThat(details.parameters()).isEqualTo("(a, b=2)");
    assertThat(details.value()).isNull();
    assertThat(details.docstring()).isEqualTo("Summary line.\n\n    Indented detail.\nLast line.");
  }

  @Test
  void joinsParametersSpreadOverSeveralLines() {
    String text =
        "def __init__(self, name,\n"
            + "             punctuation=\"!\"):  # set up\n"
            + "    self.name = name\n";

    NodeDetails details = inspector.inspect(only(text));

    assertThat(details.parameters()).isEqualTo("(self, name, punctuation=\"!\")");
    assertThat(details.header()).isEqualTo("def __init__(self, name, punctuation=\"!\"):");
    assertThat(details.docstring()).isNull();
  }

  @Test
  void classWithoutBasesHasNoParameters() {
    NodeDetails details = inspector.inspect(only("class Plain:\n    pass\n"));

    assertThat(details.header()).isEqualTo("class Plain:");
    assertThat(details.parameters()).isNull();
  }

  @Test
  void acceptsPrefixedLiteralsAndSkipsComments() {
    assertThat(inspector.inspect(only("def g():\n    r'''raw \\d'''\n")).docstring())
        .isEqualTo("raw \\d");
    assertThat(inspector.inspect(only("def k():\n    # note\n    \"\"\"Doc.\"\"\"\n")).docstring())
        .isEqualTo("Doc.");
  }

  @Test
  void skipsDecoratorsBeforeTheHeader() {
    String text =
        "@cache  # memoized\n"
            + "@route(\n"
            + "    \"/items\")\n"
            + "def items(limit=10):\n"
            + "    \"\"\"List items.\"\"\"\n"
            + "    return []\n";

    NodeDetails details = inspector.inspect(only(text));

    assertThat(details.header()).isEqualTo("def items(limit=10):");
    assertThat(details.parameters()).isEqualTo("(limit=10)");
    assertThat(details.docstring()).isEqualTo("List items.");
  }

  @Test
  void docstringMustBeTheFirstStatement() {
    assertThat(inspector.inspect(only("def h():\n    x()\n    \"\"\"late\"\"\"\n")).docstring())
        .isNull();
  }

  @Test
  void assignmentValueFollowsContinuations() {
    NodeDetails details = inspector.inspect(only("x = 1 + \\\n    2\n"));

    assertThat(details.value()).isEqualTo("1 + 2");
    assertThat(details.parameters()).isNull();
  }

  @Test
  void annotatedAssignmentDropsTrailingComment() {
    NodeDetails details = inspector.inspect(only("limit: int = 10  # max\n"));

    assertThat(details.header()).isEqualTo("limit: int = 10");
    assertThat(details.value()).isEqualTo("10");
  }

  @Test
  void moduleDocstringMayFollowAComment() {
    Node root = extractor.extractStructure("#!/usr/bin/env python\n\"\"\"Module doc.\"\"\"\nx = 1\n");

    assertThat(inspector.inspectModule(root).docstring()).isEqualTo("Module doc.");
    assertThat(inspector.inspectModule(extractor.extractStructure("x = 1\n")).docstring()).isNull();
  }

  private Node only(String text) {
    return extractor.extractStructure(text).children().get(0);
  }
}
