package com.docgen.mcp.outline;

import com.docgen.mcp.config.DocgenProperties;
import com.docgen.structure.declaration.DeclarationKind;
import com.docgen.structure.doc.NodeDetails;
import com.docgen.structure.doc.NodeInspector;
import com.docgen.structure.tree.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns an extracted node tree into the documented outline of a module.
 *
 * <p>Names starting with an underscore are private and left out unless configured otherwise;
 * dunder names are public except the interpreter-managed ones in {@link #HIDDEN_DUNDERS}.
 * Unnamed blocks are flattened into their parent. A function's body is not part of the
 * outline. When a name is bound several times in one scope only the last binding is kept.
 */
@Component
public class OutlineAssembler {

  static final Set<String> HIDDEN_DUNDERS =
      Set.of(
          "__module__",
          "__dict__",
          "__weakref__",
          "__doc__",
          "__builtins__",
          "__file__",
          "__name__",
          "__package__");

  private static final String DEFAULT_MODULE_NAME = "module";

  private final NodeInspector inspector;
  private final DocgenProperties properties;

  public OutlineAssembler(NodeInspector inspector, DocgenProperties properties) {
    this.inspector = Objects.requireNonNull(inspector, "inspector");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public OutlineNode assemble(String moduleName, Node root) {
    Objects.requireNonNull(root, "root");
    String name = StringUtils.hasText(moduleName) ? moduleName : DEFAULT_MODULE_NAME;
    NodeDetails module = inspector.inspectModule(root);
    return new OutlineNode(
        OutlineKind.MODULE, name, 1, name, null, module.docstring(), members(root));
  }

  /** Module name for a file name or path: {@code pkg/util.py} is {@code util}. */
  public static String moduleName(String sourceName) {
    if (!StringUtils.hasText(sourceName)) {
      return DEFAULT_MODULE_NAME;
    }
    String[] parts = sourceName.trim().replace('\\', '/').split("/");
    String fileName = parts[parts.length - 1];
    if (fileName.equals("__init__.py") && parts.length > 1) {
      fileName = parts[parts.length - 2];
    }
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return StringUtils.hasText(stem) ? stem : DEFAULT_MODULE_NAME;
  }

  boolean isVisible(String name, DeclarationKind kind) {
    DocgenProperties.Outline outline = properties.getOutline();
    if (kind == DeclarationKind.ASSIGNMENT && !outline.isIncludeAssignments()) {
      return false;
    }
    if (!name.startsWith("_")) {
      return true;
    }
    if (name.length() > 4 && name.startsWith("__") && name.endsWith("__")) {
      return !HIDDEN_DUNDERS.contains(name);
    }
    return outline.isIncludePrivate();
  }

  private List<OutlineNode> members(Node scope) {
    Map<String, Node> bindings = new LinkedHashMap<>();
    collect(scope, bindings);
    List<OutlineNode> members = new ArrayList<>(bindings.size());
    for (Node node : bindings.values()) {
      members.add(describe(node));
    }
    return members;
  }

  private void collect(Node scope, Map<String, Node> bindings) {
    for (Node child : scope.children()) {
      if (!child.isNamed()) {
        collect(child, bindings);
      } else if (isVisible(child.name(), child.kind())) {
        bindings.remove(child.name());
        bindings.put(child.name(), child);
      }
    }
  }

  private OutlineNode describe(Node node) {
    NodeDetails details = inspector.inspect(node);
    int lineno = node.lineno() + 1;
    return switch (node.kind()) {
      case FUNCTION -> new OutlineNode(
          OutlineKind.FUNCTION,
          node.name(),
          lineno,
          node.name() + orEmptyParentheses(details.parameters()),
          null,
          details.docstring(),
          List.of());
      case CLASS -> new OutlineNode(
          OutlineKind.CLASS,
          node.name(),
          lineno,
          node.name() + orEmptyParentheses(details.parameters()),
          null,
          details.docstring(),
          members(node));
      case ASSIGNMENT -> new OutlineNode(
          OutlineKind.ASSIGNMENT,
          node.name(),
          lineno,
          node.name(),
          abbreviate(details.value()),
          null,
          List.of());
      case NONE -> throw new IllegalStateException("Unnamed node at line " + lineno);
    };
  }

  private String abbreviate(String value) {
    if (value == null) {
      return null;
    }
    int max = properties.getOutline().getMaxValueLength();
    return value.length() <= max ? value : value.substring(0, max - 3) + "...";
  }

  private static String orEmptyParentheses(String parameters) {
    return parameters != null ? parameters : "()";
  }
}
