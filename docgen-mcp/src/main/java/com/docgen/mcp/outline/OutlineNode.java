package com.docgen.mcp.outline;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * Documented item of a module.
 *
 * @param lineno 1-based line of the declaration
 * @param signature {@code name(parameters)} for functions, {@code Name(bases)} for classes and
 *     the bare name otherwise
 * @param value assigned expression, assignments only
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OutlineNode(
    OutlineKind kind,
    String name,
    int lineno,
    String signature,
    String value,
    String docstring,
    List<OutlineNode> children) {

  public OutlineNode {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    children = children == null ? List.of() : List.copyOf(children);
  }
}
