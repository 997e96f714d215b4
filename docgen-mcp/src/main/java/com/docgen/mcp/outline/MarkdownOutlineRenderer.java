package com.docgen.mcp.outline;

import com.docgen.mcp.config.DocgenProperties;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Renders an outline as Markdown: one heading per item, nested items one level deeper, the
 * docstring under its item with its own headings pushed below the item's heading.
 */
@Component
public class MarkdownOutlineRenderer {

  private static final int MAX_HEADING_LEVEL = 6;
  private static final Pattern HEADING = Pattern.compile("^(#{1,6})(?=[ \\t]|$)");
  private static final Pattern FENCE = Pattern.compile("^[ ]{0,3}(```|~~~)");

  private final DocgenProperties properties;

  public MarkdownOutlineRenderer(DocgenProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public String render(OutlineNode outline) {
    Objects.requireNonNull(outline, "outline");
    StringBuilder markdown = new StringBuilder();
    append(outline, properties.getOutline().getBaseHeadingLevel(), markdown);
    return markdown.toString().stripTrailing() + "\n";
  }

  private void append(OutlineNode node, int level, StringBuilder markdown) {
    String heading = "#".repeat(Math.min(level, MAX_HEADING_LEVEL)) + " ";
    switch (node.kind()) {
      case MODULE -> {
        List<String> lines = docstringLines(node.docstring());
        String summary = lines.isEmpty() ? "" : lines.get(0).strip();
        markdown.append(heading).append(code(node.name()));
        if (!summary.isEmpty()) {
          markdown.append(" -- ").append(summary);
        }
        markdown.append("\n\n");
        String description =
            lines.size() > 1 ? String.join("\n", lines.subList(1, lines.size())).strip() : "";
        appendBlock(shiftHeadings(description, level + 1), markdown);
      }
      case FUNCTION, CLASS -> {
        markdown
            .append(heading)
            .append(code(node.signature()))
            .append(" [`")
            .append(node.kind().label())
            .append("`]\n\n");
        appendBlock(shiftHeadings(node.docstring(), level + 1), markdown);
      }
      case ASSIGNMENT -> {
        markdown
            .append(heading)
            .append(code(node.name()))
            .append(" [`")
            .append(node.kind().label())
            .append("`]\n\n");
        if (StringUtils.hasText(node.value())) {
          appendBlock(code(node.value()), markdown);
        }
      }
    }
    for (OutlineNode child : node.children()) {
      append(child, level + 1, markdown);
    }
  }

  /**
   * Raises every ATX heading of {@code text} by the same amount so the shallowest one lands on
   * {@code minimum}. Headings inside fenced code blocks are left alone.
   */
  static String shiftHeadings(String text, int minimum) {
    if (!StringUtils.hasText(text)) {
      return "";
    }
    String[] lines = text.split("\n", -1);
    boolean[] headings = new boolean[lines.length];
    int shallowest = Integer.MAX_VALUE;
    boolean fenced = false;
    for (int i = 0; i < lines.length; i++) {
      if (FENCE.matcher(lines[i]).find()) {
        fenced = !fenced;
        continue;
      }
      Matcher matcher = HEADING.matcher(lines[i]);
      if (!fenced && matcher.find()) {
        headings[i] = true;
        shallowest = Math.min(shallowest, matcher.group(1).length());
      }
    }
    int target = Math.min(minimum, MAX_HEADING_LEVEL);
    if (shallowest == Integer.MAX_VALUE || shallowest >= target) {
      return text;
    }
    String prefix = "#".repeat(target - shallowest);
    for (int i = 0; i < lines.length; i++) {
      if (headings[i]) {
        lines[i] = prefix + lines[i];
      }
    }
    return String.join("\n", lines);
  }

  private static List<String> docstringLines(String docstring) {
    return StringUtils.hasText(docstring) ? Arrays.asList(docstring.split("\n", -1)) : List.of();
  }

  private static void appendBlock(String block, StringBuilder markdown) {
    if (StringUtils.hasText(block)) {
      markdown.append(block).append("\n\n");
    }
  }

  private static String code(String text) {
    return text.contains("`") ? "`` " + text + " ``" : "`" + text + "`";
  }
}
