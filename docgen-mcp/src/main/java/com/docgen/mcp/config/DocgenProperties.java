package com.docgen.mcp.config;

import com.docgen.mcp.outline.OutlineFormat;
import java.nio.charset.Charset;
import java.nio.file.Path;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "docgen")
public class DocgenProperties implements InitializingBean {

  private static final int MAX_HEADING_LEVEL = 6;
  private static final int MIN_VALUE_LENGTH = 8;

  private final Source source = new Source();
  private final Outline outline = new Outline();
  private final Cli cli = new Cli();

  @Override
  public void afterPropertiesSet() {
    if (source.getMaxFileBytes() <= 0) {
      throw new IllegalStateException(
          "docgen.source.max-file-bytes must be positive, got " + source.getMaxFileBytes());
    }
    if (!isSupportedCharset(source.getCharset())) {
      throw new IllegalStateException(
          "docgen.source.charset is not supported: " + source.getCharset());
    }
    int level = outline.getBaseHeadingLevel();
    if (level < 1 || level > MAX_HEADING_LEVEL) {
      throw new IllegalStateException(
          "docgen.outline.base-heading-level must be between 1 and %d, got %d"
              .formatted(MAX_HEADING_LEVEL, level));
    }
    if (outline.getMaxValueLength() < MIN_VALUE_LENGTH) {
      throw new IllegalStateException(
          "docgen.outline.max-value-length must be at least %d, got %d"
              .formatted(MIN_VALUE_LENGTH, outline.getMaxValueLength()));
    }
    try {
      OutlineFormat.from(cli.getFormat());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("docgen.cli.format: " + ex.getMessage(), ex);
    }
  }

  private static boolean isSupportedCharset(String name) {
    try {
      return Charset.isSupported(name);
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  public Source getSource() {
    return source;
  }

  public Outline getOutline() {
    return outline;
  }

  public Cli getCli() {
    return cli;
  }

  public static class Source {

    private String root;
    private long maxFileBytes = 1024 * 1024;
    private String charset = "UTF-8";

    public String getRoot() {
      return root;
    }

    public void setRoot(String root) {
      this.root = root;
    }

    @Nullable
    public Path rootPath() {
      return StringUtils.hasText(root) ? Path.of(root).toAbsolutePath().normalize() : null;
    }

    public long getMaxFileBytes() {
      return maxFileBytes;
    }

    public void setMaxFileBytes(long maxFileBytes) {
      this.maxFileBytes = maxFileBytes;
    }

    public String getCharset() {
      return charset;
    }

    public void setCharset(String charset) {
      this.charset = StringUtils.hasText(charset) ? charset.trim() : "UTF-8";
    }

    public Charset charset() {
      return Charset.forName(charset);
    }
  }

  public static class Outline {

    private int baseHeadingLevel = 1;
    private boolean includePrivate = false;
    private boolean includeAssignments = true;
    private int maxValueLength = 120;

    public int getBaseHeadingLevel() {
      return baseHeadingLevel;
    }

    public void setBaseHeadingLevel(int baseHeadingLevel) {
      this.baseHeadingLevel = baseHeadingLevel;
    }

    public boolean isIncludePrivate() {
      return includePrivate;
    }

    public void setIncludePrivate(boolean includePrivate) {
      this.includePrivate = includePrivate;
    }

    public boolean isIncludeAssignments() {
      return includeAssignments;
    }

    public void setIncludeAssignments(boolean includeAssignments) {
      this.includeAssignments = includeAssignments;
    }

    public int getMaxValueLength() {
      return maxValueLength;
    }

    public void setMaxValueLength(int maxValueLength) {
      this.maxValueLength = maxValueLength;
    }
  }

  public static class Cli {

    private boolean enabled = false;
    private String input;
    private String output;
    private String format = "markdown";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getInput() {
      return input;
    }

    public void setInput(String input) {
      this.input = input;
    }

    public String getOutput() {
      return output;
    }

    public void setOutput(String output) {
      this.output = output;
    }

    public String getFormat() {
      return format;
    }

    public void setFormat(String format) {
      this.format = StringUtils.hasText(format) ? format.trim() : "markdown";
    }
  }
}
