package com.docgen.mcp.outline;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum OutlineFormat {
  MARKDOWN,
  JSON;

  /** Parses a format name case-insensitively; blank means {@link #MARKDOWN}. */
  public static OutlineFormat from(String value) {
    if (!StringUtils.hasText(value)) {
      return MARKDOWN;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("MD")) {
      return MARKDOWN;
    }
    for (OutlineFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unsupported outline format: " + value);
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
