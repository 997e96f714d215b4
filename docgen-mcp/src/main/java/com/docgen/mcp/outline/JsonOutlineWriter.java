package com.docgen.mcp.outline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class JsonOutlineWriter {

  private final ObjectMapper objectMapper;

  public JsonOutlineWriter(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public String write(OutlineNode outline) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(outline);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize outline of " + outline.name(), ex);
    }
  }
}
