package com.docgen.mcp.structure;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class StructureToolConfiguration {

  @Bean
  ToolCallbackProvider structureToolCallbackProvider(StructureTools tools) {
    return MethodToolCallbackProvider.builder().toolObjects(tools).build();
  }
}
