package com.docgen.mcp.config;

import com.docgen.structure.StructureExtractor;
import com.docgen.structure.doc.NodeInspector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class DocgenStructureConfiguration {

  @Bean
  StructureExtractor structureExtractor() {
    return StructureExtractor.python();
  }

  @Bean
  NodeInspector nodeInspector(StructureExtractor structureExtractor) {
    return new NodeInspector(structureExtractor.tokenizer());
  }
}
