package com.docgen.mcp;

import com.docgen.mcp.config.DocgenProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DocgenProperties.class)
public class DocgenMcpApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocgenMcpApplication.class, args);
  }
}
