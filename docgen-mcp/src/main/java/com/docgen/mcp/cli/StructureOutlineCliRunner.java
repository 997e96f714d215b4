package com.docgen.mcp.cli;

import com.docgen.mcp.config.DocgenProperties;
import com.docgen.mcp.outline.OutlineService;
import com.docgen.mcp.structure.StructureModels.RenderOutlineRequest;
import com.docgen.mcp.structure.StructureModels.RenderOutlineResponse;
import com.docgen.mcp.structure.StructureModels.StructureFailure;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@ConditionalOnProperty(prefix = "docgen.cli", name = "enabled", havingValue = "true")
public class StructureOutlineCliRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(StructureOutlineCliRunner.class);

  private final OutlineService outlineService;
  private final DocgenProperties properties;

  public StructureOutlineCliRunner(OutlineService outlineService, DocgenProperties properties) {
    this.outlineService = outlineService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    DocgenProperties.Cli cli = properties.getCli();
    String input = cli.getInput();
    if (!StringUtils.hasText(input) && !args.getNonOptionArgs().isEmpty()) {
      input = args.getNonOptionArgs().get(0);
    }
    if (!StringUtils.hasText(input)) {
      log.warn("Outline CLI requires docgen.cli.input or a file argument");
      return;
    }
    RenderOutlineResponse response =
        outlineService.render(new RenderOutlineRequest(input, null, null, cli.getFormat()));
    if (!response.success()) {
      StructureFailure failure = response.failure();
      log.warn(
          "Outline of {} not rendered: inconsistent indentation at line {}: {}",
          response.sourceName(),
          failure.line(),
          failure.lineText());
      return;
    }
    if (!StringUtils.hasText(cli.getOutput())) {
      log.info("Outline of {} ({}):\n{}", response.sourceName(), response.format(), response.content());
      return;
    }
    Path output = Path.of(cli.getOutput()).toAbsolutePath().normalize();
    try {
      if (output.getParent() != null) {
        Files.createDirectories(output.getParent());
      }
      Files.writeString(output, response.content(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to write outline to " + output, ex);
    }
    log.info(
        "Outline of {} written to {} (format={})",
        response.sourceName(),
        output,
        response.format());
  }
}
