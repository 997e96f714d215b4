package com.docgen.mcp.structure;

import com.docgen.mcp.config.DocgenProperties;
import com.docgen.mcp.structure.StructureModels.ExtractStructureRequest;
import com.docgen.mcp.structure.StructureModels.ExtractedDocument;
import com.docgen.mcp.structure.StructureModels.StructureEntry;
import com.docgen.mcp.structure.StructureModels.StructureFailure;
import com.docgen.mcp.structure.StructureModels.StructureReport;
import com.docgen.structure.ExtractionResult;
import com.docgen.structure.StructureExtractor;
import com.docgen.structure.lexing.LineIndex;
import com.docgen.structure.tree.Node;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class StructureExtractionService {

  private static final Logger log = LoggerFactory.getLogger(StructureExtractionService.class);

  static final String DEFAULT_SOURCE_NAME = "inline.py";
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final StructureExtractor extractor;
  private final DocgenProperties properties;
  private final MeterRegistry meterRegistry;
  private final Timer extractTimer;
  private final Counter extractSuccessCounter;
  private final Counter extractFailureCounter;

  public StructureExtractionService(
      StructureExtractor extractor,
      DocgenProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.properties = Objects.requireNonNull(properties, "properties");
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.extractTimer = this.meterRegistry.timer("docgen_structure_extract_duration");
    this.extractSuccessCounter =
        this.meterRegistry.counter("docgen_structure_extract_success_total");
    this.extractFailureCounter =
        this.meterRegistry.counter("docgen_structure_extract_failure_total");
  }

  public StructureReport extract(ExtractStructureRequest request) {
    Objects.requireNonNull(request, "request");
    return report(extractDocument(request.path(), request.source(), request.sourceName()));
  }

  public StructureReport extractFromFile(String path) {
    return report(extractDocument(path, null, null));
  }

  public StructureReport extractFromSource(@Nullable String sourceName, String text) {
    Objects.requireNonNull(text, "text");
    return report(extractDocument(null, text, sourceName));
  }

  /**
   * Reads {@code path} when it is given, otherwise takes {@code source} as the module text, and
   * runs the extractor over it. Inconsistent indentation is part of the returned document, not
   * an exception.
   */
  public ExtractedDocument extractDocument(
      @Nullable String path, @Nullable String source, @Nullable String sourceName) {
    if (StringUtils.hasText(path)) {
      String text = readSource(path.trim());
      String name = StringUtils.hasText(sourceName) ? sourceName.trim() : path.trim();
      return extract(name, text);
    }
    if (source == null) {
      throw new IllegalArgumentException("Either path or source must be provided");
    }
    String name = StringUtils.hasText(sourceName) ? sourceName.trim() : DEFAULT_SOURCE_NAME;
    return extract(name, stripByteOrderMark(source));
  }

  private ExtractedDocument extract(String sourceName, String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    ExtractionResult result = extractor.tryExtract(text);
    sample.stop(extractTimer);
    if (result.isSuccess()) {
      extractSuccessCounter.increment();
      log.debug("Extracted structure of {} ({} chars)", sourceName, text.length());
    } else {
      extractFailureCounter.increment();
      StructureFailure failure = StructureFailure.from(result.failure());
      log.warn(
          "Inconsistent indentation in {} at line {}: {}",
          sourceName,
          failure.line(),
          failure.lineText());
    }
    return new ExtractedDocument(sourceName, text, result);
  }

  StructureReport report(ExtractedDocument document) {
    LineIndex index = new LineIndex(document.text());
    if (!document.isSuccess()) {
      return new StructureReport(
          document.sourceName(), false, null, document.failure(), index.lineCount(), 0);
    }
    Node root = document.root();
    return new StructureReport(
        document.sourceName(),
        true,
        toEntry(root, index),
        null,
        index.lineCount(),
        root.preorder().size() - 1);
  }

  private static StructureEntry toEntry(Node node, LineIndex index) {
    List<StructureEntry> children = new ArrayList<>(node.children().size());
    for (Node child : node.children()) {
      children.add(toEntry(child, index));
    }
    int start = node.source().start();
    int end = Math.max(start, node.source().end() - 1);
    return new StructureEntry(
        node.lineno() + 1,
        node.name(),
        node.kind() != null ? node.kind().name().toLowerCase(Locale.ROOT) : null,
        index.lineOf(start) + 1,
        index.lineOf(end) + 1,
        List.copyOf(children));
  }

  private String readSource(String path) {
    Path target = resolvePath(path);
    if (!Files.exists(target)) {
      throw new IllegalArgumentException("File does not exist: " + path);
    }
    if (!Files.isRegularFile(target)) {
      throw new IllegalArgumentException("Path is not a regular file: " + path);
    }
    long limit = properties.getSource().getMaxFileBytes();
    byte[] data;
    try {
      long size = Files.size(target);
      if (size > limit) {
        throw new IllegalArgumentException(
            "File exceeds max bytes limit for " + path + ": " + size + " > " + limit);
      }
      data = Files.readAllBytes(target);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to read file: " + path, ex);
    }
    return stripByteOrderMark(decode(data, properties.getSource().charset()));
  }

  private Path resolvePath(String path) {
    Path root = properties.getSource().rootPath();
    if (root == null) {
      return Path.of(path).toAbsolutePath().normalize();
    }
    Path target = root.resolve(path).normalize();
    if (!target.startsWith(root)) {
      throw new IllegalArgumentException("path must be within source root: " + path);
    }
    return target;
  }

  private static String decode(byte[] data, Charset charset) {
    CharsetDecoder decoder = charset.newDecoder();
    decoder.onMalformedInput(CodingErrorAction.REPLACE);
    decoder.onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      return decoder.decode(ByteBuffer.wrap(data)).toString();
    } catch (CharacterCodingException ex) {
      return new String(data, charset);
    }
  }

  private static String stripByteOrderMark(String text) {
    return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
  }
}
