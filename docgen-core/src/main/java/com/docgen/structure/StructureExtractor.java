package com.docgen.structure;

import com.docgen.structure.declaration.DeclarationClassifier;
import com.docgen.structure.layout.IndentEvent;
import com.docgen.structure.layout.IndentationAnalyzer;
import com.docgen.structure.layout.IndentationInconsistencyException;
import com.docgen.structure.lexing.Atom;
import com.docgen.structure.lexing.BracketMatcher;
import com.docgen.structure.lexing.LineIndex;
import com.docgen.structure.lexing.LineSet;
import com.docgen.structure.lexing.LineSuppressor;
import com.docgen.structure.lexing.Tokenizer;
import com.docgen.structure.tree.DeclarationEvent;
import com.docgen.structure.tree.Node;
import com.docgen.structure.tree.TreeBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the indentation-structure extractor: tokenizes the text, pairs brackets,
 * suppresses continuation lines, computes indentation deltas, classifies declarations and
 * builds the node tree. Each call works on its own state, so one instance can be shared.
 */
public final class StructureExtractor {

  private static final Logger log = LoggerFactory.getLogger(StructureExtractor.class);

  private final Tokenizer tokenizer;
  private final DeclarationClassifier classifier;
  private final BracketMatcher bracketMatcher = new BracketMatcher();
  private final LineSuppressor lineSuppressor = new LineSuppressor();
  private final IndentationAnalyzer indentationAnalyzer = new IndentationAnalyzer();
  private final TreeBuilder treeBuilder = new TreeBuilder();

  public StructureExtractor(Tokenizer tokenizer, DeclarationClassifier classifier) {
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  public static StructureExtractor python() {
    return new StructureExtractor(Tokenizer.python(), DeclarationClassifier.python());
  }

  public Tokenizer tokenizer() {
    return tokenizer;
  }

  /**
   * Builds the structure tree of {@code sourceText}.
   *
   * @throws IndentationInconsistencyException when a line's indentation contradicts an
   *     enclosing block
   */
  public Node extractStructure(String sourceText) {
    Objects.requireNonNull(sourceText, "sourceText");
    LineIndex index = new LineIndex(sourceText);
    List<Atom> atoms = bracketMatcher.match(tokenizer.tokenize(sourceText));
    LineSet suppressed = lineSuppressor.suppressedLines(atoms, index);
    List<IndentEvent> indentation = indentationAnalyzer.analyze(index, suppressed);

    List<DeclarationEvent> events = new ArrayList<>(indentation.size());
    for (IndentEvent event : indentation) {
      String line = index.lineText(event.line());
      events.add(
          new DeclarationEvent(
              event.line(),
              event.delta(),
              classifier.classify(line),
              classifier.isDecorator(line)));
    }
    Node root = treeBuilder.build(index, events);
    if (log.isDebugEnabled()) {
      log.debug(
          "Extracted structure: lines={}, atoms={}, suppressedLines={}, events={}, nodes={}",
          index.lineCount(),
          atoms.size(),
          suppressed.size(),
          events.size(),
          root.preorder().size());
    }
    return root;
  }

  /** Same as {@link #extractStructure(String)} but reports inconsistent indentation as a value. */
  public ExtractionResult tryExtract(String sourceText) {
    try {
      return ExtractionResult.success(extractStructure(sourceText));
    } catch (IndentationInconsistencyException ex) {
      log.debug("Structure extraction stopped at line {}: {}", ex.getLine() + 1, ex.getLineText());
      return ExtractionResult.failure(ex);
    }
  }
}
