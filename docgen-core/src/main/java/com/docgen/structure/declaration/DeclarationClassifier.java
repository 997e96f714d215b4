package com.docgen.structure.declaration;

import com.docgen.structure.lexing.PatternFinder;
import com.docgen.structure.lexing.PatternMatch;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recognises the declaration introduced by one physical line. Candidates from all finders are
 * ranked with the same first-then-longest rule the tokenizer uses.
 */
public final class DeclarationClassifier {

  private static final Comparator<PatternMatch<DeclarationKind>> ORDER =
      PatternMatch.firstThenLongest();

  private final List<PatternFinder<DeclarationKind>> finders;
  private final Pattern decorator;

  public DeclarationClassifier(List<PatternFinder<DeclarationKind>> finders) {
    this(finders, null);
  }

  /**
   * @param decorator matches lines that prefix the next declaration, {@code null} when the
   *     language has none
   */
  public DeclarationClassifier(
      List<PatternFinder<DeclarationKind>> finders, String decorator) {
    Objects.requireNonNull(finders, "finders");
    this.finders = List.copyOf(finders);
    this.decorator = decorator != null ? Pattern.compile(decorator) : null;
  }

  public static DeclarationClassifier python() {
    return new DeclarationClassifier(PythonDeclarations.finders(), PythonDeclarations.DECORATOR);
  }

  public boolean isDecorator(String line) {
    return decorator != null && line != null && decorator.matcher(line).lookingAt();
  }

  public Declaration classify(String line) {
    if (line == null || line.isBlank()) {
      return Declaration.none();
    }
    PatternMatch<DeclarationKind> best = null;
    for (PatternFinder<DeclarationKind> finder : finders) {
      PatternMatch<DeclarationKind> candidate = finder.find(line, 0).orElse(null);
      if (candidate != null && (best == null || ORDER.compare(candidate, best) < 0)) {
        best = candidate;
      }
    }
    if (best == null || best.kind() == DeclarationKind.NONE) {
      return Declaration.none();
    }
    return new Declaration(best.kind(), line.substring(best.start(), best.end()));
  }
}
