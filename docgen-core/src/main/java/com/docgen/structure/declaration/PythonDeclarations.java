package com.docgen.structure.declaration;

import com.docgen.structure.lexing.PatternFinder;
import java.util.List;

/** Declaration patterns for Python statements; every pattern captures the declared name. */
public final class PythonDeclarations {

  private static final String INDENT = "^[ \\t\\f]*";
  private static final String IDENTIFIER = "[\\p{L}_][\\p{L}\\p{N}_]*";

  static final String FUNCTION =
      INDENT + "(?:async[ \\t]+)?def[ \\t]+(" + IDENTIFIER + ")[ \\t]*\\(";

  static final String CLASS = INDENT + "class[ \\t]+(" + IDENTIFIER + ")";

  // Hard keywords can start a compound statement such as "else: x = 1"; never a target.
  private static final String KEYWORD =
      "(?:False|None|True|and|as|assert|async|await|break|class|continue|def|del|elif|else"
          + "|except|finally|for|from|global|if|import|in|is|lambda|nonlocal|not|or|pass"
          + "|raise|return|try|while|with|yield)(?![\\p{L}\\p{N}_])";

  static final String ASSIGNMENT =
      INDENT + "(?!" + KEYWORD + ")(" + IDENTIFIER + ")[ \\t\\f]*(?::[^=\\n]*)?=(?!=)";

  /** A decorator line; it belongs to the declaration that follows it. */
  public static final String DECORATOR = INDENT + "@";

  private PythonDeclarations() {}

  public static List<PatternFinder<DeclarationKind>> finders() {
    return List.of(
        PatternFinder.of(DeclarationKind.FUNCTION, FUNCTION),
        PatternFinder.of(DeclarationKind.CLASS, CLASS),
        PatternFinder.of(DeclarationKind.ASSIGNMENT, ASSIGNMENT));
  }
}
