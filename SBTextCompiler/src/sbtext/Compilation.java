package sbtext;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Runs the front end over a merged program and reports failures against the original files.
 */
public final class Compilation {

  @AutoValue
  public abstract static class Checked {
    public abstract Project project();

    public abstract ImmutableList<SemanticWarning> warnings();

    static Checked create(Project project, ImmutableList<SemanticWarning> warnings) {
      return new AutoValue_Compilation_Checked(project, warnings);
    }
  }

  private Compilation() {}

  /** Lexes, parses and validates; errors carry their original file and line. */
  public static Checked parseAndValidate(MergedSource merged, SemanticAnalyzer.Options options)
      throws CompilerException {
    try {
      Project project = new Parser(new Lexer(merged.source()).tokenize()).parseProject();
      ImmutableList<SemanticWarning> warnings = SemanticAnalyzer.analyze(project, options);
      return Checked.create(project, warnings);
    } catch (CompilerException ex) {
      throw remap(ex, merged);
    }
  }

  /** Validates a single source text that has no import provenance. */
  public static Checked parseAndValidateSource(String source, SemanticAnalyzer.Options options)
      throws CompilerException {
    Project project;
    try {
      project = new Parser(new Lexer(source).tokenize()).parseProject();
    } catch (CompilerException ex) {
      throw ex.withMessage(
          String.format(
              "%s: %s (line %d, column %d)",
              kind(ex), ex.errorMsg(), ex.pos().line(), ex.pos().column()));
    }
    return Checked.create(project, SemanticAnalyzer.analyze(project, options));
  }

  static CompilerException remap(CompilerException ex, MergedSource merged) {
    switch (ex.phase()) {
      case LEX:
      case PARSE:
        {
          MergedSource.MappedPosition mapped =
              merged.mapPosition(ex.pos().line(), ex.pos().column());
          return ex.withMessage(
              String.format(
                  "%s: %s (file '%s', line %d, column %d)",
                  kind(ex), ex.errorMsg(), mapped.file(), mapped.line(), mapped.column()));
        }
      case SEMANTIC:
        if (!ex.hasPos()) return ex;
        MergedSource.MappedPosition mapped =
            merged.mapPosition(ex.pos().line(), ex.pos().column());
        return ex.withMessage(
            String.format(
                "%s (file '%s', mapped line %d, column %d)",
                ex.errorMsg(), mapped.file(), mapped.line(), mapped.column()));
      default:
        return ex;
    }
  }

  private static String kind(CompilerException ex) {
    return ex.phase() == CompilerException.Phase.LEX ? "Lex error" : "Parse error";
  }
}
