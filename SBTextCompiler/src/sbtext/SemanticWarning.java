package sbtext;

import com.google.auto.value.AutoValue;

/** A non-fatal finding of semantic analysis. */
@AutoValue
public abstract class SemanticWarning {
  public abstract String message();

  public abstract Lexer.Pos pos();

  public static SemanticWarning create(String message, Lexer.Pos pos) {
    return new AutoValue_SemanticWarning(message, pos);
  }
}
