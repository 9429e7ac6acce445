package sbtext;

import java.io.PrintStream;

/** A fatal compile failure, tagged with the pipeline phase that raised it. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Phase {
    IMPORT,
    LEX,
    PARSE,
    SEMANTIC,
    CODEGEN,
    BUNDLE;
  }

  private final Phase phase;
  private final Lexer.Pos pos;
  private final String errorMsg;

  public CompilerException(Phase phase, Lexer.Pos pos, String errorMsg) {
    super(errorMsg);
    this.phase = phase;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public CompilerException(Phase phase, String errorMsg) {
    this(phase, Lexer.Pos.internal(), errorMsg);
  }

  public CompilerException(Phase phase, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.phase = phase;
    this.pos = Lexer.Pos.internal();
    this.errorMsg = errorMsg;
  }

  public Phase phase() {
    return phase;
  }

  /** Position in merged-source coordinates, or {@link Lexer.Pos#internal()}. */
  public Lexer.Pos pos() {
    return pos;
  }

  public boolean hasPos() {
    return !pos.isInternal();
  }

  public String errorMsg() {
    return errorMsg;
  }

  /** Same failure, reworded for the user; the position is kept. */
  public CompilerException withMessage(String message) {
    CompilerException ex = new CompilerException(phase, pos, message);
    ex.initCause(this);
    return ex;
  }

  public void print() {
    print(System.err);
  }

  public void print(PrintStream err) {
    err.println("ERROR: " + getMessage());
  }
}
