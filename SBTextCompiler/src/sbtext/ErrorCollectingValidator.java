package sbtext;

import java.util.ArrayList;
import java.util.List;

/** Base for tree walks that record semantic errors in traversal order instead of throwing. */
abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> errors = new ArrayList<>();

  protected void logError(Lexer.Pos pos, String msg) {
    logError(new CompilerException(CompilerException.Phase.SEMANTIC, pos, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Throws the earliest recorded error, if any. */
  public void throwFirstError() throws CompilerException {
    if (hasErrors()) {
      throw errors.get(0);
    }
  }
}
