package sbtext;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class SemanticAnalyzerTest {

  private StringBuilder file = new StringBuilder();
  private SemanticAnalyzer.Options options = SemanticAnalyzer.Options.defaults();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<SemanticWarning> analyze() throws CompilerException {
    Project project = new Parser(new Lexer(file.toString()).tokenize()).parseProject();
    return SemanticAnalyzer.analyze(project, options);
  }

  private CompilerException analyzeFails() {
    CompilerException ex = assertThrows(CompilerException.class, this::analyze);
    assertThat(ex.phase()).isEqualTo(CompilerException.Phase.SEMANTIC);
    return ex;
  }

  @Test
  public void validProgram() throws CompilerException {
    println("stage");
    println("  var score");
    println("  list names");
    println("end");
    println("sprite Cat");
    println("  var lives = 3");
    println("  define hop (height)");
    println("    change y by (height)");
    println("    set [score] to (score + 1)");
    println("    add (lives) to [names]");
    println("  end");
    println("  when flag clicked");
    println("    hop (10)");
    println("    Dog.bark");
    println("    say (Dog.volume)");
    println("    log (\"trace\")");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  var volume");
    println("  define bark");
    println("    say (\"woof\")");
    println("  end");
    println("end");

    assertThat(analyze()).isEmpty();
  }

  @Test
  public void moreThanOneStage() {
    println("stage");
    println("end");
    println("stage Scene");
    println("end");

    assertThat(analyzeFails().errorMsg()).isEqualTo("Project can only define one stage.");
  }

  @Test
  public void duplicateTargetNamesIgnoreCase() {
    println("sprite Cat");
    println("end");
    println("sprite CAT");
    println("end");

    CompilerException ex = analyzeFails();

    assertThat(ex.errorMsg()).isEqualTo("Duplicate target name 'CAT'.");
    assertThat(ex.pos()).isEqualTo(new Lexer.Pos(3, 1));
  }

  @Test
  public void duplicateProcedure() {
    println("sprite Cat");
    println("  define jump");
    println("  end");
    println("  define JUMP");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Procedure 'JUMP' is already defined at line 2 in target 'Cat'.");
  }

  @Test
  public void duplicateParameters() {
    println("sprite Cat");
    println("  define jump (a) (A)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Procedure 'jump' has duplicate parameter names at line 2, column 3.");
  }

  @Test
  public void duplicateDeclarationsArePermissiveByDefault() throws CompilerException {
    println("sprite Cat");
    println("  var x");
    println("  var X");
    println("end");

    assertThat(analyze()).isEmpty();
  }

  @Test
  public void duplicateDeclarationsInStrictMode() {
    options = SemanticAnalyzer.Options.builder().setRejectDuplicateDeclarations(true).build();
    println("sprite Cat");
    println("  list items");
    println("  list ITEMS");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Duplicate list 'ITEMS' at line 3, column 3 in target 'Cat'.");
  }

  @Test
  public void unknownVariable() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (missing)");
    println("  end");
    println("end");

    CompilerException ex = analyzeFails();

    assertThat(ex.errorMsg())
        .isEqualTo("Unknown variable 'missing' at line 3, column 10 in target 'Cat'.");
    assertThat(ex.pos()).isEqualTo(new Lexer.Pos(3, 10));
  }

  @Test
  public void parameterIsNotAVariableField() {
    println("sprite Cat");
    println("  define jump (h)");
    println("    set [h] to (1)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .startsWith("Variable field 'h' refers to a procedure parameter at line 3, column 5");
  }

  @Test
  public void parametersAreOnlyVisibleInTheirProcedure() {
    println("sprite Cat");
    println("  define jump (h)");
    println("    say (h)");
    println("  end");
    println("  when flag clicked");
    println("    say (h)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Unknown variable 'h' at line 6, column 10 in target 'Cat'.");
  }

  @Test
  public void unknownList() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    add (1) to [nope]");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Unknown list 'nope' at line 3, column 5 in target 'Cat'.");
  }

  @Test
  public void localArityMismatch() {
    println("sprite Cat");
    println("  define jump (h)");
    println("  end");
    println("  when flag clicked");
    println("    jump (1) (2)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo(
            "Procedure 'jump' expects 1 argument(s), got 2 at line 5, column 5 in event script.");
  }

  @Test
  public void remoteArityMismatch() {
    println("sprite Cat");
    println("  define hop");
    println("    Dog.bark (1)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  define bark");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo(
            "Procedure 'bark' on target 'Dog' expects 0 argument(s), got 1 at line 3, column 5"
                + " in procedure 'hop'.");
  }

  @Test
  public void unknownRemoteTarget() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    Fish.swim");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo(
            "Unknown target 'Fish' in procedure call 'Fish.swim' at line 3, column 5 in target"
                + " 'Cat'.");
  }

  @Test
  public void unknownRemoteVariable() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (Dog.age)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Unknown variable 'age' on target 'Dog' at line 3, column 10 in target 'Cat'.");
  }

  @Test
  public void unknownProcedure() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    fly");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg())
        .isEqualTo("Unknown procedure 'fly' at line 3, column 5 in target 'Cat'.");
  }

  @Test
  public void unknownProceduresBecomeWarningsWhenAllowed() throws CompilerException {
    options = SemanticAnalyzer.Options.builder().setAllowUnknownProcedures(true).build();
    println("sprite Cat");
    println("  when flag clicked");
    println("    fly");
    println("    Fish.swim (1)");
    println("  end");
    println("end");

    ImmutableList<SemanticWarning> warnings = analyze();

    assertThat(warnings).hasSize(2);
    assertThat(warnings.get(0).message())
        .isEqualTo(
            "Allowed unknown procedure call 'fly' at line 3, column 5 in target 'Cat' because"
                + " allow_unknown_procedures is enabled.");
    assertThat(warnings.get(1).pos()).isEqualTo(new Lexer.Pos(4, 5));
  }

  @Test
  public void arityErrorsStayFatalWhenUnknownCallsAreAllowed() {
    options = SemanticAnalyzer.Options.builder().setAllowUnknownProcedures(true).build();
    println("sprite Cat");
    println("  define jump");
    println("  end");
    println("  when flag clicked");
    println("    jump (1)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg()).startsWith("Procedure 'jump' expects 0 argument(s)");
  }

  @Test
  public void firstErrorInSourceOrderWins() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (first)");
    println("    say (second)");
    println("  end");
    println("end");

    assertThat(analyzeFails().errorMsg()).contains("'first'");
  }

  @Test
  public void variablesResolveAcrossTargets() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (lives)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  var lives");
    println("end");

    assertThat(analyze()).isEmpty();
  }
}
