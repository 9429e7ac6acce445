package sbtext;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import sbtext.Statement.Opcode;

public class ParserTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private Project parse() throws CompilerException {
    return new Parser(new Lexer(file.toString()).tokenize()).parseProject();
  }

  private ImmutableList<Statement> flagScript() throws CompilerException {
    return parse().targets().get(0).scripts().get(0).body();
  }

  private static Statement.Block block(Statement statement, Opcode opcode) {
    assertThat(statement.type()).isEqualTo(Statement.Type.BLOCK);
    Statement.Block block = statement.cast();
    assertThat(block.opcode()).isEqualTo(opcode);
    return block;
  }

  @Test
  public void targetsAndDeclarations() throws CompilerException {
    println("stage");
    println("  var score = 10");
    println("  var name = \"Bob\"");
    println("  var t = -1.5");
    println("  list items = [\"a\", 2, -3]");
    println("  costume \"bg.svg\"");
    println("end");
    println("sprite \"Big Cat\"");
    println("end");

    Project project = parse();

    assertThat(project.targets()).hasSize(2);
    Project.Target stage = project.targets().get(0);
    assertThat(stage.isStage()).isTrue();
    assertThat(stage.name()).isEqualTo("Stage");
    assertThat(stage.variables()).hasSize(3);
    Expression.NumberLiteral score = stage.variables().get(0).initialValue().get().cast();
    assertThat(score.value()).isEqualTo(10.0);
    Expression.StringLiteral name = stage.variables().get(1).initialValue().get().cast();
    assertThat(name.value()).isEqualTo("Bob");
    Expression.NumberLiteral t = stage.variables().get(2).initialValue().get().cast();
    assertThat(t.value()).isEqualTo(-1.5);
    assertThat(stage.lists().get(0).items()).hasSize(3);
    assertThat(stage.costumes().get(0).path()).isEqualTo("bg.svg");

    Project.Target sprite = project.targets().get(1);
    assertThat(sprite.isStage()).isFalse();
    assertThat(sprite.name()).isEqualTo("Big Cat");
  }

  @Test
  public void proceduresAndWarp() throws CompilerException {
    println("sprite Cat");
    println("  define !jump (height) (speed)");
    println("    change y by (height)");
    println("  end");
    println("end");

    Project.Procedure procedure = parse().targets().get(0).procedures().get(0);

    assertThat(procedure.name()).isEqualTo("jump");
    assertThat(procedure.warp()).isTrue();
    assertThat(procedure.params()).containsExactly("height", "speed").inOrder();
    Statement.Block change = block(procedure.body().get(0), Opcode.CHANGE_Y);
    assertThat(change.inputs().get(0).type()).isEqualTo(Expression.Type.VARIABLE);
  }

  @Test
  public void eventScriptsWithAndWithoutEnd() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (\"hi\")");
    println("  end");
    println("  when I receive [game over]");
    println("    hide");
    println("  when this sprite clicked");
    println("    show");
    println("end");

    Project.Target target = parse().targets().get(0);

    assertThat(target.scripts()).hasSize(3);
    assertThat(target.scripts().get(0).event())
        .isEqualTo(Project.EventScript.Event.FLAG_CLICKED);
    assertThat(target.scripts().get(1).message()).hasValue("game over");
    assertThat(target.scripts().get(1).body()).hasSize(1);
    assertThat(target.scripts().get(2).event())
        .isEqualTo(Project.EventScript.Event.SPRITE_CLICKED);
  }

  @Test
  public void operatorPrecedence() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (1 + 2 * 3 < 10 and not (x = 2))");
    println("  end");
    println("end");

    Statement.Block say = block(flagScript().get(0), Opcode.SAY);
    Expression.Binary and = say.inputs().get(0).cast();

    assertThat(and.operator()).isEqualTo(Expression.Binary.Operator.AND);
    Expression.Binary less = and.left().cast();
    assertThat(less.operator()).isEqualTo(Expression.Binary.Operator.LESS);
    Expression.Binary add = less.left().cast();
    assertThat(add.operator()).isEqualTo(Expression.Binary.Operator.ADD);
    Expression.Binary multiply = add.right().cast();
    assertThat(multiply.operator()).isEqualTo(Expression.Binary.Operator.MULTIPLY);
    Expression.Unary not = and.right().cast();
    assertThat(not.operator()).isEqualTo(Expression.Unary.Operator.NOT);
  }

  @Test
  public void controlFlow() throws CompilerException {
    println("sprite Cat");
    println("  var i");
    println("  when flag clicked");
    println("    if <i > 3> then");
    println("      move (10) steps");
    println("    else");
    println("      turn right (15)");
    println("    end");
    println("    repeat (3)");
    println("      next costume");
    println("    end");
    println("    repeat until <i = 10>");
    println("      change [i] by (1)");
    println("    end");
    println("    while i < 5");
    println("      wait (1)");
    println("    end");
    println("    for each [i] in (4)");
    println("      stamp");
    println("    end");
    println("    forever");
    println("      if on edge bounce");
    println("    end");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    assertThat(body).hasSize(6);
    Statement.If ifStatement = body.get(0).cast();
    assertThat(ifStatement.thenBody()).hasSize(1);
    assertThat(ifStatement.elseBody()).hasSize(1);
    Statement.Loop repeat = body.get(1).cast();
    assertThat(repeat.kind()).isEqualTo(Statement.Loop.Kind.REPEAT);
    Statement.Loop until = body.get(2).cast();
    assertThat(until.kind()).isEqualTo(Statement.Loop.Kind.REPEAT_UNTIL);
    Statement.VariableCommand change = until.body().get(0).cast();
    assertThat(change.kind()).isEqualTo(Statement.VariableCommand.Kind.CHANGE);
    Statement.Loop whileLoop = body.get(3).cast();
    assertThat(whileLoop.kind()).isEqualTo(Statement.Loop.Kind.WHILE);
    Statement.ForEach forEach = body.get(4).cast();
    assertThat(forEach.variableName()).isEqualTo("i");
    Statement.Loop forever = body.get(5).cast();
    assertThat(forever.kind()).isEqualTo(Statement.Loop.Kind.FOREVER);
    block(forever.body().get(0), Opcode.IF_ON_EDGE_BOUNCE);
  }

  @Test
  public void listStatementsAndReporters() throws CompilerException {
    println("sprite Cat");
    println("  list items");
    println("  when flag clicked");
    println("    add (\"x\") to [items]");
    println("    insert (\"y\") at (1) of [items]");
    println("    replace item (1) of [items] with (\"z\")");
    println("    delete (1) of [items]");
    println("    delete all of [items]");
    println("    say (item (1) of [items])");
    println("    say (length of [items])");
    println("    say ([items] contains (\"z\"))");
    println("    say (contents of [items])");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    assertThat(body).hasSize(9);
    Statement.ListCommand replace = body.get(2).cast();
    assertThat(replace.kind()).isEqualTo(Statement.ListCommand.Kind.REPLACE);
    assertThat(replace.inputs()).hasSize(2);
    Statement.ListCommand deleteAll = body.get(4).cast();
    assertThat(deleteAll.kind()).isEqualTo(Statement.ListCommand.Kind.DELETE_ALL);
    assertThat(block(body.get(5), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.LIST_ITEM);
    assertThat(block(body.get(6), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.LIST_LENGTH);
    assertThat(block(body.get(7), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.LIST_CONTAINS);
    assertThat(block(body.get(8), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.LIST_CONTENTS);
  }

  @Test
  public void motionLooksAndSoundForms() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    go to x (1) y (2)");
    println("    go to (\"_mouse_\")");
    println("    glide (1) secs to x (0) y (0)");
    println("    glide (2) seconds to (\"_random_\")");
    println("    go to front layer");
    println("    go backward (2) layers");
    println("    set [color] effect to (50)");
    println("    set [pitch] sound effect to (10)");
    println("    clear graphic effects");
    println("    play sound (\"pop\") until done");
    println("    stop all sounds");
    println("    set rotation style [left-right]");
    println("    create clone of (\"_myself_\")");
    println("    delete this clone");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    block(body.get(0), Opcode.GO_TO_XY);
    block(body.get(1), Opcode.GO_TO);
    block(body.get(2), Opcode.GLIDE_TO_XY);
    block(body.get(3), Opcode.GLIDE_TO);
    assertThat(block(body.get(4), Opcode.GO_TO_LAYER).fields()).containsExactly("front");
    assertThat(block(body.get(5), Opcode.CHANGE_LAYER).fields()).containsExactly("backward");
    assertThat(block(body.get(6), Opcode.SET_EFFECT).fields()).containsExactly("COLOR");
    block(body.get(7), Opcode.SET_SOUND_EFFECT);
    block(body.get(8), Opcode.CLEAR_EFFECTS);
    block(body.get(9), Opcode.PLAY_SOUND_UNTIL_DONE);
    block(body.get(10), Opcode.STOP_ALL_SOUNDS);
    assertThat(block(body.get(11), Opcode.SET_ROTATION_STYLE).fields())
        .containsExactly("left-right");
    block(body.get(12), Opcode.CREATE_CLONE);
    block(body.get(13), Opcode.DELETE_CLONE);
  }

  @Test
  public void penStatements() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    pen down");
    println("    set pen color to (50)");
    println("    change pen size by (1)");
    println("    erase all");
    println("    pen up");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    block(body.get(0), Opcode.PEN_DOWN);
    block(body.get(2), Opcode.CHANGE_PEN_SIZE);
    block(body.get(3), Opcode.PEN_CLEAR);
    block(body.get(4), Opcode.PEN_UP);
  }

  @Test
  public void identifierStatementsFallBackToCalls() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    glide");
    println("    Player.jump (1) (\"two\")");
    println("    start (3)");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    Statement.ProcedureCall glide = body.get(0).cast();
    assertThat(glide.name()).isEqualTo("glide");
    assertThat(glide.args()).isEmpty();
    Statement.ProcedureCall remote = body.get(1).cast();
    assertThat(remote.name()).isEqualTo("Player.jump");
    assertThat(remote.args()).hasSize(2);
    Statement.ProcedureCall start = body.get(2).cast();
    assertThat(start.args()).hasSize(1);
  }

  @Test
  public void mathFunctionsAndReporters() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (sqrt (16) + round (2.5) + mouse x + timer)");
    println("    say (pick random (1) to (10))");
    println("    say (key (\"space\") pressed?)");
    println("  end");
    println("end");

    ImmutableList<Statement> body = flagScript();

    Expression.Binary sum = block(body.get(0), Opcode.SAY).inputs().get(0).cast();
    assertThat(sum.right().type()).isEqualTo(Expression.Type.REPORTER);
    assertThat(block(body.get(1), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.PICK_RANDOM);
    assertThat(block(body.get(2), Opcode.SAY).inputs().get(0).type())
        .isEqualTo(Expression.Type.KEY_PRESSED);
  }

  @Test
  public void callInsideExpressionIsRejected() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (jump (1))");
    println("  end");
    println("end");

    CompilerException ex = assertThrows(CompilerException.class, this::parse);

    assertThat(ex.phase()).isEqualTo(CompilerException.Phase.PARSE);
    assertThat(ex.errorMsg())
        .isEqualTo("Procedure call 'jump' cannot appear inside an expression.");
    assertThat(ex.pos()).isEqualTo(new Lexer.Pos(3, 10));
  }

  @Test
  public void unterminatedTarget() {
    println("sprite Cat");
    println("  var x");

    CompilerException ex = assertThrows(CompilerException.class, this::parse);

    assertThat(ex.errorMsg()).isEqualTo("Unterminated target block for 'Cat'. Expected 'end'.");
  }

  @Test
  public void emptyProgram() {
    println("# nothing here");

    CompilerException ex = assertThrows(CompilerException.class, this::parse);

    assertThat(ex.errorMsg()).isEqualTo("Expected at least one 'stage' or 'sprite' block.");
  }

  @Test
  public void emptyBroadcastMessage() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    broadcast []");
    println("  end");
    println("end");

    CompilerException ex = assertThrows(CompilerException.class, this::parse);

    assertThat(ex.errorMsg()).isEqualTo("Broadcast message cannot be empty.");
  }
}
