package sbtext;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import sbtext.processor.ASTChild;
import sbtext.processor.ASTNode;

/** Stack blocks. Control statements own their nested bodies. */
public abstract class Statement implements ASTNodeInterface {

  public enum Type {
    BLOCK,
    BROADCAST,
    VARIABLE_COMMAND,
    LIST_COMMAND,
    LOOP,
    FOR_EACH,
    IF,
    PROCEDURE_CALL;
  }

  /** The literal shadow an input falls back to, and how a literal is encoded into it. */
  public enum InputKind {
    NUMBER,
    STRING,
    BOOLEAN;
  }

  /**
   * One input or field of a block, in source order. Expression-backed slots consume the next
   * entry of {@link Block#inputs()}; text-backed slots consume the next entry of {@link
   * Block#fields()}.
   */
  public static final class Slot {
    public enum Kind {
      // Expression lowered into an input.
      INPUT,
      // Expression rendered as the text of a menu shadow block.
      MENU,
      // Literal expression rendered as a field, with a fallback for anything else.
      OPTION,
      // Source text rendered as a field.
      FIELD,
      // Source text rendered as the text of a menu shadow block.
      FIELD_MENU;
    }

    private final Kind kind;
    private final String name;
    private final InputKind inputKind;
    private final String menuOpcode;
    private final String menuField;
    private final String fallback;

    private Slot(
        Kind kind,
        String name,
        InputKind inputKind,
        String menuOpcode,
        String menuField,
        String fallback) {
      this.kind = kind;
      this.name = name;
      this.inputKind = inputKind;
      this.menuOpcode = menuOpcode;
      this.menuField = menuField;
      this.fallback = fallback;
    }

    public static Slot number(String name) {
      return new Slot(Kind.INPUT, name, InputKind.NUMBER, null, null, null);
    }

    public static Slot text(String name) {
      return new Slot(Kind.INPUT, name, InputKind.STRING, null, null, null);
    }

    public static Slot condition(String name) {
      return new Slot(Kind.INPUT, name, InputKind.BOOLEAN, null, null, null);
    }

    public static Slot menu(String name, String menuOpcode, String menuField, String fallback) {
      return new Slot(Kind.MENU, name, InputKind.STRING, menuOpcode, menuField, fallback);
    }

    public static Slot option(String name, String fallback) {
      return new Slot(Kind.OPTION, name, InputKind.STRING, null, null, fallback);
    }

    public static Slot field(String name) {
      return new Slot(Kind.FIELD, name, InputKind.STRING, null, null, null);
    }

    public static Slot fieldMenu(String name, String menuOpcode, String menuField) {
      return new Slot(Kind.FIELD_MENU, name, InputKind.STRING, menuOpcode, menuField, null);
    }

    public Kind kind() {
      return kind;
    }

    public String name() {
      return name;
    }

    public InputKind inputKind() {
      return inputKind;
    }

    public String menuOpcode() {
      return menuOpcode;
    }

    public String menuField() {
      return menuField;
    }

    public String fallback() {
      return fallback;
    }

    public boolean takesExpression() {
      return kind == Kind.INPUT || kind == Kind.MENU || kind == Kind.OPTION;
    }

    public boolean hasMenu() {
      return kind == Kind.MENU || kind == Kind.FIELD_MENU;
    }
  }

  /** Single-block statements with a fixed input/field layout. */
  public enum Opcode {
    MOVE_STEPS("motion_movesteps", Slot.number("STEPS")),
    TURN_RIGHT("motion_turnright", Slot.number("DEGREES")),
    TURN_LEFT("motion_turnleft", Slot.number("DEGREES")),
    GO_TO("motion_goto", Slot.menu("TO", "motion_goto_menu", "TO", "_random_")),
    GO_TO_XY("motion_gotoxy", Slot.number("X"), Slot.number("Y")),
    GLIDE_TO(
        "motion_glideto",
        Slot.number("SECS"),
        Slot.menu("TO", "motion_glideto_menu", "TO", "_random_")),
    GLIDE_TO_XY("motion_glidesecstoxy", Slot.number("SECS"), Slot.number("X"), Slot.number("Y")),
    CHANGE_X("motion_changexby", Slot.number("DX")),
    SET_X("motion_setx", Slot.number("X")),
    CHANGE_Y("motion_changeyby", Slot.number("DY")),
    SET_Y("motion_sety", Slot.number("Y")),
    POINT_IN_DIRECTION("motion_pointindirection", Slot.number("DIRECTION")),
    POINT_TOWARDS(
        "motion_pointtowards",
        Slot.menu("TOWARDS", "motion_pointtowards_menu", "TOWARDS", "_mouse_")),
    SET_ROTATION_STYLE("motion_setrotationstyle", Slot.field("STYLE")),
    IF_ON_EDGE_BOUNCE("motion_ifonedgebounce"),

    SAY("looks_say", Slot.text("MESSAGE")),
    SAY_FOR_SECS("looks_sayforsecs", Slot.text("MESSAGE"), Slot.number("SECS")),
    THINK("looks_think", Slot.text("MESSAGE")),
    CHANGE_SIZE("looks_changesizeby", Slot.number("CHANGE")),
    SET_SIZE("looks_setsizeto", Slot.number("SIZE")),
    SET_EFFECT("looks_seteffectto", Slot.field("EFFECT"), Slot.number("VALUE")),
    CHANGE_EFFECT("looks_changeeffectby", Slot.field("EFFECT"), Slot.number("CHANGE")),
    CLEAR_EFFECTS("looks_cleargraphiceffects"),
    GO_TO_LAYER("looks_gotofrontback", Slot.field("FRONT_BACK")),
    CHANGE_LAYER(
        "looks_goforwardbackwardlayers", Slot.field("FORWARD_BACKWARD"), Slot.number("NUM")),
    SHOW("looks_show"),
    HIDE("looks_hide"),
    NEXT_COSTUME("looks_nextcostume"),
    NEXT_BACKDROP("looks_nextbackdrop"),
    SWITCH_COSTUME("looks_switchcostumeto", Slot.text("COSTUME")),
    SWITCH_BACKDROP("looks_switchbackdropto", Slot.text("BACKDROP")),

    PEN_DOWN("pen_penDown"),
    PEN_UP("pen_penUp"),
    PEN_CLEAR("pen_clear"),
    PEN_STAMP("pen_stamp"),
    CHANGE_PEN_SIZE("pen_changePenSizeBy", Slot.number("SIZE")),
    SET_PEN_SIZE("pen_setPenSizeTo", Slot.number("SIZE")),
    CHANGE_PEN_COLOR_PARAM(
        "pen_changePenColorParamBy",
        Slot.fieldMenu("COLOR_PARAM", "pen_menu_colorParam", "colorParam"),
        Slot.number("VALUE")),
    SET_PEN_COLOR_PARAM(
        "pen_setPenColorParamTo",
        Slot.fieldMenu("COLOR_PARAM", "pen_menu_colorParam", "colorParam"),
        Slot.number("VALUE")),

    START_SOUND(
        "sound_play", Slot.menu("SOUND_MENU", "sound_sounds_menu", "SOUND_MENU", "sound_play")),
    PLAY_SOUND_UNTIL_DONE(
        "sound_playuntildone",
        Slot.menu("SOUND_MENU", "sound_sounds_menu", "SOUND_MENU", "sound_play")),
    STOP_ALL_SOUNDS("sound_stopallsounds"),
    SET_SOUND_EFFECT("sound_seteffectto", Slot.field("EFFECT"), Slot.number("VALUE")),
    SET_VOLUME("sound_setvolumeto", Slot.number("VOLUME")),

    WAIT("control_wait", Slot.number("DURATION")),
    WAIT_UNTIL("control_wait_until", Slot.condition("CONDITION")),
    STOP("control_stop", Slot.option("STOP_OPTION", "all")),
    CREATE_CLONE(
        "control_create_clone_of",
        Slot.menu("CLONE_OPTION", "control_create_clone_of_menu", "CLONE_OPTION", "_myself_")),
    DELETE_CLONE("control_delete_this_clone"),

    ASK("sensing_askandwait", Slot.text("QUESTION")),
    RESET_TIMER("sensing_resettimer");

    private final String opcode;
    private final ImmutableList<Slot> slots;

    private Opcode(String opcode, Slot... slots) {
      this.opcode = opcode;
      this.slots = ImmutableList.copyOf(slots);
    }

    public String opcode() {
      return opcode;
    }

    public ImmutableList<Slot> slots() {
      return slots;
    }

    public boolean usesPen() {
      return opcode.startsWith("pen_");
    }

    // control_stop carries a mutation telling the editor it has no next block.
    public boolean terminal() {
      return this == STOP;
    }

    int expressionCount() {
      return (int) slots.stream().filter(Slot::takesExpression).count();
    }

    int fieldCount() {
      return slots.size() - expressionCount();
    }
  }

  private final Type type;
  private final Lexer.Pos pos;

  protected Statement(Type type, Lexer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public final Type type() {
    return type;
  }

  public final Lexer.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  @ASTNode
  public static class Block extends Statement implements Statement_Block_ASTNode {
    private final Opcode opcode;
    private final ImmutableList<String> fields;
    private final ImmutableList<Expression> inputs;

    public Block(
        Opcode opcode,
        ImmutableList<String> fields,
        ImmutableList<Expression> inputs,
        Lexer.Pos pos) {
      super(Type.BLOCK, pos);
      Preconditions.checkArgument(
          fields.size() == opcode.fieldCount(), "%s takes %s fields", opcode, opcode.fieldCount());
      Preconditions.checkArgument(
          inputs.size() == opcode.expressionCount(),
          "%s takes %s inputs",
          opcode,
          opcode.expressionCount());
      this.opcode = opcode;
      this.fields = fields;
      this.inputs = inputs;
    }

    public static Block of(Opcode opcode, Lexer.Pos pos, Expression... inputs) {
      return new Block(opcode, ImmutableList.of(), ImmutableList.copyOf(inputs), pos);
    }

    public static Block withField(
        Opcode opcode, String field, Lexer.Pos pos, Expression... inputs) {
      return new Block(opcode, ImmutableList.of(field), ImmutableList.copyOf(inputs), pos);
    }

    public Opcode opcode() {
      return opcode;
    }

    public ImmutableList<String> fields() {
      return fields;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> inputs() {
      return inputs;
    }
  }

  @ASTNode
  public static class Broadcast extends Statement implements Statement_Broadcast_ASTNode {
    private final String message;
    private final boolean andWait;

    public Broadcast(String message, boolean andWait, Lexer.Pos pos) {
      super(Type.BROADCAST, pos);
      this.message = message;
      this.andWait = andWait;
    }

    public String message() {
      return message;
    }

    public boolean andWait() {
      return andWait;
    }
  }

  /** Statements whose VARIABLE field must name a declared variable. */
  @ASTNode
  public static class VariableCommand extends Statement
      implements Statement_VariableCommand_ASTNode {
    public enum Kind {
      SET("data_setvariableto"),
      CHANGE("data_changevariableby"),
      SHOW("data_showvariable"),
      HIDE("data_hidevariable");

      private final String opcode;

      private Kind(String opcode) {
        this.opcode = opcode;
      }

      public String opcode() {
        return opcode;
      }
    }

    private final Kind kind;
    private final String variableName;
    private final Optional<Expression> value;

    public VariableCommand(
        Kind kind, String variableName, Optional<Expression> value, Lexer.Pos pos) {
      super(Type.VARIABLE_COMMAND, pos);
      Preconditions.checkArgument(
          value.isPresent() == (kind == Kind.SET || kind == Kind.CHANGE),
          "%s value mismatch",
          kind);
      this.kind = kind;
      this.variableName = variableName;
      this.value = value;
    }

    public Kind kind() {
      return kind;
    }

    public String variableName() {
      return variableName;
    }

    @ASTChild
    @Override
    public Optional<Expression> value() {
      return value;
    }
  }

  @ASTNode
  public static class ListCommand extends Statement implements Statement_ListCommand_ASTNode {
    public enum Kind {
      ADD("data_addtolist", Slot.text("ITEM")),
      DELETE("data_deleteoflist", Slot.number("INDEX")),
      DELETE_ALL("data_deletealloflist"),
      INSERT("data_insertatlist", Slot.text("ITEM"), Slot.number("INDEX")),
      REPLACE("data_replaceitemoflist", Slot.number("INDEX"), Slot.text("ITEM"));

      private final String opcode;
      private final ImmutableList<Slot> slots;

      private Kind(String opcode, Slot... slots) {
        this.opcode = opcode;
        this.slots = ImmutableList.copyOf(slots);
      }

      public String opcode() {
        return opcode;
      }

      public ImmutableList<Slot> slots() {
        return slots;
      }
    }

    private final Kind kind;
    private final String listName;
    private final ImmutableList<Expression> inputs;

    public ListCommand(
        Kind kind, String listName, ImmutableList<Expression> inputs, Lexer.Pos pos) {
      super(Type.LIST_COMMAND, pos);
      Preconditions.checkArgument(inputs.size() == kind.slots().size(), "%s arity", kind);
      this.kind = kind;
      this.listName = listName;
      this.inputs = inputs;
    }

    public Kind kind() {
      return kind;
    }

    public String listName() {
      return listName;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> inputs() {
      return inputs;
    }
  }

  @ASTNode
  public static class Loop extends Statement implements Statement_Loop_ASTNode {
    public enum Kind {
      REPEAT("control_repeat", Optional.of(Slot.number("TIMES"))),
      REPEAT_UNTIL("control_repeat_until", Optional.of(Slot.condition("CONDITION"))),
      WHILE("control_while", Optional.of(Slot.condition("CONDITION"))),
      FOREVER("control_forever", Optional.empty());

      private final String opcode;
      private final Optional<Slot> slot;

      private Kind(String opcode, Optional<Slot> slot) {
        this.opcode = opcode;
        this.slot = slot;
      }

      public String opcode() {
        return opcode;
      }

      public Optional<Slot> slot() {
        return slot;
      }
    }

    private final Kind kind;
    private final Optional<Expression> argument;
    private final ImmutableList<Statement> body;

    public Loop(
        Kind kind, Optional<Expression> argument, ImmutableList<Statement> body, Lexer.Pos pos) {
      super(Type.LOOP, pos);
      Preconditions.checkArgument(argument.isPresent() == kind.slot().isPresent(), "%s", kind);
      this.kind = kind;
      this.argument = argument;
      this.body = body;
    }

    public Kind kind() {
      return kind;
    }

    @ASTChild
    @Override
    public Optional<Expression> argument() {
      return argument;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class ForEach extends Statement implements Statement_ForEach_ASTNode {
    private final String variableName;
    private final Expression count;
    private final ImmutableList<Statement> body;

    public ForEach(
        String variableName, Expression count, ImmutableList<Statement> body, Lexer.Pos pos) {
      super(Type.FOR_EACH, pos);
      this.variableName = variableName;
      this.count = count;
      this.body = body;
    }

    public String variableName() {
      return variableName;
    }

    @ASTChild
    @Override
    public Expression count() {
      return count;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class If extends Statement implements Statement_If_ASTNode {
    private final Expression condition;
    private final ImmutableList<Statement> thenBody;
    private final ImmutableList<Statement> elseBody;

    public If(
        Expression condition,
        ImmutableList<Statement> thenBody,
        ImmutableList<Statement> elseBody,
        Lexer.Pos pos) {
      super(Type.IF, pos);
      this.condition = condition;
      this.thenBody = thenBody;
      this.elseBody = elseBody;
    }

    @ASTChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> thenBody() {
      return thenBody;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> elseBody() {
      return elseBody;
    }
  }

  /** A local call, or a {@code Target.procedure} remote call. */
  @ASTNode
  public static class ProcedureCall extends Statement implements Statement_ProcedureCall_ASTNode {
    private final String name;
    private final ImmutableList<Expression> args;

    public ProcedureCall(String name, ImmutableList<Expression> args, Lexer.Pos pos) {
      super(Type.PROCEDURE_CALL, pos);
      this.name = name;
      this.args = args;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return args;
    }
  }
}
