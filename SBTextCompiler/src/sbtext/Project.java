package sbtext;

import java.util.Locale;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import sbtext.processor.ASTChild;
import sbtext.processor.ASTNode;

/** Root of the syntax tree: the targets of one merged program, in source order. */
@ASTNode
public class Project implements Project_ASTNode {
  private final ImmutableList<Target> targets;
  private final Lexer.Pos pos;

  public Project(ImmutableList<Target> targets, Lexer.Pos pos) {
    this.targets = targets;
    this.pos = pos;
  }

  @ASTChild
  @Override
  public ImmutableList<Target> targets() {
    return targets;
  }

  public Lexer.Pos pos() {
    return pos;
  }

  public Optional<Target> stage() {
    return targets.stream().filter(Target::isStage).findFirst();
  }

  public Optional<Target> findTarget(String name) {
    String lowered = name.toLowerCase(Locale.ROOT);
    return targets.stream().filter(t -> t.lowerName().equals(lowered)).findFirst();
  }

  @AutoValue
  public abstract static class VariableDecl {
    public abstract String name();

    /** A number or string literal. */
    public abstract Optional<Expression> initialValue();

    public abstract Lexer.Pos pos();

    public static VariableDecl create(
        String name, Optional<Expression> initialValue, Lexer.Pos pos) {
      return new AutoValue_Project_VariableDecl(name, initialValue, pos);
    }
  }

  @AutoValue
  public abstract static class ListDecl {
    public abstract String name();

    /** Number or string literals. */
    public abstract ImmutableList<Expression> items();

    public abstract Lexer.Pos pos();

    public static ListDecl create(String name, ImmutableList<Expression> items, Lexer.Pos pos) {
      return new AutoValue_Project_ListDecl(name, items, pos);
    }
  }

  @AutoValue
  public abstract static class CostumeDecl {
    public abstract String path();

    public abstract Lexer.Pos pos();

    public static CostumeDecl create(String path, Lexer.Pos pos) {
      return new AutoValue_Project_CostumeDecl(path, pos);
    }
  }

  /** The stage, or one sprite. */
  @ASTNode
  public static class Target implements Project_Target_ASTNode {
    private final String name;
    private final boolean isStage;
    private final ImmutableList<VariableDecl> variables;
    private final ImmutableList<ListDecl> lists;
    private final ImmutableList<CostumeDecl> costumes;
    private final ImmutableList<Procedure> procedures;
    private final ImmutableList<EventScript> scripts;
    private final Lexer.Pos pos;

    public Target(
        String name,
        boolean isStage,
        ImmutableList<VariableDecl> variables,
        ImmutableList<ListDecl> lists,
        ImmutableList<CostumeDecl> costumes,
        ImmutableList<Procedure> procedures,
        ImmutableList<EventScript> scripts,
        Lexer.Pos pos) {
      this.name = name;
      this.isStage = isStage;
      this.variables = variables;
      this.lists = lists;
      this.costumes = costumes;
      this.procedures = procedures;
      this.scripts = scripts;
      this.pos = pos;
    }

    /** An empty stage, used when a program declares none. */
    public static Target emptyStage(String name) {
      return new Target(
          name,
          true,
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          Lexer.Pos.internal());
    }

    public String name() {
      return name;
    }

    public String lowerName() {
      return name.toLowerCase(Locale.ROOT);
    }

    public boolean isStage() {
      return isStage;
    }

    public ImmutableList<VariableDecl> variables() {
      return variables;
    }

    public ImmutableList<ListDecl> lists() {
      return lists;
    }

    public ImmutableList<CostumeDecl> costumes() {
      return costumes;
    }

    @ASTChild
    @Override
    public ImmutableList<Procedure> procedures() {
      return procedures;
    }

    @ASTChild
    @Override
    public ImmutableList<EventScript> scripts() {
      return scripts;
    }

    public Lexer.Pos pos() {
      return pos;
    }

    public Optional<Procedure> findProcedure(String procedureName) {
      String lowered = procedureName.toLowerCase(Locale.ROOT);
      return procedures
          .stream()
          .filter(p -> p.name().toLowerCase(Locale.ROOT).equals(lowered))
          .findFirst();
    }
  }

  @ASTNode
  public static class Procedure implements Project_Procedure_ASTNode {
    private final String name;
    private final ImmutableList<String> params;
    private final boolean warp;
    private final ImmutableList<Statement> body;
    private final Lexer.Pos pos;

    public Procedure(
        String name,
        ImmutableList<String> params,
        boolean warp,
        ImmutableList<Statement> body,
        Lexer.Pos pos) {
      this.name = name;
      this.params = params;
      this.warp = warp;
      this.body = body;
      this.pos = pos;
    }

    public String name() {
      return name;
    }

    public ImmutableList<String> params() {
      return params;
    }

    /** Run without screen refresh. */
    public boolean warp() {
      return warp;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    public Lexer.Pos pos() {
      return pos;
    }
  }

  @ASTNode
  public static class EventScript implements Project_EventScript_ASTNode {
    public enum Event {
      FLAG_CLICKED("event_whenflagclicked"),
      SPRITE_CLICKED("event_whenthisspriteclicked"),
      RECEIVE("event_whenbroadcastreceived");

      private final String opcode;

      private Event(String opcode) {
        this.opcode = opcode;
      }

      public String opcode() {
        return opcode;
      }
    }

    private final Event event;
    private final Optional<String> message;
    private final ImmutableList<Statement> body;
    private final Lexer.Pos pos;

    public EventScript(
        Event event, Optional<String> message, ImmutableList<Statement> body, Lexer.Pos pos) {
      this.event = event;
      this.message = message;
      this.body = body;
      this.pos = pos;
    }

    public Event event() {
      return event;
    }

    /** The received broadcast, for {@link Event#RECEIVE}. */
    public Optional<String> message() {
      return message;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    public Lexer.Pos pos() {
      return pos;
    }
  }
}
