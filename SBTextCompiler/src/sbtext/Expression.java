package sbtext;

import java.util.Locale;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

import sbtext.processor.ASTChild;
import sbtext.processor.ASTNode;

/** Reporter expressions. Every node is immutable and carries the position of its first token. */
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    // Literals; lowered inline without a reporter block.
    NUMBER,
    STRING,

    VARIABLE,
    PICK_RANDOM,
    LIST_ITEM,
    LIST_LENGTH,
    LIST_CONTENTS,
    LIST_CONTAINS,
    KEY_PRESSED,
    REPORTER,
    MATH_FUNCTION,
    UNARY,
    BINARY;

    public boolean isLiteral() {
      return this == NUMBER || this == STRING;
    }
  }

  private final Type type;
  private final Lexer.Pos pos;

  protected Expression(Type type, Lexer.Pos pos) {
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
  public <T extends Expression> T cast() {
    return (T) this;
  }

  /** Integral values print without a fraction; others with at most six decimals. */
  public static String formatNumber(double value) {
    if (Math.abs(value - Math.rint(value)) < 1e-9) {
      return Long.toString(Math.round(value));
    }
    String text = String.format(Locale.ROOT, "%.6f", value);
    if (text.indexOf('.') < 0) return text;
    int end = text.length();
    while (text.charAt(end - 1) == '0') end--;
    if (text.charAt(end - 1) == '.') end--;
    return text.substring(0, end);
  }

  @ASTNode
  public static class NumberLiteral extends Expression implements Expression_NumberLiteral_ASTNode {
    private final double value;

    public NumberLiteral(double value, Lexer.Pos pos) {
      super(Type.NUMBER, pos);
      this.value = value;
    }

    public double value() {
      return value;
    }

    public String text() {
      return formatNumber(value);
    }
  }

  @ASTNode
  public static class StringLiteral extends Expression implements Expression_StringLiteral_ASTNode {
    private final String value;

    public StringLiteral(String value, Lexer.Pos pos) {
      super(Type.STRING, pos);
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  /** A bare or {@code Target.name} qualified variable read. */
  @ASTNode
  public static class Variable extends Expression implements Expression_Variable_ASTNode {
    private final String name;

    public Variable(String name, Lexer.Pos pos) {
      super(Type.VARIABLE, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  @ASTNode
  public static class PickRandom extends Expression implements Expression_PickRandom_ASTNode {
    private final Expression from;
    private final Expression to;

    public PickRandom(Expression from, Expression to, Lexer.Pos pos) {
      super(Type.PICK_RANDOM, pos);
      this.from = from;
      this.to = to;
    }

    @ASTChild
    @Override
    public Expression from() {
      return from;
    }

    @ASTChild
    @Override
    public Expression to() {
      return to;
    }
  }

  @ASTNode
  public static class ListItem extends Expression implements Expression_ListItem_ASTNode {
    private final String listName;
    private final Expression index;

    public ListItem(String listName, Expression index, Lexer.Pos pos) {
      super(Type.LIST_ITEM, pos);
      this.listName = listName;
      this.index = index;
    }

    public String listName() {
      return listName;
    }

    @ASTChild
    @Override
    public Expression index() {
      return index;
    }
  }

  @ASTNode
  public static class ListLength extends Expression implements Expression_ListLength_ASTNode {
    private final String listName;

    public ListLength(String listName, Lexer.Pos pos) {
      super(Type.LIST_LENGTH, pos);
      this.listName = listName;
    }

    public String listName() {
      return listName;
    }
  }

  @ASTNode
  public static class ListContents extends Expression implements Expression_ListContents_ASTNode {
    private final String listName;

    public ListContents(String listName, Lexer.Pos pos) {
      super(Type.LIST_CONTENTS, pos);
      this.listName = listName;
    }

    public String listName() {
      return listName;
    }
  }

  @ASTNode
  public static class ListContains extends Expression implements Expression_ListContains_ASTNode {
    private final String listName;
    private final Expression item;

    public ListContains(String listName, Expression item, Lexer.Pos pos) {
      super(Type.LIST_CONTAINS, pos);
      this.listName = listName;
      this.item = item;
    }

    public String listName() {
      return listName;
    }

    @ASTChild
    @Override
    public Expression item() {
      return item;
    }
  }

  @ASTNode
  public static class KeyPressed extends Expression implements Expression_KeyPressed_ASTNode {
    private final Expression key;

    public KeyPressed(Expression key, Lexer.Pos pos) {
      super(Type.KEY_PRESSED, pos);
      this.key = key;
    }

    @ASTChild
    @Override
    public Expression key() {
      return key;
    }
  }

  /** Built-in sensing reporters that take no arguments. */
  @ASTNode
  public static class Reporter extends Expression implements Expression_Reporter_ASTNode {
    public enum Kind {
      ANSWER("sensing_answer"),
      MOUSE_X("sensing_mousex"),
      MOUSE_Y("sensing_mousey"),
      TIMER("sensing_timer");

      private final String opcode;

      private Kind(String opcode) {
        this.opcode = opcode;
      }

      public String opcode() {
        return opcode;
      }
    }

    private final Kind kind;

    public Reporter(Kind kind, Lexer.Pos pos) {
      super(Type.REPORTER, pos);
      this.kind = kind;
    }

    public Kind kind() {
      return kind;
    }
  }

  @ASTNode
  public static class MathFunction extends Expression implements Expression_MathFunction_ASTNode {
    // Lowered through operator_mathop, except round which has its own block.
    public static final ImmutableSet<String> FUNCTIONS =
        ImmutableSet.of(
            "abs", "floor", "ceiling", "sqrt", "sin", "cos", "tan", "asin", "acos", "atan", "ln",
            "log", "round");

    private final String function;
    private final Expression value;

    public MathFunction(String function, Expression value, Lexer.Pos pos) {
      super(Type.MATH_FUNCTION, pos);
      this.function = function;
      this.value = value;
    }

    public String function() {
      return function;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  @ASTNode
  public static class Unary extends Expression implements Expression_Unary_ASTNode {
    public enum Operator {
      NEGATE,
      NOT;
    }

    private final Operator operator;
    private final Expression operand;

    public Unary(Operator operator, Expression operand, Lexer.Pos pos) {
      super(Type.UNARY, pos);
      this.operator = operator;
      this.operand = operand;
    }

    public Operator operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    public enum Operator {
      OR("or", 1),
      AND("and", 2),
      EQUALS("=", 3),
      DOUBLE_EQUALS("==", 3),
      NOT_EQUALS("!=", 3),
      LESS("<", 3),
      LESS_EQUALS("<=", 3),
      GREATER(">", 3),
      GREATER_EQUALS(">=", 3),
      ADD("+", 4),
      SUBTRACT("-", 4),
      MULTIPLY("*", 5),
      DIVIDE("/", 5),
      MOD("%", 5);

      private final String symbol;
      private final int precedence;

      private Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
      }

      public String symbol() {
        return symbol;
      }

      public int precedence() {
        return precedence;
      }

      public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator op : values()) {
          if (op.symbol.equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
      }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public Binary(Operator operator, Expression left, Expression right, Lexer.Pos pos) {
      super(Type.BINARY, pos);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    public Operator operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Expression left() {
      return left;
    }

    @ASTChild
    @Override
    public Expression right() {
      return right;
    }
  }
}
