package sbtext;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Turns merged SBText source into a flat token list terminated by {@link TokenType#EOF}. */
public class Lexer {

  /** 1-based line and column in merged-source coordinates. */
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos(0, 0);

    public static Pos internal() {
      return INTERNAL;
    }

    private final int line;
    private final int column;

    public Pos(int line, int column) {
      this.line = line;
      this.column = column;
    }

    public int line() {
      return line;
    }

    public int column() {
      return column;
    }

    public boolean isInternal() {
      return this == INTERNAL;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparingInt(Pos::line).thenComparingInt(Pos::column).compare(this, pos);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Pos)) return false;
      Pos other = (Pos) obj;
      return line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(line, column);
    }

    @Override
    public String toString() {
      return line + ":" + column;
    }
  }

  public enum TokenType {
    KEYWORD,
    IDENT,
    NUMBER,
    STRING,
    OP,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    NEWLINE,
    EOF;
  }

  @AutoValue
  public abstract static class Token {
    public abstract TokenType type();

    public abstract String text();

    public abstract Pos pos();

    public static Token create(TokenType type, String text, Pos pos) {
      return new AutoValue_Lexer_Token(type, text, pos);
    }

    public boolean is(TokenType type) {
      return type() == type;
    }

    public boolean isKeyword(String keyword) {
      return type() == TokenType.KEYWORD && text().equals(keyword);
    }

    public boolean isOp(String op) {
      return type() == TokenType.OP && text().equals(op);
    }

    /** Keywords and identifiers both spell names in bracketed and qualified positions. */
    public boolean isWord() {
      return type() == TokenType.KEYWORD || type() == TokenType.IDENT;
    }
  }

  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "add", "all", "and", "answer", "ask", "at", "backdrop", "bounce", "broadcast",
          "brightness", "by", "change", "clicked", "color", "contains", "contents", "costume",
          "down", "define", "delete", "direction", "edge", "else", "end", "erase", "each", "flag",
          "floor", "for", "forever", "go", "hide", "i", "if", "in", "insert", "item", "key",
          "left", "length", "list", "mouse", "move", "next", "not", "of", "on", "or", "pick",
          "point", "pressed", "random", "receive", "repeat", "replace", "reset", "right", "round",
          "say", "saturation", "seconds", "set", "show", "size", "sprite", "stamp", "stage",
          "steps", "stop", "switch", "pen", "then", "think", "this", "timer", "to",
          "transparency", "turn", "up", "until", "var", "wait", "while", "when", "with", "x",
          "y");

  // BOM, zero width space, zero width non-joiner, zero width joiner, word joiner.
  private static final ImmutableSet<Integer> IGNORABLE =
      ImmutableSet.of(0xFEFF, 0x200B, 0x200C, 0x200D, 0x2060);

  private final int[] chars;
  private int index = 0;
  private int line = 1;
  private int column = 1;

  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  public Lexer(String source) {
    this.chars = source.codePoints().toArray();
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    while (!atEnd()) {
      int ch = peek();
      if (IGNORABLE.contains(ch) || ch == ' ' || ch == '\t' || ch == '\r') {
        advance();
      } else if (ch == '\n') {
        Pos pos = pos();
        advance();
        tokens.add(Token.create(TokenType.NEWLINE, "\n", pos));
      } else if (ch == '#') {
        while (!atEnd() && peek() != '\n') {
          advance();
        }
      } else if (ch == '"') {
        tokens.add(readString());
      } else if (isAsciiDigit(ch)) {
        tokens.add(readNumber());
      } else if (isAsciiLetter(ch) || ch == '_') {
        tokens.add(readIdentifier());
      } else {
        readPunctuation(ch);
      }
    }
    tokens.add(Token.create(TokenType.EOF, "", pos()));
    return tokens.build();
  }

  private void readPunctuation(int ch) throws CompilerException {
    Pos pos = pos();
    TokenType type;
    switch (ch) {
      case '(':
        type = TokenType.LPAREN;
        break;
      case ')':
        type = TokenType.RPAREN;
        break;
      case '[':
        type = TokenType.LBRACKET;
        break;
      case ']':
        type = TokenType.RBRACKET;
        break;
      case ',':
        type = TokenType.COMMA;
        break;
      case '+':
      case '-':
      case '*':
      case '/':
      case '%':
        type = TokenType.OP;
        break;
      case '=':
      case '!':
      case '<':
      case '>':
        advance();
        String op = Character.toString(ch);
        if (!atEnd() && peek() == '=') {
          advance();
          op += "=";
        }
        tokens.add(Token.create(TokenType.OP, op, pos));
        return;
      default:
        throw error(pos, String.format("Unexpected character '%s'", Character.toString(ch)));
    }
    advance();
    tokens.add(Token.create(type, Character.toString(ch), pos));
  }

  private Token readIdentifier() {
    Pos pos = pos();
    StringBuilder text = new StringBuilder();
    text.appendCodePoint(advance());
    while (!atEnd()) {
      int ch = peek();
      if (isAsciiLetter(ch) || isAsciiDigit(ch) || ch == '_' || ch == '?' || ch == '.') {
        text.appendCodePoint(advance());
      } else {
        break;
      }
    }

    String lowered = text.toString().toLowerCase(Locale.ROOT);
    if (KEYWORDS.contains(lowered)) {
      return Token.create(TokenType.KEYWORD, lowered, pos);
    }
    return Token.create(TokenType.IDENT, text.toString(), pos);
  }

  private Token readNumber() throws CompilerException {
    Pos pos = pos();
    int first = advance();
    if (first == '0' && !atEnd()) {
      int radix = radixOf(peek());
      if (radix != 0) {
        StringBuilder raw = new StringBuilder("0").appendCodePoint(advance());
        StringBuilder digits = new StringBuilder();
        while (!atEnd() && (peek() == '_' || isRadixDigit(peek(), radix))) {
          int ch = advance();
          raw.appendCodePoint(ch);
          if (ch != '_') digits.appendCodePoint(ch);
        }
        if (digits.length() == 0) {
          throw error(pos, String.format("Invalid number literal '%s'", raw));
        }
        return Token.create(
            TokenType.NUMBER, new BigInteger(digits.toString(), radix).toString(), pos);
      }
    }

    StringBuilder text = new StringBuilder().appendCodePoint(first);
    boolean seenDot = false;
    while (!atEnd()) {
      int ch = peek();
      if (isAsciiDigit(ch)) {
        text.appendCodePoint(advance());
      } else if (ch == '.' && !seenDot) {
        seenDot = true;
        text.appendCodePoint(advance());
      } else {
        break;
      }
    }
    return Token.create(TokenType.NUMBER, text.toString(), pos);
  }

  private static int radixOf(int prefix) {
    switch (prefix) {
      case 'x':
      case 'X':
        return 16;
      case 'b':
      case 'B':
        return 2;
      case 'o':
      case 'O':
        return 8;
      default:
        return 0;
    }
  }

  private Token readString() throws CompilerException {
    Pos pos = pos();
    advance();
    StringBuilder out = new StringBuilder();
    while (!atEnd()) {
      int ch = advance();
      if (ch == '"') {
        return Token.create(TokenType.STRING, out.toString(), pos);
      } else if (ch == '\n') {
        break;
      } else if (ch == '\\') {
        if (atEnd()) break;
        int esc = advance();
        switch (esc) {
          case 'n':
            out.append('\n');
            break;
          case 'r':
            out.append('\r');
            break;
          case 't':
            out.append('\t');
            break;
          default:
            out.appendCodePoint(esc);
        }
      } else {
        out.appendCodePoint(ch);
      }
    }
    throw error(pos, "Unterminated string literal");
  }

  private boolean atEnd() {
    return index >= chars.length;
  }

  private int peek() {
    return chars[index];
  }

  private int advance() {
    int ch = chars[index++];
    if (ch == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return ch;
  }

  private Pos pos() {
    return new Pos(line, column);
  }

  private static boolean isAsciiDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isRadixDigit(int ch, int radix) {
    return ch < 0x80 && Character.digit(ch, radix) >= 0;
  }

  private static boolean isAsciiLetter(int ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
  }

  private static CompilerException error(Pos pos, String msg) {
    return new CompilerException(CompilerException.Phase.LEX, pos, msg);
  }
}
