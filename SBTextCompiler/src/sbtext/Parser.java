package sbtext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import sbtext.Lexer.Pos;
import sbtext.Lexer.Token;
import sbtext.Lexer.TokenType;
import sbtext.Statement.Opcode;

/** Recursive-descent parser from a token list to a {@link Project}. Fails on the first error. */
public class Parser {

  private static final ImmutableSet<String> PEN_COLOR_PARAMS =
      ImmutableSet.of("color", "saturation", "brightness", "transparency");

  private static final ImmutableSet<String> EVENT_BODY_END =
      ImmutableSet.of("when", "define", "var", "list", "costume", "end");

  private final ImmutableList<Token> tokens;
  private int index = 0;

  public Parser(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public Project parseProject() throws CompilerException {
    skipNewlines();
    Pos start = current().pos();
    ImmutableList.Builder<Project.Target> targets = ImmutableList.builder();
    boolean any = false;
    while (!atEnd()) {
      Pos pos = current().pos();
      if (matchKeyword("sprite")) {
        String name;
        if (matchKeyword("stage")) {
          name = "Stage";
        } else {
          name = parseNameToken();
        }
        skipNewlines();
        targets.add(parseTargetBody(name, false, pos));
      } else if (matchKeyword("stage")) {
        String name = "Stage";
        if (check(TokenType.IDENT) || check(TokenType.STRING)) {
          name = parseNameToken();
        }
        skipNewlines();
        targets.add(parseTargetBody(name, true, pos));
      } else {
        throw errorHere("Expected 'sprite' or 'stage'.");
      }
      any = true;
      skipNewlines();
    }
    if (!any) {
      throw error(start, "Expected at least one 'stage' or 'sprite' block.");
    }
    return new Project(targets.build(), start);
  }

  private Project.Target parseTargetBody(String name, boolean isStage, Pos pos)
      throws CompilerException {
    ImmutableList.Builder<Project.VariableDecl> variables = ImmutableList.builder();
    ImmutableList.Builder<Project.ListDecl> lists = ImmutableList.builder();
    ImmutableList.Builder<Project.CostumeDecl> costumes = ImmutableList.builder();
    ImmutableList.Builder<Project.Procedure> procedures = ImmutableList.builder();
    ImmutableList.Builder<Project.EventScript> scripts = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (atEnd()) {
        throw errorHere(
            String.format("Unterminated target block for '%s'. Expected 'end'.", name));
      }
      Pos declPos = current().pos();
      if (matchKeyword("end")) {
        break;
      } else if (matchKeyword("var")) {
        String varName = parseDeclNameToken();
        Optional<Expression> initial = Optional.empty();
        if (matchOp("=")) {
          initial = Optional.of(parseLiteral());
        }
        variables.add(Project.VariableDecl.create(varName, initial, declPos));
      } else if (matchKeyword("list")) {
        String listName = parseDeclNameToken();
        ImmutableList<Expression> items = ImmutableList.of();
        if (matchOp("=")) {
          items = parseListInitializer();
        }
        lists.add(Project.ListDecl.create(listName, items, declPos));
      } else if (matchKeyword("costume")) {
        Token path = consume(TokenType.STRING, "Expected costume path string.");
        costumes.add(Project.CostumeDecl.create(path.text(), declPos));
      } else if (matchKeyword("define")) {
        procedures.add(parseProcedure(declPos));
      } else if (matchKeyword("when")) {
        scripts.add(parseEventScript(declPos));
      } else {
        throw errorHere(
            "Expected 'var', 'list', 'costume', 'define', 'when', or 'end' inside target.");
      }
    }
    return new Project.Target(
        name,
        isStage,
        variables.build(),
        lists.build(),
        costumes.build(),
        procedures.build(),
        scripts.build(),
        pos);
  }

  private Expression parseLiteral() throws CompilerException {
    Token token = current();
    if (token.is(TokenType.STRING)) {
      advance();
      return new Expression.StringLiteral(token.text(), token.pos());
    }
    boolean negative = matchOp("-");
    if (check(TokenType.NUMBER)) {
      double value = parseNumber(advance());
      return new Expression.NumberLiteral(negative ? -value : value, token.pos());
    }
    throw errorHere("Expected number or string literal after '='.");
  }

  private ImmutableList<Expression> parseListInitializer() throws CompilerException {
    consume(TokenType.LBRACKET, "Expected '['.");
    ImmutableList.Builder<Expression> items = ImmutableList.builder();
    if (!check(TokenType.RBRACKET)) {
      items.add(parseLiteral());
      while (match(TokenType.COMMA)) {
        items.add(parseLiteral());
      }
    }
    consume(TokenType.RBRACKET, "Expected ']' to close list initializer.");
    return items.build();
  }

  private Project.Procedure parseProcedure(Pos pos) throws CompilerException {
    boolean warp = matchOp("!");
    String name = parseNameToken();
    ImmutableList.Builder<String> params = ImmutableList.builder();
    while (check(TokenType.LPAREN)) {
      consume(TokenType.LPAREN, "Expected '('.");
      if (check(TokenType.RPAREN)) {
        throw errorHere("Empty parameter declaration is not allowed.");
      }
      params.add(parseDeclNameToken());
      consume(TokenType.RPAREN, "Expected ')' after parameter name.");
    }
    skipNewlines();
    ImmutableList<Statement> body = parseStatementBlock(ImmutableSet.of("end"));
    consumeKeyword("end", "Expected 'end' to close procedure definition.");
    return new Project.Procedure(name, params.build(), warp, body, pos);
  }

  private Project.EventScript parseEventScript(Pos pos) throws CompilerException {
    Project.EventScript.Event event;
    Optional<String> message = Optional.empty();
    if (matchKeyword("flag")) {
      consumeKeyword("clicked", "Expected 'clicked' after 'when flag'.");
      event = Project.EventScript.Event.FLAG_CLICKED;
    } else if (matchKeyword("this")) {
      consumeKeyword("sprite", "Expected 'sprite' in 'when this sprite clicked'.");
      consumeKeyword("clicked", "Expected 'clicked' in 'when this sprite clicked'.");
      event = Project.EventScript.Event.SPRITE_CLICKED;
    } else if (matchKeyword("i")) {
      consumeKeyword("receive", "Expected 'receive' after 'when I'.");
      String text = parseBracketText();
      if (text.isEmpty()) {
        throw errorHere("Broadcast message cannot be empty.");
      }
      event = Project.EventScript.Event.RECEIVE;
      message = Optional.of(text);
    } else {
      throw errorHere("Unknown event header after 'when'.");
    }
    skipNewlines();
    ImmutableList<Statement> body = parseStatementBlock(EVENT_BODY_END);
    if (checkKeyword("end") && looksLikeEventEnd()) {
      advance();
    }
    return new Project.EventScript(event, message, body, pos);
  }

  // An 'end' closes the event script unless it is the target's own 'end'.
  private boolean looksLikeEventEnd() {
    int idx = index + 1;
    while (idx < tokens.size() && tokens.get(idx).is(TokenType.NEWLINE)) {
      idx++;
    }
    if (idx >= tokens.size()) return false;
    Token token = tokens.get(idx);
    return !token.is(TokenType.EOF) && !token.isKeyword("sprite") && !token.isKeyword("stage");
  }

  private ImmutableList<Statement> parseStatementBlock(Set<String> untilKeywords)
      throws CompilerException {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (atEnd()) break;
      Token token = current();
      if (token.is(TokenType.KEYWORD) && untilKeywords.contains(token.text())) break;
      statements.add(parseStatement());
    }
    return statements.build();
  }

  private Statement parseStatement() throws CompilerException {
    Token token = current();
    if (token.is(TokenType.IDENT)) {
      return parseIdentStatement();
    } else if (!token.is(TokenType.KEYWORD)) {
      throw errorHere("Unknown statement.");
    }

    switch (token.text()) {
      case "broadcast":
        return parseBroadcast();
      case "set":
        return parseSet();
      case "change":
        return parseChange();
      case "move":
        return parseMove();
      case "say":
        return parseSay();
      case "think":
        advance();
        return Statement.Block.of(Opcode.THINK, token.pos(), parseWrappedExpression());
      case "repeat":
        return parseRepeat();
      case "forever":
        {
          advance();
          ImmutableList<Statement> body = parseBody("Expected 'end' to close forever block.");
          return new Statement.Loop(
              Statement.Loop.Kind.FOREVER, Optional.empty(), body, token.pos());
        }
      case "while":
        {
          advance();
          Expression condition = parseConditionUntilNewline(token.pos(), "while");
          ImmutableList<Statement> body = parseBody("Expected 'end' to close while block.");
          return new Statement.Loop(
              Statement.Loop.Kind.WHILE, Optional.of(condition), body, token.pos());
        }
      case "for":
        return parseForEach();
      case "if":
        if (looksLikeIfOnEdgeBounce()) {
          advance();
          consumeKeyword("on", "Expected 'on' in 'if on edge bounce'.");
          consumeKeyword("edge", "Expected 'edge' in 'if on edge bounce'.");
          consumeKeyword("bounce", "Expected 'bounce' in 'if on edge bounce'.");
          return Statement.Block.of(Opcode.IF_ON_EDGE_BOUNCE, token.pos());
        }
        return parseIf();
      case "turn":
        return parseTurn();
      case "go":
        return parseGo();
      case "point":
        return parsePoint();
      case "show":
      case "hide":
        return parseShowHide();
      case "next":
        {
          advance();
          if (matchKeyword("costume")) {
            return Statement.Block.of(Opcode.NEXT_COSTUME, token.pos());
          } else if (matchKeyword("backdrop")) {
            return Statement.Block.of(Opcode.NEXT_BACKDROP, token.pos());
          }
          throw errorHere("Expected 'costume' or 'backdrop' after 'next'.");
        }
      case "switch":
        {
          advance();
          if (matchKeyword("costume")) {
            consumeKeyword("to", "Expected 'to' in 'switch costume to'.");
            return Statement.Block.of(
                Opcode.SWITCH_COSTUME, token.pos(), parseWrappedExpression());
          } else if (matchKeyword("backdrop")) {
            consumeKeyword("to", "Expected 'to' in 'switch backdrop to'.");
            return Statement.Block.of(
                Opcode.SWITCH_BACKDROP, token.pos(), parseWrappedExpression());
          }
          throw errorHere("Expected 'costume' or 'backdrop' after 'switch'.");
        }
      case "wait":
        {
          advance();
          if (matchKeyword("until")) {
            Expression condition = parseConditionUntilNewline(token.pos(), "wait until");
            return Statement.Block.of(Opcode.WAIT_UNTIL, token.pos(), condition);
          }
          return Statement.Block.of(Opcode.WAIT, token.pos(), parseWrappedExpression());
        }
      case "stop":
        {
          advance();
          if (checkKeyword("all") && "sounds".equals(wordAt(1))) {
            advance();
            advance();
            return Statement.Block.of(Opcode.STOP_ALL_SOUNDS, token.pos());
          }
          return Statement.Block.of(Opcode.STOP, token.pos(), parseWrappedExpression());
        }
      case "ask":
        advance();
        return Statement.Block.of(Opcode.ASK, token.pos(), parseWrappedExpression());
      case "reset":
        advance();
        consumeKeyword("timer", "Expected 'timer' after 'reset'.");
        return Statement.Block.of(Opcode.RESET_TIMER, token.pos());
      case "pen":
        advance();
        if (matchKeyword("down")) {
          return Statement.Block.of(Opcode.PEN_DOWN, token.pos());
        } else if (matchKeyword("up")) {
          return Statement.Block.of(Opcode.PEN_UP, token.pos());
        }
        throw errorHere("Expected 'down' or 'up' after 'pen'.");
      case "erase":
        advance();
        consumeKeyword("all", "Expected 'all' after 'erase'.");
        return Statement.Block.of(Opcode.PEN_CLEAR, token.pos());
      case "stamp":
        advance();
        return Statement.Block.of(Opcode.PEN_STAMP, token.pos());
      case "add":
        return parseAddToList();
      case "delete":
        return parseDelete();
      case "insert":
        return parseInsertAtList();
      case "replace":
        return parseReplaceItem();
      default:
        throw errorHere("Unknown statement.");
    }
  }

  private ImmutableList<Statement> parseBody(String missingEnd) throws CompilerException {
    skipNewlines();
    ImmutableList<Statement> body = parseStatementBlock(ImmutableSet.of("end"));
    consumeKeyword("end", missingEnd);
    return body;
  }

  private Statement parseBroadcast() throws CompilerException {
    Pos start = advance().pos();
    boolean andWait = false;
    if (matchKeyword("and")) {
      consumeKeyword("wait", "Expected 'wait' after 'broadcast and'.");
      andWait = true;
    }
    String message = parseBracketText();
    if (message.isEmpty()) {
      throw errorHere("Broadcast message cannot be empty.");
    }
    return new Statement.Broadcast(message, andWait, start);
  }

  private Statement parseSet() throws CompilerException {
    Pos start = advance().pos();
    if (matchKeyword("x")) {
      consumeKeyword("to", "Expected 'to' in 'set x to'.");
      return Statement.Block.of(Opcode.SET_X, start, parseWrappedExpression());
    } else if (matchKeyword("y")) {
      consumeKeyword("to", "Expected 'to' in 'set y to'.");
      return Statement.Block.of(Opcode.SET_Y, start, parseWrappedExpression());
    } else if (matchKeyword("size")) {
      consumeKeyword("to", "Expected 'to' in 'set size to'.");
      return Statement.Block.of(Opcode.SET_SIZE, start, parseWrappedExpression());
    } else if (matchKeyword("pen")) {
      return parsePenParam(start, true);
    } else if ("volume".equals(currentWord())) {
      advance();
      consumeKeyword("to", "Expected 'to' in 'set volume to'.");
      return Statement.Block.of(Opcode.SET_VOLUME, start, parseWrappedExpression());
    } else if ("rotation".equals(currentWord()) && "style".equals(wordAt(1))) {
      advance();
      advance();
      return Statement.Block.withField(Opcode.SET_ROTATION_STYLE, parseStyleText(), start);
    } else if (looksLikeEffect()) {
      String effect = parseEffectName();
      if (matchWord("sound")) {
        consumeWord("effect", "Expected 'effect' in 'set ... sound effect to'.");
        consumeKeyword("to", "Expected 'to' in 'set ... sound effect to'.");
        return Statement.Block.withField(
            Opcode.SET_SOUND_EFFECT, effect, start, parseWrappedExpression());
      }
      consumeWord("effect", "Expected 'effect' in 'set ... effect to'.");
      consumeKeyword("to", "Expected 'to' in 'set ... effect to'.");
      return Statement.Block.withField(Opcode.SET_EFFECT, effect, start, parseWrappedExpression());
    }
    String varName = parseVariableFieldName();
    consumeKeyword("to", "Expected 'to' in set statement.");
    Expression value = parseWrappedExpression();
    return new Statement.VariableCommand(
        Statement.VariableCommand.Kind.SET, varName, Optional.of(value), start);
  }

  private Statement parseChange() throws CompilerException {
    Pos start = advance().pos();
    if (matchKeyword("x")) {
      consumeKeyword("by", "Expected 'by' in 'change x by'.");
      return Statement.Block.of(Opcode.CHANGE_X, start, parseWrappedExpression());
    } else if (matchKeyword("y")) {
      consumeKeyword("by", "Expected 'by' in 'change y by'.");
      return Statement.Block.of(Opcode.CHANGE_Y, start, parseWrappedExpression());
    } else if (matchKeyword("size")) {
      consumeKeyword("by", "Expected 'by' in 'change size by'.");
      return Statement.Block.of(Opcode.CHANGE_SIZE, start, parseWrappedExpression());
    } else if (matchKeyword("pen")) {
      return parsePenParam(start, false);
    } else if (looksLikeEffect()) {
      String effect = parseEffectName();
      consumeWord("effect", "Expected 'effect' in 'change ... effect by'.");
      consumeKeyword("by", "Expected 'by' in 'change ... effect by'.");
      return Statement.Block.withField(
          Opcode.CHANGE_EFFECT, effect, start, parseWrappedExpression());
    }
    String varName = parseVariableFieldName();
    consumeKeyword("by", "Expected 'by' in change statement.");
    Expression delta = parseWrappedExpression();
    return new Statement.VariableCommand(
        Statement.VariableCommand.Kind.CHANGE, varName, Optional.of(delta), start);
  }

  // set/change <name> [sound] effect ..., the name bare or in brackets.
  private boolean looksLikeEffect() {
    int nameLength;
    if (current().isWord()) {
      nameLength = 1;
    } else if (check(TokenType.LBRACKET)
        && index + 2 < tokens.size()
        && tokens.get(index + 1).isWord()
        && tokens.get(index + 2).is(TokenType.RBRACKET)) {
      nameLength = 3;
    } else {
      return false;
    }
    String next = wordAt(nameLength);
    return "effect".equals(next)
        || ("sound".equals(next) && "effect".equals(wordAt(nameLength + 1)));
  }

  private String parseEffectName() throws CompilerException {
    String name = check(TokenType.LBRACKET) ? parseBracketText() : advance().text();
    return name.toUpperCase(Locale.ROOT);
  }

  private String parseStyleText() throws CompilerException {
    if (check(TokenType.STRING)) {
      return advance().text();
    }
    // Bracket tokens are joined with spaces; hyphenated styles such as left-right rejoin.
    String style = parseBracketText().replace(" - ", "-");
    if (style.isEmpty()) {
      throw errorHere("Rotation style cannot be empty.");
    }
    return style;
  }

  private Statement parsePenParam(Pos start, boolean set) throws CompilerException {
    String param;
    Token token = current();
    if (token.is(TokenType.KEYWORD)) {
      param = advance().text();
    } else if (token.is(TokenType.IDENT)) {
      param = advance().text().toLowerCase(Locale.ROOT);
    } else {
      throw errorHere("Expected pen parameter name.");
    }

    String verb = set ? "to" : "by";
    if (param.equals("size")) {
      consumeKeyword(
          verb,
          String.format(
              "Expected '%s' in '%s pen size %s'.", verb, set ? "set" : "change", verb));
      return Statement.Block.of(
          set ? Opcode.SET_PEN_SIZE : Opcode.CHANGE_PEN_SIZE, start, parseWrappedExpression());
    } else if (PEN_COLOR_PARAMS.contains(param)) {
      consumeKeyword(
          verb,
          String.format(
              "Expected '%s' in '%s pen <param> %s'.", verb, set ? "set" : "change", verb));
      return Statement.Block.withField(
          set ? Opcode.SET_PEN_COLOR_PARAM : Opcode.CHANGE_PEN_COLOR_PARAM,
          param,
          start,
          parseWrappedExpression());
    }
    throw errorHere("Unknown pen parameter. Use size/color/saturation/brightness/transparency.");
  }

  private Statement parseMove() throws CompilerException {
    Pos start = advance().pos();
    Expression steps = parseWrappedExpression();
    if (!matchKeyword("steps") && check(TokenType.LBRACKET)) {
      if (!parseBracketText().equalsIgnoreCase("steps")) {
        throw errorHere("Expected 'steps' or '[steps]' after move amount.");
      }
    }
    return Statement.Block.of(Opcode.MOVE_STEPS, start, steps);
  }

  private Statement parseSay() throws CompilerException {
    Pos start = advance().pos();
    Expression message = parseWrappedExpression();
    if (matchKeyword("for")) {
      Expression duration = parseWrappedExpression();
      if (!matchKeyword("seconds") && check(TokenType.LBRACKET)) {
        if (!parseBracketText().equalsIgnoreCase("seconds")) {
          throw errorHere("Expected 'seconds' or '[seconds]' after say duration.");
        }
      }
      return Statement.Block.of(Opcode.SAY_FOR_SECS, start, message, duration);
    }
    return Statement.Block.of(Opcode.SAY, start, message);
  }

  private Statement parseRepeat() throws CompilerException {
    Pos start = advance().pos();
    if (matchKeyword("until")) {
      Expression condition = parseConditionUntilNewline(start, "repeat until");
      ImmutableList<Statement> body = parseBody("Expected 'end' to close repeat-until block.");
      return new Statement.Loop(
          Statement.Loop.Kind.REPEAT_UNTIL, Optional.of(condition), body, start);
    }
    Expression times = parseWrappedExpression();
    ImmutableList<Statement> body = parseBody("Expected 'end' to close repeat block.");
    return new Statement.Loop(Statement.Loop.Kind.REPEAT, Optional.of(times), body, start);
  }

  private Statement parseForEach() throws CompilerException {
    Pos start = advance().pos();
    consumeKeyword("each", "Expected 'each' after 'for'.");
    String varName = parseVariableFieldName();
    consumeKeyword("in", "Expected 'in' in 'for each' statement.");
    Expression count = parseWrappedExpression();
    ImmutableList<Statement> body = parseBody("Expected 'end' to close for-each block.");
    return new Statement.ForEach(varName, count, body, start);
  }

  private Statement parseIf() throws CompilerException {
    Pos start = advance().pos();
    List<Token> conditionTokens = collectTokensUntilKeyword("then");
    if (conditionTokens.isEmpty()) {
      throw error(start, "Expected condition after 'if'.");
    }
    if (conditionTokens.get(0).isOp("<")) {
      if (!conditionTokens.get(conditionTokens.size() - 1).isOp(">")) {
        throw error(start, "Expected condition enclosed in '<...>' before 'then'.");
      }
      conditionTokens = conditionTokens.subList(1, conditionTokens.size() - 1);
    }
    Expression condition = parseExpressionFromTokens(conditionTokens);
    consumeKeyword("then", "Expected 'then' in if statement.");
    skipNewlines();
    ImmutableList<Statement> thenBody = parseStatementBlock(ImmutableSet.of("else", "end"));
    ImmutableList<Statement> elseBody = ImmutableList.of();
    if (matchKeyword("else")) {
      skipNewlines();
      elseBody = parseStatementBlock(ImmutableSet.of("end"));
    }
    consumeKeyword("end", "Expected 'end' to close if statement.");
    return new Statement.If(condition, thenBody, elseBody, start);
  }

  private Statement parseTurn() throws CompilerException {
    Pos start = advance().pos();
    if (matchKeyword("right")) {
      return Statement.Block.of(Opcode.TURN_RIGHT, start, parseWrappedExpression());
    } else if (matchKeyword("left")) {
      return Statement.Block.of(Opcode.TURN_LEFT, start, parseWrappedExpression());
    }
    throw errorHere("Expected 'right' or 'left' after 'turn'.");
  }

  private Statement parseGo() throws CompilerException {
    Pos start = advance().pos();
    String word = currentWord();
    if ("forward".equals(word) || "backward".equals(word)) {
      advance();
      Expression layers = parseWrappedExpression();
      consumeWord("layers", "Expected 'layers' in 'go forward/backward (...) layers'.");
      return Statement.Block.withField(Opcode.CHANGE_LAYER, word, start, layers);
    }
    consumeKeyword("to", "Expected 'to' after 'go'.");
    word = currentWord();
    if (("front".equals(word) || "back".equals(word)) && "layer".equals(wordAt(1))) {
      advance();
      advance();
      return Statement.Block.withField(Opcode.GO_TO_LAYER, word, start);
    } else if (check(TokenType.LPAREN)) {
      return Statement.Block.of(Opcode.GO_TO, start, parseWrappedExpression());
    }
    consumeKeyword("x", "Expected 'x' in 'go to x ... y ...'.");
    Expression x = parseWrappedExpression();
    consumeKeyword("y", "Expected 'y' in 'go to x ... y ...'.");
    Expression y = parseWrappedExpression();
    return Statement.Block.of(Opcode.GO_TO_XY, start, x, y);
  }

  private Statement parsePoint() throws CompilerException {
    Pos start = advance().pos();
    if (matchWord("towards")) {
      return Statement.Block.of(Opcode.POINT_TOWARDS, start, parseWrappedExpression());
    }
    consumeKeyword("in", "Expected 'in' after 'point'.");
    consumeKeyword("direction", "Expected 'direction' after 'point in'.");
    return Statement.Block.of(Opcode.POINT_IN_DIRECTION, start, parseWrappedExpression());
  }

  private Statement parseShowHide() throws CompilerException {
    Token token = advance();
    boolean show = token.isKeyword("show");
    if (matchWord("variable")) {
      String varName = parseVariableFieldName();
      return new Statement.VariableCommand(
          show ? Statement.VariableCommand.Kind.SHOW : Statement.VariableCommand.Kind.HIDE,
          varName,
          Optional.empty(),
          token.pos());
    }
    return Statement.Block.of(show ? Opcode.SHOW : Opcode.HIDE, token.pos());
  }

  private Statement parseAddToList() throws CompilerException {
    Pos start = advance().pos();
    Expression item = parseWrappedExpression();
    consumeKeyword("to", "Expected 'to' in list add statement.");
    String listName = parseListFieldName();
    return new Statement.ListCommand(
        Statement.ListCommand.Kind.ADD, listName, ImmutableList.of(item), start);
  }

  private Statement parseDelete() throws CompilerException {
    Pos start = advance().pos();
    if (checkKeyword("this") && "clone".equals(wordAt(1))) {
      advance();
      advance();
      return Statement.Block.of(Opcode.DELETE_CLONE, start);
    } else if (matchKeyword("all")) {
      consumeKeyword("of", "Expected 'of' in 'delete all of [list]'.");
      String listName = parseListFieldName();
      return new Statement.ListCommand(
          Statement.ListCommand.Kind.DELETE_ALL, listName, ImmutableList.of(), start);
    }
    Expression index = parseWrappedExpression();
    consumeKeyword("of", "Expected 'of' in list delete statement.");
    String listName = parseListFieldName();
    return new Statement.ListCommand(
        Statement.ListCommand.Kind.DELETE, listName, ImmutableList.of(index), start);
  }

  private Statement parseInsertAtList() throws CompilerException {
    Pos start = advance().pos();
    Expression item = parseWrappedExpression();
    consumeKeyword("at", "Expected 'at' in list insert statement.");
    Expression index = parseWrappedExpression();
    consumeKeyword("of", "Expected 'of' in list insert statement.");
    String listName = parseListFieldName();
    return new Statement.ListCommand(
        Statement.ListCommand.Kind.INSERT, listName, ImmutableList.of(item, index), start);
  }

  private Statement parseReplaceItem() throws CompilerException {
    Pos start = advance().pos();
    consumeKeyword("item", "Expected 'item' after 'replace'.");
    Expression index = parseWrappedExpression();
    consumeKeyword("of", "Expected 'of' in list replace statement.");
    String listName = parseListFieldName();
    skipNewlines();
    consumeKeyword("with", "Expected 'with' in list replace statement.");
    Expression item = parseWrappedExpression();
    return new Statement.ListCommand(
        Statement.ListCommand.Kind.REPLACE, listName, ImmutableList.of(index, item), start);
  }

  // Identifier-led statements: a few multi-word blocks, otherwise a procedure call.
  private Statement parseIdentStatement() throws CompilerException {
    int mark = index;
    Token token = advance();
    Optional<Statement> statement = Optional.empty();
    switch (token.text().toLowerCase(Locale.ROOT)) {
      case "glide":
        statement = parseGlide(token.pos());
        break;
      case "clear":
        if (matchWord("graphic") && matchWord("effects")) {
          statement = Optional.of(Statement.Block.of(Opcode.CLEAR_EFFECTS, token.pos()));
        }
        break;
      case "start":
        if (matchWord("sound") && check(TokenType.LPAREN)) {
          statement =
              Optional.of(
                  Statement.Block.of(Opcode.START_SOUND, token.pos(), parseWrappedExpression()));
        }
        break;
      case "play":
        if (matchWord("sound") && check(TokenType.LPAREN)) {
          Expression sound = parseWrappedExpression();
          consumeKeyword("until", "Expected 'until done' after 'play sound (...)'.");
          consumeWord("done", "Expected 'until done' after 'play sound (...)'.");
          statement =
              Optional.of(Statement.Block.of(Opcode.PLAY_SOUND_UNTIL_DONE, token.pos(), sound));
        }
        break;
      case "create":
        if (matchWord("clone") && matchKeyword("of")) {
          statement =
              Optional.of(
                  Statement.Block.of(Opcode.CREATE_CLONE, token.pos(), parseWrappedExpression()));
        }
        break;
      default:
        break;
    }
    if (statement.isPresent()) {
      return statement.get();
    }

    index = mark;
    return parseCall();
  }

  private Optional<Statement> parseGlide(Pos start) throws CompilerException {
    if (!check(TokenType.LPAREN)) return Optional.empty();
    Expression duration = parseWrappedExpression();
    if (!matchWord("secs") && !matchKeyword("seconds")) return Optional.empty();
    consumeKeyword("to", "Expected 'to' in glide statement.");
    if (matchKeyword("x")) {
      Expression x = parseWrappedExpression();
      consumeKeyword("y", "Expected 'y' in 'glide ... to x ... y ...'.");
      Expression y = parseWrappedExpression();
      return Optional.of(Statement.Block.of(Opcode.GLIDE_TO_XY, start, duration, x, y));
    }
    return Optional.of(
        Statement.Block.of(Opcode.GLIDE_TO, start, duration, parseWrappedExpression()));
  }

  private Statement parseCall() throws CompilerException {
    Token token = consume(TokenType.IDENT, "Expected procedure name.");
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    while (check(TokenType.LPAREN)) {
      args.add(parseWrappedExpression());
    }
    return new Statement.ProcedureCall(token.text(), args.build(), token.pos());
  }

  private Expression parseConditionUntilNewline(Pos start, String context)
      throws CompilerException {
    List<Token> conditionTokens = collectTokensUntilNewline();
    if (conditionTokens.isEmpty()) {
      throw error(start, String.format("Expected condition after '%s'.", context));
    }
    if (conditionTokens.get(0).isOp("<")
        && conditionTokens.get(conditionTokens.size() - 1).isOp(">")) {
      conditionTokens = conditionTokens.subList(1, conditionTokens.size() - 1);
    }
    return parseExpressionFromTokens(conditionTokens);
  }

  private List<Token> collectTokensUntilKeyword(String keyword) throws CompilerException {
    return collectBalanced(t -> t.isKeyword(keyword));
  }

  private List<Token> collectTokensUntilNewline() throws CompilerException {
    return collectBalanced(t -> t.is(TokenType.NEWLINE));
  }

  @FunctionalInterface
  private interface Terminator {
    boolean test(Token token);
  }

  private List<Token> collectBalanced(Terminator terminator) throws CompilerException {
    List<Token> out = new ArrayList<>();
    int parens = 0;
    int brackets = 0;
    while (!atEnd()) {
      Token token = current();
      if (parens == 0 && brackets == 0 && terminator.test(token)) break;
      switch (token.type()) {
        case LPAREN:
          parens++;
          break;
        case RPAREN:
          parens--;
          break;
        case LBRACKET:
          brackets++;
          break;
        case RBRACKET:
          brackets--;
          break;
        default:
          break;
      }
      out.add(advance());
    }
    if (parens != 0 || brackets != 0) {
      throw errorHere("Unbalanced delimiters while reading condition.");
    }
    return out;
  }

  /** Parses a detached token span as one complete expression. */
  private Expression parseExpressionFromTokens(List<Token> span) throws CompilerException {
    Pos eofPos = span.isEmpty() ? new Pos(1, 1) : span.get(span.size() - 1).pos();
    List<Token> detached = new ArrayList<>(span);
    detached.add(Token.create(TokenType.EOF, "", eofPos));
    Parser parser = new Parser(detached);
    Expression expr = parser.parseExpression(TokenType.EOF, 1);
    parser.consume(TokenType.EOF, "Unexpected trailing tokens in expression.");
    return expr;
  }

  private Expression parseWrappedExpression() throws CompilerException {
    consume(TokenType.LPAREN, "Expected '('.");
    Expression expr = parseExpression(TokenType.RPAREN, 1);
    consume(TokenType.RPAREN, "Expected ')' after expression.");
    return expr;
  }

  private Expression parseExpression(TokenType stop, int minPrecedence) throws CompilerException {
    Expression left = parseUnary(stop);
    while (true) {
      Token token = current();
      if (token.is(stop)) break;
      Optional<Expression.Binary.Operator> op = asOperator(token);
      if (!op.isPresent() || op.get().precedence() < minPrecedence) break;
      advance();
      Expression right = parseExpression(stop, op.get().precedence() + 1);
      left = new Expression.Binary(op.get(), left, right, token.pos());
    }
    return left;
  }

  private static Optional<Expression.Binary.Operator> asOperator(Token token) {
    if (token.is(TokenType.OP) || token.isKeyword("and") || token.isKeyword("or")) {
      return Expression.Binary.Operator.fromSymbol(token.text());
    }
    return Optional.empty();
  }

  private Expression parseUnary(TokenType stop) throws CompilerException {
    Token token = current();
    if (token.isOp("-")) {
      advance();
      return new Expression.Unary(Expression.Unary.Operator.NEGATE, parseUnary(stop), token.pos());
    } else if (token.isKeyword("not")) {
      advance();
      return new Expression.Unary(Expression.Unary.Operator.NOT, parseUnary(stop), token.pos());
    }
    return parsePrimary(stop);
  }

  private Expression parsePrimary(TokenType stop) throws CompilerException {
    Token token = current();
    if (token.is(stop)) {
      throw errorHere("Expected expression.");
    }
    switch (token.type()) {
      case KEYWORD:
        return parseKeywordPrimary(token);
      case NUMBER:
        advance();
        return new Expression.NumberLiteral(parseNumber(token), token.pos());
      case STRING:
        advance();
        return new Expression.StringLiteral(token.text(), token.pos());
      case IDENT:
        if (peek().is(TokenType.LPAREN)) {
          String lowered = token.text().toLowerCase(Locale.ROOT);
          if (Expression.MathFunction.FUNCTIONS.contains(lowered)) {
            advance();
            return new Expression.MathFunction(lowered, parseWrappedExpression(), token.pos());
          }
          throw error(
              token.pos(),
              String.format(
                  "Procedure call '%s' cannot appear inside an expression.", token.text()));
        }
        advance();
        return new Expression.Variable(token.text(), token.pos());
      case LPAREN:
        {
          advance();
          Expression expr = parseExpression(TokenType.RPAREN, 1);
          consume(TokenType.RPAREN, "Expected ')' after grouped expression.");
          return expr;
        }
      case LBRACKET:
        {
          String name = parseVariableFieldName();
          if (matchKeyword("contains")) {
            return new Expression.ListContains(name, parseWrappedExpression(), token.pos());
          }
          return new Expression.Variable(name, token.pos());
        }
      default:
        throw errorHere("Expected expression.");
    }
  }

  private Expression parseKeywordPrimary(Token token) throws CompilerException {
    Pos start = token.pos();
    switch (token.text()) {
      case "pick":
        {
          advance();
          consumeKeyword("random", "Expected 'random' after 'pick'.");
          Expression from = parseWrappedExpression();
          consumeKeyword("to", "Expected 'to' in 'pick random ... to ...'.");
          Expression to = parseWrappedExpression();
          return new Expression.PickRandom(from, to, start);
        }
      case "item":
        {
          advance();
          Expression index = parseWrappedExpression();
          consumeKeyword("of", "Expected 'of' in 'item (...) of [list]'.");
          return new Expression.ListItem(parseListFieldName(), index, start);
        }
      case "length":
        advance();
        consumeKeyword("of", "Expected 'of' in 'length of ...'.");
        if (check(TokenType.LBRACKET)) {
          return new Expression.ListLength(parseListFieldName(), start);
        }
        throw errorHere("Expected list reference after 'length of'.");
      case "contents":
        advance();
        consumeKeyword("of", "Expected 'of' in 'contents of [list]'.");
        return new Expression.ListContents(parseListFieldName(), start);
      case "key":
        {
          advance();
          Expression key = parseWrappedExpression();
          String word = currentWord();
          if (!"pressed".equals(word) && !"pressed?".equals(word)) {
            throw errorHere("Expected 'pressed?' in key sensing expression.");
          }
          advance();
          return new Expression.KeyPressed(key, start);
        }
      case "floor":
      case "round":
        advance();
        return new Expression.MathFunction(token.text(), parseWrappedExpression(), start);
      case "answer":
        advance();
        return new Expression.Reporter(Expression.Reporter.Kind.ANSWER, start);
      case "mouse":
        advance();
        if (matchKeyword("x")) {
          return new Expression.Reporter(Expression.Reporter.Kind.MOUSE_X, start);
        } else if (matchKeyword("y")) {
          return new Expression.Reporter(Expression.Reporter.Kind.MOUSE_Y, start);
        }
        throw errorHere("Expected 'x' or 'y' after 'mouse'.");
      case "timer":
        advance();
        return new Expression.Reporter(Expression.Reporter.Kind.TIMER, start);
      default:
        // Any other keyword reads a variable of that name.
        advance();
        return new Expression.Variable(token.text(), start);
    }
  }

  private static double parseNumber(Token token) {
    try {
      return Double.parseDouble(token.text());
    } catch (NumberFormatException ex) {
      return 0.0;
    }
  }

  private String parseVariableFieldName() throws CompilerException {
    List<Token> contents = parseBracketTokens();
    if (contents.isEmpty()) {
      throw errorHere("Variable name cannot be empty.");
    }
    if (contents.get(0).text().equalsIgnoreCase("var")) {
      contents = contents.subList(1, contents.size());
    }
    String name = joinTokens(contents);
    if (name.isEmpty()) {
      throw errorHere("Variable name cannot be empty.");
    }
    return name;
  }

  private String parseListFieldName() throws CompilerException {
    String name = joinTokens(parseBracketTokens());
    if (name.isEmpty()) {
      throw errorHere("List name cannot be empty.");
    }
    return name;
  }

  private String parseBracketText() throws CompilerException {
    return joinTokens(parseBracketTokens());
  }

  private static String joinTokens(List<Token> contents) {
    return Joiner.on(' ').join(contents.stream().map(Token::text).iterator()).trim();
  }

  private List<Token> parseBracketTokens() throws CompilerException {
    consume(TokenType.LBRACKET, "Expected '['.");
    List<Token> contents = new ArrayList<>();
    while (!atEnd() && !check(TokenType.RBRACKET)) {
      if (check(TokenType.NEWLINE)) {
        throw errorHere("Unexpected newline in bracket expression.");
      }
      contents.add(advance());
    }
    consume(TokenType.RBRACKET, "Expected ']'.");
    return contents;
  }

  private String parseNameToken() throws CompilerException {
    if (check(TokenType.IDENT) || check(TokenType.STRING)) {
      return advance().text();
    }
    throw errorHere("Expected name.");
  }

  private String parseDeclNameToken() throws CompilerException {
    if (check(TokenType.IDENT) || check(TokenType.STRING) || check(TokenType.KEYWORD)) {
      return advance().text();
    }
    throw errorHere("Expected name.");
  }

  private boolean looksLikeIfOnEdgeBounce() {
    return "on".equals(wordAt(1)) && "edge".equals(wordAt(2)) && "bounce".equals(wordAt(3));
  }

  // Keywords and identifiers compared case-insensitively; null for other tokens.
  private String wordAt(int offset) {
    int at = index + offset;
    if (at >= tokens.size()) return null;
    Token token = tokens.get(at);
    if (token.is(TokenType.KEYWORD)) return token.text();
    if (token.is(TokenType.IDENT)) return token.text().toLowerCase(Locale.ROOT);
    return null;
  }

  private String currentWord() {
    return wordAt(0);
  }

  private boolean matchWord(String word) {
    if (word.equals(currentWord())) {
      advance();
      return true;
    }
    return false;
  }

  private void consumeWord(String word, String message) throws CompilerException {
    if (!matchWord(word)) {
      throw errorHere(message);
    }
  }

  private boolean checkKeyword(String keyword) {
    return current().isKeyword(keyword);
  }

  private boolean matchKeyword(String keyword) {
    if (checkKeyword(keyword)) {
      advance();
      return true;
    }
    return false;
  }

  private Token consumeKeyword(String keyword, String message) throws CompilerException {
    if (!checkKeyword(keyword)) {
      throw errorHere(message);
    }
    return advance();
  }

  private boolean matchOp(String op) {
    if (current().isOp(op)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenType type) {
    return current().is(type);
  }

  private boolean match(TokenType type) {
    if (check(type)) {
      advance();
      return true;
    }
    return false;
  }

  private Token consume(TokenType type, String message) throws CompilerException {
    if (!check(type)) {
      throw errorHere(message);
    }
    return advance();
  }

  private void skipNewlines() {
    while (check(TokenType.NEWLINE)) {
      advance();
    }
  }

  private boolean atEnd() {
    return check(TokenType.EOF);
  }

  private Token current() {
    return tokens.get(index);
  }

  private Token peek() {
    return tokens.get(Math.min(index + 1, tokens.size() - 1));
  }

  private Token advance() {
    Token token = tokens.get(index);
    if (index < tokens.size() - 1) {
      index++;
    }
    return token;
  }

  private CompilerException errorHere(String message) {
    return error(current().pos(), message);
  }

  private static CompilerException error(Pos pos, String message) {
    return new CompilerException(CompilerException.Phase.PARSE, pos, message);
  }
}
