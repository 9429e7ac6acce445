package sbtext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Lowers the scripts of one target into its {@code blocks} object.
 *
 * <p>Statements become chains linked through {@code next}/{@code parent}; literals become inline
 * shadow tuples and every other expression a reporter block owned by the block that reads it. A
 * block's ID is always allocated before the IDs of its menus and operands.
 */
class BlockEmitter {
  static final int PROCEDURE_X = 30;
  static final int SCRIPT_X = 320;
  static final int HANDLER_X = 580;

  private static final JsonNodeFactory json = JsonNodeFactory.instance;

  private static final class Chain {
    final String first;
    final String last;

    Chain(String first, String last) {
      this.first = first;
      this.last = last;
    }

    static Chain single(String id) {
      return new Chain(id, id);
    }
  }

  /** Project-wide lookup tables shared by every target's emitter. */
  static final class Scope {
    final ImmutableMap<String, String> variables;
    final ImmutableMap<String, String> lists;
    final ImmutableMap<String, String> spriteVariableOwners;
    final ImmutableMap<String, RemoteCall> remoteCalls;
    final Map<String, String> broadcastIds;

    Scope(
        ImmutableMap<String, String> variables,
        ImmutableMap<String, String> lists,
        ImmutableMap<String, String> spriteVariableOwners,
        ImmutableMap<String, RemoteCall> remoteCalls,
        Map<String, String> broadcastIds) {
      this.variables = variables;
      this.lists = lists;
      this.spriteVariableOwners = spriteVariableOwners;
      this.remoteCalls = remoteCalls;
      this.broadcastIds = broadcastIds;
    }
  }

  private final IdArena ids;
  private final ObjectNode blocks;
  private final Scope scope;
  private final ImmutableMap<String, ProcedureSignature> signatures;

  private ImmutableSet<String> paramScope = ImmutableSet.of();

  BlockEmitter(
      IdArena ids,
      ObjectNode blocks,
      Scope scope,
      ImmutableMap<String, ProcedureSignature> signatures) {
    this.ids = ids;
    this.blocks = blocks;
    this.scope = scope;
    this.signatures = signatures;
  }

  static String remoteKey(String target, String procedure) {
    return SemanticAnalyzer.lower(target) + "." + SemanticAnalyzer.lower(procedure);
  }

  /** Emits a definition hat, its prototype and the body; returns the next free y. */
  int emitProcedure(Project.Procedure procedure, int y) throws CompilerException {
    ProcedureSignature signature = signatures.get(SemanticAnalyzer.lower(procedure.name()));
    if (signature == null) {
      throw codegenError("Missing procedure signature for '%s'.", procedure.name());
    }
    String definitionId = ids.block();
    String prototypeId = ids.block();
    ObjectNode definition = topLevelBlock(definitionId, "procedures_definition", PROCEDURE_X, y);
    inputs(definition).set("custom_block", shadowInput(prototypeId));

    ObjectNode prototype = newBlock(prototypeId, "procedures_prototype", definitionId);
    prototype.put("shadow", true);
    for (int i = 0; i < signature.params().size(); i++) {
      String reporterId = ids.block();
      ObjectNode reporter =
          newBlock(reporterId, "argument_reporter_string_number", prototypeId);
      field(reporter, "VALUE", signature.params().get(i), null);
      reporter.put("shadow", true);
      inputs(prototype).set(signature.argumentIds().get(i), shadowInput(reporterId));
    }
    ObjectNode mutation = mutation(prototype);
    mutation.put("proccode", signature.proccode());
    mutation.put("argumentids", ProcedureSignature.jsonStringArray(signature.argumentIds()));
    mutation.put("argumentnames", ProcedureSignature.jsonStringArray(signature.params()));
    List<String> defaults = new ArrayList<>();
    signature.params().forEach(p -> defaults.add(""));
    mutation.put("argumentdefaults", ProcedureSignature.jsonStringArray(defaults));
    mutation.put("warp", Boolean.toString(signature.warp()));

    paramScope =
        signature
            .params()
            .stream()
            .map(SemanticAnalyzer::lower)
            .collect(ImmutableSet.toImmutableSet());
    try {
      return attachBody(definition, definitionId, procedure.body(), y);
    } finally {
      paramScope = ImmutableSet.of();
    }
  }

  int emitScript(Project.EventScript script, int y) throws CompilerException {
    String hatId = ids.block();
    ObjectNode hat = topLevelBlock(hatId, script.event().opcode(), SCRIPT_X, y);
    if (script.event() == Project.EventScript.Event.RECEIVE) {
      String message = script.message().get();
      field(hat, "BROADCAST_OPTION", message, broadcastId(message));
    }
    return attachBody(hat, hatId, script.body(), y);
  }

  /** One receive handler per remote procedure, forwarding the slot variables to the real call. */
  int emitRemoteHandlers(Iterable<RemoteCall> handlers, int y) throws CompilerException {
    for (RemoteCall handler : handlers) {
      String hatId = ids.block();
      ObjectNode hat =
          topLevelBlock(hatId, Project.EventScript.Event.RECEIVE.opcode(), HANDLER_X, y);
      field(hat, "BROADCAST_OPTION", handler.message(), broadcastId(handler.message()));

      ProcedureSignature signature =
          signatures.get(SemanticAnalyzer.lower(handler.procedureName()));
      Verify.verifyNotNull(signature, "no local procedure for %s", handler.message());
      List<Expression> args = new ArrayList<>();
      for (String slot : handler.argVarNames()) {
        args.add(new Expression.Variable(slot, Lexer.Pos.internal()));
      }
      String callId = emitLocalCall(signature, args, hatId);
      hat.put("next", callId);
      y += 140;
    }
    return y;
  }

  private int attachBody(ObjectNode hat, String hatId, List<Statement> body, int y)
      throws CompilerException {
    Optional<Chain> chain = emitChain(body, hatId);
    if (chain.isPresent()) {
      hat.put("next", chain.get().first);
      return y + 140;
    }
    return y + 80;
  }

  private Optional<Chain> emitChain(List<Statement> statements, String parentId)
      throws CompilerException {
    String first = null;
    String last = null;
    for (Statement statement : statements) {
      Chain chain = emitStatement(statement, last == null ? parentId : last);
      if (last != null) {
        block(last).put("next", chain.first);
      }
      if (first == null) first = chain.first;
      last = chain.last;
    }
    return first == null ? Optional.empty() : Optional.of(new Chain(first, last));
  }

  private Chain emitStatement(Statement statement, String parentId) throws CompilerException {
    switch (statement.type()) {
      case BLOCK:
        return Chain.single(emitBlock(statement.cast(), parentId));
      case BROADCAST:
        Statement.Broadcast broadcast = statement.cast();
        return Chain.single(
            emitBroadcast(broadcast.message(), broadcast.andWait(), parentId));
      case VARIABLE_COMMAND:
        return Chain.single(emitVariableCommand(statement.cast(), parentId));
      case LIST_COMMAND:
        return Chain.single(emitListCommand(statement.cast(), parentId));
      case LOOP:
        return Chain.single(emitLoop(statement.cast(), parentId));
      case FOR_EACH:
        return Chain.single(emitForEach(statement.cast(), parentId));
      case IF:
        return Chain.single(emitIf(statement.cast(), parentId));
      case PROCEDURE_CALL:
        return emitCall(statement.cast(), parentId);
    }
    throw new AssertionError(statement.type());
  }

  private String emitBlock(Statement.Block statement, String parentId) throws CompilerException {
    String id = ids.block();
    ObjectNode block = newBlock(id, statement.opcode().opcode(), parentId);
    ObjectNode inputs = inputs(block);

    // Menus and fields are laid out first so that menu IDs precede operand IDs; expression
    // inputs keep their slot position through a placeholder.
    Iterator<Expression> expressions = statement.inputs().iterator();
    Iterator<String> texts = statement.fields().iterator();
    List<Statement.Slot> pendingSlots = new ArrayList<>();
    List<Expression> pendingValues = new ArrayList<>();
    for (Statement.Slot slot : statement.opcode().slots()) {
      switch (slot.kind()) {
        case INPUT:
          inputs.putNull(slot.name());
          pendingSlots.add(slot);
          pendingValues.add(expressions.next());
          break;
        case MENU:
          String menuText = menuText(expressions.next(), slot.fallback());
          inputs.set(slot.name(), shadowInput(emitMenu(slot, menuText, id)));
          break;
        case FIELD_MENU:
          inputs.set(slot.name(), shadowInput(emitMenu(slot, texts.next(), id)));
          break;
        case OPTION:
          field(block, slot.name(), optionText(expressions.next(), slot.fallback()), null);
          break;
        case FIELD:
          field(block, slot.name(), texts.next(), null);
          break;
      }
    }
    for (int i = 0; i < pendingSlots.size(); i++) {
      Statement.Slot slot = pendingSlots.get(i);
      inputs.set(slot.name(), input(pendingValues.get(i), id, slot.inputKind()));
    }
    if (statement.opcode().terminal()) {
      mutation(block).put("hasnext", "false");
    }
    return id;
  }

  private String emitMenu(Statement.Slot slot, String text, String parentId) {
    String menuId = ids.block();
    ObjectNode menu = newBlock(menuId, slot.menuOpcode(), parentId);
    field(menu, slot.menuField(), text, null);
    menu.put("shadow", true);
    return menuId;
  }

  private String emitBroadcast(String message, boolean andWait, String parentId) {
    String id = ids.block();
    String menuId = ids.block();
    ObjectNode block =
        newBlock(id, andWait ? "event_broadcastandwait" : "event_broadcast", parentId);
    inputs(block).set("BROADCAST_INPUT", shadowInput(menuId));
    ObjectNode menu = newBlock(menuId, "event_broadcast_menu", id);
    field(menu, "BROADCAST_OPTION", message, broadcastId(message));
    menu.put("shadow", true);
    return id;
  }

  private String emitVariableCommand(Statement.VariableCommand command, String parentId)
      throws CompilerException {
    String variableId = variableId(command.variableName());
    String id = ids.block();
    ObjectNode block = newBlock(id, command.kind().opcode(), parentId);
    if (command.value().isPresent()) {
      inputs(block)
          .set("VALUE", input(command.value().get(), id, Statement.InputKind.NUMBER));
    }
    field(block, "VARIABLE", command.variableName(), variableId);
    return id;
  }

  private String emitListCommand(Statement.ListCommand command, String parentId)
      throws CompilerException {
    String listId = listId(command.listName());
    String id = ids.block();
    ObjectNode block = newBlock(id, command.kind().opcode(), parentId);
    for (int i = 0; i < command.inputs().size(); i++) {
      Statement.Slot slot = command.kind().slots().get(i);
      inputs(block).set(slot.name(), input(command.inputs().get(i), id, slot.inputKind()));
    }
    field(block, "LIST", command.listName(), listId);
    return id;
  }

  private String emitLoop(Statement.Loop loop, String parentId) throws CompilerException {
    String id = ids.block();
    ObjectNode block = newBlock(id, loop.kind().opcode(), parentId);
    if (loop.argument().isPresent()) {
      Statement.Slot slot = loop.kind().slot().get();
      inputs(block).set(slot.name(), input(loop.argument().get(), id, slot.inputKind()));
    }
    substack(block, id, "SUBSTACK", loop.body());
    return id;
  }

  private String emitForEach(Statement.ForEach forEach, String parentId)
      throws CompilerException {
    String variableId = variableId(forEach.variableName());
    String id = ids.block();
    ObjectNode block = newBlock(id, "control_for_each", parentId);
    inputs(block).set("VALUE", input(forEach.count(), id, Statement.InputKind.NUMBER));
    substack(block, id, "SUBSTACK", forEach.body());
    field(block, "VARIABLE", forEach.variableName(), variableId);
    return id;
  }

  private String emitIf(Statement.If statement, String parentId) throws CompilerException {
    String id = ids.block();
    ObjectNode block = newBlock(id, "control_if_else", parentId);
    inputs(block)
        .set("CONDITION", input(statement.condition(), id, Statement.InputKind.BOOLEAN));
    substack(block, id, "SUBSTACK", statement.thenBody());
    substack(block, id, "SUBSTACK2", statement.elseBody());
    return id;
  }

  private void substack(ObjectNode block, String id, String name, List<Statement> body)
      throws CompilerException {
    Optional<Chain> chain = emitChain(body, id);
    if (chain.isPresent()) {
      ArrayNode input = inputs(block).putArray(name);
      input.add(2).add(chain.get().first);
    }
  }

  private Chain emitCall(Statement.ProcedureCall call, String parentId)
      throws CompilerException {
    ProcedureSignature signature = signatures.get(SemanticAnalyzer.lower(call.name()));
    if (signature != null) {
      return Chain.single(emitLocalCall(signature, call.args(), parentId));
    }
    Optional<QualifiedName> qualified = QualifiedName.split(call.name());
    if (qualified.isPresent()) {
      RemoteCall remote =
          scope.remoteCalls.get(remoteKey(qualified.get().target(), qualified.get().member()));
      if (remote != null) {
        return emitRemoteCall(remote, call.args(), parentId);
      }
    }
    // Ignored trace calls and permissively allowed unknown calls.
    String id = ids.block();
    ObjectNode block = newBlock(id, Statement.Opcode.WAIT.opcode(), parentId);
    inputs(block).set("DURATION", literal(4, "0"));
    return Chain.single(id);
  }

  private String emitLocalCall(
      ProcedureSignature signature, List<Expression> args, String parentId)
      throws CompilerException {
    String id = ids.block();
    ObjectNode block = newBlock(id, "procedures_call", parentId);
    for (int i = 0; i < signature.argumentIds().size() && i < args.size(); i++) {
      inputs(block)
          .set(
              signature.argumentIds().get(i),
              input(args.get(i), id, Statement.InputKind.STRING));
    }
    ObjectNode mutation = mutation(block);
    mutation.put("proccode", signature.proccode());
    mutation.put("argumentids", ProcedureSignature.jsonStringArray(signature.argumentIds()));
    mutation.put("warp", Boolean.toString(signature.warp()));
    return id;
  }

  // Stores each argument in its slot variable, then broadcasts and waits for the handler.
  private Chain emitRemoteCall(RemoteCall remote, List<Expression> args, String parentId)
      throws CompilerException {
    String first = null;
    String last = null;
    for (int i = 0; i < args.size(); i++) {
      String slot = remote.argVarNames().get(i);
      String slotId = variableId(slot);
      String id = ids.block();
      ObjectNode block = newBlock(id, "data_setvariableto", last == null ? parentId : last);
      inputs(block).set("VALUE", input(args.get(i), id, Statement.InputKind.STRING));
      field(block, "VARIABLE", slot, slotId);
      if (last != null) {
        block(last).put("next", id);
      }
      if (first == null) first = id;
      last = id;
    }
    String broadcastId = emitBroadcast(remote.message(), true, last == null ? parentId : last);
    if (last != null) {
      block(last).put("next", broadcastId);
    }
    return new Chain(first == null ? broadcastId : first, broadcastId);
  }

  private JsonNode input(Expression expr, String parentId, Statement.InputKind kind)
      throws CompilerException {
    switch (expr.type()) {
      case NUMBER:
        return literal(4, expr.<Expression.NumberLiteral>cast().text());
      case STRING:
        return literal(10, expr.<Expression.StringLiteral>cast().value());
      default:
        break;
    }
    String reporterId = emitReporter(expr, parentId);
    if (reporterId == null) {
      return defaultShadow(kind);
    }
    ArrayNode input = json.arrayNode();
    return input.add(2).add(reporterId);
  }

  private static JsonNode defaultShadow(Statement.InputKind kind) {
    return kind == Statement.InputKind.NUMBER ? literal(4, "0") : literal(10, "");
  }

  private String emitReporter(Expression expr, String parentId) throws CompilerException {
    switch (expr.type()) {
      case NUMBER:
      case STRING:
        return null;
      case VARIABLE:
        return emitVariable(expr.cast(), parentId);
      case PICK_RANDOM:
        {
          Expression.PickRandom random = expr.cast();
          String id = ids.block();
          ObjectNode block = newBlock(id, "operator_random", parentId);
          inputs(block).set("FROM", input(random.from(), id, Statement.InputKind.NUMBER));
          inputs(block).set("TO", input(random.to(), id, Statement.InputKind.NUMBER));
          return id;
        }
      case LIST_ITEM:
        {
          Expression.ListItem item = expr.cast();
          String listId = listId(item.listName());
          String id = ids.block();
          ObjectNode block = newBlock(id, "data_itemoflist", parentId);
          inputs(block).set("INDEX", input(item.index(), id, Statement.InputKind.NUMBER));
          field(block, "LIST", item.listName(), listId);
          return id;
        }
      case LIST_LENGTH:
        {
          Expression.ListLength length = expr.cast();
          return emitListReporter("data_lengthoflist", length.listName(), parentId);
        }
      case LIST_CONTENTS:
        {
          Expression.ListContents contents = expr.cast();
          return emitListReporter("data_listcontents", contents.listName(), parentId);
        }
      case LIST_CONTAINS:
        {
          Expression.ListContains contains = expr.cast();
          String listId = listId(contains.listName());
          String id = ids.block();
          ObjectNode block = newBlock(id, "data_listcontainsitem", parentId);
          inputs(block).set("ITEM", input(contains.item(), id, Statement.InputKind.STRING));
          field(block, "LIST", contains.listName(), listId);
          return id;
        }
      case KEY_PRESSED:
        {
          Expression.KeyPressed pressed = expr.cast();
          String id = ids.block();
          String menuId = ids.block();
          ObjectNode block = newBlock(id, "sensing_keypressed", parentId);
          inputs(block).set("KEY_OPTION", shadowInput(menuId));
          String key =
              pressed.key().type() == Expression.Type.STRING
                  ? pressed.key().<Expression.StringLiteral>cast().value()
                  : "space";
          ObjectNode menu = newBlock(menuId, "sensing_keyoptions", id);
          field(menu, "KEY_OPTION", key, null);
          menu.put("shadow", true);
          return id;
        }
      case REPORTER:
        {
          Expression.Reporter reporter = expr.cast();
          String id = ids.block();
          newBlock(id, reporter.kind().opcode(), parentId);
          return id;
        }
      case MATH_FUNCTION:
        {
          Expression.MathFunction function = expr.cast();
          String id = ids.block();
          boolean round = function.function().equals("round");
          ObjectNode block = newBlock(id, round ? "operator_round" : "operator_mathop", parentId);
          if (!round) {
            field(block, "OPERATOR", function.function(), null);
          }
          inputs(block).set("NUM", input(function.value(), id, Statement.InputKind.NUMBER));
          return id;
        }
      case UNARY:
        return emitUnary(expr.cast(), parentId);
      case BINARY:
        return emitBinary(expr.cast(), parentId);
    }
    throw new AssertionError(expr.type());
  }

  private String emitListReporter(String opcode, String listName, String parentId)
      throws CompilerException {
    String listId = listId(listName);
    String id = ids.block();
    field(newBlock(id, opcode, parentId), "LIST", listName, listId);
    return id;
  }

  private String emitVariable(Expression.Variable variable, String parentId)
      throws CompilerException {
    String name = variable.name();
    String lowered = SemanticAnalyzer.lower(name);
    if (paramScope.contains(lowered)) {
      String id = ids.block();
      field(newBlock(id, "argument_reporter_string_number", parentId), "VALUE", name, null);
      return id;
    }
    String variableId = scope.variables.get(lowered);
    if (variableId != null) {
      String id = ids.block();
      field(newBlock(id, "data_variable", parentId), "VARIABLE", name, variableId);
      return id;
    }
    Optional<QualifiedName> qualified = QualifiedName.split(name);
    if (qualified.isPresent()) {
      return emitSensingOf(qualified.get().target(), qualified.get().member(), parentId);
    }
    String owner = scope.spriteVariableOwners.get(lowered);
    if (owner != null) {
      return emitSensingOf(owner, name, parentId);
    }
    throw codegenError("Variable '%s' is not declared.", name);
  }

  // Reads a variable that lives on another sprite.
  private String emitSensingOf(String target, String property, String parentId) {
    String id = ids.block();
    String menuId = ids.block();
    ObjectNode block = newBlock(id, "sensing_of", parentId);
    inputs(block).set("OBJECT", shadowInput(menuId));
    field(block, "PROPERTY", property, null);
    ObjectNode menu = newBlock(menuId, "sensing_of_object_menu", id);
    field(menu, "OBJECT", target, null);
    menu.put("shadow", true);
    return id;
  }

  private String emitUnary(Expression.Unary unary, String parentId) throws CompilerException {
    String id = ids.block();
    if (unary.operator() == Expression.Unary.Operator.NEGATE) {
      ObjectNode block = newBlock(id, "operator_subtract", parentId);
      inputs(block).set("NUM1", literal(4, "0"));
      inputs(block).set("NUM2", input(unary.operand(), id, Statement.InputKind.NUMBER));
    } else {
      ObjectNode block = newBlock(id, "operator_not", parentId);
      inputs(block)
          .set("OPERAND", input(unary.operand(), id, Statement.InputKind.BOOLEAN));
    }
    return id;
  }

  private String emitBinary(Expression.Binary binary, String parentId)
      throws CompilerException {
    Expression left = binary.left();
    Expression right = binary.right();
    Lexer.Pos pos = binary.pos();
    switch (binary.operator()) {
      case LESS_EQUALS:
      case GREATER_EQUALS:
        {
          // No native block: (a < b) or (a = b), with both operands lowered twice.
          Expression.Binary.Operator strict =
              binary.operator() == Expression.Binary.Operator.LESS_EQUALS
                  ? Expression.Binary.Operator.LESS
                  : Expression.Binary.Operator.GREATER;
          Expression rewritten =
              new Expression.Binary(
                  Expression.Binary.Operator.OR,
                  new Expression.Binary(strict, left, right, pos),
                  new Expression.Binary(Expression.Binary.Operator.EQUALS, left, right, pos),
                  pos);
          return emitReporter(rewritten, parentId);
        }
      case NOT_EQUALS:
        return emitReporter(
            new Expression.Unary(
                Expression.Unary.Operator.NOT,
                new Expression.Binary(Expression.Binary.Operator.EQUALS, left, right, pos),
                pos),
            parentId);
      default:
        break;
    }

    String opcode;
    String leftKey = "OPERAND1";
    String rightKey = "OPERAND2";
    Statement.InputKind kind;
    switch (binary.operator()) {
      case ADD:
        opcode = "operator_add";
        break;
      case SUBTRACT:
        opcode = "operator_subtract";
        break;
      case MULTIPLY:
        opcode = "operator_multiply";
        break;
      case DIVIDE:
        opcode = "operator_divide";
        break;
      case MOD:
        opcode = "operator_mod";
        break;
      case LESS:
        opcode = "operator_lt";
        break;
      case GREATER:
        opcode = "operator_gt";
        break;
      case EQUALS:
      case DOUBLE_EQUALS:
        opcode = "operator_equals";
        break;
      case AND:
        opcode = "operator_and";
        break;
      case OR:
        opcode = "operator_or";
        break;
      default:
        throw new AssertionError(binary.operator());
    }
    if (opcode.equals("operator_equals")) {
      kind = Statement.InputKind.STRING;
    } else if (opcode.equals("operator_and") || opcode.equals("operator_or")) {
      kind = Statement.InputKind.BOOLEAN;
    } else {
      kind = Statement.InputKind.NUMBER;
      if (!opcode.equals("operator_lt") && !opcode.equals("operator_gt")) {
        leftKey = "NUM1";
        rightKey = "NUM2";
      }
    }

    String id = ids.block();
    ObjectNode block = newBlock(id, opcode, parentId);
    JsonNode leftInput = input(left, id, kind);
    JsonNode rightInput = input(right, id, kind);
    inputs(block).set(leftKey, leftInput);
    inputs(block).set(rightKey, rightInput);
    return id;
  }

  private static String menuText(Expression expr, String fallback) {
    switch (expr.type()) {
      case STRING:
        return expr.<Expression.StringLiteral>cast().value();
      case NUMBER:
        return expr.<Expression.NumberLiteral>cast().text();
      case VARIABLE:
        return expr.<Expression.Variable>cast().name();
      default:
        return fallback;
    }
  }

  private static String optionText(Expression expr, String fallback) {
    switch (expr.type()) {
      case STRING:
        return expr.<Expression.StringLiteral>cast().value();
      case NUMBER:
        return expr.<Expression.NumberLiteral>cast().text();
      default:
        return fallback;
    }
  }

  private String variableId(String name) throws CompilerException {
    String id = scope.variables.get(SemanticAnalyzer.lower(name));
    if (id == null) throw codegenError("Variable '%s' is not declared.", name);
    return id;
  }

  private String listId(String name) throws CompilerException {
    String id = scope.lists.get(SemanticAnalyzer.lower(name));
    if (id == null) throw codegenError("List '%s' is not declared.", name);
    return id;
  }

  private String broadcastId(String message) {
    return scope.broadcastIds.computeIfAbsent(message, m -> ids.next("broadcast"));
  }

  private static CompilerException codegenError(String format, Object... args) {
    return new CompilerException(CompilerException.Phase.CODEGEN, String.format(format, args));
  }

  private ObjectNode block(String id) {
    return (ObjectNode) Verify.verifyNotNull(blocks.get(id), "unknown block %s", id);
  }

  private ObjectNode newBlock(String id, String opcode, String parentId) {
    Verify.verify(!blocks.has(id), "block %s allocated twice", id);
    ObjectNode block = blocks.putObject(id);
    block.put("opcode", opcode);
    block.putNull("next");
    if (parentId == null) {
      block.putNull("parent");
    } else {
      block.put("parent", parentId);
    }
    block.putObject("inputs");
    block.putObject("fields");
    block.put("shadow", false);
    block.put("topLevel", false);
    return block;
  }

  private ObjectNode topLevelBlock(String id, String opcode, int x, int y) {
    ObjectNode block = newBlock(id, opcode, null);
    block.put("topLevel", true);
    block.put("x", x);
    block.put("y", y);
    return block;
  }

  private static ObjectNode inputs(ObjectNode block) {
    return (ObjectNode) block.get("inputs");
  }

  @CanIgnoreReturnValue
  private static ObjectNode field(ObjectNode block, String name, String value, String id) {
    ArrayNode field = ((ObjectNode) block.get("fields")).putArray(name);
    field.add(value);
    if (id == null) {
      field.addNull();
    } else {
      field.add(id);
    }
    return block;
  }

  private static ObjectNode mutation(ObjectNode block) {
    ObjectNode mutation = block.putObject("mutation");
    mutation.put("tagName", "mutation");
    mutation.putArray("children");
    return mutation;
  }

  private static ArrayNode shadowInput(String blockId) {
    return json.arrayNode().add(1).add(blockId);
  }

  private static ArrayNode literal(int type, String value) {
    ArrayNode shadow = json.arrayNode().add(type).add(value);
    return json.arrayNode().add(1).add(shadow);
  }
}
