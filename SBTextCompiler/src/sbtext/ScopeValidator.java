package sbtext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import sbtext.SemanticAnalyzer.TargetInfo;

/** Resolves every variable, list and procedure reference against the declared names. */
class ScopeValidator extends ErrorCollectingValidator {

  private final ImmutableMap<String, TargetInfo> targetInfos;
  private final SemanticAnalyzer.Options options;
  private final List<SemanticWarning> warnings = new ArrayList<>();

  private Project.Target target = null;
  private ImmutableSet<String> paramScope = ImmutableSet.of();
  private String scopeName = "event script";

  ScopeValidator(ImmutableMap<String, TargetInfo> targetInfos, SemanticAnalyzer.Options options) {
    this.targetInfos = targetInfos;
    this.options = options;
  }

  ImmutableList<SemanticWarning> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  @Override
  public void visitImpl(Project.Target target) {
    this.target = target;
    if (options.rejectDuplicateDeclarations()) {
      checkDuplicateDeclarations(target);
    }

    Map<String, Project.Procedure> procedures = new HashMap<>();
    for (Project.Procedure procedure : target.procedures()) {
      String lowered = SemanticAnalyzer.lower(procedure.name());
      Project.Procedure prev = procedures.putIfAbsent(lowered, procedure);
      if (prev != null) {
        logError(
            procedure.pos(),
            String.format(
                "Procedure '%s' is already defined at line %d in target '%s'.",
                procedure.name(), prev.pos().line(), target.name()));
      }
      Set<String> params = new HashSet<>();
      for (String param : procedure.params()) {
        if (!params.add(SemanticAnalyzer.lower(param))) {
          logError(
              procedure.pos(),
              String.format(
                  "Procedure '%s' has duplicate parameter names at line %d, column %d.",
                  procedure.name(), procedure.pos().line(), procedure.pos().column()));
          break;
        }
      }
    }

    target.visitChildren(this, null);
  }

  private void checkDuplicateDeclarations(Project.Target target) {
    Set<String> seen = new HashSet<>();
    for (Project.VariableDecl decl : target.variables()) {
      if (!seen.add(SemanticAnalyzer.lower(decl.name()))) {
        logError(decl.pos(), duplicateMessage("variable", decl.name(), decl.pos()));
      }
    }
    seen.clear();
    for (Project.ListDecl decl : target.lists()) {
      if (!seen.add(SemanticAnalyzer.lower(decl.name()))) {
        logError(decl.pos(), duplicateMessage("list", decl.name(), decl.pos()));
      }
    }
  }

  private String duplicateMessage(String kind, String name, Lexer.Pos pos) {
    return String.format(
        "Duplicate %s '%s' at line %d, column %d in target '%s'.",
        kind, name, pos.line(), pos.column(), target.name());
  }

  @Override
  public void visitImpl(Project.Procedure procedure) {
    paramScope =
        procedure
            .params()
            .stream()
            .map(SemanticAnalyzer::lower)
            .collect(ImmutableSet.toImmutableSet());
    scopeName = String.format("procedure '%s'", procedure.name());
    procedure.visitChildren(this, null);
    paramScope = ImmutableSet.of();
    scopeName = "event script";
  }

  @Override
  public void visitImpl(Project.EventScript script) {
    paramScope = ImmutableSet.of();
    scopeName = "event script";
    script.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.Broadcast broadcast) {
    if (broadcast.message().isEmpty()) {
      logError(
          broadcast.pos(),
          String.format(
              "Broadcast message cannot be empty at line %d, column %d in target '%s'.",
              broadcast.pos().line(), broadcast.pos().column(), target.name()));
    }
  }

  @Override
  public void visitImpl(Statement.VariableCommand command) {
    checkVariableField(command.variableName(), command.pos());
    command.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.ForEach forEach) {
    checkVariableField(forEach.variableName(), forEach.pos());
    forEach.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.ListCommand command) {
    checkList(command.listName(), command.pos());
    command.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.ProcedureCall call) {
    checkCall(call);
    call.visitChildren(this, null);
  }

  private void checkCall(Statement.ProcedureCall call) {
    String name = call.name();
    Lexer.Pos pos = call.pos();
    int argCount = call.args().size();

    Optional<Project.Procedure> local = target.findProcedure(name);
    if (local.isPresent()) {
      int expected = local.get().params().size();
      if (argCount != expected) {
        logError(
            pos,
            String.format(
                "Procedure '%s' expects %d argument(s), got %d at line %d, column %d in %s.",
                name, expected, argCount, pos.line(), pos.column(), scopeName));
      }
      return;
    }

    Optional<QualifiedName> qualified = QualifiedName.split(name);
    if (qualified.isPresent()) {
      TargetInfo remote = targetInfos.get(SemanticAnalyzer.lower(qualified.get().target()));
      if (remote == null) {
        unknownCall(
            call,
            String.format(
                "Unknown target '%s' in procedure call '%s' at line %d, column %d in target '%s'.",
                qualified.get().target(), name, pos.line(), pos.column(), target.name()));
        return;
      }
      Integer expected = remote.procedures().get(SemanticAnalyzer.lower(qualified.get().member()));
      if (expected == null) {
        unknownCall(
            call,
            String.format(
                "Unknown procedure '%s' on target '%s' at line %d, column %d in target '%s'.",
                qualified.get().member(), remote.name(), pos.line(), pos.column(), target.name()));
      } else if (argCount != expected) {
        logError(
            pos,
            String.format(
                "Procedure '%s' on target '%s' expects %d argument(s), got %d at line %d, column"
                    + " %d in %s.",
                qualified.get().member(),
                remote.name(),
                expected,
                argCount,
                pos.line(),
                pos.column(),
                scopeName));
      }
      return;
    }

    if (isIgnoredCall(name)) return;
    unknownCall(
        call,
        String.format(
            "Unknown procedure '%s' at line %d, column %d in target '%s'.",
            name, pos.line(), pos.column(), target.name()));
  }

  private void unknownCall(Statement.ProcedureCall call, String errorMsg) {
    if (options.allowUnknownProcedures()) {
      Lexer.Pos pos = call.pos();
      warnings.add(
          SemanticWarning.create(
              String.format(
                  "Allowed unknown procedure call '%s' at line %d, column %d in target '%s'"
                      + " because allow_unknown_procedures is enabled.",
                  call.name(), pos.line(), pos.column(), target.name()),
              pos));
    } else {
      logError(call.pos(), errorMsg);
    }
  }

  /** Debug trace calls compile to nothing whether or not they are declared. */
  static boolean isIgnoredCall(String name) {
    return name.equalsIgnoreCase("log");
  }

  @Override
  public void visitImpl(Expression.Variable variable) {
    String name = variable.name();
    Lexer.Pos pos = variable.pos();
    String lowered = SemanticAnalyzer.lower(name);
    if (paramScope.contains(lowered) || variableExistsAnywhere(lowered)) return;

    Optional<QualifiedName> qualified = QualifiedName.split(name);
    if (qualified.isPresent()) {
      TargetInfo remote = targetInfos.get(SemanticAnalyzer.lower(qualified.get().target()));
      if (remote == null) {
        logError(
            pos,
            String.format(
                "Unknown target '%s' in variable reference '%s' at line %d, column %d in target"
                    + " '%s'.",
                qualified.get().target(), name, pos.line(), pos.column(), target.name()));
      } else if (!remote.variables().contains(SemanticAnalyzer.lower(qualified.get().member()))) {
        logError(
            pos,
            String.format(
                "Unknown variable '%s' on target '%s' at line %d, column %d in target '%s'.",
                qualified.get().member(), remote.name(), pos.line(), pos.column(), target.name()));
      }
      return;
    }
    logError(pos, unknownVariableMessage(name, pos));
  }

  @Override
  public void visitImpl(Expression.ListItem item) {
    checkList(item.listName(), item.pos());
    item.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Expression.ListLength length) {
    checkList(length.listName(), length.pos());
  }

  @Override
  public void visitImpl(Expression.ListContents contents) {
    checkList(contents.listName(), contents.pos());
  }

  @Override
  public void visitImpl(Expression.ListContains contains) {
    checkList(contains.listName(), contains.pos());
    contains.visitChildren(this, null);
  }

  // Variable blocks name a real variable; parameters only exist as reporters.
  private void checkVariableField(String name, Lexer.Pos pos) {
    String lowered = SemanticAnalyzer.lower(name);
    if (paramScope.contains(lowered)) {
      logError(
          pos,
          String.format(
              "Variable field '%s' refers to a procedure parameter at line %d, column %d; Scratch"
                  + " variable blocks must target declared variables.",
              name, pos.line(), pos.column()));
    } else if (!variableExistsAnywhere(lowered)) {
      logError(pos, unknownVariableMessage(name, pos));
    }
  }

  private void checkList(String name, Lexer.Pos pos) {
    String lowered = SemanticAnalyzer.lower(name);
    if (targetInfos.values().stream().noneMatch(info -> info.lists().contains(lowered))) {
      logError(
          pos,
          String.format(
              "Unknown list '%s' at line %d, column %d in target '%s'.",
              name, pos.line(), pos.column(), target.name()));
    }
  }

  private String unknownVariableMessage(String name, Lexer.Pos pos) {
    return String.format(
        "Unknown variable '%s' at line %d, column %d in target '%s'.",
        name, pos.line(), pos.column(), target.name());
  }

  private boolean variableExistsAnywhere(String lowered) {
    return targetInfos.values().stream().anyMatch(info -> info.variables().contains(lowered));
  }
}
