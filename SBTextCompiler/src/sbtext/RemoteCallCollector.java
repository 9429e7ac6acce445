package sbtext;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Finds the distinct remote procedures called anywhere in a project. */
class RemoteCallCollector extends ErrorCollectingValidator {

  private final Map<String, Project.Procedure> procedures = new HashMap<>();
  private final Map<String, RemoteCall> calls = new HashMap<>();
  private Project.Target target = null;

  /** Returns one entry per callee, ordered by broadcast message. */
  static ImmutableList<RemoteCall> collect(Project project) throws CompilerException {
    RemoteCallCollector collector = new RemoteCallCollector(project);
    project.accept(collector, null);
    collector.throwFirstError();
    return collector
        .calls
        .values()
        .stream()
        .sorted((a, b) -> a.message().compareTo(b.message()))
        .collect(ImmutableList.toImmutableList());
  }

  private RemoteCallCollector(Project project) {
    for (Project.Target target : project.targets()) {
      for (Project.Procedure procedure : target.procedures()) {
        procedures.putIfAbsent(key(target.name(), procedure.name()), procedure);
      }
    }
  }

  private static String key(String target, String procedure) {
    return SemanticAnalyzer.lower(target) + "." + SemanticAnalyzer.lower(procedure);
  }

  @Override
  public void visitImpl(Project.Target target) {
    this.target = target;
    target.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.ProcedureCall call) {
    if (target.findProcedure(call.name()).isPresent()) return;
    Optional<QualifiedName> qualified = QualifiedName.split(call.name());
    if (!qualified.isPresent()) return;

    String key = key(qualified.get().target(), qualified.get().member());
    Project.Procedure callee = procedures.get(key);
    if (callee == null) return;
    if (callee.params().size() != call.args().size()) {
      logError(
          new CompilerException(
              CompilerException.Phase.CODEGEN,
              String.format(
                  "Remote procedure '%s' expects %d args, got %d.",
                  call.name(), callee.params().size(), call.args().size())));
      return;
    }
    calls.computeIfAbsent(
        key,
        k ->
            RemoteCall.create(
                qualified.get().target(), callee.name(), callee.params().size()));
  }
}
