package sbtext;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Validates a parsed {@link Project}: target naming, then per-target declarations and every
 * variable, list and procedure reference. The first error in source order is thrown.
 */
public class SemanticAnalyzer {

  @AutoValue
  public abstract static class Options {
    /** Unresolvable procedure calls become warnings and compile to a no-op. */
    public abstract boolean allowUnknownProcedures();

    /** A repeated {@code var} or {@code list} name in one target is an error. */
    public abstract boolean rejectDuplicateDeclarations();

    public static Builder builder() {
      return new AutoValue_SemanticAnalyzer_Options.Builder()
          .setAllowUnknownProcedures(false)
          .setRejectDuplicateDeclarations(false);
    }

    public static Options defaults() {
      return builder().build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setAllowUnknownProcedures(boolean value);

      public abstract Builder setRejectDuplicateDeclarations(boolean value);

      public abstract Options build();
    }
  }

  /** Declared names of one target, lowercased. */
  @AutoValue
  abstract static class TargetInfo {
    abstract String name();

    abstract ImmutableSet<String> variables();

    abstract ImmutableSet<String> lists();

    /** Procedure name to parameter count; the first definition wins. */
    abstract ImmutableMap<String, Integer> procedures();

    static TargetInfo of(Project.Target target) {
      ImmutableSet<String> variables =
          target
              .variables()
              .stream()
              .map(decl -> lower(decl.name()))
              .collect(ImmutableSet.toImmutableSet());
      ImmutableSet<String> lists =
          target
              .lists()
              .stream()
              .map(decl -> lower(decl.name()))
              .collect(ImmutableSet.toImmutableSet());
      ImmutableMap.Builder<String, Integer> procedures = ImmutableMap.builder();
      Set<String> seen = new HashSet<>();
      for (Project.Procedure procedure : target.procedures()) {
        if (seen.add(lower(procedure.name()))) {
          procedures.put(lower(procedure.name()), procedure.params().size());
        }
      }
      return new AutoValue_SemanticAnalyzer_TargetInfo(
          target.name(), variables, lists, procedures.build());
    }
  }

  private final Project project;
  private final Options options;

  public SemanticAnalyzer(Project project, Options options) {
    this.project = project;
    this.options = options;
  }

  /** Returns the warnings of a successful analysis. */
  public ImmutableList<SemanticWarning> analyze() throws CompilerException {
    checkTargets();

    ImmutableMap.Builder<String, TargetInfo> targetInfos = ImmutableMap.builder();
    for (Project.Target target : project.targets()) {
      targetInfos.put(target.lowerName(), TargetInfo.of(target));
    }

    ScopeValidator validator = new ScopeValidator(targetInfos.build(), options);
    project.accept(validator, null);
    validator.throwFirstError();
    return validator.warnings();
  }

  public static ImmutableList<SemanticWarning> analyze(Project project, Options options)
      throws CompilerException {
    return new SemanticAnalyzer(project, options).analyze();
  }

  private void checkTargets() throws CompilerException {
    if (project.targets().isEmpty()) {
      throw error("Project must define at least one target.");
    }
    if (project.targets().stream().filter(Project.Target::isStage).count() > 1) {
      throw error("Project can only define one stage.");
    }
    Set<String> names = new HashSet<>();
    for (Project.Target target : project.targets()) {
      if (!names.add(target.lowerName())) {
        throw new CompilerException(
            CompilerException.Phase.SEMANTIC,
            target.pos(),
            String.format("Duplicate target name '%s'.", target.name()));
      }
    }
  }

  private static CompilerException error(String msg) {
    return new CompilerException(CompilerException.Phase.SEMANTIC, msg);
  }

  static String lower(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
