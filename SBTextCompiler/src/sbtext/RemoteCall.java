package sbtext;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The lowering of every {@code Target.procedure} call to one callee: a broadcast channel plus one
 * global slot variable per argument. Call sites store their arguments into the slots and then
 * broadcast and wait; the callee answers with a single receive handler.
 */
@AutoValue
public abstract class RemoteCall {
  public abstract String calleeTargetLower();

  public abstract String procedureLower();

  /** The callee's procedure name as declared. */
  public abstract String procedureName();

  public abstract String message();

  public abstract ImmutableList<String> argVarNames();

  static RemoteCall create(String calleeTarget, String procedureName, int argCount) {
    String targetLower = SemanticAnalyzer.lower(calleeTarget);
    String procedureLower = SemanticAnalyzer.lower(procedureName);
    String message = String.format("__rpc__%s__%s", targetLower, procedureLower);
    ImmutableList.Builder<String> argVarNames = ImmutableList.builder();
    for (int i = 1; i <= argCount; i++) {
      argVarNames.add(String.format("%s__arg%d", message, i));
    }
    return new AutoValue_RemoteCall(
        targetLower, procedureLower, procedureName, message, argVarNames.build());
  }
}
