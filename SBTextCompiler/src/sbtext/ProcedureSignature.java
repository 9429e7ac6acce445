package sbtext;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** How call sites and the prototype block refer to one procedure. */
@AutoValue
abstract class ProcedureSignature {
  /** The procedure name followed by one {@code %s} per parameter. */
  abstract String proccode();

  abstract ImmutableList<String> params();

  abstract ImmutableList<String> argumentIds();

  abstract boolean warp();

  static ProcedureSignature create(Project.Procedure procedure, IdArena ids) {
    StringBuilder proccode = new StringBuilder(procedure.name());
    ImmutableList.Builder<String> argumentIds = ImmutableList.builder();
    for (int i = 0; i < procedure.params().size(); i++) {
      proccode.append(" %s");
      argumentIds.add(ids.next("arg"));
    }
    return new AutoValue_ProcedureSignature(
        proccode.toString(), procedure.params(), argumentIds.build(), procedure.warp());
  }

  /** Renders strings the way mutation attributes embed them: as a compact JSON array. */
  static String jsonStringArray(Iterable<String> values) {
    ArrayNode array = JsonNodeFactory.instance.arrayNode();
    values.forEach(array::add);
    return array.toString();
  }
}
