package sbtext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Lowers a validated {@link Project} into a {@code project.json} document and its asset table.
 *
 * <p>Stage variables and lists, plus the slot variables of remote procedure calls, are global;
 * everything declared on a sprite is local to it. One generator instance performs one compile.
 */
public class CodeGenerator {
  private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

  private static final JsonNodeFactory json = JsonNodeFactory.instance;

  @AutoValue
  public abstract static class Options {
    /** Whether SVG costumes are rescaled into the canonical 64x64 box. */
    public abstract boolean scaleSvgs();

    public static Builder builder() {
      return new AutoValue_CodeGenerator_Options.Builder().setScaleSvgs(true);
    }

    public static Options defaults() {
      return builder().build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setScaleSvgs(boolean scaleSvgs);

      public abstract Options build();
    }
  }

  @AutoValue
  public abstract static class Result {
    public abstract ObjectNode project();

    /** Asset bytes keyed by {@code <md5>.<ext>}. */
    public abstract ImmutableSortedMap<String, byte[]> assets();

    static Result create(ObjectNode project, Map<String, byte[]> assets) {
      return new AutoValue_CodeGenerator_Result(project, ImmutableSortedMap.copyOf(assets));
    }
  }

  private final Project project;
  private final Path sourceDir;
  private final Options options;
  private final ProgressListener progress;

  private final IdArena ids = new IdArena();
  private final Map<String, String> broadcastIds = new LinkedHashMap<>();
  // Lowercased name to ID, and to display name, in registration order.
  private final Map<String, String> globalVariableIds = new LinkedHashMap<>();
  private final Map<String, String> globalVariableNames = new LinkedHashMap<>();
  private final Map<String, String> globalListIds = new LinkedHashMap<>();
  private final Map<String, String> globalListNames = new LinkedHashMap<>();
  private final Map<String, byte[]> assets = new TreeMap<>();

  private ImmutableList<RemoteCall> remoteCalls = ImmutableList.of();
  private ImmutableMap<String, String> spriteVariableOwners = ImmutableMap.of();

  public CodeGenerator(
      Project project, Path sourceDir, Options options, ProgressListener progress) {
    this.project = project;
    this.sourceDir = sourceDir;
    this.options = options;
    this.progress = progress;
  }

  public static Result generate(Project project, Path sourceDir, Options options)
      throws CompilerException {
    return new CodeGenerator(project, sourceDir, options, ProgressListener.NONE).generate();
  }

  public Result generate() throws CompilerException {
    for (String message : BroadcastCollector.collect(project)) {
      broadcastIds.put(message, ids.next("broadcast"));
    }
    remoteCalls = RemoteCallCollector.collect(project);
    for (RemoteCall call : remoteCalls) {
      broadcastIds.computeIfAbsent(call.message(), m -> ids.next("broadcast"));
    }
    for (RemoteCall call : remoteCalls) {
      for (String slot : call.argVarNames()) {
        registerGlobal(globalVariableIds, globalVariableNames, slot, "gvar");
      }
    }

    ImmutableList<Project.Target> targets = orderedTargets();
    for (Project.Target target : targets) {
      if (!target.isStage()) continue;
      target
          .variables()
          .forEach(v -> registerGlobal(globalVariableIds, globalVariableNames, v.name(), "gvar"));
      target
          .lists()
          .forEach(l -> registerGlobal(globalListIds, globalListNames, l.name(), "glist"));
    }
    spriteVariableOwners = spriteVariableOwners(targets);

    CostumeBuilder costumes = new CostumeBuilder(sourceDir, options.scaleSvgs(), assets);
    ArrayNode targetsJson = json.arrayNode();
    for (int i = 0; i < targets.size(); i++) {
      targetsJson.add(buildTarget(targets.get(i), i, costumes));
      progress.onProgress(i + 1, targets.size(), "Emitting targets");
    }
    ObjectNode stageBroadcasts = (ObjectNode) targetsJson.get(0).get("broadcasts");
    broadcastIds.forEach((message, id) -> stageBroadcasts.put(id, message));

    ObjectNode document = json.objectNode();
    document.set("targets", targetsJson);
    document.putArray("monitors");
    ArrayNode extensions = document.putArray("extensions");
    if (PenUsageDetector.usesPen(project)) {
      extensions.add("pen");
    }
    ObjectNode meta = document.putObject("meta");
    meta.put("semver", "3.0.0");
    meta.put("vm", "0.2.0");
    meta.put("agent", "SBText Compiler");
    logger.debug(
        "Generated {} targets, {} broadcasts, {} assets",
        targets.size(),
        broadcastIds.size(),
        assets.size());
    return Result.create(document, assets);
  }

  private void registerGlobal(
      Map<String, String> idsByKey, Map<String, String> names, String name, String prefix) {
    String key = SemanticAnalyzer.lower(name);
    if (idsByKey.containsKey(key)) return;
    idsByKey.put(key, ids.next(prefix));
    names.put(key, name);
  }

  /** The stage first, synthesizing one when the program declares none. */
  private ImmutableList<Project.Target> orderedTargets() {
    ImmutableList.Builder<Project.Target> ordered = ImmutableList.builder();
    Optional<Project.Target> stage = project.stage();
    ordered.add(stage.isPresent() ? stage.get() : Project.Target.emptyStage(stageName()));
    project.targets().stream().filter(t -> !t.isStage()).forEach(ordered::add);
    return ordered.build();
  }

  private String stageName() {
    Set<String> taken = new HashSet<>();
    project.targets().forEach(t -> taken.add(t.lowerName()));
    String name = "Stage";
    for (int n = 2; taken.contains(SemanticAnalyzer.lower(name)); n++) {
      name = "Stage" + n;
    }
    return name;
  }

  // Unqualified reads of a sprite variable from elsewhere go to the first sprite declaring it.
  private static ImmutableMap<String, String> spriteVariableOwners(
      List<Project.Target> targets) {
    Map<String, String> owners = new LinkedHashMap<>();
    for (Project.Target target : targets) {
      if (target.isStage()) continue;
      for (Project.VariableDecl decl : target.variables()) {
        owners.putIfAbsent(SemanticAnalyzer.lower(decl.name()), target.name());
      }
    }
    return ImmutableMap.copyOf(owners);
  }

  private ObjectNode buildTarget(Project.Target target, int layerOrder, CostumeBuilder costumes)
      throws CompilerException {
    Map<String, String> variables = new LinkedHashMap<>();
    ObjectNode variablesJson = json.objectNode();
    for (Project.VariableDecl decl : target.variables()) {
      String key = SemanticAnalyzer.lower(decl.name());
      if (variables.containsKey(key)) continue;
      String id = target.isStage() ? globalVariableIds.get(key) : ids.next("var");
      variables.put(key, id);
      variablesJson.set(id, json.arrayNode().add(decl.name()).add(value(decl.initialValue())));
    }
    Map<String, String> lists = new LinkedHashMap<>();
    ObjectNode listsJson = json.objectNode();
    for (Project.ListDecl decl : target.lists()) {
      String key = SemanticAnalyzer.lower(decl.name());
      if (lists.containsKey(key)) continue;
      String id = target.isStage() ? globalListIds.get(key) : ids.next("list");
      lists.put(key, id);
      ArrayNode items = json.arrayNode();
      decl.items().forEach(item -> items.add(value(Optional.of(item))));
      listsJson.set(id, json.arrayNode().add(decl.name()).add(items));
    }
    if (target.isStage()) {
      for (Map.Entry<String, String> global : globalVariableIds.entrySet()) {
        if (variablesJson.has(global.getValue())) continue;
        variablesJson.set(
            global.getValue(),
            json.arrayNode().add(globalVariableNames.get(global.getKey())).add(0));
      }
      for (Map.Entry<String, String> global : globalListIds.entrySet()) {
        if (listsJson.has(global.getValue())) continue;
        listsJson.set(
            global.getValue(),
            json.arrayNode().add(globalListNames.get(global.getKey())).add(json.arrayNode()));
      }
    }
    variables.putAll(globalVariableIds);
    lists.putAll(globalListIds);

    Map<String, ProcedureSignature> signatures = new LinkedHashMap<>();
    for (Project.Procedure procedure : target.procedures()) {
      String key = SemanticAnalyzer.lower(procedure.name());
      if (!signatures.containsKey(key)) {
        signatures.put(key, ProcedureSignature.create(procedure, ids));
      }
    }

    ImmutableMap.Builder<String, RemoteCall> remoteCallsByKey = ImmutableMap.builder();
    List<RemoteCall> handlers = new ArrayList<>();
    for (RemoteCall call : remoteCalls) {
      remoteCallsByKey.put(
          BlockEmitter.remoteKey(call.calleeTargetLower(), call.procedureLower()), call);
      if (call.calleeTargetLower().equals(target.lowerName())) {
        handlers.add(call);
      }
    }
    BlockEmitter.Scope scope =
        new BlockEmitter.Scope(
            ImmutableMap.copyOf(variables),
            ImmutableMap.copyOf(lists),
            spriteVariableOwners,
            remoteCallsByKey.build(),
            broadcastIds);

    ObjectNode blocks = json.objectNode();
    BlockEmitter emitter =
        new BlockEmitter(ids, blocks, scope, ImmutableMap.copyOf(signatures));
    int y = 30;
    for (Project.Procedure procedure : target.procedures()) {
      y = emitter.emitProcedure(procedure, y) + 40;
    }
    for (Project.EventScript script : target.scripts()) {
      y = emitter.emitScript(script, y) + 40;
    }
    emitter.emitRemoteHandlers(handlers, y);

    ArrayNode costumesJson = costumes.build(target);

    ObjectNode node = json.objectNode();
    node.put("isStage", target.isStage());
    node.put("name", target.name());
    node.set("variables", variablesJson);
    node.set("lists", listsJson);
    // Filled in for the stage once every target has been emitted.
    node.putObject("broadcasts");
    node.set("blocks", blocks);
    node.putObject("comments");
    node.put("currentCostume", 0);
    node.set("costumes", costumesJson);
    node.putArray("sounds");
    node.put("volume", 100);
    node.put("layerOrder", layerOrder);
    if (target.isStage()) {
      node.put("tempo", 60);
      node.put("videoTransparency", 50);
      node.put("videoState", "on");
      node.putNull("textToSpeechLanguage");
    } else {
      node.put("visible", true);
      node.put("x", 0);
      node.put("y", 0);
      node.put("size", 100);
      node.put("direction", 90);
      node.put("draggable", false);
      node.put("rotationStyle", "all around");
    }
    return node;
  }

  /** Declared initial values; numbers stay numeric and integral ones print without a fraction. */
  private static JsonNode value(Optional<Expression> initial) {
    if (!initial.isPresent()) {
      return json.numberNode(0);
    }
    Expression expr = initial.get();
    if (expr.type() == Expression.Type.STRING) {
      return json.textNode(expr.<Expression.StringLiteral>cast().value());
    }
    double number = expr.<Expression.NumberLiteral>cast().value();
    if (number == Math.rint(number) && !Double.isInfinite(number)) {
      return json.numberNode((long) number);
    }
    return json.numberNode(number);
  }
}
