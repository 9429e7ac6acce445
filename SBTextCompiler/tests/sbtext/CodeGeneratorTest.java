package sbtext;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.io.MoreFiles;

public class CodeGeneratorTest {

  private static final String SVG_32_BY_16 =
      "<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 32 16\">"
          + "<rect width=\"32\" height=\"16\"/></svg>";

  @TempDir Path dir;

  private StringBuilder file = new StringBuilder();
  private SemanticAnalyzer.Options semanticOptions = SemanticAnalyzer.Options.defaults();
  private CodeGenerator.Options options = CodeGenerator.Options.defaults();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private void writeAsset(String name, String content) throws IOException {
    MoreFiles.asCharSink(dir.resolve(name), StandardCharsets.UTF_8).write(content);
  }

  private CodeGenerator.Result generate() throws CompilerException {
    Project project =
        Compilation.parseAndValidateSource(file.toString(), semanticOptions).project();
    return CodeGenerator.generate(project, dir, options);
  }

  private JsonNode generateProject() throws CompilerException {
    return generate().project();
  }

  private static JsonNode target(JsonNode project, String name) {
    for (JsonNode target : project.get("targets")) {
      if (target.get("name").asText().equals(name)) return target;
    }
    throw new AssertionError("no target " + name);
  }

  private static List<JsonNode> blocksWithOpcode(JsonNode target, String opcode) {
    List<JsonNode> found = new ArrayList<>();
    for (JsonNode block : target.get("blocks")) {
      if (block.get("opcode").asText().equals(opcode)) found.add(block);
    }
    return found;
  }

  private static JsonNode onlyBlock(JsonNode target, String opcode) {
    List<JsonNode> found = blocksWithOpcode(target, opcode);
    assertThat(found).hasSize(1);
    return found.get(0);
  }

  /** The block a {@code [2, id]} input points at. */
  private static JsonNode inputBlock(JsonNode target, JsonNode block, String input) {
    JsonNode value = block.get("inputs").get(input);
    assertThat(value.get(0).asInt()).isEqualTo(2);
    return target.get("blocks").get(value.get(1).asText());
  }

  @Test
  public void stageIsSynthesizedFirst() throws CompilerException {
    println("sprite Cat");
    println("end");

    JsonNode project = generateProject();

    assertThat(project.get("targets")).hasSize(2);
    JsonNode stage = project.get("targets").get(0);
    assertThat(stage.get("isStage").asBoolean()).isTrue();
    assertThat(stage.get("name").asText()).isEqualTo("Stage");
    assertThat(stage.get("layerOrder").asInt()).isEqualTo(0);
    assertThat(stage.get("tempo").asInt()).isEqualTo(60);
    JsonNode cat = project.get("targets").get(1);
    assertThat(cat.get("layerOrder").asInt()).isEqualTo(1);
    assertThat(cat.get("rotationStyle").asText()).isEqualTo("all around");
    assertThat(project.get("meta").get("semver").asText()).isEqualTo("3.0.0");
    assertThat(project.get("extensions")).isEmpty();
  }

  @Test
  public void synthesizedStageAvoidsSpriteNames() throws CompilerException {
    println("sprite stage2");
    println("end");
    println("sprite \"Stage\"");
    println("end");

    JsonNode project = generateProject();

    assertThat(project.get("targets").get(0).get("name").asText()).isEqualTo("Stage3");
  }

  @Test
  public void declaredStageComesFirst() throws CompilerException {
    println("sprite Cat");
    println("end");
    println("stage Scene");
    println("end");

    JsonNode project = generateProject();

    assertThat(project.get("targets").get(0).get("name").asText()).isEqualTo("Scene");
    assertThat(project.get("targets").get(1).get("name").asText()).isEqualTo("Cat");
  }

  @Test
  public void initialValuesAreEmitted() throws CompilerException {
    println("stage");
    println("  var score = 10");
    println("  var name = \"Bob\"");
    println("  var half = 0.5");
    println("  list items = [\"a\", 2]");
    println("end");

    JsonNode stage = target(generateProject(), "Stage");

    JsonNode variables = stage.get("variables");
    assertThat(variables.get("gvar_1").toString()).isEqualTo("[\"score\",10]");
    assertThat(variables.get("gvar_2").toString()).isEqualTo("[\"name\",\"Bob\"]");
    assertThat(variables.get("gvar_3").toString()).isEqualTo("[\"half\",0.5]");
    assertThat(stage.get("lists").get("glist_1").toString()).isEqualTo("[\"items\",[\"a\",2]]");
  }

  @Test
  public void scriptLayout() throws CompilerException {
    println("sprite Cat");
    println("  define jump");
    println("  end");
    println("  when flag clicked");
    println("    show");
    println("  end");
    println("  when this sprite clicked");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    JsonNode definition = onlyBlock(cat, "procedures_definition");
    assertThat(definition.get("x").asInt()).isEqualTo(30);
    assertThat(definition.get("y").asInt()).isEqualTo(30);
    JsonNode flag = onlyBlock(cat, "event_whenflagclicked");
    assertThat(flag.get("x").asInt()).isEqualTo(320);
    assertThat(flag.get("y").asInt()).isEqualTo(150);
    JsonNode clicked = onlyBlock(cat, "event_whenthisspriteclicked");
    assertThat(clicked.get("y").asInt()).isEqualTo(330);
  }

  @Test
  public void statementsAreChained() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    show");
    println("    hide");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    JsonNode hat = onlyBlock(cat, "event_whenflagclicked");
    String showId = hat.get("next").asText();
    JsonNode show = cat.get("blocks").get(showId);
    assertThat(show.get("opcode").asText()).isEqualTo("looks_show");
    assertThat(show.get("parent").asText()).isEqualTo("block_1");
    JsonNode hide = cat.get("blocks").get(show.get("next").asText());
    assertThat(hide.get("opcode").asText()).isEqualTo("looks_hide");
    assertThat(hide.get("parent").asText()).isEqualTo(showId);
    assertThat(hide.get("next").isNull()).isTrue();
    assertThat(ImmutableList.copyOf(Iterators.limit(show.fieldNames(), 7)))
        .containsExactly("opcode", "next", "parent", "inputs", "fields", "shadow", "topLevel")
        .inOrder();
  }

  @Test
  public void comparisonOperatorsAreRewritten() throws CompilerException {
    println("sprite Cat");
    println("  var a");
    println("  when flag clicked");
    println("    say (a <= 3)");
    println("    say (a != 3)");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    List<JsonNode> says = blocksWithOpcode(cat, "looks_say");
    JsonNode or = inputBlock(cat, says.get(0), "MESSAGE");
    assertThat(or.get("opcode").asText()).isEqualTo("operator_or");
    assertThat(inputBlock(cat, or, "OPERAND1").get("opcode").asText()).isEqualTo("operator_lt");
    assertThat(inputBlock(cat, or, "OPERAND2").get("opcode").asText())
        .isEqualTo("operator_equals");
    assertThat(blocksWithOpcode(cat, "data_variable")).hasSize(3);

    JsonNode not = inputBlock(cat, says.get(1), "MESSAGE");
    assertThat(not.get("opcode").asText()).isEqualTo("operator_not");
    JsonNode equals = inputBlock(cat, not, "OPERAND");
    assertThat(equals.get("opcode").asText()).isEqualTo("operator_equals");
    assertThat(equals.get("inputs").get("OPERAND2").toString()).isEqualTo("[1,[4,\"3\"]]");
  }

  @Test
  public void literalInputsAreInlineShadows() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    move (10) steps");
    println("    say (\"hi\")");
    println("    go to (\"_mouse_\")");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    assertThat(onlyBlock(cat, "motion_movesteps").get("inputs").get("STEPS").toString())
        .isEqualTo("[1,[4,\"10\"]]");
    assertThat(onlyBlock(cat, "looks_say").get("inputs").get("MESSAGE").toString())
        .isEqualTo("[1,[10,\"hi\"]]");
    JsonNode menu = onlyBlock(cat, "motion_goto_menu");
    assertThat(menu.get("shadow").asBoolean()).isTrue();
    assertThat(menu.get("fields").get("TO").get(0).asText()).isEqualTo("_mouse_");
  }

  @Test
  public void ifWithoutElseLeavesSecondSubstackUnset() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    if <mouse x > 0> then");
    println("      show");
    println("    end");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    JsonNode ifElse = onlyBlock(cat, "control_if_else");
    assertThat(ifElse.get("inputs").has("SUBSTACK")).isTrue();
    assertThat(ifElse.get("inputs").has("SUBSTACK2")).isFalse();
  }

  @Test
  public void traceCallsBecomeWaits() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    log (\"hello\")");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    JsonNode wait = onlyBlock(cat, "control_wait");
    assertThat(wait.get("inputs").get("DURATION").toString()).isEqualTo("[1,[4,\"0\"]]");
  }

  @Test
  public void allowedUnknownCallsBecomeWaits() throws CompilerException {
    semanticOptions = SemanticAnalyzer.Options.builder().setAllowUnknownProcedures(true).build();
    println("sprite Cat");
    println("  when flag clicked");
    println("    fly (1)");
    println("    Dog.fly");
    println("  end");
    println("end");
    println("sprite Dog");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    List<JsonNode> waits = blocksWithOpcode(cat, "control_wait");
    assertThat(waits).hasSize(2);
    for (JsonNode wait : waits) {
      assertThat(wait.get("inputs").toString()).isEqualTo("{\"DURATION\":[1,[4,\"0\"]]}");
    }
    assertThat(blocksWithOpcode(cat, "event_broadcastandwait")).isEmpty();
  }

  @Test
  public void localProcedureCall() throws CompilerException {
    println("sprite Cat");
    println("  define !jump (height)");
    println("    change y by (height)");
    println("  end");
    println("  when flag clicked");
    println("    jump (5)");
    println("  end");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    JsonNode prototype = onlyBlock(cat, "procedures_prototype");
    JsonNode mutation = prototype.get("mutation");
    assertThat(mutation.get("proccode").asText()).isEqualTo("jump %s");
    assertThat(mutation.get("argumentids").asText()).isEqualTo("[\"arg_1\"]");
    assertThat(mutation.get("argumentnames").asText()).isEqualTo("[\"height\"]");
    assertThat(mutation.get("warp").asText()).isEqualTo("true");
    JsonNode call = onlyBlock(cat, "procedures_call");
    assertThat(call.get("inputs").get("arg_1").toString()).isEqualTo("[1,[4,\"5\"]]");
    JsonNode change = onlyBlock(cat, "motion_changeyby");
    JsonNode reporter = inputBlock(cat, change, "DY");
    assertThat(reporter.get("opcode").asText()).isEqualTo("argument_reporter_string_number");
  }

  @Test
  public void remoteCallsGoThroughSlotVariablesAndBroadcasts() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    Dog.bark (7)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  define bark (n)");
    println("    say (n)");
    println("  end");
    println("end");

    JsonNode project = generateProject();

    JsonNode stage = target(project, "Stage");
    assertThat(stage.get("variables").get("gvar_1").toString())
        .isEqualTo("[\"__rpc__dog__bark__arg1\",0]");
    assertThat(stage.get("broadcasts").get("broadcast_1").asText())
        .isEqualTo("__rpc__dog__bark");

    JsonNode cat = target(project, "Cat");
    JsonNode set = onlyBlock(cat, "data_setvariableto");
    assertThat(set.get("fields").get("VARIABLE").toString())
        .isEqualTo("[\"__rpc__dog__bark__arg1\",\"gvar_1\"]");
    JsonNode broadcast = cat.get("blocks").get(set.get("next").asText());
    assertThat(broadcast.get("opcode").asText()).isEqualTo("event_broadcastandwait");
    JsonNode menu = onlyBlock(cat, "event_broadcast_menu");
    assertThat(menu.get("fields").get("BROADCAST_OPTION").toString())
        .isEqualTo("[\"__rpc__dog__bark\",\"broadcast_1\"]");

    JsonNode dog = target(project, "Dog");
    JsonNode handler = onlyBlock(dog, "event_whenbroadcastreceived");
    assertThat(handler.get("x").asInt()).isEqualTo(580);
    assertThat(handler.get("y").asInt()).isEqualTo(210);
    JsonNode call = dog.get("blocks").get(handler.get("next").asText());
    assertThat(call.get("opcode").asText()).isEqualTo("procedures_call");
    JsonNode slot = inputBlock(dog, call, "arg_1");
    assertThat(slot.get("opcode").asText()).isEqualTo("data_variable");
  }

  @Test
  public void callSitesOfOneRemoteProcedureShareItsChannel() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    Dog.bark (1)");
    println("    Dog.bark (2)");
    println("  end");
    println("end");
    println("sprite Bird");
    println("  when this sprite clicked");
    println("    dog.BARK (3)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  define bark (n)");
    println("  end");
    println("end");

    JsonNode project = generateProject();

    JsonNode stage = target(project, "Stage");
    assertThat(stage.get("variables").toString())
        .isEqualTo("{\"gvar_1\":[\"__rpc__dog__bark__arg1\",0]}");
    assertThat(stage.get("broadcasts").toString())
        .isEqualTo("{\"broadcast_1\":\"__rpc__dog__bark\"}");
    assertThat(blocksWithOpcode(target(project, "Dog"), "event_whenbroadcastreceived"))
        .hasSize(1);
    List<JsonNode> sets = new ArrayList<>();
    sets.addAll(blocksWithOpcode(target(project, "Cat"), "data_setvariableto"));
    sets.addAll(blocksWithOpcode(target(project, "Bird"), "data_setvariableto"));
    assertThat(sets).hasSize(3);
    for (JsonNode set : sets) {
      assertThat(set.get("fields").get("VARIABLE").toString())
          .isEqualTo("[\"__rpc__dog__bark__arg1\",\"gvar_1\"]");
    }
  }

  @Test
  public void qualifiedCallsToTheOwnTargetAlsoBroadcast() throws CompilerException {
    println("sprite Cat");
    println("  define meow");
    println("  end");
    println("  when flag clicked");
    println("    Cat.meow");
    println("  end");
    println("end");

    JsonNode project = generateProject();

    JsonNode cat = target(project, "Cat");
    assertThat(blocksWithOpcode(cat, "event_broadcastandwait")).hasSize(1);
    JsonNode handler = onlyBlock(cat, "event_whenbroadcastreceived");
    assertThat(handler.get("fields").get("BROADCAST_OPTION").get(0).asText())
        .isEqualTo("__rpc__cat__meow");
    assertThat(blocksWithOpcode(cat, "procedures_call")).hasSize(1);
  }

  @Test
  public void foreignSpriteVariablesAreReadThroughSensing() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    say (lives)");
    println("    say (Dog.lives)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  var lives");
    println("end");

    JsonNode cat = target(generateProject(), "Cat");

    List<JsonNode> sensing = blocksWithOpcode(cat, "sensing_of");
    assertThat(sensing).hasSize(2);
    for (JsonNode block : sensing) {
      assertThat(block.get("fields").get("PROPERTY").get(0).asText()).isEqualTo("lives");
    }
    for (JsonNode menu : blocksWithOpcode(cat, "sensing_of_object_menu")) {
      assertThat(menu.get("fields").get("OBJECT").get(0).asText()).isEqualTo("Dog");
    }
  }

  @Test
  public void writingAForeignSpriteVariableFails() {
    println("sprite Cat");
    println("  when flag clicked");
    println("    set [lives] to (1)");
    println("  end");
    println("end");
    println("sprite Dog");
    println("  var lives");
    println("end");

    CompilerException ex = assertThrows(CompilerException.class, this::generate);

    assertThat(ex.phase()).isEqualTo(CompilerException.Phase.CODEGEN);
    assertThat(ex.getMessage()).isEqualTo("Variable 'lives' is not declared.");
  }

  @Test
  public void broadcastsAreDeclaredOnTheStage() throws CompilerException {
    println("sprite Cat");
    println("  when I receive [go]");
    println("    broadcast [stop]");
    println("  end");
    println("end");

    JsonNode project = generateProject();

    JsonNode broadcasts = target(project, "Stage").get("broadcasts");
    assertThat(broadcasts.toString())
        .isEqualTo("{\"broadcast_1\":\"go\",\"broadcast_2\":\"stop\"}");
    assertThat(target(project, "Cat").get("broadcasts")).isEmpty();
  }

  @Test
  public void penExtension() throws CompilerException {
    println("sprite Cat");
    println("  when flag clicked");
    println("    pen down");
    println("  end");
    println("end");

    JsonNode project = generateProject();

    assertThat(project.get("extensions").toString()).isEqualTo("[\"pen\"]");
  }

  @Test
  public void defaultCostumes() throws CompilerException {
    println("sprite Cat");
    println("end");

    CodeGenerator.Result result = generate();

    JsonNode stageCostume = target(result.project(), "Stage").get("costumes").get(0);
    assertThat(stageCostume.get("name").asText()).isEqualTo("backdrop1");
    JsonNode catCostume = target(result.project(), "Cat").get("costumes").get(0);
    assertThat(catCostume.get("name").asText()).isEqualTo("costume1");
    assertThat(catCostume.get("dataFormat").asText()).isEqualTo("svg");
    // Both targets share the one placeholder asset.
    assertThat(result.assets()).hasSize(1);
    assertThat(result.assets()).containsKey(catCostume.get("md5ext").asText());
  }

  @Test
  public void svgCostumesAreScaled() throws Exception {
    writeAsset("cat.svg", SVG_32_BY_16);
    println("sprite Cat");
    println("  costume \"cat.svg\"");
    println("end");

    CodeGenerator.Result result = generate();

    JsonNode costume = target(result.project(), "Cat").get("costumes").get(0);
    assertThat(costume.get("name").asText()).isEqualTo("cat");
    assertThat(costume.get("rotationCenterX").asDouble()).isEqualTo(32.0);
    assertThat(costume.get("rotationCenterY").asDouble()).isEqualTo(32.0);
    String svg =
        new String(result.assets().get(costume.get("md5ext").asText()), StandardCharsets.UTF_8);
    assertThat(svg).contains("viewBox=\"0 0 64 64\"");
    assertThat(svg).contains("scale(2 4)");
  }

  @Test
  public void svgScalingCanBeDisabled() throws Exception {
    writeAsset("cat.svg", SVG_32_BY_16);
    options = CodeGenerator.Options.builder().setScaleSvgs(false).build();
    println("sprite Cat");
    println("  costume \"cat.svg\"");
    println("end");

    JsonNode costume = target(generateProject(), "Cat").get("costumes").get(0);

    assertThat(costume.get("rotationCenterX").asDouble()).isEqualTo(16.0);
    assertThat(costume.get("rotationCenterY").asDouble()).isEqualTo(8.0);
  }

  @Test
  public void nonPositiveViewBoxSkipsTheCostume() throws Exception {
    writeAsset("cat.svg", SVG_32_BY_16);
    writeAsset("flat.svg", "<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 10 0\"/>");
    println("sprite Cat");
    println("  costume \"flat.svg\"");
    println("  costume \"cat.svg\"");
    println("end");

    JsonNode costumes = target(generateProject(), "Cat").get("costumes");

    assertThat(costumes).hasSize(1);
    assertThat(costumes.get(0).get("name").asText()).isEqualTo("cat");
  }

  @Test
  public void onlyNonPositiveViewBoxesFallBackToPlaceholder() throws Exception {
    writeAsset("flat.svg", "<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 0 0\"/>");
    println("sprite Cat");
    println("  costume \"flat.svg\"");
    println("end");

    JsonNode costumes = target(generateProject(), "Cat").get("costumes");

    assertThat(costumes).hasSize(1);
    assertThat(costumes.get(0).get("name").asText()).isEqualTo("costume1");
  }

  @Test
  public void pngCostumesAndUniqueNames() throws Exception {
    writeAsset("cat.png", "not really a png");
    MoreFiles.createParentDirectories(dir.resolve("other/cat.svg"));
    writeAsset("other/cat.svg", SVG_32_BY_16);
    println("sprite Cat");
    println("  costume \"cat.png\"");
    println("  costume \"other/cat.svg\"");
    println("end");

    CodeGenerator.Result result = generate();

    JsonNode costumes = target(result.project(), "Cat").get("costumes");
    assertThat(costumes.get(0).get("name").asText()).isEqualTo("cat");
    assertThat(costumes.get(0).get("dataFormat").asText()).isEqualTo("png");
    assertThat(costumes.get(0).get("bitmapResolution").asInt()).isEqualTo(1);
    assertThat(costumes.get(1).get("name").asText()).isEqualTo("cat 2");
    for (Map.Entry<String, byte[]> asset : result.assets().entrySet()) {
      assertThat(asset.getKey()).matches("[0-9a-f]{32}\\.(png|svg)");
    }
  }

  @Test
  public void missingCostume() {
    println("sprite Cat");
    println("  costume \"nope.svg\"");
    println("end");

    CompilerException ex = assertThrows(CompilerException.class, this::generate);

    assertThat(ex.phase()).isEqualTo(CompilerException.Phase.CODEGEN);
    assertThat(ex.getMessage())
        .startsWith("Costume file not found for target 'Cat': 'nope.svg' resolved to ");
  }

  @Test
  public void unsupportedCostumeFormat() throws Exception {
    writeAsset("cat.gif", "GIF89a");
    println("sprite Cat");
    println("  costume \"cat.gif\"");
    println("end");

    CompilerException ex = assertThrows(CompilerException.class, this::generate);

    assertThat(ex.getMessage()).startsWith("Unsupported costume format '.gif'");
  }

  @Test
  public void progressIsReportedPerTarget() throws CompilerException {
    println("sprite Cat");
    println("end");
    Project project =
        Compilation.parseAndValidateSource(file.toString(), SemanticAnalyzer.Options.defaults())
            .project();
    List<String> events = new ArrayList<>();

    new CodeGenerator(
            project,
            dir,
            options,
            (step, total, label) -> events.add(label + " " + step + "/" + total))
        .generate();

    assertThat(events).containsExactly("Emitting targets 1/2", "Emitting targets 2/2").inOrder();
  }
}
