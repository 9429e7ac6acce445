package sbtext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;

/** Resolves, prepares and hashes the costumes of each target into the shared asset table. */
class CostumeBuilder {
  private static final Logger logger = LoggerFactory.getLogger(CostumeBuilder.class);

  static final String DEFAULT_STAGE_BACKDROP = "__default_stage_backdrop__.svg";
  static final String DEFAULT_SPRITE_COSTUME = "__default_sprite_costume__.svg";
  static final byte[] DEFAULT_SVG =
      ("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"1\" height=\"1\" viewBox=\"0 0 1 1\">"
              + "</svg>")
          .getBytes(StandardCharsets.UTF_8);

  private final JsonNodeFactory json = JsonNodeFactory.instance;
  private final Path sourceDir;
  private final boolean scaleSvgs;
  private final Map<String, byte[]> assets;

  CostumeBuilder(Path sourceDir, boolean scaleSvgs, Map<String, byte[]> assets) {
    this.sourceDir = sourceDir;
    this.scaleSvgs = scaleSvgs;
    this.assets = assets;
  }

  ArrayNode build(Project.Target target) throws CompilerException {
    List<String> paths = new ArrayList<>();
    target.costumes().forEach(c -> paths.add(c.path()));
    if (paths.isEmpty()) {
      paths.add(target.isStage() ? DEFAULT_STAGE_BACKDROP : DEFAULT_SPRITE_COSTUME);
    }

    ArrayNode costumes = json.arrayNode();
    Set<String> usedNames = new HashSet<>();
    for (int i = 0; i < paths.size(); i++) {
      String path = paths.get(i);
      byte[] data;
      String ext;
      String baseName;
      if (path.equals(DEFAULT_STAGE_BACKDROP)) {
        data = DEFAULT_SVG;
        ext = "svg";
        baseName = "backdrop" + (i + 1);
      } else if (path.equals(DEFAULT_SPRITE_COSTUME)) {
        data = DEFAULT_SVG;
        ext = "svg";
        baseName = "costume" + (i + 1);
      } else {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
          throw codegenError(
              "Costume file not found for target '%s': '%s' resolved to '%s'.",
              target.name(), path, file);
        }
        ext = MoreFiles.getFileExtension(file).toLowerCase(Locale.ROOT);
        if (!ext.equals("svg") && !ext.equals("png")) {
          throw codegenError(
              "Unsupported costume format '.%s' for '%s'. Only .svg and .png are supported.",
              ext, file);
        }
        data = read(file);
        baseName = MoreFiles.getNameWithoutExtension(file);
      }
      String name = uniqueName(baseName, usedNames);

      double centerX = 0;
      double centerY = 0;
      if (ext.equals("svg")) {
        SvgNormalizer.Prepared prepared;
        try {
          prepared = SvgNormalizer.prepare(data, path, scaleSvgs);
        } catch (SvgNormalizer.NonPositiveViewBoxException e) {
          logger.warn(
              "Skipping SVG costume '{}' for target '{}' due to non-positive viewBox dimensions.",
              path,
              target.name());
          continue;
        }
        data = prepared.data();
        centerX = prepared.rotationCenterX();
        centerY = prepared.rotationCenterY();
      }
      ObjectNode costume = addAsset(name, data, ext, centerX, centerY);
      if (ext.equals("png")) {
        costume.put("bitmapResolution", 1);
      }
      costumes.add(costume);
    }

    if (costumes.isEmpty()) {
      SvgNormalizer.Prepared fallback =
          SvgNormalizer.prepare(DEFAULT_SVG, "__fallback_default__.svg", scaleSvgs);
      String name = uniqueName(target.isStage() ? "backdrop1" : "costume1", usedNames);
      costumes.add(
          addAsset(
              name,
              fallback.data(),
              "svg",
              fallback.rotationCenterX(),
              fallback.rotationCenterY()));
    }
    return costumes;
  }

  @SuppressWarnings("deprecation") // md5 names assets in the archive format.
  private ObjectNode addAsset(
      String name, byte[] data, String ext, double centerX, double centerY) {
    String digest = Hashing.md5().hashBytes(data).toString();
    String md5ext = digest + "." + ext;
    assets.put(md5ext, data);
    ObjectNode costume = json.objectNode();
    costume.put("name", name);
    costume.put("assetId", digest);
    costume.put("md5ext", md5ext);
    costume.put("dataFormat", ext);
    costume.put("rotationCenterX", centerX);
    costume.put("rotationCenterY", centerY);
    return costume;
  }

  // Relative paths: the source directory, then its parent, then the working directory.
  private Path resolve(String path) {
    Path file = Paths.get(path);
    if (file.isAbsolute()) return file;
    ImmutableList.Builder<Path> builder = ImmutableList.builder();
    builder.add(sourceDir.resolve(file));
    if (sourceDir.getParent() != null) {
      builder.add(sourceDir.getParent().resolve(file));
    }
    builder.add(Paths.get("").toAbsolutePath().resolve(file));
    ImmutableList<Path> candidates = builder.build();
    return candidates.stream().filter(Files::exists).findFirst().orElse(candidates.get(0));
  }

  private static byte[] read(Path file) throws CompilerException {
    try {
      return MoreFiles.asByteSource(file).read();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.CODEGEN,
          String.format("Failed to read costume '%s': %s", file, e.getMessage()),
          e);
    }
  }

  /** Trimmed, never empty, and distinct from earlier names ignoring case. */
  static String uniqueName(String base, Set<String> usedNames) {
    String name = base.trim();
    if (name.isEmpty()) name = "costume";
    if (usedNames.add(SemanticAnalyzer.lower(name))) return name;
    for (int n = 2; ; n++) {
      String candidate = name + " " + n;
      if (usedNames.add(SemanticAnalyzer.lower(candidate))) return candidate;
    }
  }

  private static CompilerException codegenError(String format, Object... args) {
    return new CompilerException(CompilerException.Phase.CODEGEN, String.format(format, args));
  }
}
