package sbtext;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;

/**
 * The .sbtc bundle: a resolved program saved with its line provenance so that it can be compiled
 * again without the original files.
 */
public final class SbtcBundle {
  static final String FORMAT = "sbtc";
  static final int VERSION = 1;

  static final String MANIFEST = "manifest.json";
  static final String MERGED = "merged.sbtext";
  static final String MERGED_MARKED = "merged_marked.sbtext";
  static final String LINE_MAP = "line_map.json";

  private static final ObjectMapper mapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  @AutoValue
  public abstract static class Contents {
    public abstract MergedSource source();

    /** Where costumes are looked up; absent when the manifest leaves it out. */
    public abstract Optional<Path> sourceDir();

    static Contents create(MergedSource source, Optional<Path> sourceDir) {
      return new AutoValue_SbtcBundle_Contents(source, sourceDir);
    }
  }

  private SbtcBundle() {}

  public static byte[] write(MergedSource merged, Path sourceDir) throws CompilerException {
    ObjectNode manifest = mapper.createObjectNode();
    manifest.put("format", FORMAT);
    manifest.put("version", VERSION);
    manifest.put("entry_file", merged.entryFile().toString());
    manifest.put("source_dir", sourceDir.toString());
    manifest.put("line_count", merged.lineOrigins().size());

    ObjectNode lineMap = mapper.createObjectNode();
    ArrayNode origins = lineMap.putArray("origins");
    for (MergedSource.LineOrigin origin : merged.lineOrigins()) {
      ObjectNode entry = origins.addObject();
      entry.put("file", origin.file().toString());
      entry.put("line", origin.line());
    }

    try {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
        writeEntry(zip, MANIFEST, mapper.writeValueAsBytes(manifest));
        writeEntry(zip, MERGED, merged.source().getBytes(StandardCharsets.UTF_8));
        writeEntry(zip, MERGED_MARKED, markedSource(merged).getBytes(StandardCharsets.UTF_8));
        writeEntry(zip, LINE_MAP, mapper.writeValueAsBytes(lineMap));
      }
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.BUNDLE, "Failed to write .sbtc archive: " + e.getMessage(), e);
    }
  }

  public static Contents read(byte[] data) throws CompilerException {
    Map<String, byte[]> entries = readEntries(data);
    String manifestText = entryText(entries, MANIFEST);
    String mergedText = entryText(entries, MERGED);
    String lineMapText = entryText(entries, LINE_MAP);

    JsonNode manifest = parseJson(manifestText, "Invalid manifest.json in .sbtc archive.");
    String format = manifest.path("format").asText("");
    if (!format.equals(FORMAT)) {
      throw bundleError("Invalid .sbtc archive format '%s'.", format);
    }
    JsonNode versionNode = manifest.path("version");
    long version = versionNode.canConvertToLong() ? versionNode.asLong() : 0;
    if (version != VERSION) {
      throw bundleError("Unsupported .sbtc version %d (expected %d).", version, VERSION);
    }
    Path entryFile =
        nonBlankText(manifest, "entry_file").map(Paths::get).orElse(Paths.get("bundle.sbtext"));
    Optional<Path> sourceDir = nonBlankText(manifest, "source_dir").map(Paths::get);

    JsonNode lineMap = parseJson(lineMapText, "Invalid line_map.json in .sbtc archive.");
    JsonNode origins = lineMap.get("origins");
    if (origins == null || !origins.isArray()) {
      throw bundleError("line_map.json is missing 'origins' array.");
    }
    ImmutableList.Builder<MergedSource.LineOrigin> lineOrigins = ImmutableList.builder();
    for (JsonNode origin : origins) {
      JsonNode file = origin.get("file");
      if (file == null || !file.isTextual()) {
        throw bundleError("line_map origin missing 'file'.");
      }
      JsonNode line = origin.get("line");
      if (line == null || !line.canConvertToInt() || line.asInt() < 0) {
        throw bundleError("line_map origin missing 'line'.");
      }
      lineOrigins.add(MergedSource.LineOrigin.create(Paths.get(file.asText()), line.asInt()));
    }

    MergedSource merged = MergedSource.create(mergedText, lineOrigins.build(), entryFile);
    long sourceLines = mergedText.lines().count();
    if (sourceLines != merged.lineOrigins().size()) {
      throw bundleError(
          ".sbtc source/map mismatch: merged source has %d lines, line map has %d entries.",
          sourceLines, merged.lineOrigins().size());
    }
    return Contents.create(merged, sourceDir);
  }

  /** The merged text with an origin marker wherever provenance jumps. */
  static String markedSource(MergedSource merged) {
    if (merged.lineOrigins().isEmpty()) {
      return merged.source();
    }
    StringBuilder out = new StringBuilder();
    Path prevFile = null;
    int prevLine = 0;
    int i = 0;
    for (String text : merged.source().lines().collect(ImmutableList.toImmutableList())) {
      if (i >= merged.lineOrigins().size()) break;
      MergedSource.LineOrigin origin = merged.lineOrigins().get(i++);
      boolean continuous = origin.file().equals(prevFile) && origin.line() == prevLine + 1;
      if (!continuous) {
        out.append(
            String.format(
                "# @sbtc-origin file=\"%s\" line=%d\n",
                escapeMarker(origin.file().toString()), origin.line()));
      }
      out.append(text).append('\n');
      prevFile = origin.file();
      prevLine = origin.line();
    }
    return out.toString();
  }

  private static String escapeMarker(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static Map<String, byte[]> readEntries(byte[] data) throws CompilerException {
    Map<String, byte[]> entries = new HashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(data))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), ByteStreams.toByteArray(zip));
      }
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.BUNDLE, "Input is not a valid .sbtc archive.", e);
    }
    // ZipInputStream reads non-zip input as an empty archive.
    if (entries.isEmpty()) {
      throw bundleError("Input is not a valid .sbtc archive.");
    }
    return entries;
  }

  private static String entryText(Map<String, byte[]> entries, String name)
      throws CompilerException {
    byte[] bytes = entries.get(name);
    if (bytes == null) {
      throw bundleError("Missing '%s' in .sbtc archive.", name);
    }
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static JsonNode parseJson(String text, String errorMsg) throws CompilerException {
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new CompilerException(CompilerException.Phase.BUNDLE, errorMsg, e);
    }
  }

  private static Optional<String> nonBlankText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().trim().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }

  private static void writeEntry(ZipOutputStream zip, String name, byte[] data)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(data);
    zip.closeEntry();
  }

  private static CompilerException bundleError(String format, Object... args) {
    return new CompilerException(CompilerException.Phase.BUNDLE, String.format(format, args));
  }
}
