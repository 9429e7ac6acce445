package sbtext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;

/**
 * Merges an entry file and everything it imports into one source text.
 *
 * <p>Imports are resolved depth first and each file's imports precede its own lines. A file
 * reached twice through different importers contributes its lines only once, at the first place
 * it was reached.
 */
public class ImportResolver {
  private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

  private static final Pattern IMPORT =
      Pattern.compile(
          "^\\s*import\\s+\\[(?<name>[^\\]\\r\\n]+)\\]\\s+from\\s+"
              + "\"(?<path>[^\"\\r\\n]+)\"\\s*(?:#.*)?$");
  private static final Pattern SPRITE =
      Pattern.compile("^\\s*sprite\\s+(?<name>\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_]*)\\s*(?:#.*)?$");
  private static final Pattern STAGE =
      Pattern.compile("^\\s*stage(?:\\s+(\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_]*))?\\s*(?:#.*)?$");

  @AutoValue
  abstract static class ImportDirective {
    abstract String spriteName();

    abstract String relativePath();

    abstract int line();

    static ImportDirective create(String spriteName, String relativePath, int line) {
      return new AutoValue_ImportResolver_ImportDirective(spriteName, relativePath, line);
    }
  }

  /** What an importer needs to know about a file it imports. */
  @AutoValue
  abstract static class FileSummary {
    abstract ImmutableList<String> localSprites();

    abstract boolean hasStage();

    static FileSummary create(ImmutableList<String> localSprites, boolean hasStage) {
      return new AutoValue_ImportResolver_FileSummary(localSprites, hasStage);
    }
  }

  private final Map<Path, FileSummary> resolved = new HashMap<>();
  private final List<Path> stack = new ArrayList<>();
  private final List<String> mergedLines = new ArrayList<>();
  private final ImmutableList.Builder<MergedSource.LineOrigin> origins = ImmutableList.builder();
  private final List<String> mergedSprites = new ArrayList<>();

  private ImportResolver() {}

  public static MergedSource resolve(Path entry) throws CompilerException {
    Path canonical = canonicalize(entry);
    ImportResolver resolver = new ImportResolver();
    resolver.resolveFile(canonical);
    resolver.checkUniqueSprites();

    String source =
        resolver.mergedLines.isEmpty() ? "" : Joiner.on('\n').join(resolver.mergedLines) + "\n";
    logger.debug(
        "Merged {} files into {} lines",
        resolver.resolved.size(),
        resolver.mergedLines.size());
    return MergedSource.create(source, resolver.origins.build(), canonical);
  }

  static Path canonicalize(Path path) throws CompilerException {
    if (!Files.isRegularFile(path)) {
      throw importError("Input file not found: '%s'.", path);
    }
    try {
      return path.toRealPath();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.IMPORT,
          String.format("Input file not found: '%s'.", path),
          e);
    }
  }

  private FileSummary resolveFile(Path file) throws CompilerException {
    FileSummary cached = resolved.get(file);
    if (cached != null) {
      return cached;
    }
    int onStack = stack.indexOf(file);
    if (onStack >= 0) {
      List<Path> cycle = new ArrayList<>(stack.subList(onStack, stack.size()));
      cycle.add(file);
      throw importError("Circular import detected: %s", Joiner.on(" -> ").join(cycle));
    }

    logger.debug("Resolving {}", file);
    String text = read(file);
    List<ImportDirective> imports = new ArrayList<>();
    List<String> bodyLines = new ArrayList<>();
    List<Integer> bodyLineNumbers = new ArrayList<>();
    ImmutableList.Builder<String> localSprites = ImmutableList.builder();
    boolean hasStage = false;
    boolean sawCode = false;

    List<String> lines = text.lines().collect(ImmutableList.toImmutableList());
    for (int i = 0; i < lines.size(); i++) {
      int lineNo = i + 1;
      String raw = lines.get(i);
      String line = lineNo == 1 ? stripBom(raw) : raw;
      Matcher importMatcher = IMPORT.matcher(line);
      if (importMatcher.matches()) {
        if (sawCode) {
          throw importError(
              "Imports are only allowed at the top level. Invalid import in '%s' at line %d.",
              file, lineNo);
        }
        imports.add(
            ImportDirective.create(
                importMatcher.group("name").trim(), importMatcher.group("path").trim(), lineNo));
        continue;
      }
      String trimmed = line.trim();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        sawCode = true;
      }
      Matcher spriteMatcher = SPRITE.matcher(line);
      if (spriteMatcher.matches()) {
        localSprites.add(unquote(spriteMatcher.group("name").trim()));
      } else if (STAGE.matcher(line).matches()) {
        hasStage = true;
      }
      bodyLines.add(raw);
      bodyLineNumbers.add(lineNo);
    }

    stack.add(file);
    for (ImportDirective directive : imports) {
      Path imported = resolveImportPath(file, directive);
      FileSummary child = resolveFile(imported);
      validateImport(directive, file, imported, child);
    }
    stack.remove(stack.size() - 1);

    for (int i = 0; i < bodyLines.size(); i++) {
      mergedLines.add(bodyLines.get(i));
      origins.add(MergedSource.LineOrigin.create(file, bodyLineNumbers.get(i)));
    }
    FileSummary summary = FileSummary.create(localSprites.build(), hasStage);
    mergedSprites.addAll(summary.localSprites());
    resolved.put(file, summary);
    return summary;
  }

  private static Path resolveImportPath(Path importer, ImportDirective directive)
      throws CompilerException {
    Path parent = importer.getParent();
    Path candidate =
        parent == null
            ? Path.of(directive.relativePath())
            : parent.resolve(directive.relativePath());
    try {
      return candidate.toRealPath();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.IMPORT,
          String.format(
              "Imported file does not exist: '%s' (from '%s', line %d).",
              directive.relativePath(), importer, directive.line()),
          e);
    }
  }

  private static void validateImport(
      ImportDirective directive, Path importer, Path imported, FileSummary child)
      throws CompilerException {
    if (child.localSprites().isEmpty()) {
      throw importError(
          "Imported file '%s' defines zero sprites; expected exactly one (imported from '%s',"
              + " line %d).",
          imported, importer, directive.line());
    }
    if (child.localSprites().size() > 1) {
      throw importError(
          "Imported file '%s' defines more than one sprite; expected exactly one (imported from"
              + " '%s', line %d).",
          imported, importer, directive.line());
    }
    String actual = child.localSprites().get(0);
    if (!actual.equals(directive.spriteName())) {
      throw importError(
          "Imported sprite name mismatch in '%s', line %d: expected '%s', file defines '%s'.",
          importer, directive.line(), directive.spriteName(), actual);
    }
    if (child.hasStage()) {
      throw importError(
          "Imported file '%s' must not define a stage (imported from '%s', line %d).",
          imported, importer, directive.line());
    }
  }

  private void checkUniqueSprites() throws CompilerException {
    Set<String> seen = new HashSet<>();
    for (String sprite : mergedSprites) {
      if (!seen.add(SemanticAnalyzer.lower(sprite))) {
        throw importError("Duplicate sprite name in final project: '%s'.", sprite);
      }
    }
  }

  private static String read(Path file) throws CompilerException {
    try {
      return MoreFiles.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.IMPORT,
          String.format("Failed to read '%s': %s", file, e.getMessage()),
          e);
    }
  }

  private static String stripBom(String line) {
    int start = 0;
    while (start < line.length() && line.charAt(start) == '\uFEFF') start++;
    return line.substring(start);
  }

  private static String unquote(String name) {
    if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
      return name.substring(1, name.length() - 1);
    }
    return name;
  }

  private static CompilerException importError(String format, Object... args) {
    return new CompilerException(CompilerException.Phase.IMPORT, String.format(format, args));
  }
}
