package sbtext;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class SbtcBundleTest {

  private static final Path MAIN = Paths.get("/work/main.sbtext");
  private static final Path CAT = Paths.get("/work/sprites/cat.sbtext");

  private static final String VALID_MANIFEST =
      "{\"format\": \"sbtc\", \"version\": 1, \"entry_file\": \"/work/main.sbtext\"}";
  private static final String ONE_LINE_MAP =
      "{\"origins\": [{\"file\": \"/work/main.sbtext\", \"line\": 1}]}";

  private static MergedSource merged() {
    return MergedSource.create(
        "sprite Cat\nend\nstage\nend\n",
        ImmutableList.of(
            MergedSource.LineOrigin.create(CAT, 1),
            MergedSource.LineOrigin.create(CAT, 2),
            MergedSource.LineOrigin.create(MAIN, 2),
            MergedSource.LineOrigin.create(MAIN, 3)),
        MAIN);
  }

  private static byte[] zip(Map<String, String> entries) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey()));
        zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
      }
    }
    return bytes.toByteArray();
  }

  private static Map<String, String> validEntries() {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put(SbtcBundle.MANIFEST, VALID_MANIFEST);
    entries.put(SbtcBundle.MERGED, "stage\n");
    entries.put(SbtcBundle.LINE_MAP, ONE_LINE_MAP);
    return entries;
  }

  private static CompilerException readFails(Map<String, String> entries) throws IOException {
    byte[] data = zip(entries);
    CompilerException ex = assertThrows(CompilerException.class, () -> SbtcBundle.read(data));
    assertThat(ex.phase()).isEqualTo(CompilerException.Phase.BUNDLE);
    return ex;
  }

  @Test
  public void writeThenRead() throws CompilerException {
    byte[] data = SbtcBundle.write(merged(), Paths.get("/work"));

    SbtcBundle.Contents contents = SbtcBundle.read(data);

    assertThat(contents.source()).isEqualTo(merged());
    assertThat(contents.sourceDir()).hasValue(Paths.get("/work"));
  }

  @Test
  public void markedSourceShowsProvenanceJumps() {
    assertThat(SbtcBundle.markedSource(merged()))
        .isEqualTo(
            "# @sbtc-origin file=\"/work/sprites/cat.sbtext\" line=1\n"
                + "sprite Cat\n"
                + "end\n"
                + "# @sbtc-origin file=\"/work/main.sbtext\" line=2\n"
                + "stage\n"
                + "end\n");
  }

  @Test
  public void markerEscapesQuotes() {
    MergedSource merged =
        MergedSource.create(
            "stage\n",
            ImmutableList.of(MergedSource.LineOrigin.create(Paths.get("/a \"b\".sbtext"), 1)),
            MAIN);

    assertThat(SbtcBundle.markedSource(merged))
        .startsWith("# @sbtc-origin file=\"/a \\\"b\\\".sbtext\" line=1\n");
  }

  @Test
  public void manifestWithoutSourceDir() throws Exception {
    SbtcBundle.Contents contents = SbtcBundle.read(zip(validEntries()));

    assertThat(contents.sourceDir()).isEmpty();
    assertThat(contents.source().entryFile()).isEqualTo(MAIN);
  }

  @Test
  public void missingEntry() throws Exception {
    Map<String, String> entries = validEntries();
    entries.remove(SbtcBundle.LINE_MAP);

    assertThat(readFails(entries).errorMsg())
        .isEqualTo("Missing 'line_map.json' in .sbtc archive.");
  }

  @Test
  public void wrongFormat() throws Exception {
    Map<String, String> entries = validEntries();
    entries.put(SbtcBundle.MANIFEST, "{\"format\": \"zip\", \"version\": 1}");

    assertThat(readFails(entries).errorMsg()).isEqualTo("Invalid .sbtc archive format 'zip'.");
  }

  @Test
  public void unsupportedVersion() throws Exception {
    Map<String, String> entries = validEntries();
    entries.put(SbtcBundle.MANIFEST, "{\"format\": \"sbtc\", \"version\": 2}");

    assertThat(readFails(entries).errorMsg())
        .isEqualTo("Unsupported .sbtc version 2 (expected 1).");
  }

  @Test
  public void malformedManifest() throws Exception {
    Map<String, String> entries = validEntries();
    entries.put(SbtcBundle.MANIFEST, "{not json");

    assertThat(readFails(entries).errorMsg())
        .isEqualTo("Invalid manifest.json in .sbtc archive.");
  }

  @Test
  public void originWithoutLine() throws Exception {
    Map<String, String> entries = validEntries();
    entries.put(SbtcBundle.LINE_MAP, "{\"origins\": [{\"file\": \"/work/main.sbtext\"}]}");

    assertThat(readFails(entries).errorMsg()).isEqualTo("line_map origin missing 'line'.");
  }

  @Test
  public void lineCountMismatch() throws Exception {
    Map<String, String> entries = validEntries();
    entries.put(SbtcBundle.MERGED, "stage\nend\n");

    assertThat(readFails(entries).errorMsg())
        .isEqualTo(
            ".sbtc source/map mismatch: merged source has 2 lines, line map has 1 entries.");
  }

  @Test
  public void notAZip() {
    byte[] data = "stage\nend\n".getBytes(StandardCharsets.UTF_8);

    CompilerException ex = assertThrows(CompilerException.class, () -> SbtcBundle.read(data));

    assertThat(ex.errorMsg()).isEqualTo("Input is not a valid .sbtc archive.");
  }
}
