package sbtext;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Writes a generated project into the bytes of an .sb3 archive. */
public final class Sb3Packager {
  private static final Logger logger = LoggerFactory.getLogger(Sb3Packager.class);

  static final String PROJECT_JSON = "project.json";

  private static final ObjectMapper mapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private Sb3Packager() {}

  /**
   * Builds the whole archive in memory: {@code project.json} first, then the assets in name
   * order.
   */
  public static byte[] pack(CodeGenerator.Result result, ProgressListener progress)
      throws CompilerException {
    try {
      byte[] projectJson = mapper.writeValueAsBytes(result.project());
      progress.onProgress(1, 1, "Writing project.json");

      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
        zip.setMethod(ZipOutputStream.DEFLATED);
        writeEntry(zip, PROJECT_JSON, projectJson);
        int total = result.assets().size();
        int step = 0;
        for (Map.Entry<String, byte[]> asset : result.assets().entrySet()) {
          writeEntry(zip, asset.getKey(), asset.getValue());
          progress.onProgress(++step, total, "Packaging assets");
        }
        if (total == 0) {
          progress.onProgress(1, 1, "Packaging assets");
        }
      }
      logger.debug("Packed {} assets into {} bytes", result.assets().size(), bytes.size());
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.CODEGEN, "Failed to write .sb3 archive: " + e.getMessage(), e);
    }
  }

  private static void writeEntry(ZipOutputStream zip, String name, byte[] data)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(data);
    zip.closeEntry();
  }
}
