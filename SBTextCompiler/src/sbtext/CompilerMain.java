package sbtext;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.io.MoreFiles;

public class CompilerMain {
  private static final Logger logger = LoggerFactory.getLogger(CompilerMain.class);

  private static final String USAGE =
      "Usage: sbtext <input.sbtext|input.sbtc> [output.sb3] [--no-svg-scale]"
          + " [--emit-merged <path>] [--emit-bundle <path>] [--allow-unknown-procedures]";

  @AutoValue
  abstract static class Arguments {
    abstract Path input();

    abstract Optional<Path> output();

    abstract boolean noSvgScale();

    abstract Optional<Path> emitMerged();

    abstract Optional<Path> emitBundle();

    abstract boolean allowUnknownProcedures();

    abstract boolean pythonBackend();

    abstract boolean decompile();

    abstract boolean splitSprites();

    static Builder builder() {
      return new AutoValue_CompilerMain_Arguments.Builder()
          .setNoSvgScale(false)
          .setAllowUnknownProcedures(false)
          .setPythonBackend(false)
          .setDecompile(false)
          .setSplitSprites(false);
    }

    @AutoValue.Builder
    abstract static class Builder {
      abstract Builder setInput(Path input);

      abstract Builder setOutput(Path output);

      abstract Builder setNoSvgScale(boolean value);

      abstract Builder setEmitMerged(Path path);

      abstract Builder setEmitBundle(Path path);

      abstract Builder setAllowUnknownProcedures(boolean value);

      abstract Builder setPythonBackend(boolean value);

      abstract Builder setDecompile(boolean value);

      abstract Builder setSplitSprites(boolean value);

      abstract Arguments build();
    }

    /** Throws {@link IllegalArgumentException} with a user-facing message on bad input. */
    static Arguments parse(String[] args) {
      Builder builder = builder();
      int positional = 0;
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        switch (arg) {
          case "--no-svg-scale":
            builder.setNoSvgScale(true);
            break;
          case "--allow-unknown-procedures":
            builder.setAllowUnknownProcedures(true);
            break;
          case "--python-backend":
            builder.setPythonBackend(true);
            break;
          case "--decompile":
            builder.setDecompile(true);
            break;
          case "--split-sprites":
            builder.setSplitSprites(true);
            break;
          case "--emit-merged":
            builder.setEmitMerged(Paths.get(value(args, ++i, arg)));
            break;
          case "--emit-bundle":
            builder.setEmitBundle(Paths.get(value(args, ++i, arg)));
            break;
          default:
            if (arg.startsWith("--")) {
              throw new IllegalArgumentException("Unknown option '" + arg + "'.\n" + USAGE);
            }
            if (positional == 0) {
              builder.setInput(Paths.get(arg));
            } else if (positional == 1) {
              builder.setOutput(Paths.get(arg));
            } else {
              throw new IllegalArgumentException("Unexpected argument '" + arg + "'.\n" + USAGE);
            }
            positional++;
        }
      }
      if (positional == 0) {
        throw new IllegalArgumentException(USAGE);
      }
      return builder.build();
    }

    private static String value(String[] args, int i, String option) {
      if (i >= args.length) {
        throw new IllegalArgumentException("Option " + option + " requires a path.");
      }
      return args[i];
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Returns the process exit status. */
  static int run(String[] argv, PrintStream out, PrintStream err) {
    Arguments args;
    try {
      args = Arguments.parse(argv);
      checkSupported(args);
    } catch (IllegalArgumentException ex) {
      err.println("ERROR: " + ex.getMessage());
      return 1;
    }

    try {
      compile(args, out, err);
      return 0;
    } catch (CompilerException ex) {
      ex.print(err);
      return 1;
    }
  }

  private static void checkSupported(Arguments args) {
    if (args.splitSprites() && !args.decompile()) {
      throw new IllegalArgumentException("--split-sprites requires --decompile.");
    }
    if (args.decompile()) {
      throw new IllegalArgumentException("--decompile is not supported by this compiler.");
    }
    if (args.pythonBackend()) {
      throw new IllegalArgumentException("--python-backend is not supported by this compiler.");
    }
  }

  private static void compile(Arguments args, PrintStream out, PrintStream err)
      throws CompilerException {
    MergedSource merged;
    Path sourceDir;
    if (isBundle(args.input())) {
      Path input = ImportResolver.canonicalize(args.input());
      SbtcBundle.Contents contents = SbtcBundle.read(readBytes(input));
      merged = contents.source();
      sourceDir = contents.sourceDir().orElse(input.getParent());
    } else {
      merged = ImportResolver.resolve(args.input());
      sourceDir = merged.entryFile().getParent();
    }

    SemanticAnalyzer.Options semanticOptions =
        SemanticAnalyzer.Options.builder()
            .setAllowUnknownProcedures(args.allowUnknownProcedures())
            .build();
    Compilation.Checked checked = Compilation.parseAndValidate(merged, semanticOptions);
    for (SemanticWarning warning : checked.warnings()) {
      err.println("WARNING: " + warning.message());
    }

    if (args.emitMerged().isPresent()) {
      write(args.emitMerged().get(), merged.source().getBytes(StandardCharsets.UTF_8));
      out.println("Wrote merged source to " + args.emitMerged().get());
    }
    if (args.emitBundle().isPresent()) {
      write(args.emitBundle().get(), SbtcBundle.write(merged, sourceDir));
      out.println("Wrote bundle to " + args.emitBundle().get());
    }
    if (args.output().isPresent()) {
      CodeGenerator.Options codegenOptions =
          CodeGenerator.Options.builder().setScaleSvgs(!args.noSvgScale()).build();
      ProgressListener progress =
          (step, total, label) -> logger.debug("{} ({}/{})", label, step, total);
      CodeGenerator.Result result =
          new CodeGenerator(checked.project(), sourceDir, codegenOptions, progress).generate();
      byte[] sb3 = Sb3Packager.pack(result, progress);
      write(args.output().get(), sb3);
      out.println("Compiled " + args.input() + " to " + args.output().get());
    }
  }

  private static boolean isBundle(Path input) {
    return input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sbtc");
  }

  private static byte[] readBytes(Path file) throws CompilerException {
    try {
      return MoreFiles.asByteSource(file).read();
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.BUNDLE,
          String.format("Failed to read '%s'.", file),
          e);
    }
  }

  private static void write(Path file, byte[] data) throws CompilerException {
    try {
      if (file.toAbsolutePath().getParent() != null) {
        Files.createDirectories(file.toAbsolutePath().getParent());
      }
      MoreFiles.asByteSink(file).write(data);
    } catch (IOException e) {
      throw new CompilerException(
          CompilerException.Phase.CODEGEN,
          String.format("Failed to write '%s': %s", file, e.getMessage()),
          e);
    }
  }
}
