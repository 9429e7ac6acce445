package sbtext;

import java.nio.file.Path;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A whole program as one text, with the file and line every merged line came from. */
@AutoValue
public abstract class MergedSource {

  @AutoValue
  public abstract static class LineOrigin {
    public abstract Path file();

    public abstract int line();

    public static LineOrigin create(Path file, int line) {
      return new AutoValue_MergedSource_LineOrigin(file, line);
    }
  }

  @AutoValue
  public abstract static class MappedPosition {
    public abstract Path file();

    public abstract int line();

    public abstract int column();

    static MappedPosition create(Path file, int line, int column) {
      return new AutoValue_MergedSource_MappedPosition(file, line, column);
    }
  }

  public abstract String source();

  /** One entry per line of {@link #source()}. */
  public abstract ImmutableList<LineOrigin> lineOrigins();

  public abstract Path entryFile();

  public static MergedSource create(
      String source, ImmutableList<LineOrigin> lineOrigins, Path entryFile) {
    return new AutoValue_MergedSource(source, lineOrigins, entryFile);
  }

  /** Maps a merged-source position back to the file it was read from. */
  public MappedPosition mapPosition(int line, int column) {
    int col = Math.max(column, 1);
    ImmutableList<LineOrigin> origins = lineOrigins();
    if (origins.isEmpty()) {
      return MappedPosition.create(entryFile(), Math.max(line, 1), col);
    }
    if (line > 0 && line <= origins.size()) {
      LineOrigin origin = origins.get(line - 1);
      return MappedPosition.create(origin.file(), origin.line(), col);
    }
    LineOrigin last = origins.get(origins.size() - 1);
    int extra = Math.max(line - origins.size(), 0);
    return MappedPosition.create(last.file(), last.line() + extra, col);
  }
}
