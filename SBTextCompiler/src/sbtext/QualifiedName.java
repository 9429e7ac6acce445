package sbtext;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A {@code Target.member} reference to another target's variable or procedure. */
@AutoValue
public abstract class QualifiedName {
  public abstract String target();

  public abstract String member();

  /** Splits at the first dot; both halves must be non-empty and the member dot-free. */
  public static Optional<QualifiedName> split(String name) {
    int dot = name.indexOf('.');
    if (dot <= 0 || dot == name.length() - 1) return Optional.empty();
    String member = name.substring(dot + 1);
    if (member.indexOf('.') >= 0) return Optional.empty();
    return Optional.of(new AutoValue_QualifiedName(name.substring(0, dot), member));
  }
}
