package sbtext;

import java.util.Optional;

/** Child dispatch used by the generated {@code visitChildren} methods. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> node, ASTVisitor<V> visitor, V value) {
    return node.isPresent() ? accept(node.get(), visitor, value) : value;
  }

  private ASTNodeUtils() {}
}
