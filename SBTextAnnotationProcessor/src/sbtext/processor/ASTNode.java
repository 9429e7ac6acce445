package sbtext.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a syntax tree class. The processor generates an {@code Outer_Inner_ASTNode} interface for
 * it, which the class must implement, and registers it with the generated visitors.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
