package ai.rewrite.rules;

import com.github.javaparser.ast.CompilationUnit;

/**
 * A tree mutation registered under a stable identifier in a {@link RuleRegistry}.
 * Implementations may rewrite {@code unit} in place or return a different unit; they may throw.
 */
@FunctionalInterface
public interface Transformation {

    CompilationUnit apply(CompilationUnit unit);
}
