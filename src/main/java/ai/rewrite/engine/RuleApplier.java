package ai.rewrite.engine;

import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;

import ai.rewrite.model.Outcome;
import ai.rewrite.model.RewriteError;
import ai.rewrite.rules.Rule;
import ai.rewrite.rules.RuleRegistry;
import ai.rewrite.rules.Transformation;

/**
 * Runs the transformation behind one rule over a working tree.
 */
public final class RuleApplier {

    private final RuleRegistry registry;

    public RuleApplier(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Outcome<CompilationUnit> apply(Rule rule, CompilationUnit working) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(working, "working");

        final Transformation transformation = registry.resolve(rule.target()).orElse(null);
        if (transformation == null) {
            return Outcome.failure(RewriteError.transform(
                    "No transformation registered for '" + rule.target() + "'"));
        }

        final CompilationUnit result;
        try {
            result = transformation.apply(working);
        } catch (StackOverflowError err) {
            return Outcome.failure(RewriteError.transform("Stack overflow in '" + rule.target() + "'"));
        } catch (Exception | Error ex) {
            RewriteError.rethrowIfFatal(ex);
            return Outcome.failure(RewriteError.transform(RewriteError.describe(ex)));
        }
        if (result == null) {
            return Outcome.failure(RewriteError.transform(
                    "Transformation '" + rule.target() + "' returned no tree"));
        }
        return Outcome.success(result);
    }
}
