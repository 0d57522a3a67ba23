package ai.rewrite.rules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import ai.rewrite.rules.builtin.DiamondOperatorTransformation;
import ai.rewrite.rules.builtin.EmptyStatementTransformation;
import ai.rewrite.rules.builtin.ReturnSpacingTransformation;

/**
 * The rules shipped with the tool.
 */
public final class BuiltinRules {

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put(DiamondOperatorTransformation.ID,
                "Replace explicit constructor type arguments with the diamond operator");
        DESCRIPTIONS.put(EmptyStatementTransformation.ID,
                "Remove empty statements");
        DESCRIPTIONS.put(ReturnSpacingTransformation.ID,
                "Use a single space between 'return' and its value");
    }

    private BuiltinRules() {
    }

    public static RuleRegistry registry() {
        return RuleRegistry.builder()
                .register(DiamondOperatorTransformation.ID, new DiamondOperatorTransformation())
                .register(EmptyStatementTransformation.ID, new EmptyStatementTransformation())
                .register(ReturnSpacingTransformation.ID, new ReturnSpacingTransformation())
                .build();
    }

    public static List<String> ids() {
        return new ArrayList<>(DESCRIPTIONS.keySet());
    }

    /**
     * Creates one rule per id, in the given order. Unknown ids are rejected.
     */
    public static List<Rule> rules(Collection<String> ids, Predicate<Path> exclusion) {
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(exclusion, "exclusion");
        final List<Rule> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            final String description = DESCRIPTIONS.get(id);
            if (description == null) {
                throw new IllegalArgumentException("Unknown rule: " + id + " (known: " + ids() + ")");
            }
            out.add(new Rule(id, description, id, exclusion));
        }
        return out;
    }

    public static List<Rule> rules(Predicate<Path> exclusion) {
        return rules(ids(), exclusion);
    }
}
