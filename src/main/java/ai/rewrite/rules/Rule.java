package ai.rewrite.rules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import ai.rewrite.model.ResultEntry;

/**
 * A named refactoring rule: description, exclusion predicate and the registry id of its
 * transformation. Collects the entries produced for it, in file-processing order.
 */
public final class Rule {

    private final String name;
    private final String description;
    private final String target;
    private final Predicate<Path> exclusion;
    private final List<ResultEntry> results = new ArrayList<>();

    public Rule(String name, String description, String target, Predicate<Path> exclusion) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
        this.target = Objects.requireNonNull(target, "target");
        this.exclusion = Objects.requireNonNull(exclusion, "exclusion");
    }

    public Rule(String name, String description, String target) {
        this(name, description, target, PathExclusion.none());
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String target() {
        return target;
    }

    public boolean isExcluded(Path file) {
        return exclusion.test(file);
    }

    public void addResult(ResultEntry entry) {
        results.add(Objects.requireNonNull(entry, "entry"));
    }

    public List<ResultEntry> results() {
        return Collections.unmodifiableList(results);
    }

    @Override
    public String toString() {
        return "Rule[" + name + " -> " + target + "]";
    }
}
