package ai.rewrite.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifier -> {@link Transformation} lookup. Built once, read-only afterwards.
 */
public final class RuleRegistry {

    private final Map<String, Transformation> byId;

    private RuleRegistry(Map<String, Transformation> byId) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(byId));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Transformation> resolve(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /**
     * Registered identifiers in registration order.
     */
    public List<String> ids() {
        return new ArrayList<>(byId.keySet());
    }

    public static final class Builder {

        private final Map<String, Transformation> byId = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String id, Transformation transformation) {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(transformation, "transformation");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Transformation id must not be blank");
            }
            if (byId.putIfAbsent(id, transformation) != null) {
                throw new IllegalArgumentException("Duplicate transformation id: " + id);
            }
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(byId);
        }
    }
}
