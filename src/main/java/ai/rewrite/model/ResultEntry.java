package ai.rewrite.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of applying one rule to one file.
 * <p>
 * kind:
 * - CHANGE: the rule rewrote the file; diff holds the unified diff
 * - ERROR:  the rule failed; diff is null
 */
public record ResultEntry(
        Kind kind,
        Path file,
        String diff,     // null for ERROR
        String message   // description + diff, or the failure text
) {

    private static final String ERROR_PREFIX = "[ERROR] Could not process this file, due to: ";

    public ResultEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(message, "message");
    }

    public static ResultEntry change(Path file, String description, String diff) {
        Objects.requireNonNull(diff, "diff");
        return new ResultEntry(Kind.CHANGE, file, diff, description + "\n" + diff);
    }

    public static ResultEntry error(Path file, String cause) {
        return new ResultEntry(Kind.ERROR, file, null, ERROR_PREFIX + cause + ".");
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public enum Kind {
        CHANGE,
        ERROR
    }
}
