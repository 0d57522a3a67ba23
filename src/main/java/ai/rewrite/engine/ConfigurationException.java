package ai.rewrite.engine;

import java.nio.file.Path;

/**
 * A file cannot be taken into processing at all (missing, unreadable, unresolvable path).
 * Fatal for that file; no rule runs on it.
 */
public class ConfigurationException extends Exception {

    private final transient Path file;

    public ConfigurationException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
