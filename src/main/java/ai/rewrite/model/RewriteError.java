package ai.rewrite.model;

import java.util.Objects;

/**
 * Rule-scoped failure, tagged with the pipeline stage that produced it.
 */
public record RewriteError(Stage stage, String message) {

    public RewriteError {
        Objects.requireNonNull(stage, "stage");
        message = message == null || message.isBlank() ? "unknown failure" : message;
    }

    public static RewriteError parse(String message) {
        return new RewriteError(Stage.PARSE, message);
    }

    public static RewriteError transform(String message) {
        return new RewriteError(Stage.TRANSFORM, message);
    }

    public static RewriteError print(String message) {
        return new RewriteError(Stage.PRINT, message);
    }

    /**
     * Message of a caught throwable, falling back to its type name when it carries none.
     */
    public static String describe(Throwable t) {
        final String msg = t.getMessage();
        if (msg == null || msg.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return msg;
    }

    /**
     * Rethrows JVM failures that no rule boundary may absorb. Stack and heap exhaustion stay
     * rule-scoped; other {@link VirtualMachineError}s propagate.
     */
    public static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError
                && !(t instanceof StackOverflowError)
                && !(t instanceof OutOfMemoryError)) {
            throw (VirtualMachineError) t;
        }
    }

    public enum Stage {
        PARSE,
        TRANSFORM,
        PRINT
    }
}
