package ai.rewrite.engine;

import java.nio.file.Path;

/**
 * What processing one file added to the rules.
 */
public record FileReport(
        Path file,
        int rulesApplied,  // rules that were not excluded
        int changes,
        int errors
) {
}
