package ai.rewrite.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file under processing: canonical absolute path plus its raw text.
 */
public record SourceFile(Path path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }
}
