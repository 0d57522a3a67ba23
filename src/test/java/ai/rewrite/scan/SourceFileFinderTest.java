package ai.rewrite.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFileFinderTest {

    @TempDir
    Path root;

    @Test
    void findsJavaFilesSortedAndSkipsBuildOutput() throws IOException {
        final Path b = touch("src/main/java/p/B.java");
        final Path a = touch("src/main/java/p/A.java");
        touch("src/main/resources/app.properties");
        touch("target/generated-sources/G.java");
        touch(".git/hooks/H.java");

        final List<Path> files = new SourceFileFinder().find(List.of(root));

        assertEquals(List.of(a.toAbsolutePath().normalize(), b.toAbsolutePath().normalize()), files);
    }

    @Test
    void acceptsFilesAndDeduplicates() throws IOException {
        final Path a = touch("A.java");

        final List<Path> files = new SourceFileFinder().find(List.of(a, root));

        assertEquals(List.of(a.toAbsolutePath().normalize()), files);
    }

    @Test
    void missingRootFails() {
        assertThrows(IOException.class, () -> new SourceFileFinder().find(List.of(root.resolve("nope"))));
    }

    private Path touch(String rel) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "class X {}\n");
        return file;
    }
}
