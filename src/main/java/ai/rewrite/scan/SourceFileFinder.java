package ai.rewrite.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the .java files to process from files and directories given on the command line.
 * Directories are walked recursively, skipping VCS, IDE and build output folders.
 * Result is de-duplicated and sorted.
 */
public final class SourceFileFinder {

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", ".idea", ".gradle", "build", "out", "target", "node_modules");

    private final Set<String> skippedDirs;

    public SourceFileFinder() {
        this(SKIPPED_DIRS);
    }

    public SourceFileFinder(Set<String> skippedDirs) {
        this.skippedDirs = Set.copyOf(Objects.requireNonNull(skippedDirs, "skippedDirs"));
    }

    public List<Path> find(Collection<Path> roots) throws IOException {
        Objects.requireNonNull(roots, "roots");
        final Set<Path> out = new LinkedHashSet<>();

        for (Path root : roots) {
            final Path abs = root.toAbsolutePath().normalize();
            if (Files.isRegularFile(abs)) {
                if (isJavaFile(abs)) {
                    out.add(abs);
                }
                continue;
            }
            if (!Files.isDirectory(abs)) {
                throw new IOException("No such file or directory: " + root);
            }

            Files.walkFileTree(abs, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (!dir.equals(abs) && skippedDirs.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isJavaFile(file)) {
                        out.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        final List<Path> sorted = new ArrayList<>(out);
        sorted.sort(null);
        return sorted;
    }

    private static boolean isJavaFile(Path file) {
        final var name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(".java");
    }
}
