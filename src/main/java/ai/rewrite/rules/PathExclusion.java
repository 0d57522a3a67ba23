package ai.rewrite.rules;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether a rule skips a file.
 * <p>
 * Patterns:
 * - "glob:..." or anything containing '*', '?', '{' or '[' -> PathMatcher glob on the absolute path
 * - otherwise a path prefix (file or directory), resolved against {@code baseDir}
 */
public final class PathExclusion implements Predicate<Path> {

    private static final PathExclusion NONE = new PathExclusion(List.of(), List.of(), List.of());

    private final List<String> patterns;
    private final List<PathMatcher> matchers;
    private final List<Path> prefixes;

    private PathExclusion(List<String> patterns, List<PathMatcher> matchers, List<Path> prefixes) {
        this.patterns = List.copyOf(patterns);
        this.matchers = List.copyOf(matchers);
        this.prefixes = List.copyOf(prefixes);
    }

    public static PathExclusion none() {
        return NONE;
    }

    public static PathExclusion of(Collection<String> patterns, Path baseDir) {
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(baseDir, "baseDir");
        if (patterns.isEmpty()) {
            return NONE;
        }

        final FileSystem fs = baseDir.getFileSystem();
        final Path base = baseDir.toAbsolutePath().normalize();
        final List<String> kept = new ArrayList<>();
        final List<PathMatcher> matchers = new ArrayList<>();
        final List<Path> prefixes = new ArrayList<>();

        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            final String p = raw.trim();
            kept.add(p);
            if (p.startsWith("glob:") || p.startsWith("regex:")) {
                matchers.add(fs.getPathMatcher(p));
            } else if (isGlob(p)) {
                matchers.add(fs.getPathMatcher("glob:" + p));
            } else {
                prefixes.add(base.resolve(p).normalize());
            }
        }
        return new PathExclusion(kept, matchers, prefixes);
    }

    public static PathExclusion of(Collection<String> patterns) {
        return of(patterns, FileSystems.getDefault().getPath("").toAbsolutePath());
    }

    @Override
    public boolean test(Path file) {
        if (file == null) {
            return false;
        }
        final Path abs = file.toAbsolutePath().normalize();
        for (Path prefix : prefixes) {
            if (abs.startsWith(prefix)) {
                return true;
            }
        }
        for (PathMatcher m : matchers) {
            if (m.matches(abs) || (abs.getFileName() != null && m.matches(abs.getFileName()))) {
                return true;
            }
        }
        return false;
    }

    public List<String> patterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    private static boolean isGlob(String p) {
        return p.indexOf('*') >= 0 || p.indexOf('?') >= 0 || p.indexOf('{') >= 0 || p.indexOf('[') >= 0;
    }

    @Override
    public String toString() {
        return "PathExclusion" + patterns;
    }
}
