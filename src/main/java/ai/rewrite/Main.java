package ai.rewrite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ai.rewrite.diff.UnifiedDiffer;
import ai.rewrite.engine.ConfigurationException;
import ai.rewrite.engine.FileReport;
import ai.rewrite.engine.RuleApplier;
import ai.rewrite.engine.RuleFileProcessor;
import ai.rewrite.io.ReportWriter;
import ai.rewrite.parse.SourceParser;
import ai.rewrite.parse.TreeCloner;
import ai.rewrite.print.FormatPreservingPrinter;
import ai.rewrite.rules.BuiltinRules;
import ai.rewrite.rules.PathExclusion;
import ai.rewrite.rules.Rule;
import ai.rewrite.scan.SourceFileFinder;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        final List<Path> roots = new ArrayList<>();
        Path out = null;
        Path excludeFile = null;
        int context = UnifiedDiffer.DEFAULT_CONTEXT;
        final Set<String> ruleIds = new LinkedHashSet<>();
        final Set<String> excludes = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--out=")) {
                    out = Paths.get(arg.substring("--out=".length()));
                    continue;
                }
                if (arg.startsWith("--rules=")) {
                    splitInto(arg.substring("--rules=".length()), ruleIds);
                    continue;
                }
                if (arg.startsWith("--exclude=")) {
                    splitInto(arg.substring("--exclude=".length()), excludes);
                    continue;
                }
                if (arg.startsWith("--excludeFile=")) {
                    excludeFile = Paths.get(arg.substring("--excludeFile=".length()));
                    continue;
                }
                if (arg.startsWith("--context=")) {
                    context = Integer.parseInt(arg.substring("--context=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                roots.add(Paths.get(arg));
            }

            final Path workDir = Paths.get(".").toAbsolutePath().normalize();
            if (roots.isEmpty()) {
                roots.add(workDir);
            }
            if (excludeFile != null) {
                loadExcludesFromFile(excludeFile, excludes);
            }
            if (out == null) {
                out = workDir.resolve("rewrite-report.json");
            }

            final PathExclusion exclusion = PathExclusion.of(excludes, workDir);
            if (!exclusion.isEmpty()) {
                System.out.println("Excluding: " + String.join(", ", exclusion.patterns()));
            }
            final List<Rule> rules = BuiltinRules.rules(
                    ruleIds.isEmpty() ? BuiltinRules.ids() : new ArrayList<>(ruleIds), exclusion);

            final SourceParser parser = new SourceParser();
            final TreeCloner cloner = new TreeCloner(parser);
            final RuleFileProcessor processor = new RuleFileProcessor(
                    parser,
                    cloner,
                    new RuleApplier(BuiltinRules.registry()),
                    new FormatPreservingPrinter(cloner),
                    new UnifiedDiffer(context));
            processor.addRules(rules);

            final List<Path> files = new SourceFileFinder().find(roots);
            int processed = 0;
            int rejected = 0;
            int changes = 0;
            int errors = 0;
            for (Path file : files) {
                try {
                    final FileReport report = processor.processFile(file);
                    processed++;
                    changes += report.changes();
                    errors += report.errors();
                    if (report.errors() > 0) {
                        System.err.println("WARN: " + report.errors() + " rule(s) failed on " + file);
                    }
                } catch (ConfigurationException ex) {
                    rejected++;
                    System.err.println("WARN: skipped " + file + " -> " + safeMsg(ex.getMessage()));
                }
            }

            final ReportWriter writer = new ReportWriter();
            writer.write(out, writer.toReport(rules, processed, rejected, Instant.now().toString()));

            System.out.println("Rewrite report written to: " + out);
            System.out.println("Schema: " + ReportWriter.SCHEMA_VERSION);
            System.out.println("Files: " + processed
                    + ", rules: " + rules.size()
                    + ", changes: " + changes
                    + ", errors: " + errors);
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: rewrite failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void splitInto(String list, Set<String> target) {
        final String trimmed = list.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(target::add);
    }

    static void loadExcludesFromFile(Path file, Set<String> excludes) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Exclude file not found: " + file);
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            final int hash = trimmed.indexOf('#');
            if (hash >= 0) {
                trimmed = trimmed.substring(0, hash).trim();
            }
            if (!trimmed.isEmpty()) {
                excludes.add(trimmed);
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: ai-rewrite [paths...] [options]");
        System.out.println("Options:");
        System.out.println("  --rules=<r1,r2>         Rules to run (default: all; known: " + BuiltinRules.ids() + ")");
        System.out.println("  --exclude=<p1,p2>       Glob patterns or path prefixes to skip");
        System.out.println("  --excludeFile=<path>    File with one exclude pattern per line");
        System.out.println("  --out=<path>            Report file (default: ./rewrite-report.json)");
        System.out.println("  --context=<n>           Diff context lines (default: " + UnifiedDiffer.DEFAULT_CONTEXT + ")");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
