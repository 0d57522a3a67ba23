package ai.rewrite.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.rewrite.model.ResultEntry;
import ai.rewrite.rules.Rule;

/**
 * Writes the entries collected on each rule as one JSON document.
 */
public final class ReportWriter {

    public static final String SCHEMA_VERSION = "ai-rewrite/v1";

    private final ObjectMapper jsonMapper;

    public ReportWriter() {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Report toReport(List<Rule> rules, int filesProcessed, int filesRejected, String generatedAt) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(generatedAt, "generatedAt");

        final List<RuleReport> ruleReports = new ArrayList<>(rules.size());
        int totalChanges = 0;
        int totalErrors = 0;
        for (Rule rule : rules) {
            final List<EntryLine> entries = new ArrayList<>(rule.results().size());
            int changes = 0;
            int errors = 0;
            for (ResultEntry e : rule.results()) {
                entries.add(new EntryLine(
                        e.kind().name().toLowerCase(Locale.ROOT),
                        e.file().toString(),
                        e.diff(),
                        e.message()));
                if (e.isError()) {
                    errors++;
                } else {
                    changes++;
                }
            }
            totalChanges += changes;
            totalErrors += errors;
            ruleReports.add(new RuleReport(rule.name(), rule.description(), changes, errors, entries));
        }

        final Summary summary = new Summary(filesProcessed, filesRejected, totalChanges, totalErrors);
        return new Report(SCHEMA_VERSION, generatedAt, summary, ruleReports);
    }

    public void write(Path file, Report report) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(report, "report");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), report);
    }

    // --- report records ---

    public record Report(
            String schema,
            String generatedAt,
            Summary summary,
            List<RuleReport> rules
    ) {
    }

    public record Summary(
            int files,
            int rejectedFiles,
            int changes,
            int errors
    ) {
    }

    public record RuleReport(
            String name,
            String description,
            int changes,
            int errors,
            List<EntryLine> entries
    ) {
    }

    public record EntryLine(
            String kind,     // "change" | "error"
            String file,
            String diff,     // omitted for errors
            String message
    ) {
    }
}
