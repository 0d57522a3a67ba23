package ai.rewrite.engine;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import ai.rewrite.diff.Differ;
import ai.rewrite.model.Outcome;
import ai.rewrite.model.ResultEntry;
import ai.rewrite.model.RewriteError;
import ai.rewrite.model.SourceFile;
import ai.rewrite.parse.ParsedSource;
import ai.rewrite.parse.SourceParser;
import ai.rewrite.parse.TreeCloner;
import ai.rewrite.print.FormatPreservingPrinter;
import ai.rewrite.rules.Rule;

/**
 * Applies every registered rule to a file, one at a time, and records on each rule what it
 * would change.
 * <p>
 * Per rule: clone the reference tree, transform the clone, print it against the reference
 * tokens, diff against the original text. A failing stage yields one ERROR entry on that rule
 * and processing moves on; an empty diff yields nothing. The file itself is never written.
 * <p>
 * The reference parse is done once per file, on demand, and shared by its rules; it is never
 * mutated. Not thread-safe.
 */
public final class RuleFileProcessor {

    private final SourceParser parser;
    private final TreeCloner cloner;
    private final RuleApplier applier;
    private final FormatPreservingPrinter printer;
    private final Differ differ;
    private final List<Rule> rules = new ArrayList<>();

    public RuleFileProcessor(SourceParser parser,
                             TreeCloner cloner,
                             RuleApplier applier,
                             FormatPreservingPrinter printer,
                             Differ differ) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.cloner = Objects.requireNonNull(cloner, "cloner");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.printer = Objects.requireNonNull(printer, "printer");
        this.differ = Objects.requireNonNull(differ, "differ");
    }

    public void addRule(Rule rule) {
        rules.add(Objects.requireNonNull(rule, "rule"));
    }

    public void addRules(List<Rule> toAdd) {
        for (Rule rule : toAdd) {
            addRule(rule);
        }
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public FileReport processFile(Path file) throws ConfigurationException {
        Objects.requireNonNull(file, "file");

        final Path realPath;
        try {
            realPath = file.toRealPath();
        } catch (IOException ex) {
            throw new ConfigurationException(file, "Unable to find file " + file, ex);
        }
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(realPath);
        } catch (IOException ex) {
            throw new ConfigurationException(file, "Unable to read file " + realPath, ex);
        }
        return process(realPath, decode(bytes));
    }

    /**
     * Same as {@link #processFile(Path)} for content already in memory; {@code source.path()}
     * is taken as canonical.
     */
    public FileReport processFile(SourceFile source) {
        Objects.requireNonNull(source, "source");
        return process(source.path(), Outcome.success(source.content()));
    }

    private FileReport process(Path path, Outcome<String> content) {
        Outcome<ParsedSource> parsed = null;
        int applied = 0;
        int changes = 0;
        int errors = 0;

        for (Rule rule : rules) {
            Outcome<String> diff;
            try {
                if (rule.isExcluded(path)) {
                    continue;
                }
                applied++;
                if (parsed == null) {
                    parsed = content.flatMap(parser::parse);
                }
                diff = parsed.flatMap(ps -> rewrite(rule, ps).flatMap(printed -> diff(ps.text(), printed)));
            } catch (Exception | Error ex) {
                RewriteError.rethrowIfFatal(ex);
                diff = Outcome.failure(RewriteError.transform(RewriteError.describe(ex)));
            }

            if (diff instanceof Outcome.Failure<String> failure) {
                rule.addResult(ResultEntry.error(path, failure.error().message()));
                errors++;
            } else if (diff instanceof Outcome.Success<String> success && !success.value().isEmpty()) {
                rule.addResult(ResultEntry.change(path, rule.description(), success.value()));
                changes++;
            }
        }
        return new FileReport(path, applied, changes, errors);
    }

    private static Outcome<String> decode(byte[] bytes) {
        try {
            return Outcome.success(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException ex) {
            return Outcome.failure(RewriteError.parse("File is not valid UTF-8: " + RewriteError.describe(ex)));
        }
    }

    private Outcome<String> diff(String original, String printed) {
        try {
            return Outcome.success(differ.diff(original, printed));
        } catch (Exception | Error ex) {
            RewriteError.rethrowIfFatal(ex);
            return Outcome.failure(RewriteError.print("Cannot diff rewritten text: " + RewriteError.describe(ex)));
        }
    }

    private Outcome<String> rewrite(Rule rule, ParsedSource source) {
        return cloner.cloneTree(source)
                .flatMap(working -> applier.apply(rule, working))
                .flatMap(rewritten -> printer.print(rewritten, source.reference(), source.tokens()));
    }
}
