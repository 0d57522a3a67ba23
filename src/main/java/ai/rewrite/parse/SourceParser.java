package ai.rewrite.parse;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import ai.rewrite.model.Outcome;
import ai.rewrite.model.RewriteError;

/**
 * Parses raw Java text into a reference tree plus its paired token stream.
 */
public final class SourceParser {

    private static final int MAX_REPORTED_PROBLEMS = 3;

    private final JavaParser parser;

    public SourceParser() {
        this(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21));
    }

    public SourceParser(ParserConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        // lexical preservation needs the token chain
        configuration.setStoreTokens(true);
        this.parser = new JavaParser(configuration);
    }

    public Outcome<ParsedSource> parse(String text) {
        Objects.requireNonNull(text, "text");

        final ParseResult<CompilationUnit> res;
        try {
            res = parser.parse(text);
        } catch (Exception | Error ex) {
            RewriteError.rethrowIfFatal(ex);
            return Outcome.failure(RewriteError.parse("Parser failure: " + RewriteError.describe(ex)));
        }

        if (!res.getProblems().isEmpty()) {
            return Outcome.failure(RewriteError.parse(describeProblems(res.getProblems())));
        }
        final var cuOpt = res.getResult();
        if (cuOpt.isEmpty()) {
            return Outcome.failure(RewriteError.parse("Parser produced no compilation unit"));
        }

        final CompilationUnit cu = cuOpt.get();
        final TokenStream tokens = TokenStream.of(cu);
        if (!tokens.text().equals(text)) {
            return Outcome.failure(RewriteError.parse(
                    "Token stream does not reproduce the source text (" + tokens.size() + " tokens)"));
        }
        return Outcome.success(new ParsedSource(cu, tokens, text));
    }

    private static String describeProblems(List<Problem> problems) {
        final String shown = problems.stream()
                .limit(MAX_REPORTED_PROBLEMS)
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
        final int hidden = problems.size() - MAX_REPORTED_PROBLEMS;
        return "Syntax error: " + shown + (hidden > 0 ? " (+" + hidden + " more)" : "");
    }
}
