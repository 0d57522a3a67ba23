package ai.rewrite.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Immutable snapshot of every token of one parse (whitespace, line ends and comments included),
 * in source order. Bound by identity to the {@link CompilationUnit} it was read from.
 */
public final class TokenStream {

    private final CompilationUnit owner;
    private final List<Token> tokens;
    private final String text;

    private TokenStream(CompilationUnit owner, List<Token> tokens) {
        this.owner = owner;
        this.tokens = Collections.unmodifiableList(tokens);
        final StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.text());
        }
        this.text = sb.toString();
    }

    /**
     * Reads the full token chain behind {@code unit}. Leading and trailing trivia outside the
     * unit's own range is included, so {@link #text()} reproduces the whole parsed input.
     */
    public static TokenStream of(CompilationUnit unit) {
        Objects.requireNonNull(unit, "unit");
        final List<Token> out = new ArrayList<>();
        final var range = unit.getTokenRange().orElse(null);
        if (range == null) {
            return new TokenStream(unit, out);
        }

        JavaToken first = range.getBegin();
        while (first.getPreviousToken().isPresent()) {
            first = first.getPreviousToken().get();
        }
        JavaToken t = first;
        while (t != null) {
            out.add(new Token(t.getKind(), t.getCategory(), t.getText()));
            t = t.getNextToken().orElse(null);
        }
        return new TokenStream(unit, out);
    }

    public boolean isPairedWith(CompilationUnit unit) {
        return owner == unit;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public String text() {
        return text;
    }

    public record Token(int kind, JavaToken.Category category, String text) {

        public boolean isTrivia() {
            return category.isWhitespaceOrComment();
        }
    }
}
