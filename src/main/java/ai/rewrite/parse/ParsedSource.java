package ai.rewrite.parse;

import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;

/**
 * Reference tree of one parse together with the token stream it was built from.
 * The reference tree is never mutated; rules work on clones.
 */
public record ParsedSource(CompilationUnit reference, TokenStream tokens, String text) {

    public ParsedSource {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(text, "text");
        if (!tokens.isPairedWith(reference)) {
            throw new IllegalArgumentException("token stream belongs to a different parse");
        }
    }
}
