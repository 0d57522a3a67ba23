package ai.rewrite.print;

import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;

import ai.rewrite.model.Outcome;
import ai.rewrite.model.RewriteError;
import ai.rewrite.parse.ChangeTracker;
import ai.rewrite.parse.ParsedSource;
import ai.rewrite.parse.SourceParser;
import ai.rewrite.parse.TokenStream;
import ai.rewrite.parse.TreeCloner;

/**
 * Turns a working tree back into source text.
 * <p>
 * Nodes the rule left alone come out with their original tokens; nodes it changed or added
 * are printed with JavaParser's default formatting. A tracked working tree that saw no edit,
 * or an untracked tree structurally equal to the reference, yields the original token text
 * byte for byte. Any other untracked tree is grafted onto a fresh tracked copy of the
 * reference, so only the subtrees that differ are reprinted.
 */
public final class FormatPreservingPrinter {

    private final TreeCloner cloner;

    public FormatPreservingPrinter() {
        this(new TreeCloner(new SourceParser()));
    }

    public FormatPreservingPrinter(TreeCloner cloner) {
        this.cloner = Objects.requireNonNull(cloner, "cloner");
    }

    public Outcome<String> print(CompilationUnit working, CompilationUnit reference, TokenStream tokens) {
        Objects.requireNonNull(working, "working");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(tokens, "tokens");

        if (working == reference) {
            return Outcome.failure(RewriteError.print("Working tree is the reference tree itself"));
        }
        if (!tokens.isPairedWith(reference)) {
            return Outcome.failure(RewriteError.print("Token stream was not produced by the reference parse"));
        }

        final Optional<ChangeTracker> tracker = ChangeTracker.of(working);
        if (tracker.isPresent()) {
            return tracker.get().isModified() ? printTracked(working) : Outcome.success(tokens.text());
        }
        if (working.equals(reference)) {
            return Outcome.success(tokens.text());
        }
        return cloner.cloneTree(new ParsedSource(reference, tokens, tokens.text()))
                .flatMap(tracked -> graft(tracked, working));
    }

    private Outcome<String> graft(CompilationUnit tracked, CompilationUnit working) {
        try {
            TreeGrafter.graft(tracked, working);
        } catch (Exception | Error ex) {
            RewriteError.rethrowIfFatal(ex);
            return Outcome.failure(RewriteError.print("Cannot graft rewritten tree: " + RewriteError.describe(ex)));
        }
        if (!tracked.equals(working)) {
            return Outcome.failure(RewriteError.print("Rewritten tree could not be grafted onto the original"));
        }
        return printTracked(tracked);
    }

    private static Outcome<String> printTracked(CompilationUnit tracked) {
        try {
            return Outcome.success(LexicalPreservingPrinter.print(tracked));
        } catch (Exception | Error ex) {
            RewriteError.rethrowIfFatal(ex);
            return Outcome.failure(RewriteError.print("Cannot print rewritten tree: " + RewriteError.describe(ex)));
        }
    }
}
