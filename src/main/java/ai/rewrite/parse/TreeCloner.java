package ai.rewrite.parse;

import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;

import ai.rewrite.model.Outcome;
import ai.rewrite.model.RewriteError;

/**
 * Produces the working tree a rule is allowed to mutate.
 * <p>
 * The copy is rebuilt from the reference token text, so it shares no node, token or
 * lexical-preservation state with the reference. It is checked for structural equality with
 * the reference, registered with {@link LexicalPreservingPrinter} and given a
 * {@link ChangeTracker} before it is handed out.
 */
public final class TreeCloner {

    private final SourceParser parser;

    public TreeCloner(SourceParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public Outcome<CompilationUnit> cloneTree(ParsedSource source) {
        Objects.requireNonNull(source, "source");

        return parser.parse(source.tokens().text()).flatMap(copy -> {
            final CompilationUnit working = copy.reference();
            if (!working.equals(source.reference())) {
                return Outcome.failure(RewriteError.parse("Working copy diverges from the reference tree"));
            }
            try {
                final CompilationUnit tracked = LexicalPreservingPrinter.setup(working);
                ChangeTracker.attach(tracked);
                return Outcome.success(tracked);
            } catch (Exception | Error ex) {
                RewriteError.rethrowIfFatal(ex);
                return Outcome.failure(RewriteError.parse(
                        "Cannot track formatting of working copy: " + RewriteError.describe(ex)));
            }
        });
    }
}
