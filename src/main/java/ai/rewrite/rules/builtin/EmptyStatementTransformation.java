package ai.rewrite.rules.builtin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;

import ai.rewrite.rules.Transformation;

/**
 * Drops stray {@code ;} statements from blocks. Empty bodies of if/for/while stay.
 * <p>
 * Removing a list element through the lexical printer also eats the line break after it,
 * which joins lines when the {@code ;} shares a line with another statement. Instead, every
 * outermost block holding stray statements is rebuilt from its own tokens with the
 * semicolons cut out, reparsed, and swapped in:
 * <ul>
 *   <li>a {@code ;} alone on its line takes the whole line with it;</li>
 *   <li>one that follows code on its line takes the blanks before it;</li>
 *   <li>one that starts a line before other code takes the blanks after it.</li>
 * </ul>
 */
public final class EmptyStatementTransformation implements Transformation {

    public static final String ID = "empty-statement";

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21)
            .setStoreTokens(true));

    @Override
    public CompilationUnit apply(CompilationUnit unit) {
        final Map<BlockStmt, Boolean> outermost = new IdentityHashMap<>();
        for (EmptyStmt stray : unit.findAll(EmptyStmt.class, EmptyStatementTransformation::isStray)) {
            outermost.put(outermostBlock(stray), Boolean.TRUE);
        }
        for (BlockStmt block : outermost.keySet()) {
            rebuild(block);
        }
        return unit;
    }

    private static boolean isStray(EmptyStmt stmt) {
        return stmt.getParentNode().filter(p -> p instanceof BlockStmt).isPresent();
    }

    private static BlockStmt outermostBlock(EmptyStmt stray) {
        BlockStmt found = null;
        Node current = stray.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof BlockStmt) {
                found = (BlockStmt) current;
            }
            current = current.getParentNode().orElse(null);
        }
        return found;
    }

    private void rebuild(BlockStmt block) {
        final TokenRange range = block.getTokenRange()
                .orElseThrow(() -> new IllegalStateException("Block has no tokens"));
        final List<JavaToken> tokens = new ArrayList<>();
        for (JavaToken t : range) {
            tokens.add(t);
        }

        final Set<JavaToken> semicolons = Collections.newSetFromMap(new IdentityHashMap<>());
        for (EmptyStmt stray : block.findAll(EmptyStmt.class, EmptyStatementTransformation::isStray)) {
            stray.getTokenRange().ifPresent(r -> semicolons.add(r.getBegin()));
        }

        final boolean[] dropped = new boolean[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            dropped[i] = semicolons.contains(tokens.get(i));
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (semicolons.contains(tokens.get(i))) {
                dropSurroundings(tokens, dropped, i);
            }
        }

        final StringBuilder text = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            if (!dropped[i]) {
                text.append(tokens.get(i).getText());
            }
        }

        final ParseResult<BlockStmt> res = parser.parseBlock(text.toString());
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            throw new IllegalStateException("Rebuilt block does not parse: " + res.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; ")));
        }
        final BlockStmt rebuilt = LexicalPreservingPrinter.setup(res.getResult().get());
        if (!block.replace(rebuilt)) {
            throw new IllegalStateException("Cannot replace block");
        }
    }

    private static void dropSurroundings(List<JavaToken> tokens, boolean[] dropped, int at) {
        int left = at - 1;
        while (left >= 0 && (dropped[left] || isBlank(tokens.get(left)))) {
            left--;
        }
        int right = at + 1;
        while (right < tokens.size() && (dropped[right] || isBlank(tokens.get(right)))) {
            right++;
        }
        final boolean startsLine = left < 0 || isLineEnd(tokens.get(left));
        final boolean endsLine = right >= tokens.size() || isLineEnd(tokens.get(right));

        if (startsLine && endsLine) {
            for (int i = left + 1; i < right; i++) {
                dropped[i] = true;
            }
            if (right < tokens.size()) {
                dropped[right] = true;
            }
        } else if (!startsLine) {
            for (int i = at - 1; i >= 0 && isBlank(tokens.get(i)); i--) {
                dropped[i] = true;
            }
        } else {
            for (int i = at + 1; i < tokens.size() && isBlank(tokens.get(i)); i++) {
                dropped[i] = true;
            }
        }
    }

    private static boolean isBlank(JavaToken token) {
        return token.getCategory().isWhitespaceButNotEndOfLine();
    }

    private static boolean isLineEnd(JavaToken token) {
        return token.getCategory().isEndOfLine();
    }
}
