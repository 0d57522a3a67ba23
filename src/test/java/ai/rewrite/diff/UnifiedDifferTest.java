package ai.rewrite.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

class UnifiedDifferTest {

    private final UnifiedDiffer differ = new UnifiedDiffer();

    @Test
    void identicalTextHasEmptyDiff() {
        assertEquals("", differ.diff("class A {}\n", "class A {}\n"));
        assertEquals("", differ.diff("", ""));
    }

    @Test
    void singleLineChangeWithContext() {
        final String diff = differ.diff("a\nb\nc\n", "a\nB\nc\n");

        assertEquals("--- Original\n"
                + "+++ New\n"
                + "@@ -1,3 +1,3 @@\n"
                + " a\n"
                + "-b\n"
                + "+B\n"
                + " c\n", diff);
    }

    @Test
    void missingFinalNewlineIsMarked() {
        final String diff = differ.diff("a", "b");

        assertEquals("--- Original\n"
                + "+++ New\n"
                + "@@ -1,1 +1,1 @@\n"
                + "-a\n"
                + "\\ No newline at end of file\n"
                + "+b\n"
                + "\\ No newline at end of file\n", diff);
    }

    @Test
    void distantChangesGetSeparateHunks() {
        final String original = "1\n2\n3\n4\n5\n6\n7\n8\n9\n10\n";
        final String revised = "1\nx\n3\n4\n5\n6\n7\n8\ny\n10\n";

        final String diff = new UnifiedDiffer(1).diff(original, revised);

        assertTrue(diff.contains("@@ -1,3 +1,3 @@\n 1\n-2\n+x\n 3\n"), diff);
        assertTrue(diff.contains("@@ -8,3 +8,3 @@\n 8\n-9\n+y\n 10\n"), diff);
        assertEquals(2, diff.split("\n@@ -", -1).length - 1);
    }

    @Test
    void nearbyChangesShareOneHunk() {
        final String diff = new UnifiedDiffer(2).diff("1\n2\n3\n4\n5\n", "x\n2\n3\n4\ny\n");

        assertEquals("--- Original\n"
                + "+++ New\n"
                + "@@ -1,5 +1,5 @@\n"
                + "-1\n"
                + "+x\n"
                + " 2\n"
                + " 3\n"
                + " 4\n"
                + "-5\n"
                + "+y\n", diff);
    }

    @Test
    void customLabelsAppearInHeader() {
        final String diff = new UnifiedDiffer(3, "A.java (original)", "A.java (modified)").diff("x\n", "y\n");

        assertTrue(diff.startsWith("--- A.java (original)\n+++ A.java (modified)\n"), diff);
    }

    @Test
    void negativeContextRejected() {
        assertThrows(IllegalArgumentException.class, () -> new UnifiedDiffer(-1));
    }

    @Test
    void largeFileWithChangesAtBothEnds() {
        final StringBuilder original = new StringBuilder();
        for (int i = 0; i < 20_000; i++) {
            original.append("line ").append(i).append('\n');
        }
        final String before = original.toString();
        final String after = before.replaceFirst("line 0\n", "first\n").replace("line 19999\n", "last\n");

        final String diff = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> differ.diff(before, after));

        assertTrue(diff.contains("@@ -1,4 +1,4 @@\n-line 0\n+first\n line 1\n"), diff);
        assertTrue(diff.contains("@@ -19997,4 +19997,4 @@\n line 19996\n line 19997\n line 19998\n-line 19999\n+last\n"), diff);
        assertEquals(after, UnifiedDiffPatcher.apply(before, diff));
    }

    @Test
    void unrelatedTextsListRemovalsBeforeAdditions() {
        final String diff = differ.diff("a\nb\n", "c\nd\n");

        assertEquals("--- Original\n"
                + "+++ New\n"
                + "@@ -1,2 +1,2 @@\n"
                + "-a\n"
                + "-b\n"
                + "+c\n"
                + "+d\n", diff);
    }

    @Test
    void movedBlockIsMinimal() {
        final String diff = new UnifiedDiffer(0).diff("a\nb\nc\nd\n", "b\nc\nd\na\n");

        assertEquals("--- Original\n"
                + "+++ New\n"
                + "@@ -1,1 +0,0 @@\n"
                + "-a\n"
                + "@@ -4,0 +4,1 @@\n"
                + "+a\n", diff);
    }

    @Test
    void diffAppliesBackToRevisedText() {
        final List<String[]> cases = List.of(
                new String[]{"", "class A {}\n"},
                new String[]{"class A {}\n", ""},
                new String[]{"a\nb\nc\n", "a\nc\n"},
                new String[]{"a\nb\nc\n", "a\nb\nc\nd\n"},
                new String[]{"a\nb\nc\n", "a\nb\nc"},
                new String[]{"a\nb\nc", "a\nb\nc\n"},
                new String[]{"a\r\nb\r\n", "a\r\nB\r\n"},
                new String[]{"x\n\n\ny\n\n", "\ny\n\nx\n"},
                new String[]{"1\n2\n3\n4\n5\n6\n7\n8\n9\n10\n11\n12\n", "0\n1\n2\n3\n4\n5\n6\n7\n8\n9\n10\n12\n13\n"}
        );

        for (int context = 0; context <= 3; context++) {
            final UnifiedDiffer d = new UnifiedDiffer(context);
            for (String[] c : cases) {
                final String diff = d.diff(c[0], c[1]);
                assertEquals(c[1], UnifiedDiffPatcher.apply(c[0], diff),
                        "context=" + context + " diff:\n" + diff);
            }
        }
    }
}
