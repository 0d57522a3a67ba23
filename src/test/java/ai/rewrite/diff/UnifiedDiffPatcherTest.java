package ai.rewrite.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UnifiedDiffPatcherTest {

    @Test
    void emptyDiffLeavesTextAlone() {
        assertEquals("a\n", UnifiedDiffPatcher.apply("a\n", ""));
    }

    @Test
    void appliesHandWrittenHunk() {
        final String diff = "--- Original\n"
                + "+++ New\n"
                + "@@ -2,2 +2,3 @@\n"
                + " b\n"
                + "-c\n"
                + "+C\n"
                + "+D\n";

        assertEquals("a\nb\nC\nD\ne\n", UnifiedDiffPatcher.apply("a\nb\nc\ne\n", diff));
    }

    @Test
    void rejectsDiffForOtherText() {
        final String diff = new UnifiedDiffer().diff("a\nb\n", "a\nc\n");

        assertThrows(IllegalArgumentException.class, () -> UnifiedDiffPatcher.apply("a\nx\n", diff));
    }

    @Test
    void rejectsMalformedHeader() {
        assertThrows(IllegalArgumentException.class,
                () -> UnifiedDiffPatcher.apply("a\n", "@@ nonsense @@\n-a\n"));
    }
}
