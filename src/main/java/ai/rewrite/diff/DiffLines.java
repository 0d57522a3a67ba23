package ai.rewrite.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting shared by {@link UnifiedDiffer} and {@link UnifiedDiffPatcher}.
 * Every line keeps its terminating '\n'; only the last line of a text may lack one.
 */
final class DiffLines {

    static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

    private DiffLines() {
    }

    static List<String> split(String text) {
        final List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    static boolean hasTerminator(String line) {
        return line.endsWith("\n");
    }

    static String withoutTerminator(String line) {
        return hasTerminator(line) ? line.substring(0, line.length() - 1) : line;
    }
}
