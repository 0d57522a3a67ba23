package ai.rewrite.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a diff produced by {@link UnifiedDiffer} to the text it was computed from.
 * Context and removed lines must match exactly.
 */
public final class UnifiedDiffPatcher {

    private static final Pattern HUNK_HEADER = Pattern.compile(
            "^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@");

    private UnifiedDiffPatcher() {
    }

    public static String apply(String original, String diff) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(diff, "diff");
        if (diff.isEmpty()) {
            return original;
        }

        final List<String> source = DiffLines.split(original);
        final List<String> out = new ArrayList<>(source.size());
        final List<String> diffLines = DiffLines.split(diff);

        int cursor = 0; // next unconsumed source line
        int i = 0;
        while (i < diffLines.size() && !diffLines.get(i).startsWith("@@")) {
            i++;
        }

        while (i < diffLines.size()) {
            final String header = DiffLines.withoutTerminator(diffLines.get(i));
            final Matcher m = HUNK_HEADER.matcher(header);
            if (!m.find()) {
                throw new IllegalArgumentException("Malformed hunk header: " + header);
            }
            final int oldStart = Integer.parseInt(m.group(1));
            final int oldLen = m.group(2) == null ? 1 : Integer.parseInt(m.group(2));
            final int at = oldLen == 0 ? oldStart : oldStart - 1;
            if (at < cursor || at > source.size()) {
                throw new IllegalArgumentException("Hunk out of order or out of range: " + header);
            }
            while (cursor < at) {
                out.add(source.get(cursor++));
            }
            i++;

            while (i < diffLines.size() && !diffLines.get(i).startsWith("@@")) {
                final String raw = diffLines.get(i);
                if (raw.isEmpty()) {
                    i++;
                    continue;
                }
                final char kind = raw.charAt(0);
                String line = raw.substring(1);
                if (i + 1 < diffLines.size()
                        && DiffLines.withoutTerminator(diffLines.get(i + 1)).equals(DiffLines.NO_NEWLINE_MARKER)) {
                    line = DiffLines.withoutTerminator(line);
                    i++;
                }
                i++;

                switch (kind) {
                    case ' ' -> {
                        expect(source, cursor, line);
                        out.add(source.get(cursor++));
                    }
                    case '-' -> {
                        expect(source, cursor, line);
                        cursor++;
                    }
                    case '+' -> out.add(line);
                    default -> throw new IllegalArgumentException("Unexpected diff line: " + raw);
                }
            }
        }

        while (cursor < source.size()) {
            out.add(source.get(cursor++));
        }
        return String.join("", out);
    }

    private static void expect(List<String> source, int index, String line) {
        if (index >= source.size() || !source.get(index).equals(line)) {
            throw new IllegalArgumentException("Diff does not apply at line " + (index + 1) + ": expected "
                    + DiffLines.withoutTerminator(line));
        }
    }
}
