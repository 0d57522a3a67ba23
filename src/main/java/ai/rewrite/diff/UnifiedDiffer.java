package ai.rewrite.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line-based unified diff (Myers), exact down to the final newline.
 * <p>
 * Output:
 * <pre>
 * --- Original
 * +++ New
 * &#64;&#64; -3,7 +3,7 &#64;&#64;
 *  context
 * -removed
 * +added
 * </pre>
 * A last line without '\n' is followed by {@code \ No newline at end of file}.
 */
public final class UnifiedDiffer implements Differ {

    public static final int DEFAULT_CONTEXT = 3;

    private final int contextSize;
    private final String originalLabel;
    private final String revisedLabel;

    public UnifiedDiffer() {
        this(DEFAULT_CONTEXT);
    }

    public UnifiedDiffer(int contextSize) {
        this(contextSize, "Original", "New");
    }

    public UnifiedDiffer(int contextSize, String originalLabel, String revisedLabel) {
        if (contextSize < 0) {
            throw new IllegalArgumentException("contextSize must be >= 0: " + contextSize);
        }
        this.contextSize = contextSize;
        this.originalLabel = Objects.requireNonNull(originalLabel, "originalLabel");
        this.revisedLabel = Objects.requireNonNull(revisedLabel, "revisedLabel");
    }

    @Override
    public String diff(String original, String revised) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(revised, "revised");
        if (original.equals(revised)) {
            return "";
        }

        final List<String> oldLines = DiffLines.split(original);
        final List<String> newLines = DiffLines.split(revised);
        final List<Edit> script = editScript(oldLines, newLines);

        final StringBuilder out = new StringBuilder();
        out.append("--- ").append(originalLabel).append('\n');
        out.append("+++ ").append(revisedLabel).append('\n');
        for (Hunk hunk : hunks(script)) {
            out.append(hunk.header()).append('\n');
            for (int i = hunk.from; i < hunk.to; i++) {
                final Edit e = script.get(i);
                out.append(e.type.prefix).append(DiffLines.withoutTerminator(e.line)).append('\n');
                if (!DiffLines.hasTerminator(e.line)) {
                    out.append(DiffLines.NO_NEWLINE_MARKER).append('\n');
                }
            }
        }
        return out.toString();
    }

    /**
     * Myers' O(ND) difference in linear space: each range is trimmed of its common head and
     * tail, then split at the middle snake of an optimal edit path and solved recursively.
     * Lines are compared through interned ids.
     */
    private static List<Edit> editScript(List<String> a, List<String> b) {
        final Map<String, Integer> ids = new HashMap<>();
        final int[] x = intern(a, ids);
        final int[] y = intern(b, ids);

        final List<Edit> script = new ArrayList<>(a.size() + b.size());
        new Myers(a, b, x, y, script).compare(0, x.length, 0, y.length);
        return deletionsFirst(script);
    }

    private static int[] intern(List<String> lines, Map<String, Integer> ids) {
        final int[] out = new int[lines.size()];
        for (int i = 0; i < out.length; i++) {
            final Integer known = ids.putIfAbsent(lines.get(i), ids.size());
            out[i] = known == null ? ids.size() - 1 : known;
        }
        return out;
    }

    /**
     * Within each run of changed lines, removals are listed before additions.
     */
    private static List<Edit> deletionsFirst(List<Edit> script) {
        final List<Edit> out = new ArrayList<>(script.size());
        final List<Edit> inserts = new ArrayList<>();
        for (Edit e : script) {
            switch (e.type) {
                case DELETE:
                    out.add(e);
                    break;
                case INSERT:
                    inserts.add(e);
                    break;
                default:
                    out.addAll(inserts);
                    inserts.clear();
                    out.add(e);
            }
        }
        out.addAll(inserts);
        return out;
    }

    private static final class Myers {

        private final List<String> a;
        private final List<String> b;
        private final int[] x;
        private final int[] y;
        private final List<Edit> out;

        Myers(List<String> a, List<String> b, int[] x, int[] y, List<Edit> out) {
            this.a = a;
            this.b = b;
            this.x = x;
            this.y = y;
            this.out = out;
        }

        void compare(int aLo, int aHi, int bLo, int bHi) {
            while (aLo < aHi && bLo < bHi && x[aLo] == y[bLo]) {
                out.add(new Edit(EditType.EQUAL, a.get(aLo)));
                aLo++;
                bLo++;
            }
            int tail = 0;
            while (aHi - tail > aLo && bHi - tail > bLo && x[aHi - 1 - tail] == y[bHi - 1 - tail]) {
                tail++;
            }
            aHi -= tail;
            bHi -= tail;

            if (aLo == aHi) {
                for (int j = bLo; j < bHi; j++) {
                    out.add(new Edit(EditType.INSERT, b.get(j)));
                }
            } else if (bLo == bHi) {
                for (int i = aLo; i < aHi; i++) {
                    out.add(new Edit(EditType.DELETE, a.get(i)));
                }
            } else {
                final int[] split = bisect(aLo, aHi, bLo, bHi);
                if (split == null) {
                    for (int i = aLo; i < aHi; i++) {
                        out.add(new Edit(EditType.DELETE, a.get(i)));
                    }
                    for (int j = bLo; j < bHi; j++) {
                        out.add(new Edit(EditType.INSERT, b.get(j)));
                    }
                } else {
                    compare(aLo, aLo + split[0], bLo, bLo + split[1]);
                    compare(aLo + split[0], aHi, bLo + split[1], bHi);
                }
            }

            for (int i = aHi; i < aHi + tail; i++) {
                out.add(new Edit(EditType.EQUAL, a.get(i)));
            }
        }

        /**
         * Walks the edit graph of the range from both corners at once and returns the point,
         * relative to the range start, where the two paths meet; {@code null} when the ranges
         * share no line at all.
         */
        private int[] bisect(int aLo, int aHi, int bLo, int bHi) {
            final int n = aHi - aLo;
            final int m = bHi - bLo;
            final int maxD = (n + m + 1) / 2;
            final int offset = maxD;
            final int length = 2 * maxD + 2;
            final int[] forward = new int[length];
            final int[] reverse = new int[length];
            Arrays.fill(forward, -1);
            Arrays.fill(reverse, -1);
            forward[offset + 1] = 0;
            reverse[offset + 1] = 0;

            final int delta = n - m;
            // with an odd delta the forward walk is the one that detects the overlap
            final boolean front = delta % 2 != 0;
            int k1start = 0;
            int k1end = 0;
            int k2start = 0;
            int k2end = 0;

            for (int d = 0; d < maxD; d++) {
                for (int k1 = -d + k1start; k1 <= d - k1end; k1 += 2) {
                    final int k1Offset = offset + k1;
                    int x1;
                    if (k1 == -d || (k1 != d && forward[k1Offset - 1] < forward[k1Offset + 1])) {
                        x1 = forward[k1Offset + 1];
                    } else {
                        x1 = forward[k1Offset - 1] + 1;
                    }
                    int y1 = x1 - k1;
                    while (x1 < n && y1 < m && x[aLo + x1] == y[bLo + y1]) {
                        x1++;
                        y1++;
                    }
                    forward[k1Offset] = x1;
                    if (x1 > n) {
                        k1end += 2;
                    } else if (y1 > m) {
                        k1start += 2;
                    } else if (front) {
                        final int k2Offset = offset + delta - k1;
                        if (k2Offset >= 0 && k2Offset < length && reverse[k2Offset] != -1) {
                            if (x1 >= n - reverse[k2Offset]) {
                                return new int[]{x1, y1};
                            }
                        }
                    }
                }

                for (int k2 = -d + k2start; k2 <= d - k2end; k2 += 2) {
                    final int k2Offset = offset + k2;
                    int x2;
                    if (k2 == -d || (k2 != d && reverse[k2Offset - 1] < reverse[k2Offset + 1])) {
                        x2 = reverse[k2Offset + 1];
                    } else {
                        x2 = reverse[k2Offset - 1] + 1;
                    }
                    int y2 = x2 - k2;
                    while (x2 < n && y2 < m && x[aHi - 1 - x2] == y[bHi - 1 - y2]) {
                        x2++;
                        y2++;
                    }
                    reverse[k2Offset] = x2;
                    if (x2 > n) {
                        k2end += 2;
                    } else if (y2 > m) {
                        k2start += 2;
                    } else if (!front) {
                        final int k1Offset = offset + delta - k2;
                        if (k1Offset >= 0 && k1Offset < length && forward[k1Offset] != -1) {
                            final int x1 = forward[k1Offset];
                            final int y1 = offset + x1 - k1Offset;
                            if (x1 >= n - x2) {
                                return new int[]{x1, y1};
                            }
                        }
                    }
                }
            }
            return null;
        }
    }

    private List<Hunk> hunks(List<Edit> script) {
        final List<Integer> changes = new ArrayList<>();
        for (int i = 0; i < script.size(); i++) {
            if (script.get(i).type != EditType.EQUAL) {
                changes.add(i);
            }
        }
        if (changes.isEmpty()) {
            return Collections.emptyList();
        }

        final List<Hunk> hunks = new ArrayList<>();
        int groupStart = changes.get(0);
        int groupEnd = groupStart;
        for (int k = 1; k < changes.size(); k++) {
            final int c = changes.get(k);
            // equal run between two changes short enough to share context -> same hunk
            if (c - groupEnd - 1 <= 2 * contextSize) {
                groupEnd = c;
            } else {
                hunks.add(hunk(script, groupStart, groupEnd));
                groupStart = c;
                groupEnd = c;
            }
        }
        hunks.add(hunk(script, groupStart, groupEnd));
        return hunks;
    }

    private Hunk hunk(List<Edit> script, int firstChange, int lastChange) {
        final int from = Math.max(0, firstChange - contextSize);
        final int to = Math.min(script.size(), lastChange + contextSize + 1);

        int oldBefore = 0;
        int newBefore = 0;
        for (int i = 0; i < from; i++) {
            final EditType t = script.get(i).type;
            if (t != EditType.INSERT) {
                oldBefore++;
            }
            if (t != EditType.DELETE) {
                newBefore++;
            }
        }
        int oldLen = 0;
        int newLen = 0;
        for (int i = from; i < to; i++) {
            final EditType t = script.get(i).type;
            if (t != EditType.INSERT) {
                oldLen++;
            }
            if (t != EditType.DELETE) {
                newLen++;
            }
        }
        // an empty side is addressed by the line before it
        final int oldStart = oldLen == 0 ? oldBefore : oldBefore + 1;
        final int newStart = newLen == 0 ? newBefore : newBefore + 1;
        return new Hunk(from, to, oldStart, oldLen, newStart, newLen);
    }

    enum EditType {
        EQUAL(' '),
        DELETE('-'),
        INSERT('+');

        final char prefix;

        EditType(char prefix) {
            this.prefix = prefix;
        }
    }

    private record Edit(EditType type, String line) {
    }

    private record Hunk(int from, int to, int oldStart, int oldLen, int newStart, int newLen) {

        String header() {
            return "@@ -" + oldStart + "," + oldLen + " +" + newStart + "," + newLen + " @@";
        }
    }
}
