package ai.rewrite.diff;

/**
 * Textual comparison of two versions of a file.
 */
public interface Differ {

    /**
     * @return the difference between {@code original} and {@code revised}, or {@code ""} when equal
     */
    String diff(String original, String revised);
}
