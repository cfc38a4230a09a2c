package org.pragmatica.regex.error;

/**
 * Thrown when a pattern string cannot be compiled.
 *
 * <p>Carries the reason and the zero-based offset in the pattern where the problem was detected.
 * For unclosed groups and classes the offset points at the opening delimiter.
 */
public final class PatternSyntaxException extends RuntimeException {

    private final String pattern;
    private final SyntaxError reason;
    private final int offset;

    public PatternSyntaxException(String pattern, SyntaxError reason, int offset) {
        super(reason.description() + describeCharacter(pattern, reason, offset)
              + " at offset " + offset + " (pattern: " + truncate(pattern) + ")");
        this.pattern = pattern;
        this.reason = reason;
        this.offset = offset;
    }

    public String pattern() {
        return pattern;
    }

    public SyntaxError reason() {
        return reason;
    }

    public int offset() {
        return offset;
    }

    private static String describeCharacter(String pattern, SyntaxError reason, int offset) {
        if (reason != SyntaxError.UNEXPECTED_CHARACTER && reason != SyntaxError.UNESCAPED_SPECIAL) {
            return "";
        }
        return offset < pattern.length() ? " '" + pattern.charAt(offset) + "'" : "";
    }

    private static String truncate(String s) {
        return s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
