package org.pragmatica.regex.engine;

/**
 * A range in the matched text from start (inclusive) to end (exclusive).
 */
public record MatchRange(int start, int end) {

    public MatchRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid match range: " + start + ".." + end);
        }
    }

    public static MatchRange of(int start, int end) {
        return new MatchRange(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public String extract(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
