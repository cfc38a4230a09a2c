package org.pragmatica.regex.ast;

/**
 * Type tag for each {@link Node} variant.
 */
public enum NodeKind {
    LITERAL("Literal"),
    DOT("Dot"),
    CHAR_CLASS("CharClass"),
    START("Start"),
    END("End"),
    SEQUENCE("Sequence"),
    ALTERNATION("Alternation"),
    STAR("Star"),
    PLUS("Plus"),
    QUESTION("Question"),
    LAZY_STAR("LazyStar"),
    LAZY_PLUS("LazyPlus"),
    LAZY_QUESTION("LazyQuestion"),
    NON_CAPTURE_GROUP("NonCaptureGroup"),
    LOOKAHEAD("Lookahead"),
    LOOKBEHIND("Lookbehind");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Human-readable name used in traces and rendered trees.
     */
    public String label() {
        return label;
    }
}
