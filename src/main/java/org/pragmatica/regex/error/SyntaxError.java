package org.pragmatica.regex.error;

/**
 * Reasons a pattern can be rejected by the parser.
 */
public enum SyntaxError {
    UNEXPECTED_END("Unexpected end of pattern"),
    UNEXPECTED_CHARACTER("Unexpected character"),
    UNCLOSED_GROUP("Missing closing parenthesis"),
    UNCLOSED_CHAR_CLASS("Missing closing bracket"),
    UNESCAPED_SPECIAL("Unescaped special character"),
    DANGLING_ESCAPE("Pattern ends with an escape character");

    private final String description;

    SyntaxError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
