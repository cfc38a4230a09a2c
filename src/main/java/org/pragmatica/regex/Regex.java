package org.pragmatica.regex;

import org.pragmatica.regex.ast.NodeDescriptor;
import org.pragmatica.regex.engine.BacktrackingPattern;
import org.pragmatica.regex.engine.MatchConfig;
import org.pragmatica.regex.engine.MatchListener;
import org.pragmatica.regex.engine.Pattern;
import org.pragmatica.regex.error.PatternSyntaxException;
import org.pragmatica.regex.parser.PatternParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for compiling patterns.
 *
 * <p>Example usage:
 * <pre>{@code
 * var pattern = Regex.compile("a+b");
 *
 * pattern.match("aaab");          // true
 * pattern.search("xaaabyz");      // Optional[(1, 5)]
 * }</pre>
 *
 * <p>Supported syntax: literals, {@code .}, {@code [...]} and {@code [^...]} classes,
 * {@code ^} and {@code $}, {@code * + ?} and their lazy forms, {@code |}, {@code (...)},
 * {@code (?:...)}, {@code (?=...)}, {@code (?!...)}, {@code (?<=...)} and {@code (?<!...)}.
 * A backslash always makes the next character literal.
 */
public final class Regex {
    private static final Logger log = LoggerFactory.getLogger(Regex.class);

    private Regex() {}

    /**
     * Compile a pattern with default configuration.
     *
     * @throws PatternSyntaxException if the pattern is malformed
     */
    public static Pattern compile(String pattern) {
        return compile(pattern, MatchConfig.DEFAULT);
    }

    /**
     * Compile a pattern with custom configuration.
     *
     * @throws PatternSyntaxException if the pattern is malformed
     */
    public static Pattern compile(String pattern, MatchConfig config) {
        try {
            var root = PatternParser.parse(pattern);
            if (log.isDebugEnabled()) {
                log.debug("Compiled pattern '{}' into {} nodes, traced: {}",
                          pattern, NodeDescriptor.describe(root).size(), config.isTraced());
            }
            return BacktrackingPattern.create(pattern, root, config);
        } catch (PatternSyntaxException e) {
            log.debug("Rejected pattern: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Create a builder for more complex pattern configuration.
     */
    public static Builder builder(String pattern) {
        return new Builder(pattern);
    }

    public static final class Builder {
        private final String pattern;
        private MatchListener listener = MatchListener.NONE;

        private Builder(String pattern) {
            this.pattern = pattern;
        }

        public Builder listener(MatchListener listener) {
            this.listener = listener;
            return this;
        }

        public Pattern build() {
            return compile(pattern, new MatchConfig(listener));
        }
    }
}
