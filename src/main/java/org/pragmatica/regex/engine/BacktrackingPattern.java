package org.pragmatica.regex.engine;

import org.pragmatica.regex.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pattern implementation driving a {@link NodeMatcher} over the compiled AST.
 */
public final class BacktrackingPattern implements Pattern {

    private final String pattern;
    private final Node root;
    private final MatchConfig config;
    private final NodeMatcher matcher;

    private BacktrackingPattern(String pattern, Node root, MatchConfig config) {
        this.pattern = pattern;
        this.root = root;
        this.config = config;
        this.matcher = NodeMatcher.create(config.listener());
    }

    public static BacktrackingPattern create(String pattern, Node root, MatchConfig config) {
        return new BacktrackingPattern(Objects.requireNonNull(pattern, "pattern"),
                                       Objects.requireNonNull(root, "root"),
                                       Objects.requireNonNull(config, "config"));
    }

    @Override
    public String pattern() {
        return pattern;
    }

    @Override
    public Node root() {
        return root;
    }

    @Override
    public MatchConfig config() {
        return config;
    }

    @Override
    public boolean match(String text) {
        Objects.requireNonNull(text, "text");
        var length = text.length();
        // A full match may hide behind earlier, shorter candidates
        return matcher.produce(root, text, 0, end -> end == length);
    }

    @Override
    public Optional<MatchRange> search(String text) {
        Objects.requireNonNull(text, "text");
        for (int start = 0; start <= text.length(); start++) {
            var end = matcher.firstCandidate(root, text, start);
            if (end >= 0) {
                return Optional.of(MatchRange.of(start, end));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<MatchRange> findAll(String text) {
        Objects.requireNonNull(text, "text");
        var matches = new ArrayList<MatchRange>();
        var pos = 0;

        while (pos <= text.length()) {
            var end = matcher.firstCandidate(root, text, pos);
            if (end >= 0) {
                matches.add(MatchRange.of(pos, end));
                // Empty matches still have to move the scan forward
                pos = Math.max(pos + 1, end);
            } else {
                pos++;
            }
        }
        return matches;
    }

    @Override
    public Pattern withListener(MatchListener listener) {
        return new BacktrackingPattern(pattern, root, config.withListener(listener));
    }

    @Override
    public String toString() {
        return "Pattern[" + pattern + "]";
    }
}
