package org.pragmatica.regex.engine;

import org.pragmatica.regex.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * A compiled pattern - runs its AST against input text.
 *
 * <p>Instances are immutable; one pattern can serve any number of match calls.
 * Matching never fails: absence of a match is reported through the return value.
 */
public interface Pattern {

    /**
     * Source text this pattern was compiled from.
     */
    String pattern();

    /**
     * Root of the compiled AST.
     */
    Node root();

    MatchConfig config();

    /**
     * Check whether the whole text matches the pattern.
     */
    boolean match(String text);

    /**
     * Find the leftmost occurrence. The end is the first candidate the pattern offers at that
     * start, which is not necessarily the longest one.
     */
    Optional<MatchRange> search(String text);

    /**
     * Find all non-overlapping occurrences, ordered by start.
     */
    List<MatchRange> findAll(String text);

    /**
     * Same pattern reporting its matching steps to the given listener.
     */
    Pattern withListener(MatchListener listener);
}
