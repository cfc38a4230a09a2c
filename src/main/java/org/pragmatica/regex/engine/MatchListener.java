package org.pragmatica.regex.engine;

import org.pragmatica.regex.ast.Node;

/**
 * Observes node-level matching without the nodes being aware of it.
 *
 * <p>{@link #exit} is reported only when a node ran out of candidates. When the consumer
 * stops an enumeration early, the node is left without an exit event.
 */
public interface MatchListener {

    MatchListener NONE = new MatchListener() {};

    default void enter(Node node, int pos) {}

    default void candidate(Node node, int pos, int end) {}

    default void exit(Node node, int pos) {}
}
