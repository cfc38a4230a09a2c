package org.pragmatica.regex.engine;

/**
 * Receives candidate end positions in the order a node offers them.
 */
@FunctionalInterface
public interface EndPositionSink {

    /**
     * Accept one candidate end position.
     *
     * @return {@code true} to stop the enumeration, {@code false} to ask for the next candidate
     */
    boolean accept(int end);
}
