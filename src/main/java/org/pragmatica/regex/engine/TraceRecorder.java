package org.pragmatica.regex.engine;

import org.pragmatica.regex.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that records every matching event as a line of text.
 *
 * <p>Events read {@code ENTER Star pos=0}, {@code MATCH Literal 0->1} and {@code EXIT Star pos=0}.
 * Each one is also logged at TRACE level.
 *
 * <p>Not thread-safe: use one recorder per matching thread.
 */
public final class TraceRecorder implements MatchListener {
    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private final List<String> events = new ArrayList<>();

    private TraceRecorder() {}

    public static TraceRecorder create() {
        return new TraceRecorder();
    }

    @Override
    public void enter(Node node, int pos) {
        record("ENTER " + node.kind().label() + " pos=" + pos);
    }

    @Override
    public void candidate(Node node, int pos, int end) {
        record("MATCH " + node.kind().label() + " " + pos + "->" + end);
    }

    @Override
    public void exit(Node node, int pos) {
        record("EXIT " + node.kind().label() + " pos=" + pos);
    }

    /**
     * Snapshot of recorded events, oldest first.
     */
    public List<String> events() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }

    private void record(String event) {
        events.add(event);
        log.trace("{}", event);
    }
}
