package org.pragmatica.regex.engine;

import java.util.Objects;

/**
 * Matching configuration options.
 */
public record MatchConfig(MatchListener listener) {

    public static final MatchConfig DEFAULT = new MatchConfig(MatchListener.NONE);

    public MatchConfig {
        Objects.requireNonNull(listener, "listener");
    }

    public MatchConfig withListener(MatchListener listener) {
        return new MatchConfig(listener);
    }

    public boolean isTraced() {
        return listener != MatchListener.NONE;
    }
}
