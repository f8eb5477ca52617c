package com.kalbot.strategy.model;

import java.math.BigDecimal;

/**
 * A directional vote recomputed every cycle. {@code magnitudePct} is the percent move behind a
 * momentum vote and is null for the previous-result vote.
 */
public record Signal(
        SignalKind kind,
        Vote vote,
        BigDecimal magnitudePct
) {
    public Signal {
        if (vote == null) vote = Vote.NONE;
    }

    public static Signal none(SignalKind kind) {
        return new Signal(kind, Vote.NONE, null);
    }

    public boolean present() {
        return vote.present();
    }
}
