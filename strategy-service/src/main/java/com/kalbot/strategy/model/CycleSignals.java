package com.kalbot.strategy.model;

/**
 * Votes visible to the evaluators in one cycle. {@code latchedMomentum} is the first short-window
 * vote seen for the current ticker after its rollover and never changes afterwards.
 */
public record CycleSignals(
        Signal previous,
        Signal shortMomentum,
        Signal longMomentum,
        Signal latchedMomentum
) {
    public static CycleSignals none() {
        return new CycleSignals(
                Signal.none(SignalKind.PREVIOUS),
                Signal.none(SignalKind.MOMENTUM_SHORT),
                Signal.none(SignalKind.MOMENTUM_LONG),
                Signal.none(SignalKind.MOMENTUM_SHORT)
        );
    }
}
