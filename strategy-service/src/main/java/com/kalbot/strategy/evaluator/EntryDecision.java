package com.kalbot.strategy.evaluator;

import com.kalbot.strategy.model.Position;

/**
 * Result of evaluating one strategy for the current ticker.
 *
 * <ul>
 *   <li>{@code ENTER} opens {@code position};</li>
 *   <li>{@code CONSUME} uses up the slot without a trade;</li>
 *   <li>{@code WAIT} leaves the slot open for the next cycle.</li>
 * </ul>
 */
public record EntryDecision(Action action, Position position, String reason) {

    public enum Action {
        ENTER,
        CONSUME,
        WAIT
    }

    public static EntryDecision enter(Position position) {
        return new EntryDecision(Action.ENTER, position, null);
    }

    public static EntryDecision consume(String reason) {
        return new EntryDecision(Action.CONSUME, null, reason);
    }

    public static EntryDecision waitFor(String reason) {
        return new EntryDecision(Action.WAIT, null, reason);
    }
}
