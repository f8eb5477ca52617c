package com.kalbot.strategy.cycle;

import com.kalbot.strategy.model.CycleStats;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.SettledTrade;

/**
 * Receives engine output. Failures are logged by the engine and never undo engine state.
 */
public interface TradeEventSink {

    default void onTradeOpened(Position position) {
    }

    default void onTradeSettled(SettledTrade trade) {
    }

    default void onCycleStats(CycleStats stats) {
    }
}
