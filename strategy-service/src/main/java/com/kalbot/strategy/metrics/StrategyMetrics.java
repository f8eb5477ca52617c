package com.kalbot.strategy.metrics;

import com.kalbot.strategy.cycle.TradeEventSink;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.SettledTrade;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.TradeStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer view of the engine: trade counters per strategy, cycle results, bankroll and open
 * position gauges.
 */
public class StrategyMetrics implements TradeEventSink {

    private final MeterRegistry meterRegistry;

    public StrategyMetrics(MeterRegistry meterRegistry, ConsensusRiskBook riskBook, TradeStateStore store) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("kalbot.consensus.bankroll", riskBook, book -> book.currentBankroll().doubleValue())
                .description("Consensus-family bankroll in USD")
                .register(meterRegistry);

        Gauge.builder("kalbot.positions.open", store, TradeStateStore::openCount)
                .description("Open simulated positions")
                .register(meterRegistry);
    }

    @Override
    public void onTradeOpened(Position position) {
        Counter.builder("kalbot.trades.opened")
                .description("Simulated entries")
                .tag("strategy", position.strategy().journalLabel())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onTradeSettled(SettledTrade trade) {
        Counter.builder("kalbot.trades.settled")
                .description("Settled simulated trades")
                .tag("strategy", trade.strategy().journalLabel())
                .tag("outcome", trade.outcome().name())
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param result {@code ok}, {@code fetch_failed} or {@code error}
     */
    public void recordCycle(String result) {
        Counter.builder("kalbot.cycles")
                .description("Trading cycles by result")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
