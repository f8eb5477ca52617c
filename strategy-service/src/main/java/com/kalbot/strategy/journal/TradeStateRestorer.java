package com.kalbot.strategy.journal;

import com.kalbot.domain.Side;
import com.kalbot.journal.TradeRecord;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.StrategyScoreboard;
import com.kalbot.strategy.service.TradeStateStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Replays journal rows into a fresh engine: existence records, open positions and arbitrage leg
 * state, consensus bankroll and rolling window, and the scoreboard.
 */
@Slf4j
public class TradeStateRestorer {

    private final TradeStateStore store;
    private final ConsensusRiskBook riskBook;
    private final StrategyScoreboard scoreboard;

    public TradeStateRestorer(TradeStateStore store, ConsensusRiskBook riskBook, StrategyScoreboard scoreboard) {
        this.store = store;
        this.riskBook = riskBook;
        this.scoreboard = scoreboard;
    }

    public RestoreResult restore(List<TradeRecord> rows) {
        int open = 0;
        int settled = 0;
        int skipped = 0;
        for (TradeRecord row : rows) {
            Optional<StrategyId> strategy = StrategyId.fromLabel(row.strategy());
            Optional<Side> side = Side.fromLabel(row.buySide());
            Optional<Instant> time = row.parsedTime();
            if (strategy.isEmpty() || side.isEmpty() || time.isEmpty() || row.buyTicker() == null
                    || row.stakeUsd() == null || row.priceUsd() == null || row.contracts() == null) {
                skipped++;
                log.warn("Skipping unreadable journal row strategy={} ticker={}", row.strategy(), row.buyTicker());
                continue;
            }
            StrategyId id = strategy.get();
            if (store.hasEntry(id, row.buyTicker())) {
                skipped++;
                log.warn("Skipping duplicate journal row {} {}", id, row.buyTicker());
                continue;
            }
            scoreboard.recordOpened(id, row.stakeUsd());

            if (row.isSettled()) {
                BigDecimal net = row.profitUsd() == null ? BigDecimal.ZERO : row.profitUsd();
                store.consume(id, row.buyTicker());
                scoreboard.recordSettled(id, net);
                if (id.consensusFamily()) {
                    riskBook.recordSettlement(net, row.parsedSettledTime().orElse(time.get()));
                }
                settled++;
            } else {
                store.open(new Position(
                        id,
                        row.buyTicker(),
                        side.get(),
                        row.stakeUsd(),
                        row.priceUsd(),
                        row.contracts(),
                        reservedFee(id, row.stakeUsd()),
                        time.get(),
                        row.previousTicker(),
                        row.previousResult()
                ));
                open++;
            }
        }
        RestoreResult result = new RestoreResult(open, settled, skipped);
        log.info("Restored journal: {} open, {} settled, {} skipped; consensus bankroll ${}",
                open, settled, skipped, riskBook.currentBankroll().toPlainString());
        return result;
    }

    private BigDecimal reservedFee(StrategyId id, BigDecimal stake) {
        if (!id.consensusFamily()) {
            return BigDecimal.ZERO;
        }
        return stake.multiply(riskBook.feePct()).setScale(4, RoundingMode.HALF_UP);
    }

    public record RestoreResult(int open, int settled, int skipped) {
    }
}
