package com.kalbot.strategy.service;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.Outcome;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.SettledTrade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settles open positions whose market has a result. Monetary results are rounded to 4 places.
 */
public class SettlementEngine {

    static final int MONEY_SCALE = 4;

    private final TradeStateStore store;
    private final ConsensusRiskBook riskBook;

    public SettlementEngine(TradeStateStore store, ConsensusRiskBook riskBook) {
        this.store = store;
        this.riskBook = riskBook;
    }

    /**
     * Settles every open position whose ticker appears in {@code facts}. A position leaves the open
     * set when settled, so a second call with the same facts settles nothing.
     */
    public List<SettledTrade> settleAll(Map<String, Side> facts, Instant settledAt) {
        List<SettledTrade> settled = new ArrayList<>();
        if (facts == null || facts.isEmpty()) {
            return settled;
        }
        for (Position position : store.openPositions()) {
            Side result = facts.get(position.ticker());
            if (result == null) {
                continue;
            }
            if (store.removeOpen(position.key()).isEmpty()) {
                continue;
            }
            SettledTrade trade = settle(position, result, settledAt);
            if (position.strategy().consensusFamily()) {
                riskBook.recordSettlement(trade);
            }
            settled.add(trade);
        }
        return settled;
    }

    public static SettledTrade settle(Position position, Side settledSide, Instant settledAt) {
        boolean won = position.side() == settledSide;
        BigDecimal payout = money(won ? position.contracts() : BigDecimal.ZERO);
        BigDecimal gross = money(payout.subtract(position.stake()));
        BigDecimal fee = money(position.feeReserved());
        BigDecimal net = money(gross.subtract(fee));
        return new SettledTrade(position, won ? Outcome.WIN : Outcome.LOSS, payout, gross, fee, net, settledSide, settledAt);
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
