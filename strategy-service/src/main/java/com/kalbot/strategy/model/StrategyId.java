package com.kalbot.strategy.model;

import java.util.Optional;

/**
 * Strategy identifiers. The enum name is the journal label.
 */
public enum StrategyId {
    PREVIOUS,
    MOMENTUM,
    MOMENTUM_15,
    CONSENSUS,
    PREVIOUS_2,
    CONSENSUS_2,
    ARBITRAGE,
    ARBITRAGE_HEDGE;

    public String journalLabel() {
        return name();
    }

    /**
     * CONSENSUS and CONSENSUS_2 share the bankroll ledger, loss caps and rolling window.
     */
    public boolean consensusFamily() {
        return this == CONSENSUS || this == CONSENSUS_2;
    }

    /**
     * Statistics bucket; the hedge leg is reported together with its first leg.
     */
    public StrategyId statsGroup() {
        return this == ARBITRAGE_HEDGE ? ARBITRAGE : this;
    }

    public static Optional<StrategyId> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(StrategyId.valueOf(label.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
