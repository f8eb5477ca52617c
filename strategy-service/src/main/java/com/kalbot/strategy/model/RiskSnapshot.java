package com.kalbot.strategy.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Consensus-family gate state frozen at the start of a cycle.
 */
public record RiskSnapshot(
        BigDecimal bankroll,
        BigDecimal riskUnit,
        BigDecimal dailyLoss,
        BigDecimal dailyCap,
        BigDecimal weeklyLoss,
        BigDecimal weeklyCap,
        boolean dailyCapBreached,
        boolean weeklyCapBreached,
        RollingMetrics rolling
) {
    public boolean bankrollDepleted() {
        return bankroll.signum() <= 0;
    }

    /**
     * First failing risk gate, or empty when consensus entries may be sized.
     */
    public Optional<String> blockReason() {
        if (bankrollDepleted()) {
            return Optional.of("bankroll depleted (%s)".formatted(bankroll.toPlainString()));
        }
        if (dailyCapBreached) {
            return Optional.of("daily loss cap hit (%s >= %s)".formatted(dailyLoss.toPlainString(), dailyCap.toPlainString()));
        }
        if (weeklyCapBreached) {
            return Optional.of("weekly loss cap hit (%s >= %s)".formatted(weeklyLoss.toPlainString(), weeklyCap.toPlainString()));
        }
        if (!rolling.gatePasses()) {
            return Optional.of("rolling win rate below break-even (%.1f%% < %.1f%%)".formatted(
                    rolling.winRate() * 100, rolling.breakEvenWinRate() * 100));
        }
        return Optional.empty();
    }
}
