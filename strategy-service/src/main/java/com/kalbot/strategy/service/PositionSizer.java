package com.kalbot.strategy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Contract sizing for fixed-stake, bankroll-relative and hedge entries.
 */
public final class PositionSizer {

    public static final int FRACTIONAL_SCALE = 6;
    private static final BigDecimal HEDGE_EPSILON = new BigDecimal("0.0001");

    private PositionSizer() {
    }

    /**
     * {@code stake / price}, fractional. Zero when the price is not positive.
     */
    public static BigDecimal fixedStakeContracts(BigDecimal stake, BigDecimal price) {
        if (stake == null || price == null || price.signum() <= 0 || stake.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return stake.divide(price, FRACTIONAL_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code floor(min(targetRisk, maxRisk) * bankroll / price)}; zero for a depleted bankroll or
     * a non-positive price.
     */
    public static long bankrollContracts(BigDecimal bankroll, double targetRisk, double maxRisk, BigDecimal price) {
        if (bankroll == null || price == null || bankroll.signum() <= 0 || price.signum() <= 0) {
            return 0L;
        }
        BigDecimal fraction = BigDecimal.valueOf(Math.min(targetRisk, maxRisk));
        if (fraction.signum() <= 0) {
            return 0L;
        }
        return fraction.multiply(bankroll).divide(price, 0, RoundingMode.FLOOR).longValueExact();
    }

    /**
     * Hedge size: no more whole contracts than the first leg and a notional strictly below
     * {@code maxBet}.
     */
    public static long hedgeContracts(BigDecimal firstContracts, BigDecimal maxBet, BigDecimal oppositeAsk) {
        if (firstContracts == null || maxBet == null || oppositeAsk == null || oppositeAsk.signum() <= 0) {
            return 0L;
        }
        BigDecimal budget = maxBet.subtract(HEDGE_EPSILON);
        if (budget.signum() <= 0) {
            return 0L;
        }
        long byBet = budget.divide(oppositeAsk, 0, RoundingMode.FLOOR).longValueExact();
        long byFirstLeg = firstContracts.setScale(0, RoundingMode.FLOOR).longValueExact();
        return Math.max(0L, Math.min(byFirstLeg, byBet));
    }
}
