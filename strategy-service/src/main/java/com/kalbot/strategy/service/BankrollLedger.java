package com.kalbot.strategy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;

/**
 * Consensus-family bankroll and realized-loss budgets.
 *
 * <p>{@code bankroll = baseCapital + realizedNet}; only {@link #recordSettlement} mutates it.
 * Losses accumulate per UTC day and per ISO week; an accumulator whose key differs from the
 * checked instant counts as zero.
 */
public class BankrollLedger {

    private final BigDecimal baseCapital;
    private final BigDecimal riskFraction;
    private final BigDecimal dailyCapMultiple;
    private final BigDecimal weeklyCapMultiple;

    private BigDecimal realizedNet = BigDecimal.ZERO;

    private LocalDate dayKey;
    private BigDecimal dailyLoss = BigDecimal.ZERO;
    private WeekKey weekKey;
    private BigDecimal weeklyLoss = BigDecimal.ZERO;

    public BankrollLedger(BigDecimal baseCapital, double riskFraction, double dailyCapMultiple, double weeklyCapMultiple) {
        this.baseCapital = baseCapital == null ? BigDecimal.ZERO : baseCapital;
        this.riskFraction = BigDecimal.valueOf(riskFraction);
        this.dailyCapMultiple = BigDecimal.valueOf(dailyCapMultiple);
        this.weeklyCapMultiple = BigDecimal.valueOf(weeklyCapMultiple);
    }

    public BigDecimal baseCapital() {
        return baseCapital;
    }

    public BigDecimal realizedNet() {
        return realizedNet;
    }

    public BigDecimal currentBankroll() {
        return baseCapital.add(realizedNet);
    }

    public void recordSettlement(BigDecimal netProfit, Instant timestamp) {
        if (netProfit == null || timestamp == null) {
            throw new IllegalArgumentException("netProfit and timestamp are required");
        }
        realizedNet = realizedNet.add(netProfit);

        LocalDate day = dayOf(timestamp);
        if (!day.equals(dayKey)) {
            dayKey = day;
            dailyLoss = BigDecimal.ZERO;
        }
        WeekKey week = WeekKey.of(day);
        if (!week.equals(weekKey)) {
            weekKey = week;
            weeklyLoss = BigDecimal.ZERO;
        }
        if (netProfit.signum() < 0) {
            dailyLoss = dailyLoss.add(netProfit.abs());
            weeklyLoss = weeklyLoss.add(netProfit.abs());
        }
    }

    /**
     * One unit of risk, recomputed from the current bankroll.
     */
    public BigDecimal riskUnit() {
        return currentBankroll().multiply(riskFraction).setScale(4, RoundingMode.HALF_UP);
    }

    public BigDecimal dailyCap() {
        return dailyCapMultiple.multiply(riskUnit());
    }

    public BigDecimal weeklyCap() {
        return weeklyCapMultiple.multiply(riskUnit());
    }

    public BigDecimal dailyLoss(Instant asOf) {
        return dayOf(asOf).equals(dayKey) ? dailyLoss : BigDecimal.ZERO;
    }

    public BigDecimal weeklyLoss(Instant asOf) {
        return WeekKey.of(dayOf(asOf)).equals(weekKey) ? weeklyLoss : BigDecimal.ZERO;
    }

    public boolean dailyCapBreached(Instant asOf) {
        return dailyLoss(asOf).compareTo(dailyCap()) >= 0;
    }

    public boolean weeklyCapBreached(Instant asOf) {
        return weeklyLoss(asOf).compareTo(weeklyCap()) >= 0;
    }

    /**
     * Gate shared by CONSENSUS and CONSENSUS_2.
     */
    public boolean entriesBlocked(Instant asOf) {
        return currentBankroll().signum() <= 0 || dailyCapBreached(asOf) || weeklyCapBreached(asOf);
    }

    private static LocalDate dayOf(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private record WeekKey(int weekBasedYear, int week) {
        static WeekKey of(LocalDate day) {
            return new WeekKey(day.get(IsoFields.WEEK_BASED_YEAR), day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    }
}
