package com.kalbot.strategy.service;

import com.kalbot.strategy.model.RiskSnapshot;
import com.kalbot.strategy.model.SettledTrade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Handle on the state shared by CONSENSUS and CONSENSUS_2: the bankroll ledger, the rolling window
 * and the sizing fractions. Passed explicitly to the consensus evaluators.
 */
public class ConsensusRiskBook {

    private final BankrollLedger ledger;
    private final RollingPerformanceTracker tracker;
    private final double riskPct;
    private final double maxRiskPct;
    private final BigDecimal feePct;

    public ConsensusRiskBook(BankrollLedger ledger, RollingPerformanceTracker tracker,
                             double riskPct, double maxRiskPct, double feePct) {
        this.ledger = ledger;
        this.tracker = tracker;
        this.riskPct = riskPct;
        this.maxRiskPct = maxRiskPct;
        this.feePct = BigDecimal.valueOf(feePct);
    }

    public BankrollLedger ledger() {
        return ledger;
    }

    public RollingPerformanceTracker tracker() {
        return tracker;
    }

    public double riskPct() {
        return riskPct;
    }

    public double maxRiskPct() {
        return maxRiskPct;
    }

    public BigDecimal feePct() {
        return feePct;
    }

    public BigDecimal currentBankroll() {
        return ledger.currentBankroll();
    }

    /**
     * Gate state read by every consensus evaluator of one cycle.
     */
    public RiskSnapshot snapshot(Instant asOf) {
        return new RiskSnapshot(
                ledger.currentBankroll(),
                ledger.riskUnit(),
                ledger.dailyLoss(asOf),
                ledger.dailyCap(),
                ledger.weeklyLoss(asOf),
                ledger.weeklyCap(),
                ledger.dailyCapBreached(asOf),
                ledger.weeklyCapBreached(asOf),
                tracker.metrics()
        );
    }

    public void recordSettlement(SettledTrade trade) {
        recordSettlement(trade.netProfit(), trade.settledAt());
    }

    public void recordSettlement(BigDecimal netProfit, Instant settledAt) {
        ledger.recordSettlement(netProfit, settledAt);
        tracker.record(netProfit.signum() > 0, netProfit);
    }
}
