package com.kalbot.strategy.evaluator;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.RiskSnapshot;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.model.Vote;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.PositionSizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Bankroll-sized entry when the previous result and the latched short momentum agree:
 * CONSENSUS and CONSENSUS_2.
 *
 * <p>A one-shot evaluator decides on the first cycle both votes exist and consumes its slot on any
 * failed gate. A waiting evaluator retries failed price, risk and size gates every cycle. Both
 * consume the slot when the votes disagree. An invalid ask is always retried.
 */
public class ConsensusEvaluator implements StrategyEvaluator {

    private final StrategyId strategy;
    private final BigDecimal priceCeiling;
    private final boolean oneShot;

    public ConsensusEvaluator(StrategyId strategy, BigDecimal priceCeiling, boolean oneShot) {
        this.strategy = strategy;
        this.priceCeiling = priceCeiling;
        this.oneShot = oneShot;
    }

    @Override
    public StrategyId strategy() {
        return strategy;
    }

    public boolean oneShot() {
        return oneShot;
    }

    @Override
    public EntryDecision evaluate(EvaluationContext context) {
        Vote previous = context.signals().previous().vote();
        Vote momentum = context.signals().latchedMomentum().vote();
        if (!previous.present() || !momentum.present()) {
            return EntryDecision.waitFor("waiting for signals (PREV=%s MOM=%s)".formatted(previous.label(), momentum.label()));
        }
        if (previous != momentum) {
            return EntryDecision.consume("signals disagree (PREV=%s MOM=%s)".formatted(previous.label(), momentum.label()));
        }

        Side side = previous.side().orElseThrow();
        MarketSnapshot snapshot = context.snapshot();
        BigDecimal price = snapshot.askFor(side);
        if (price.signum() <= 0) {
            return EntryDecision.waitFor("invalid ask %s".formatted(price.toPlainString()));
        }
        if (price.compareTo(priceCeiling) > 0) {
            return unmet("ask %s above %s".formatted(price.toPlainString(), priceCeiling.toPlainString()));
        }

        RiskSnapshot risk = context.risk();
        Optional<String> blocked = risk.blockReason();
        if (blocked.isPresent()) {
            return unmet(blocked.get());
        }

        ConsensusRiskBook book = context.riskBook();
        long contracts = PositionSizer.bankrollContracts(risk.bankroll(), book.riskPct(), book.maxRiskPct(), price);
        if (contracts < 1) {
            return unmet("bankroll %s too small for ask %s".formatted(risk.bankroll().toPlainString(), price.toPlainString()));
        }

        BigDecimal stake = price.multiply(BigDecimal.valueOf(contracts)).setScale(4, RoundingMode.HALF_UP);
        BigDecimal fee = stake.multiply(book.feePct()).setScale(4, RoundingMode.HALF_UP);
        return EntryDecision.enter(new Position(
                strategy,
                snapshot.ticker(),
                side,
                stake,
                price,
                BigDecimal.valueOf(contracts),
                fee,
                context.now(),
                null,
                "PREV=%s MOM=%s".formatted(previous.label(), momentum.label())
        ));
    }

    private EntryDecision unmet(String reason) {
        return oneShot ? EntryDecision.consume(reason) : EntryDecision.waitFor(reason);
    }
}
