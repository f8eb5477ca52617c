package com.kalbot.strategy.cycle;

import com.kalbot.domain.Side;
import com.kalbot.strategy.evaluator.EntryDecision;
import com.kalbot.strategy.evaluator.EvaluationContext;
import com.kalbot.strategy.evaluator.StrategyEvaluator;
import com.kalbot.strategy.model.CycleSignals;
import com.kalbot.strategy.model.CycleStats;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.PriceSample;
import com.kalbot.strategy.model.RiskSnapshot;
import com.kalbot.strategy.model.SettledTrade;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.SettlementEngine;
import com.kalbot.strategy.service.StrategyScoreboard;
import com.kalbot.strategy.service.TradeStateStore;
import com.kalbot.strategy.signal.SignalSources;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One poll cycle: fetch inputs, evaluate entries in catalog order, then settle.
 *
 * <p>All I/O happens in the fetch phase; a fetch failure raises {@link CycleFetchException} before
 * any state is touched. A ticker whose settlement lookup keeps failing stops failing the cycle after
 * {@code settlementLookupFailureLimit} attempts in a row and stays pending until a lookup succeeds.
 *
 * <p>Entries are sized against the risk snapshot taken at the start of the cycle, and settlements of
 * the same cycle only reach the ledger afterwards. Cycles never overlap.
 */
@Slf4j
public class TradingCycleEngine {

    private final MarketFeed feed;
    private final List<TradeEventSink> sinks;
    private final List<StrategyEvaluator> evaluators;
    private final SignalSources signals;
    private final TradeStateStore store;
    private final ConsensusRiskBook riskBook;
    private final SettlementEngine settlement;
    private final StrategyScoreboard scoreboard;
    private final String seriesTicker;
    private final String asset;
    private final int settlementLookupFailureLimit;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleStats> lastCycle = new AtomicReference<>();
    private final AtomicReference<RiskSnapshot> lastRisk = new AtomicReference<>();
    private final Map<String, Integer> lookupFailures = new HashMap<>();

    private String currentTicker;

    public TradingCycleEngine(MarketFeed feed,
                              List<TradeEventSink> sinks,
                              List<StrategyEvaluator> evaluators,
                              SignalSources signals,
                              TradeStateStore store,
                              ConsensusRiskBook riskBook,
                              SettlementEngine settlement,
                              StrategyScoreboard scoreboard,
                              String seriesTicker,
                              String asset,
                              int settlementLookupFailureLimit,
                              Clock clock) {
        this.feed = feed;
        this.sinks = List.copyOf(sinks);
        this.evaluators = List.copyOf(evaluators);
        this.signals = signals;
        this.store = store;
        this.riskBook = riskBook;
        this.settlement = settlement;
        this.scoreboard = scoreboard;
        this.seriesTicker = seriesTicker;
        this.asset = asset;
        this.settlementLookupFailureLimit = Math.max(1, settlementLookupFailureLimit);
        this.clock = clock;
    }

    /**
     * Runs one full cycle.
     *
     * @throws CycleFetchException if inputs could not be fetched; no state was changed
     * @throws IllegalStateException if another cycle is still running
     */
    public CycleStats runCycle() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Trading cycle already in progress");
        }
        try {
            CycleInput input = fetch();
            RiskSnapshot risk = riskBook.snapshot(input.now());
            lastRisk.set(risk);

            List<Position> opened = enterPhase(input, risk);
            publishOpened(opened);

            List<SettledTrade> settled = settlePhase(input);
            publishSettled(settled);

            CycleStats stats = stats(input, opened, settled);
            lastCycle.set(stats);
            publishStats(stats);
            return stats;
        } finally {
            running.set(false);
        }
    }

    private CycleInput fetch() {
        Instant now = clock.instant();
        try {
            MarketSnapshot snapshot = feed.getMarketSnapshot(seriesTicker).orElse(null);
            PriceSample price = feed.getPriceSample(asset);
            Map<String, Side> facts = new LinkedHashMap<>();
            Set<String> openTickers = store.openTickers();
            lookupFailures.keySet().retainAll(openTickers);
            for (String ticker : openTickers) {
                if (snapshot != null && ticker.equals(snapshot.ticker())) {
                    continue;
                }
                settlementFact(ticker).ifPresent(side -> facts.put(ticker, side));
            }
            return new CycleInput(now, snapshot, price, facts);
        } catch (RuntimeException e) {
            throw new CycleFetchException("Failed fetching cycle inputs series=%s".formatted(seriesTicker), e);
        }
    }

    private Optional<Side> settlementFact(String ticker) {
        try {
            Optional<Side> fact = feed.getSettlementFact(ticker);
            lookupFailures.remove(ticker);
            return fact;
        } catch (RuntimeException e) {
            int failures = lookupFailures.merge(ticker, 1, Integer::sum);
            if (failures < settlementLookupFailureLimit) {
                throw e;
            }
            log.warn("Settlement lookup for {} failed {} times in a row, leaving it pending: {}", ticker, failures, e.toString());
            return Optional.empty();
        }
    }

    private List<Position> enterPhase(CycleInput input, RiskSnapshot risk) {
        if (input.price() != null) {
            signals.recordPrice(input.price());
        }
        MarketSnapshot snapshot = input.snapshot();
        if (snapshot == null) {
            log.debug("No open {} market", seriesTicker);
            return List.of();
        }
        rollover(snapshot);

        CycleSignals cycleSignals = signals.refresh(snapshot, input.now());
        EvaluationContext context = new EvaluationContext(snapshot, cycleSignals, riskBook, risk, store, input.now());
        String ticker = snapshot.ticker();

        List<Position> opened = new ArrayList<>();
        for (StrategyEvaluator evaluator : evaluators) {
            StrategyId strategy = evaluator.strategy();
            if (store.blocked(strategy, ticker)) {
                continue;
            }
            EntryDecision decision = evaluate(evaluator, context);
            switch (decision.action()) {
                case ENTER -> {
                    Position position = decision.position();
                    store.open(position);
                    scoreboard.recordOpened(strategy, position.stake());
                    opened.add(position);
                    log.info("[{}] BUY {} {} {} contracts @ ${} stake=${} ({})",
                            strategy, ticker, position.side().label(), position.contracts().toPlainString(),
                            position.price().toPlainString(), position.stake().toPlainString(), position.note());
                }
                case CONSUME -> {
                    store.consume(strategy, ticker);
                    log.info("[{}] Skip {} - {}", strategy, ticker, decision.reason());
                }
                case WAIT -> log.debug("[{}] Waiting on {} - {}", strategy, ticker, decision.reason());
            }
        }
        return opened;
    }

    private EntryDecision evaluate(StrategyEvaluator evaluator, EvaluationContext context) {
        try {
            return evaluator.evaluate(context);
        } catch (RuntimeException e) {
            log.error("[{}] evaluation failed on {}", evaluator.strategy(), context.ticker(), e);
            return EntryDecision.waitFor("evaluation error");
        }
    }

    private void rollover(MarketSnapshot snapshot) {
        if (currentTicker != null && !currentTicker.equals(snapshot.ticker())) {
            store.closeMarket(currentTicker);
            log.info("Market rolled over {} -> {}", currentTicker, snapshot.ticker());
        }
        if (snapshot.rolloverOccurred()) {
            store.closeMarket(snapshot.rolloverPreviousTicker());
        }
        currentTicker = snapshot.ticker();
    }

    private List<SettledTrade> settlePhase(CycleInput input) {
        List<SettledTrade> settled = settlement.settleAll(input.settlementFacts(), input.now());
        for (SettledTrade trade : settled) {
            scoreboard.recordSettled(trade.strategy(), trade.netProfit());
            log.info("[{}] SETTLED {}: {} ${}", trade.strategy(), trade.ticker(), trade.outcome(), trade.netProfit().toPlainString());
        }
        return settled;
    }

    private CycleStats stats(CycleInput input, List<Position> opened, List<SettledTrade> settled) {
        MarketSnapshot snapshot = input.snapshot();
        return new CycleStats(
                input.now(),
                snapshot == null ? null : snapshot.ticker(),
                snapshot == null ? 0L : snapshot.secondsToClose(),
                snapshot == null ? BigDecimal.ZERO : snapshot.yesAsk(),
                snapshot == null ? BigDecimal.ZERO : snapshot.noAsk(),
                input.price() == null ? null : input.price().price(),
                List.copyOf(opened),
                List.copyOf(settled),
                store.openCount(),
                riskBook.currentBankroll(),
                scoreboard.snapshot()
        );
    }

    private void publishOpened(List<Position> opened) {
        for (Position position : opened) {
            for (TradeEventSink sink : sinks) {
                try {
                    sink.onTradeOpened(position);
                } catch (Exception e) {
                    log.warn("Trade sink {} failed on open {} {}: {}", sink.getClass().getSimpleName(),
                            position.strategy(), position.ticker(), e.getMessage());
                }
            }
        }
    }

    private void publishSettled(List<SettledTrade> settled) {
        for (SettledTrade trade : settled) {
            for (TradeEventSink sink : sinks) {
                try {
                    sink.onTradeSettled(trade);
                } catch (Exception e) {
                    log.warn("Trade sink {} failed on settlement {} {}: {}", sink.getClass().getSimpleName(),
                            trade.strategy(), trade.ticker(), e.getMessage());
                }
            }
        }
    }

    private void publishStats(CycleStats stats) {
        for (TradeEventSink sink : sinks) {
            try {
                sink.onCycleStats(stats);
            } catch (Exception e) {
                log.warn("Trade sink {} failed on cycle stats: {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<CycleStats> lastCycle() {
        return Optional.ofNullable(lastCycle.get());
    }

    public Optional<RiskSnapshot> lastRisk() {
        return Optional.ofNullable(lastRisk.get());
    }

    public StrategyScoreboard scoreboard() {
        return scoreboard;
    }

    public String seriesTicker() {
        return seriesTicker;
    }
}
