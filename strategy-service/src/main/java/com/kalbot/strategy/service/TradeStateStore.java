package com.kalbot.strategy.service;

import com.kalbot.strategy.model.ArbitragePosition;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.model.TradeKey;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Existence records, open positions and arbitrage leg state.
 *
 * <p>An existence record is kept for every (strategy, ticker) that entered or consumed its slot and
 * is never removed, so each strategy trades a ticker at most once. Closed tickers block every
 * strategy.
 */
public class TradeStateStore {

    private final Set<TradeKey> existence = new LinkedHashSet<>();
    private final Map<TradeKey, Position> open = new LinkedHashMap<>();
    private final Map<String, ArbitragePosition> arbitrage = new HashMap<>();
    private final Set<String> closedTickers = new HashSet<>();

    public boolean hasEntry(StrategyId strategy, String ticker) {
        return existence.contains(new TradeKey(strategy, ticker));
    }

    public boolean isClosed(String ticker) {
        return closedTickers.contains(ticker);
    }

    /**
     * Shared pre-gate of every evaluator.
     */
    public boolean blocked(StrategyId strategy, String ticker) {
        return isClosed(ticker) || hasEntry(strategy, ticker);
    }

    /**
     * Records an entry. Opening the first arbitrage leg starts its hedge state; opening the hedge
     * marks it hedged.
     */
    public void open(Position position) {
        TradeKey key = position.key();
        if (existence.contains(key)) {
            throw new IllegalStateException("Duplicate entry for %s %s".formatted(key.strategy(), key.ticker()));
        }
        existence.add(key);
        open.put(key, position);
        if (position.strategy() == StrategyId.ARBITRAGE) {
            arbitrage.put(position.ticker(), new ArbitragePosition(
                    position.ticker(), position.side(), position.price(), position.contracts(), false));
        } else if (position.strategy() == StrategyId.ARBITRAGE_HEDGE) {
            arbitrage.computeIfPresent(position.ticker(), (t, leg) -> leg.markHedged());
        }
    }

    /**
     * Uses up a strategy's slot for a ticker without opening a position.
     */
    public void consume(StrategyId strategy, String ticker) {
        existence.add(new TradeKey(strategy, ticker));
    }

    /**
     * Marks a market as closed; no strategy may enter it afterwards.
     */
    public void closeMarket(String ticker) {
        if (ticker == null || ticker.isBlank()) return;
        if (closedTickers.add(ticker)) {
            arbitrage.remove(ticker);
        }
    }

    public Optional<ArbitragePosition> arbitrage(String ticker) {
        return Optional.ofNullable(arbitrage.get(ticker));
    }

    public Optional<Position> removeOpen(TradeKey key) {
        return Optional.ofNullable(open.remove(key));
    }

    public List<Position> openPositions() {
        return new ArrayList<>(open.values());
    }

    public int openCount() {
        return open.size();
    }

    public Set<String> openTickers() {
        Set<String> tickers = new LinkedHashSet<>();
        for (TradeKey key : open.keySet()) {
            tickers.add(key.ticker());
        }
        return tickers;
    }

    public BigDecimal openStake() {
        BigDecimal sum = BigDecimal.ZERO;
        for (Position p : open.values()) {
            sum = sum.add(p.stake());
        }
        return sum;
    }

    public int existenceCount() {
        return existence.size();
    }
}
