package com.kalbot.strategy.service;

import com.kalbot.strategy.model.RollingMetrics;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of the most recent consensus-family outcomes and the break-even gate derived from it.
 */
public class RollingPerformanceTracker {

    private final int capacity;
    private final Deque<Entry> window = new ArrayDeque<>();

    public RollingPerformanceTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public void record(boolean win, BigDecimal netProfit) {
        window.addLast(new Entry(win, netProfit == null ? BigDecimal.ZERO : netProfit));
        while (window.size() > capacity) {
            window.removeFirst();
        }
    }

    public int size() {
        return window.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Inactive until the window is full; then passes when the win rate reaches break-even
     * (a tie passes).
     */
    public boolean gatePasses() {
        return metrics().gatePasses();
    }

    public RollingMetrics metrics() {
        int n = window.size();
        if (n == 0) {
            return new RollingMetrics(0, capacity, 0.0, 0.0, true);
        }
        int wins = 0;
        BigDecimal winSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        for (Entry entry : window) {
            if (entry.win()) {
                wins++;
                winSum = winSum.add(entry.netProfit());
            } else {
                lossSum = lossSum.add(entry.netProfit());
            }
        }
        int losses = n - wins;
        double winRate = (double) wins / n;
        double breakEven = breakEven(wins, winSum, losses, lossSum);
        boolean passes = n < capacity || winRate >= breakEven;
        return new RollingMetrics(n, capacity, winRate, breakEven, passes);
    }

    private static double breakEven(int wins, BigDecimal winSum, int losses, BigDecimal lossSum) {
        if (losses == 0) {
            return 0.0;
        }
        if (wins == 0) {
            return 1.0;
        }
        BigDecimal avgWin = winSum.divide(BigDecimal.valueOf(wins), MathContext.DECIMAL64);
        BigDecimal avgLoss = lossSum.divide(BigDecimal.valueOf(losses), MathContext.DECIMAL64).abs();
        BigDecimal denominator = avgWin.add(avgLoss);
        if (denominator.signum() == 0) {
            return 0.0;
        }
        return avgLoss.divide(denominator, MathContext.DECIMAL64).doubleValue();
    }

    private record Entry(boolean win, BigDecimal netProfit) {
    }
}
