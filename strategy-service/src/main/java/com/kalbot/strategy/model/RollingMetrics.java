package com.kalbot.strategy.model;

public record RollingMetrics(
        int sampleSize,
        int capacity,
        double winRate,
        double breakEvenWinRate,
        boolean gatePasses
) {
    public boolean full() {
        return sampleSize >= capacity;
    }
}
