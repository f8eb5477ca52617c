package com.kalbot.strategy.model;

public record TradeKey(StrategyId strategy, String ticker) {
}
