package com.kalbot.strategy.model;

public enum SignalKind {
    PREVIOUS,
    MOMENTUM_SHORT,
    MOMENTUM_LONG
}
