package com.kalbot.strategy.model;

public enum Outcome {
    WIN,
    LOSS
}
