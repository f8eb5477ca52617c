package com.kalbot.strategy.model;

import com.kalbot.domain.Side;

import java.util.Optional;

public enum Vote {
    YES,
    NO,
    NONE;

    public static Vote of(Side side) {
        if (side == null) return NONE;
        return side == Side.YES ? YES : NO;
    }

    public Optional<Side> side() {
        return switch (this) {
            case YES -> Optional.of(Side.YES);
            case NO -> Optional.of(Side.NO);
            case NONE -> Optional.empty();
        };
    }

    public boolean present() {
        return this != NONE;
    }

    public String label() {
        return side().map(Side::label).orElse("none");
    }
}
