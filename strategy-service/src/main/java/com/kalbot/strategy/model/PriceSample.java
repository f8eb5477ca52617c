package com.kalbot.strategy.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceSample(Instant time, BigDecimal price) {
}
