package com.kalbot.strategy.cycle;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.PriceSample;

import java.time.Instant;
import java.util.Map;

/**
 * Everything one cycle reads from the outside world, fetched before any state changes.
 * {@code snapshot} is null when the series has no open market.
 */
record CycleInput(
        Instant now,
        MarketSnapshot snapshot,
        PriceSample price,
        Map<String, Side> settlementFacts
) {
}
