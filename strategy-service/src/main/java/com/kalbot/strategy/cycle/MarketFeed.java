package com.kalbot.strategy.cycle;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.PriceSample;

import java.util.Optional;

/**
 * Market data consumed by the trading cycle. Implementations may throw on I/O failure.
 */
public interface MarketFeed {

    /**
     * Current market of the series, empty when no open market is listed.
     */
    Optional<MarketSnapshot> getMarketSnapshot(String tickerPrefix);

    PriceSample getPriceSample(String asset);

    /**
     * Settled side of a market, empty while pending.
     */
    Optional<Side> getSettlementFact(String ticker);
}
