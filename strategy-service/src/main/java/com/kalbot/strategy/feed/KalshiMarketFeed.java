package com.kalbot.strategy.feed;

import com.kalbot.coinbase.CoinbaseSpotPriceClient;
import com.kalbot.domain.Side;
import com.kalbot.kalshi.api.KalshiMarket;
import com.kalbot.kalshi.data.KalshiMarketApiClient;
import com.kalbot.strategy.cycle.MarketFeed;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.PriceSample;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link MarketFeed} over the public Kalshi and Coinbase APIs.
 *
 * <p>Follows the next-expiring open market of the series. When the ticker changes, the old ticker
 * becomes the rollover previous market of the new one and its result is looked up every cycle until
 * it is known.
 */
@Slf4j
public class KalshiMarketFeed implements MarketFeed {

    private final KalshiMarketApiClient kalshi;
    private final CoinbaseSpotPriceClient coinbase;
    private final int marketsLimit;
    private final Clock clock;

    private String currentTicker;
    private String previousTicker;
    private Side previousResult;

    public KalshiMarketFeed(KalshiMarketApiClient kalshi, CoinbaseSpotPriceClient coinbase, int marketsLimit, Clock clock) {
        this.kalshi = kalshi;
        this.coinbase = coinbase;
        this.marketsLimit = marketsLimit;
        this.clock = clock;
    }

    @Override
    public Optional<MarketSnapshot> getMarketSnapshot(String tickerPrefix) {
        Instant now = clock.instant();
        Optional<KalshiMarket> next = kalshi.findNextOpenMarket(tickerPrefix, marketsLimit, now);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        KalshiMarket market = next.get();

        boolean newlyOpen = false;
        if (!market.ticker().equals(currentTicker)) {
            if (currentTicker != null) {
                previousTicker = currentTicker;
                previousResult = null;
                log.info("New market {} (previous {})", market.ticker(), previousTicker);
            } else {
                log.info("Tracking market {}", market.ticker());
            }
            currentTicker = market.ticker();
            newlyOpen = true;
        }

        if (previousTicker != null && previousResult == null) {
            previousResult = lookupResult(previousTicker);
            if (previousResult != null) {
                log.info("Previous market {} settled {}", previousTicker, previousResult.label());
            }
        }

        return Optional.of(new MarketSnapshot(
                market.ticker(),
                market.yesAsk(),
                market.noAsk(),
                newlyOpen,
                previousTicker,
                previousResult,
                market.closeTime(),
                now
        ));
    }

    private Side lookupResult(String ticker) {
        try {
            return kalshi.getSettledSide(ticker).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Result lookup failed for {}: {}", ticker, e.getMessage());
            return null;
        }
    }

    @Override
    public PriceSample getPriceSample(String asset) {
        return new PriceSample(clock.instant(), coinbase.getSpotPrice(asset));
    }

    @Override
    public Optional<Side> getSettlementFact(String ticker) {
        return kalshi.getSettledSide(ticker);
    }
}
