package com.kalbot.strategy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.coinbase.CoinbaseSpotPriceClient;
import com.kalbot.config.KalbotProperties;
import com.kalbot.journal.TradeJournalCsv;
import com.kalbot.journal.TradeRecord;
import com.kalbot.kalshi.data.KalshiMarketApiClient;
import com.kalbot.strategy.cycle.CycleFetchException;
import com.kalbot.strategy.cycle.CycleStatusLogger;
import com.kalbot.strategy.cycle.MarketFeed;
import com.kalbot.strategy.cycle.TradeEventSink;
import com.kalbot.strategy.cycle.TradingCycleEngine;
import com.kalbot.strategy.evaluator.StrategyCatalog;
import com.kalbot.strategy.feed.KalshiMarketFeed;
import com.kalbot.strategy.journal.CsvTradeJournal;
import com.kalbot.strategy.journal.TradeStateRestorer;
import com.kalbot.strategy.metrics.StrategyMetrics;
import com.kalbot.strategy.service.BankrollLedger;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.RollingPerformanceTracker;
import com.kalbot.strategy.service.SettlementEngine;
import com.kalbot.strategy.service.StrategyScoreboard;
import com.kalbot.strategy.service.TradeStateStore;
import com.kalbot.strategy.signal.SignalSources;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the trading engine from {@link KalbotProperties}.
 *
 * Engine state (ledger, rolling window, trade store) is plain objects created here; the scheduler
 * is a separate bean so that {@code @Scheduled} is picked up.
 */
@Slf4j
@Configuration
@EnableScheduling
public class StrategyEngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient kalshiRestClient(KalbotProperties properties) {
        KalbotProperties.Kalshi kalshi = properties.kalshi();
        return RestClient.builder()
                .baseUrl(kalshi.baseUrl())
                .requestFactory(requestFactory(kalshi.httpTimeoutMillis()))
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Bean
    public RestClient coinbaseRestClient(KalbotProperties properties) {
        KalbotProperties.Coinbase coinbase = properties.coinbase();
        return RestClient.builder()
                .baseUrl(coinbase.baseUrl())
                .requestFactory(requestFactory(coinbase.httpTimeoutMillis()))
                .defaultHeader("Accept", "application/json")
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(long timeoutMillis) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Math.toIntExact(timeoutMillis));
        requestFactory.setReadTimeout(Math.toIntExact(timeoutMillis));
        return requestFactory;
    }

    @Bean
    public KalshiMarketApiClient kalshiMarketApiClient(@Qualifier("kalshiRestClient") RestClient kalshiRestClient,
                                                       ObjectMapper objectMapper) {
        return new KalshiMarketApiClient(kalshiRestClient, objectMapper);
    }

    @Bean
    public CoinbaseSpotPriceClient coinbaseSpotPriceClient(@Qualifier("coinbaseRestClient") RestClient coinbaseRestClient,
                                                           ObjectMapper objectMapper) {
        return new CoinbaseSpotPriceClient(coinbaseRestClient, objectMapper);
    }

    @Bean
    public MarketFeed marketFeed(KalshiMarketApiClient kalshi, CoinbaseSpotPriceClient coinbase,
                                 KalbotProperties properties, Clock clock) {
        return new KalshiMarketFeed(kalshi, coinbase, properties.kalshi().marketsLimit(), clock);
    }

    @Bean
    public TradeStateStore tradeStateStore() {
        return new TradeStateStore();
    }

    @Bean
    public ConsensusRiskBook consensusRiskBook(KalbotProperties properties) {
        KalbotProperties.Consensus c = properties.consensus();
        BankrollLedger ledger = new BankrollLedger(c.initialBankrollUsd(), c.riskPct(), c.dailyLossCapR(), c.weeklyLossCapR());
        RollingPerformanceTracker tracker = new RollingPerformanceTracker(c.rollingWindow());
        return new ConsensusRiskBook(ledger, tracker, c.riskPct(), c.maxRiskPct(), c.feePct());
    }

    @Bean
    public SettlementEngine settlementEngine(TradeStateStore store, ConsensusRiskBook riskBook) {
        return new SettlementEngine(store, riskBook);
    }

    @Bean
    public StrategyScoreboard strategyScoreboard() {
        return new StrategyScoreboard();
    }

    @Bean
    public StrategyCatalog strategyCatalog(KalbotProperties properties) {
        return StrategyCatalog.from(properties);
    }

    @Bean
    public TradeJournalCsv tradeJournalCsv(KalbotProperties properties) {
        return new TradeJournalCsv(Path.of(properties.journal().tradesCsvPath()));
    }

    @Bean
    public TradeStateRestorer tradeStateRestorer(TradeStateStore store, ConsensusRiskBook riskBook,
                                                 StrategyScoreboard scoreboard) {
        return new TradeStateRestorer(store, riskBook, scoreboard);
    }

    @Bean
    public CsvTradeJournal csvTradeJournal(TradeJournalCsv csv, TradeStateRestorer restorer, KalbotProperties properties) {
        List<TradeRecord> rows = csv.load();
        if (properties.journal().restoreOnStartup() && !rows.isEmpty()) {
            restorer.restore(rows);
        }
        log.info("Trade journal {} ({} rows)", csv.path().toAbsolutePath(), rows.size());
        return new CsvTradeJournal(csv, rows);
    }

    @Bean
    public StrategyMetrics strategyMetrics(MeterRegistry meterRegistry, ConsensusRiskBook riskBook, TradeStateStore store) {
        return new StrategyMetrics(meterRegistry, riskBook, store);
    }

    @Bean
    public CycleStatusLogger cycleStatusLogger() {
        return new CycleStatusLogger();
    }

    @Bean
    public TradingCycleEngine tradingCycleEngine(MarketFeed marketFeed,
                                                 List<TradeEventSink> sinks,
                                                 StrategyCatalog catalog,
                                                 TradeStateStore store,
                                                 ConsensusRiskBook riskBook,
                                                 SettlementEngine settlementEngine,
                                                 StrategyScoreboard scoreboard,
                                                 KalbotProperties properties,
                                                 Clock clock) {
        KalbotProperties.Strategy s = properties.strategy();
        return new TradingCycleEngine(
                marketFeed,
                sinks,
                catalog.evaluators(),
                new SignalSources(s.momentumWindowSeconds(), s.momentum15WindowSeconds()),
                store,
                riskBook,
                settlementEngine,
                scoreboard,
                properties.kalshi().seriesTicker(),
                properties.coinbase().productId(),
                properties.engine().settlementLookupFailureLimit(),
                clock
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "kalbot.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TradingCycleScheduler tradingCycleScheduler(TradingCycleEngine engine,
                                                       StrategyMetrics metrics,
                                                       CycleStatusLogger statusLogger,
                                                       StrategyCatalog catalog,
                                                       KalbotProperties properties) {
        return new TradingCycleScheduler(engine, metrics, statusLogger, catalog, properties);
    }

    /**
     * Runs one trading cycle per poll interval. Fixed delay keeps cycles from overlapping.
     */
    @Slf4j
    public static class TradingCycleScheduler {
        private final TradingCycleEngine engine;
        private final StrategyMetrics metrics;
        private final CycleStatusLogger statusLogger;
        private final StrategyCatalog catalog;
        private final KalbotProperties properties;

        public TradingCycleScheduler(TradingCycleEngine engine,
                                     StrategyMetrics metrics,
                                     CycleStatusLogger statusLogger,
                                     StrategyCatalog catalog,
                                     KalbotProperties properties) {
            this.engine = engine;
            this.metrics = metrics;
            this.statusLogger = statusLogger;
            this.catalog = catalog;
            this.properties = properties;
        }

        @PostConstruct
        void logBanner() {
            KalbotProperties.Consensus c = properties.consensus();
            KalbotProperties.Strategy s = properties.strategy();
            log.info("Watching {} markets with {} strategies:", properties.kalshi().seriesTicker(), catalog.descriptors().size());
            int i = 1;
            for (StrategyCatalog.StrategyDescriptor d : catalog.descriptors()) {
                log.info("  {}. {}: {}", i++, d.strategy(), d.description());
            }
            log.info("Stake: ${} per trade | Polling: {}ms | CSV: {}",
                    s.stakeUsd().toPlainString(), properties.engine().pollMillis(), properties.journal().tradesCsvPath());
            log.info("Consensus controls: bankroll=${} risk={}% maxRisk={}% maxPrice=${} dailyCap={}R weeklyCap={}R rolling={} fee={}%",
                    c.initialBankrollUsd().toPlainString(), c.riskPct() * 100, c.maxRiskPct() * 100,
                    c.maxPrice().toPlainString(), c.dailyLossCapR(), c.weeklyLossCapR(), c.rollingWindow(), c.feePct() * 100);
        }

        @Scheduled(fixedDelayString = "${kalbot.engine.poll-millis:5000}", initialDelay = 1000)
        public void tick() {
            try {
                engine.runCycle();
                metrics.recordCycle("ok");
            } catch (CycleFetchException e) {
                metrics.recordCycle("fetch_failed");
                log.warn("Cycle skipped: {} ({})", e.getMessage(), e.getCause() == null ? "-" : e.getCause().getMessage());
            } catch (Exception e) {
                metrics.recordCycle("error");
                log.error("Cycle failed, continuing scheduler loop", e);
            }
        }

        @PreDestroy
        void shutdown() {
            statusLogger.logFinalStats(engine.scoreboard().snapshot(), engine.scoreboard().totals());
        }
    }
}
