package com.kalbot.strategy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.config.KalbotProperties;
import com.kalbot.journal.TradeJournalCsv;
import com.kalbot.journal.TradeRecord;
import com.kalbot.strategy.cycle.TradingCycleEngine;
import com.kalbot.strategy.evaluator.StrategyCatalog;
import com.kalbot.strategy.journal.CsvTradeJournal;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.TradeStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyEngineConfigurationTest {

    @TempDir
    Path dir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class, StrategyEngineConfiguration.class);

    @Test
    void wiresEngineWithoutSchedulerWhenDisabled() {
        runner.withPropertyValues(
                "kalbot.engine.enabled=false",
                "kalbot.journal.trades-csv-path=" + dir.resolve("trades.csv")
        ).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(TradingCycleEngine.class);
            assertThat(context).doesNotHaveBean(StrategyEngineConfiguration.TradingCycleScheduler.class);
            assertThat(context.getBean(StrategyCatalog.class).descriptors()).hasSize(StrategyId.values().length);
            assertThat(context.getBean(TradingCycleEngine.class).seriesTicker()).isEqualTo("KXBTC15M");
        });
    }

    @Test
    void restoresJournalOnStartup() {
        // Given
        Path csvPath = dir.resolve("trades.csv");
        TradeRecord pending = TradeRecord.opened(Instant.parse("2025-01-06T10:00:00Z"), "CONSENSUS", "T0", "PREV=yes MOM=yes",
                "T1", "yes", new BigDecimal("4.80"), new BigDecimal("0.40"), new BigDecimal("12"));
        TradeRecord settled = TradeRecord.opened(Instant.parse("2025-01-06T09:45:00Z"), "CONSENSUS", "", "PREV=no MOM=no",
                        "T0", "no", new BigDecimal("4.80"), new BigDecimal("0.40"), new BigDecimal("12"))
                .settled(TradeRecord.WIN, new BigDecimal("12"), new BigDecimal("7.20"), BigDecimal.ZERO, new BigDecimal("7.20"),
                        Instant.parse("2025-01-06T10:00:00Z"));
        new TradeJournalCsv(csvPath).save(List.of(settled, pending));

        // When / Then
        runner.withPropertyValues(
                "kalbot.engine.enabled=false",
                "kalbot.journal.trades-csv-path=" + csvPath
        ).run(context -> {
            assertThat(context.getBean(TradeStateStore.class).openTickers()).containsExactly("T1");
            assertThat(context.getBean(ConsensusRiskBook.class).currentBankroll()).isEqualByComparingTo("507.20");
            assertThat(context.getBean(CsvTradeJournal.class).rows()).hasSize(2);
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(KalbotProperties.class)
    static class TestConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }
}
