package com.kalbot.journal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradeJournalCsvTest {

  private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

  @TempDir
  Path dir;

  @Test
  void missingFileLoadsEmpty() {
    TradeJournalCsv journal = new TradeJournalCsv(dir.resolve("none.csv"));

    assertThat(journal.load()).isEmpty();
  }

  @Test
  void writesHeaderInJournalColumnOrderAndEmptySettlementColumns() throws Exception {
    Path file = dir.resolve("data").resolve("trades.csv");
    TradeJournalCsv journal = new TradeJournalCsv(file);

    journal.save(List.of(TradeRecord.opened(NOW, "PREVIOUS", "T0", "yes", "T1", "yes",
        new BigDecimal("5"), new BigDecimal("0.50"), new BigDecimal("10.000000"))));

    List<String> lines = Files.readAllLines(file);
    assertThat(lines.get(0)).isEqualTo(
        "time,strategy,previous_ticker,previous_result,buy_ticker,buy_side,stake_usd,price_usd,"
            + "contracts,fee_usd,gross_profit_usd,outcome,payout_usd,profit_usd,settled_time");
    assertThat(lines.get(1)).startsWith("2025-01-01T12:00:00Z,PREVIOUS,T0,yes,T1,yes,5,0.50,10.000000,");
    assertThat(lines.get(1)).endsWith(",,,,");
  }

  @Test
  void reloadsPendingAndSettledRows() {
    TradeJournalCsv journal = new TradeJournalCsv(dir.resolve("trades.csv"));
    TradeRecord pending = TradeRecord.opened(NOW, "CONSENSUS", "", "PREV=yes MOM=yes", "T1", "yes",
        new BigDecimal("4.80"), new BigDecimal("0.40"), new BigDecimal("12"));
    TradeRecord settled = TradeRecord.opened(NOW, "MOMENTUM", "T0", "BTC +0.120%", "T1", "no",
            new BigDecimal("5"), new BigDecimal("0.50"), new BigDecimal("10"))
        .settled(TradeRecord.WIN, new BigDecimal("10"), new BigDecimal("5"), BigDecimal.ZERO, new BigDecimal("5"),
            NOW.plusSeconds(900));

    journal.save(List.of(pending, settled));
    List<TradeRecord> loaded = journal.load();

    assertThat(loaded).hasSize(2);
    assertThat(loaded.get(0).isSettled()).isFalse();
    assertThat(loaded.get(0).profitUsd()).isNull();
    assertThat(loaded.get(0).previousResult()).isEqualTo("PREV=yes MOM=yes");
    assertThat(loaded.get(0).parsedTime()).contains(NOW);
    assertThat(loaded.get(1).isSettled()).isTrue();
    assertThat(loaded.get(1).outcome()).isEqualTo("WIN");
    assertThat(loaded.get(1).profitUsd()).isEqualByComparingTo("5");
    assertThat(loaded.get(1).sameTrade("MOMENTUM", "T1")).isTrue();
    assertThat(loaded.get(1).parsedSettledTime()).contains(NOW.plusSeconds(900));
  }

  @Test
  void readsOffsetTimestampsWrittenByOlderJournals() throws Exception {
    Path file = dir.resolve("legacy.csv");
    Files.writeString(file, """
        time,strategy,previous_ticker,previous_result,buy_ticker,buy_side,stake_usd,price_usd,contracts,fee_usd,gross_profit_usd,outcome,payout_usd,profit_usd
        2025-01-01T12:00:00.123456+00:00,PREVIOUS,T0,yes,T1,yes,5.0,0.5,10.0,0.0,5.0,WIN,10.0,5.0
        """);

    List<TradeRecord> loaded = new TradeJournalCsv(file).load();

    assertThat(loaded).hasSize(1);
    assertThat(loaded.get(0).parsedTime()).contains(Instant.parse("2025-01-01T12:00:00.123456Z"));
    assertThat(loaded.get(0).contracts()).isEqualByComparingTo("10");
    assertThat(loaded.get(0).parsedSettledTime()).isEmpty();
  }

  @Test
  void saveOfEmptyListLeavesFileUntouched() {
    Path file = dir.resolve("trades.csv");
    new TradeJournalCsv(file).save(List.of());

    assertThat(Files.exists(file)).isFalse();
  }
}
