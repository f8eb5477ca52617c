package com.kalbot.strategy.journal;

import com.kalbot.domain.Side;
import com.kalbot.journal.TradeJournalCsv;
import com.kalbot.journal.TradeRecord;
import com.kalbot.strategy.Fixtures;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.SettlementEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTradeJournalTest {

    @TempDir
    Path dir;

    @Test
    void writesPendingRowThenFillsSettlementColumns() {
        // Given
        TradeJournalCsv csv = new TradeJournalCsv(dir.resolve("trades.csv"));
        CsvTradeJournal journal = new CsvTradeJournal(csv, List.of());
        Position position = new Position(StrategyId.CONSENSUS, "T1", Side.YES,
                new BigDecimal("5"), new BigDecimal("0.4167"), new BigDecimal("12"),
                new BigDecimal("0.10"), Fixtures.NOW, "T0", "PREV=yes MOM=yes");

        // When
        journal.onTradeOpened(position);

        // Then
        List<TradeRecord> pending = csv.load();
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).isSettled()).isFalse();
        assertThat(pending.get(0).previousTicker()).isEqualTo("T0");
        assertThat(pending.get(0).previousResult()).isEqualTo("PREV=yes MOM=yes");
        assertThat(pending.get(0).buySide()).isEqualTo("yes");

        // When
        journal.onTradeSettled(SettlementEngine.settle(position, Side.YES, Fixtures.NOW.plusSeconds(900)));

        // Then
        TradeRecord settled = csv.load().get(0);
        assertThat(settled.outcome()).isEqualTo(TradeRecord.WIN);
        assertThat(settled.payoutUsd()).isEqualByComparingTo("12");
        assertThat(settled.grossProfitUsd()).isEqualByComparingTo("7");
        assertThat(settled.feeUsd()).isEqualByComparingTo("0.10");
        assertThat(settled.profitUsd()).isEqualByComparingTo("6.90");
        assertThat(settled.parsedSettledTime()).contains(Fixtures.NOW.plusSeconds(900));
        assertThat(journal.rows()).hasSize(1);
    }

    @Test
    void settlementWithoutPendingRowChangesNothing() {
        TradeJournalCsv csv = new TradeJournalCsv(dir.resolve("trades.csv"));
        CsvTradeJournal journal = new CsvTradeJournal(csv, List.of());
        Position position = Fixtures.position(StrategyId.PREVIOUS, "T9", Side.NO, "5", "0.50", "10", "0");

        journal.onTradeSettled(SettlementEngine.settle(position, Side.NO, Fixtures.NOW));

        assertThat(journal.rows()).isEmpty();
        assertThat(csv.load()).isEmpty();
    }
}
