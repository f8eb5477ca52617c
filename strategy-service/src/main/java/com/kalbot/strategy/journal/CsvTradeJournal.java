package com.kalbot.strategy.journal;

import com.kalbot.journal.TradeJournalCsv;
import com.kalbot.journal.TradeRecord;
import com.kalbot.strategy.cycle.TradeEventSink;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.SettledTrade;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the trade journal in memory and rewrites the CSV file on every change.
 */
@Slf4j
public class CsvTradeJournal implements TradeEventSink {

    private final TradeJournalCsv csv;
    private final List<TradeRecord> rows;

    public CsvTradeJournal(TradeJournalCsv csv, List<TradeRecord> existing) {
        this.csv = csv;
        this.rows = new ArrayList<>(existing == null ? List.of() : existing);
    }

    @Override
    public synchronized void onTradeOpened(Position position) {
        rows.add(TradeRecord.opened(
                position.openedAt(),
                position.strategy().journalLabel(),
                position.previousTicker() == null ? "" : position.previousTicker(),
                position.note(),
                position.ticker(),
                position.side().label(),
                position.stake(),
                position.price(),
                position.contracts()
        ));
        csv.save(rows);
    }

    @Override
    public synchronized void onTradeSettled(SettledTrade trade) {
        String strategy = trade.strategy().journalLabel();
        for (int i = rows.size() - 1; i >= 0; i--) {
            TradeRecord row = rows.get(i);
            if (row.sameTrade(strategy, trade.ticker()) && !row.isSettled()) {
                rows.set(i, row.settled(
                        trade.outcome().name(),
                        trade.payout(),
                        trade.grossProfit(),
                        trade.fee(),
                        trade.netProfit(),
                        trade.settledAt()
                ));
                csv.save(rows);
                return;
            }
        }
        log.warn("No pending journal row for {} {}", strategy, trade.ticker());
    }

    public synchronized List<TradeRecord> rows() {
        return List.copyOf(rows);
    }
}
