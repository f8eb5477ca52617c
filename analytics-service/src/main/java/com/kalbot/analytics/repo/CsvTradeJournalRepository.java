package com.kalbot.analytics.repo;

import com.kalbot.journal.TradeJournalCsv;
import com.kalbot.journal.TradeRecord;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Reads the journal file on every call so reports follow a running engine.
 */
@RequiredArgsConstructor
public class CsvTradeJournalRepository implements TradeJournalRepository {

  private final @NonNull TradeJournalCsv csv;

  @Override
  public List<TradeRecord> trades() {
    return csv.load();
  }

  @Override
  public String source() {
    return csv.path().toAbsolutePath().toString();
  }
}
