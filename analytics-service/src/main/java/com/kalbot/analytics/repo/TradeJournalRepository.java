package com.kalbot.analytics.repo;

import com.kalbot.journal.TradeRecord;

import java.util.List;

public interface TradeJournalRepository {

  /**
   * All journal rows in file order, pending rows included.
   */
  List<TradeRecord> trades();

  String source();
}
