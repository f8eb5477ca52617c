package com.kalbot.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome side of a binary YES/NO market.
 */
public enum Side {
  YES("yes"),
  NO("no");

  private final String label;

  Side(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public Side opposite() {
    return this == YES ? NO : YES;
  }

  /**
   * Parses a settled market result or journal side; anything but yes/no is treated as absent.
   */
  public static Optional<Side> fromLabel(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "yes" -> Optional.of(YES);
      case "no" -> Optional.of(NO);
      default -> Optional.empty();
    };
  }
}
