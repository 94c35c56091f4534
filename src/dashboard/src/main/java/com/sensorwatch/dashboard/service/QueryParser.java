package com.sensorwatch.dashboard.service;

import com.sensorwatch.dashboard.api.BadRequestException;
import java.time.Duration;

/**
 * Parsing and validation of dashboard query parameters.
 */
public final class QueryParser {
  private QueryParser() {}

  /**
   * Parses an optional trailing window given in whole seconds.
   *
   * @param raw raw {@code duration} query value
   * @return window, or {@code null} when absent (no cutoff)
   */
  public static Duration parseDurationSeconds(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    long seconds;
    try {
      seconds = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new BadRequestException("duration must be an integer number of seconds");
    }
    if (seconds <= 0) {
      throw new BadRequestException("duration must be > 0");
    }
    return Duration.ofSeconds(seconds);
  }

  /**
   * Parses and clamps a result limit.
   *
   * @param raw raw limit query value
   * @param defaultLimit value used when absent
   * @param maxLimit hard upper bound
   * @return effective limit
   */
  public static int parseLimit(String raw, int defaultLimit, int maxLimit) {
    if (raw == null || raw.isBlank()) {
      return defaultLimit;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new BadRequestException("limit must be > 0");
      }
      return Math.min(parsed, maxLimit);
    } catch (NumberFormatException ex) {
      throw new BadRequestException("limit must be an integer");
    }
  }
}
