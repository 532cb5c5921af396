package com.bdi.api.service;

import com.bdi.api.api.BadRequestException;
import com.bdi.pipeline.aggregate.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing and validating API query parameters.
 */
public final class QueryParser {
  private static final Pattern WINDOW_PATTERN = Pattern.compile("^(\\d{1,9})([smhd])$");
  private static final Pattern ICAO_PATTERN = Pattern.compile("^~?[0-9a-f]{6}$");

  private QueryParser() {}

  /**
   * Parses a zero-based page index. Negative pages are treated as the first page.
   *
   * @param raw raw page query value
   * @return effective page index
   */
  public static int parsePage(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0;
    }
    try {
      return Math.max(0, Integer.parseInt(raw.trim()));
    } catch (NumberFormatException ex) {
      throw new BadRequestException("page must be an integer");
    }
  }

  /**
   * Parses a page size. Absent or non-positive values fall back to the default.
   *
   * @param raw raw page size query value
   * @param defaultSize default value
   * @param maxSize hard upper bound
   * @return effective page size
   */
  public static int parsePageSize(String raw, int defaultSize, int maxSize) {
    if (raw == null || raw.isBlank()) {
      return defaultSize;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      return parsed <= 0 ? defaultSize : Math.min(parsed, maxSize);
    } catch (NumberFormatException ex) {
      throw new BadRequestException("num_results must be an integer");
    }
  }

  /**
   * Parses a positive count such as {@code max_batches}.
   *
   * @param raw raw query value
   * @param name parameter name used in error messages
   * @param defaultValue value when absent
   * @param maxValue hard upper bound
   * @return effective value
   */
  public static int parsePositive(String raw, String name, int defaultValue, int maxValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new BadRequestException(name + " must be > 0");
      }
      return Math.min(parsed, maxValue);
    } catch (NumberFormatException ex) {
      throw new BadRequestException(name + " must be an integer");
    }
  }

  /**
   * Parses {@code k} for top-K queries. The sign is checked by the aggregation engine.
   *
   * @param raw raw k query value
   * @param defaultK default value
   * @param maxK hard upper bound
   * @return requested k
   */
  public static int parseTopK(String raw, int defaultK, int maxK) {
    if (raw == null || raw.isBlank()) {
      return defaultK;
    }
    try {
      return Math.min(Integer.parseInt(raw.trim()), maxK);
    } catch (NumberFormatException ex) {
      throw new BadRequestException("k must be an integer");
    }
  }

  /**
   * Parses an instant from epoch seconds, epoch milliseconds or ISO-8601.
   *
   * @param raw raw query value
   * @param name parameter name used in error messages
   * @return parsed instant or {@code null} when absent
   */
  public static Instant parseInstant(String raw, String name) {
    if (raw == null || raw.isBlank()) {
      return null;
    }

    String value = raw.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      if (value.length() > 15) {
        throw new BadRequestException(name + " is out of range");
      }
      long epoch = Long.parseLong(value);
      return epoch > 10_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
    }

    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      throw new BadRequestException(name + " must be epoch seconds/ms or ISO8601");
    }
  }

  /**
   * Parses a window length string (for example {@code 90s}, {@code 30m}, {@code 24h},
   * {@code 2d}).
   *
   * @param raw raw window query value
   * @param defaultValue fallback length
   * @param maxValue hard maximum length
   * @return validated window length
   */
  public static Duration parseWindow(String raw, Duration defaultValue, Duration maxValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }

    Matcher matcher = WINDOW_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new BadRequestException("window must use format like 90s,30m,6h,2d");
    }

    long amount = Long.parseLong(matcher.group(1));
    Duration parsed = switch (matcher.group(2)) {
      case "s" -> Duration.ofSeconds(amount);
      case "m" -> Duration.ofMinutes(amount);
      case "h" -> Duration.ofHours(amount);
      case "d" -> Duration.ofDays(amount);
      default -> throw new BadRequestException("unsupported window unit");
    };

    if (parsed.isZero()) {
      throw new BadRequestException("window must be > 0");
    }
    if (parsed.compareTo(maxValue) > 0) {
      throw new BadRequestException("window exceeds maximum allowed duration");
    }
    return parsed;
  }

  /**
   * Resolves a half-open query window from explicit bounds and/or a length.
   *
   * <p>A missing {@code to} defaults to {@code now}; a missing {@code from} is {@code to} minus
   * the window length. Windows longer than {@code maxWindow} are rejected.
   *
   * @return resolved window
   * @throws com.bdi.pipeline.error.InvalidQueryException when {@code from} is not before
   *     {@code to}
   */
  public static TimeWindow resolveWindow(
      String fromRaw,
      String toRaw,
      String windowRaw,
      Instant now,
      Duration defaultWindow,
      Duration maxWindow) {
    Instant to = parseInstant(toRaw, "to");
    Instant from = parseInstant(fromRaw, "from");
    Duration length = parseWindow(windowRaw, defaultWindow, maxWindow);

    Instant end = to == null ? now : to;
    Instant start = from == null ? end.minus(length) : from;
    TimeWindow window = TimeWindow.of(start, end);
    if (Duration.between(window.start(), window.end()).compareTo(maxWindow) > 0) {
      throw new BadRequestException("window exceeds maximum allowed duration");
    }
    return window;
  }

  /**
   * Normalizes an ICAO address path or query value.
   *
   * @param raw raw address
   * @return lower-cased, trimmed address, or an empty string when blank
   */
  public static String normalizeIcao(String raw) {
    return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a comma-separated ICAO address filter.
   *
   * @param raw raw filter value
   * @return addresses in ascending order, empty when absent
   */
  public static Set<String> parseIcaoList(String raw) {
    Set<String> addresses = new TreeSet<>();
    if (raw == null || raw.isBlank()) {
      return addresses;
    }
    Arrays.stream(raw.split(","))
        .map(QueryParser::normalizeIcao)
        .filter(value -> !value.isEmpty())
        .forEach(value -> {
          if (!ICAO_PATTERN.matcher(value).matches()) {
            throw new BadRequestException("icao must be a 6-digit hex address, got " + value);
          }
          addresses.add(value);
        });
    return addresses;
  }
}
