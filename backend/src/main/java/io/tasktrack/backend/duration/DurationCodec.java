package io.tasktrack.backend.duration;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between microsecond counts and the duration strings shown to and typed by users.
 *
 * <p>Month and year use average lengths (30.44 and 365.24 days), so formatting is lossy: {@link
 * #format(long)} keeps the two most significant units and {@link #parse(String)} of its output
 * lands within one step of the coarser of them.
 */
public final class DurationCodec {

  public static final long MICROSECOND = 1L;
  public static final long MILLISECOND = 1_000L;
  public static final long SECOND = 1_000_000L;
  public static final long MINUTE = 60_000_000L;
  public static final long HOUR = 3_600_000_000L;
  public static final long DAY = 86_400_000_000L;
  public static final long WEEK = 604_800_000_000L;
  public static final long MONTH = 2_629_746_000_000L;
  public static final long YEAR = 31_556_952_000_000L;

  private static final String ZERO = "0μs";

  private static final Map<String, Long> UNIT_FACTORS =
      Map.ofEntries(
          Map.entry("us", MICROSECOND),
          Map.entry("μs", MICROSECOND),
          Map.entry("µs", MICROSECOND),
          Map.entry("ms", MILLISECOND),
          Map.entry("s", SECOND),
          Map.entry("m", MINUTE),
          Map.entry("min", MINUTE),
          Map.entry("h", HOUR),
          Map.entry("hr", HOUR),
          Map.entry("d", DAY),
          Map.entry("day", DAY),
          Map.entry("w", WEEK),
          Map.entry("wk", WEEK),
          Map.entry("week", WEEK),
          Map.entry("mo", MONTH),
          Map.entry("mon", MONTH),
          Map.entry("month", MONTH),
          Map.entry("y", YEAR),
          Map.entry("yr", YEAR),
          Map.entry("year", YEAR));

  private static final Pattern TOKEN = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-zμµ]+)");

  private DurationCodec() {}

  /**
   * Splits a duration into years down to microseconds by successive division.
   *
   * @throws IllegalArgumentException if {@code micros} is negative
   */
  public static DurationBreakdown breakdown(long micros) {
    if (micros < 0) {
      throw new IllegalArgumentException("Cannot break down a negative duration: " + micros);
    }
    long remaining = micros;

    long years = remaining / YEAR;
    remaining %= YEAR;
    long months = remaining / MONTH;
    remaining %= MONTH;
    long weeks = remaining / WEEK;
    remaining %= WEEK;
    long days = remaining / DAY;
    remaining %= DAY;
    long hours = remaining / HOUR;
    remaining %= HOUR;
    long minutes = remaining / MINUTE;
    remaining %= MINUTE;
    long seconds = remaining / SECOND;
    remaining %= SECOND;
    long milliseconds = remaining / MILLISECOND;
    remaining %= MILLISECOND;

    return new DurationBreakdown(
        years, months, weeks, days, hours, minutes, seconds, milliseconds, remaining);
  }

  /** Formats with the two most significant units, e.g. {@code "456ms"}, {@code "2h 15m"}. */
  public static String format(long micros) {
    return format(micros, false);
  }

  /** Like {@link #format(long)} but shows microseconds below one millisecond. */
  public static String formatCompact(long micros) {
    return format(micros, true);
  }

  /**
   * Renders elapsed time the way a running timer shows it: {@code HH:MM:SS} from one hour up,
   * {@code MM:SS} below that, and {@code SS.mmm} under a minute when {@code showMillis} is set.
   * Hours are not wrapped at a day.
   */
  public static String formatTimerDisplay(long elapsedMicros, boolean showMillis) {
    long elapsed = Math.max(0, elapsedMicros);
    long hours = elapsed / HOUR;
    long minutes = (elapsed % HOUR) / MINUTE;
    long seconds = (elapsed % MINUTE) / SECOND;
    long millis = (elapsed % SECOND) / MILLISECOND;

    if (showMillis && elapsed < MINUTE) {
      return String.format(Locale.ROOT, "%02d.%03d", seconds, millis);
    }
    if (hours > 0) {
      return String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, seconds);
    }
    return String.format(Locale.ROOT, "%02d:%02d", minutes, seconds);
  }

  /**
   * Parses strings such as {@code "1h 30m"}, {@code "1.5h"}, {@code "2w3d12h"} or {@code
   * "500ms"}. Blank input and {@code "0"} mean zero. A leading {@code -} negates the result.
   *
   * @throws IllegalArgumentException if the input has no {@code <number><unit>} group, uses an
   *     unknown unit, contains anything else, or does not fit in a long
   */
  public static long parse(String input) {
    if (input == null) {
      return 0;
    }
    String text = input.trim().toLowerCase(Locale.ROOT);
    if (text.isEmpty() || text.equals("0")) {
      return 0;
    }

    boolean negative = text.startsWith("-");
    if (negative) {
      text = text.substring(1).trim();
    }

    Matcher matcher = TOKEN.matcher(text);
    BigDecimal total = BigDecimal.ZERO;
    int position = 0;
    int tokens = 0;
    while (position < text.length()) {
      if (Character.isWhitespace(text.charAt(position))) {
        position++;
        continue;
      }
      matcher.region(position, text.length());
      if (!matcher.lookingAt()) {
        throw new IllegalArgumentException(
            "Unparseable duration \"" + input + "\" at \"" + text.substring(position) + "\"");
      }
      Long factor = UNIT_FACTORS.get(matcher.group(2));
      if (factor == null) {
        throw new IllegalArgumentException(
            "Unknown time unit \""
                + matcher.group(2)
                + "\". Valid units: us, ms, s, m, h, d, w, mo, y");
      }
      total = total.add(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(factor)));
      tokens++;
      position = matcher.end();
    }

    if (tokens == 0) {
      throw new IllegalArgumentException("Unparseable duration \"" + input + "\"");
    }

    try {
      long micros = total.setScale(0, RoundingMode.HALF_UP).longValueExact();
      return negative ? -micros : micros;
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration \"" + input + "\" is out of range", e);
    }
  }

  private static String format(long micros, boolean showMicros) {
    if (micros == 0) {
      return ZERO;
    }
    boolean negative = micros < 0;
    // Long.MIN_VALUE has no positive counterpart; one microsecond short is close enough
    long magnitude = micros == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(micros);
    var b = breakdown(magnitude);

    String result;
    if (showMicros && magnitude < MILLISECOND) {
      result = b.microseconds() + "μs";
    } else if (magnitude < SECOND) {
      result = b.milliseconds() + "ms";
    } else if (magnitude < MINUTE - 50 * MILLISECOND) {
      result = formatSeconds(b);
    } else if (magnitude < MINUTE) {
      // Would round up to "60s"
      result = "1m";
    } else if (magnitude < HOUR) {
      result = pair(b.minutes(), "m", b.seconds(), "s");
    } else if (magnitude < DAY) {
      result = pair(b.hours(), "h", b.minutes(), "m");
    } else if (magnitude < WEEK) {
      result = pair(b.days(), "d", b.hours(), "h");
    } else if (magnitude < MONTH) {
      result = pair(b.weeks(), "w", b.days(), "d");
    } else if (magnitude < YEAR) {
      result = pair(b.months(), "mo", b.weeks(), "w");
    } else {
      result = pair(b.years(), "y", b.months(), "mo");
    }

    return negative ? "-" + result : result;
  }

  // One decimal of sub-second precision, dropped when it rounds to .0
  private static String formatSeconds(DurationBreakdown b) {
    if (b.milliseconds() == 0) {
      return b.seconds() + "s";
    }
    String value =
        BigDecimal.valueOf(b.seconds() * 1_000 + b.milliseconds(), 3)
            .setScale(1, RoundingMode.HALF_UP)
            .toPlainString();
    if (value.endsWith(".0")) {
      value = value.substring(0, value.length() - 2);
    }
    return value + "s";
  }

  private static String pair(long major, String majorUnit, long minor, String minorUnit) {
    String result = major + majorUnit;
    if (minor > 0) {
      result += " " + minor + minorUnit;
    }
    return result;
  }
}
