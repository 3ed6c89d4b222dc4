package dev.henneberger.vertx.changesource.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Offset in the server change log, ordered as an unsigned 64-bit value.
 */
public final class LogPosition implements Comparable<LogPosition> {

  public static final LogPosition INVALID = new LogPosition(0L);

  private final long value;

  private LogPosition(long value) {
    this.value = value;
  }

  public static LogPosition of(long value) {
    return value == 0L ? INVALID : new LogPosition(value);
  }

  /**
   * Parses the {@code XXXXXXXX/XXXXXXXX} text form used by PostgreSQL.
   */
  public static LogPosition parse(String text) {
    Objects.requireNonNull(text, "text");
    int slash = text.indexOf('/');
    if (slash <= 0 || slash == text.length() - 1) {
      throw new IllegalArgumentException("Invalid log position '" + text + "'");
    }
    try {
      long high = Long.parseLong(text.substring(0, slash), 16);
      long low = Long.parseLong(text.substring(slash + 1), 16);
      if (high > 0xFFFFFFFFL || low > 0xFFFFFFFFL || high < 0 || low < 0) {
        throw new IllegalArgumentException("Invalid log position '" + text + "'");
      }
      return of((high << 32) | low);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid log position '" + text + "'", e);
    }
  }

  public long asLong() {
    return value;
  }

  public String asString() {
    return String.format(Locale.ROOT, "%X/%X", value >>> 32, value & 0xFFFFFFFFL);
  }

  public boolean isValid() {
    return value != 0L;
  }

  @Override
  public int compareTo(LogPosition other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogPosition)) {
      return false;
    }
    return value == ((LogPosition) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return asString();
  }
}
