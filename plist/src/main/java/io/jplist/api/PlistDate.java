package io.jplist.api;

import java.time.Instant;

/**
 * A point in time, stored as floating-point seconds relative to 2001-01-01T00:00:00Z, which is the
 * representation the binary format uses. Converting through {@link Instant} rounds to nanoseconds.
 */
public record PlistDate(double secondsSinceEpoch2001) implements PlistScalar {
  /** 2001-01-01T00:00:00Z in Unix seconds. */
  public static final long EPOCH_2001_UNIX_SECONDS = 978_307_200L;

  // range of Instant, relative to 2001
  private static final double MIN_SECONDS =
      (double) (Instant.MIN.getEpochSecond() - EPOCH_2001_UNIX_SECONDS);
  private static final double MAX_SECONDS =
      (double) (Instant.MAX.getEpochSecond() - EPOCH_2001_UNIX_SECONDS);

  public PlistDate {
    if (!isValidSeconds(secondsSinceEpoch2001)) {
      throw new IllegalArgumentException(
          "Date seconds must be finite and within the Instant range: " + secondsSinceEpoch2001);
    }
  }

  /**
   * @return whether {@code secondsSinceEpoch2001} is finite and converts to an {@link Instant}
   */
  public static boolean isValidSeconds(double secondsSinceEpoch2001) {
    return Double.isFinite(secondsSinceEpoch2001)
        && secondsSinceEpoch2001 >= MIN_SECONDS
        && secondsSinceEpoch2001 <= MAX_SECONDS;
  }

  public static PlistDate ofSeconds(double secondsSinceEpoch2001) {
    return new PlistDate(secondsSinceEpoch2001);
  }

  public static PlistDate of(Instant instant) {
    double seconds =
        (double) (instant.getEpochSecond() - EPOCH_2001_UNIX_SECONDS)
            + instant.getNano() / 1_000_000_000d;
    return new PlistDate(seconds);
  }

  public Instant toInstant() {
    double whole = Math.floor(secondsSinceEpoch2001);
    long nanos = Math.round((secondsSinceEpoch2001 - whole) * 1_000_000_000d);
    // doubles this large are whole numbers, but rounding may land one step past the limits
    long epochSecond =
        Math.max(
            Instant.MIN.getEpochSecond(),
            Math.min(Instant.MAX.getEpochSecond(), (long) whole + EPOCH_2001_UNIX_SECONDS));
    if (epochSecond == Instant.MAX.getEpochSecond()) {
      nanos = Math.min(nanos, 999_999_999L);
    }
    return Instant.ofEpochSecond(epochSecond, nanos);
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.DATE;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.DATE;
  }

  @Override
  public String toString() {
    return "Date(" + toInstant() + ")";
  }
}
