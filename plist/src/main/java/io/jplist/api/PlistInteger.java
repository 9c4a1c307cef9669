package io.jplist.api;

import java.math.BigInteger;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A signed integer in the range [-2^127, 2^127 - 1].
 *
 * <p>Values in [{@link Long#MIN_VALUE}, 2^64 - 1] are supported by every codec. Values outside that
 * range are <em>extended</em> and can only be read or written with unstable features enabled.
 */
public final class PlistInteger implements PlistScalar {
  static final BigInteger MIN = BigInteger.ONE.shiftLeft(127).negate();
  static final BigInteger MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
  static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
  static final BigInteger U64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  private final BigInteger value;

  private PlistInteger(BigInteger value) {
    this.value = value;
  }

  public static PlistInteger of(long value) {
    return new PlistInteger(BigInteger.valueOf(value));
  }

  /**
   * Interprets the bits of {@code value} as an unsigned 64-bit integer.
   *
   * @param value the raw bits
   * @return the integer in [0, 2^64 - 1]
   */
  public static PlistInteger ofUnsigned(long value) {
    if (value >= 0) {
      return of(value);
    }
    return new PlistInteger(BigInteger.valueOf(value).and(U64_MAX));
  }

  /**
   * @param value any integer in [-2^127, 2^127 - 1]
   * @return the integer
   * @throws IllegalArgumentException if {@code value} lies outside the 128-bit signed range
   */
  public static PlistInteger of(BigInteger value) {
    Objects.requireNonNull(value, "value");
    if (!fits128(value)) {
      throw new IllegalArgumentException("Integer " + value + " exceeds the 128-bit signed range");
    }
    return new PlistInteger(value);
  }

  /**
   * Parses decimal text, or hexadecimal text prefixed with {@code 0x}, optionally signed.
   *
   * @param text the text to parse
   * @return the integer
   * @throws NumberFormatException if the text is not a number or lies outside the 128-bit range
   */
  public static PlistInteger parse(String text) {
    String s = text.trim();
    boolean negative = false;
    if (s.startsWith("-")) {
      negative = true;
      s = s.substring(1);
    } else if (s.startsWith("+")) {
      s = s.substring(1);
    }
    BigInteger parsed;
    if (s.startsWith("0x") || s.startsWith("0X")) {
      parsed = new BigInteger(s.substring(2), 16);
    } else {
      parsed = new BigInteger(s);
    }
    if (negative) {
      parsed = parsed.negate();
    }
    if (!fits128(parsed)) {
      throw new NumberFormatException("Integer " + text + " exceeds the 128-bit signed range");
    }
    return new PlistInteger(parsed);
  }

  static boolean fits128(BigInteger value) {
    return value.compareTo(MIN) >= 0 && value.compareTo(MAX) <= 0;
  }

  public BigInteger value() {
    return value;
  }

  /**
   * @return the value as a signed long, or empty if it does not fit
   */
  public OptionalLong asSigned() {
    if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
      return OptionalLong.of(value.longValue());
    }
    return OptionalLong.empty();
  }

  /**
   * @return the raw bits of the value as an unsigned long, or empty if it is negative or wider
   *     than 64 bits
   */
  public OptionalLong asUnsigned() {
    if (value.signum() >= 0 && value.compareTo(U64_MAX) <= 0) {
      return OptionalLong.of(value.longValue());
    }
    return OptionalLong.empty();
  }

  /**
   * @return {@code true} if the value lies outside [{@link Long#MIN_VALUE}, 2^64 - 1]
   */
  public boolean isExtended() {
    return value.compareTo(LONG_MIN) < 0 || value.compareTo(U64_MAX) > 0;
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.INTEGER;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.INTEGER;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PlistInteger other && value.equals(other.value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return "Integer(" + value + ")";
  }
}
