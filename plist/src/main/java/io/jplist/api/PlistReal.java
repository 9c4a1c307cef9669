package io.jplist.api;

/**
 * A 64-bit floating-point number.
 *
 * <p>Equality compares the bit patterns through {@link Double#compare}: {@code NaN} equals itself
 * and {@code 0.0} differs from {@code -0.0}.
 */
public record PlistReal(double value) implements PlistScalar {

  public static PlistReal of(double value) {
    return new PlistReal(value);
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.REAL;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.REAL;
  }

  @Override
  public String toString() {
    return "Real(" + value + ")";
  }
}
