package io.jplist.api;

/** A boolean. */
public record PlistBoolean(boolean value) implements PlistScalar {
  public static final PlistBoolean TRUE = new PlistBoolean(true);
  public static final PlistBoolean FALSE = new PlistBoolean(false);

  public static PlistBoolean of(boolean value) {
    return value ? TRUE : FALSE;
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.BOOLEAN;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.BOOLEAN;
  }

  @Override
  public String toString() {
    return "Boolean(" + value + ")";
  }
}
