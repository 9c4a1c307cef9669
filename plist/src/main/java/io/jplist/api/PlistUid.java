package io.jplist.api;

/**
 * A reference-style integer as used by keyed archives. The value is an unsigned 64-bit quantity.
 */
public record PlistUid(long value) implements PlistScalar {

  public static PlistUid of(long value) {
    return new PlistUid(value);
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.UID;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.UID;
  }

  @Override
  public String toString() {
    return "Uid(" + Long.toUnsignedString(value) + ")";
  }
}
