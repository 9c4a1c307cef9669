package io.jplist.api;

import java.util.Arrays;
import java.util.HexFormat;

/** An opaque byte sequence. Compared by content; the backing array is never exposed. */
public final class PlistData implements PlistScalar {
  private final byte[] bytes;

  private PlistData(byte[] bytes) {
    this.bytes = bytes;
  }

  public static PlistData of(byte[] bytes) {
    return new PlistData(bytes.clone());
  }

  /**
   * @return a copy of the bytes
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.DATA;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.DATA;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PlistData other && Arrays.equals(bytes, other.bytes));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Data(" + HexFormat.of().formatHex(bytes) + ")";
  }
}
