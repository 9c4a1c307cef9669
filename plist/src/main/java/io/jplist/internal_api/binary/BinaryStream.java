package io.jplist.internal_api.binary;

import io.jplist.api.PlistDecodeException;
import io.jplist.utils.CustomByteBuffer;

/**
 * Bounds-checked cursor over the object table. Every read fails with {@code TRUNCATED_INPUT}
 * instead of running past the limit, which is the start of the offset table.
 */
final class BinaryStream {
  private final CustomByteBuffer buffer;
  private final long limit;
  private long position;

  BinaryStream(CustomByteBuffer buffer, long limit) {
    this.buffer = buffer;
    this.limit = limit;
  }

  long position() {
    return position;
  }

  void position(long position) {
    this.position = position;
  }

  long remaining() {
    return limit - position;
  }

  /**
   * @param count number of bytes about to be read
   * @param what description used in the error message
   * @throws PlistDecodeException if fewer than {@code count} bytes remain
   */
  void require(long count, String what) throws PlistDecodeException {
    if (count < 0 || count > limit - position) {
      throw PlistDecodeException.truncated(what, position);
    }
  }

  int readU8(String what) throws PlistDecodeException {
    require(1, what);
    return buffer.get(position++) & 0xFF;
  }

  /** Reads an unsigned big-endian value of 1 to 8 bytes. */
  long readUnsigned(int width, String what) throws PlistDecodeException {
    require(width, what);
    long v = buffer.getUnsigned(position, width);
    position += width;
    return v;
  }

  byte[] readBytes(long count, String what) throws PlistDecodeException {
    require(count, what);
    byte[] bytes = new byte[(int) count];
    buffer.get(position, bytes, 0, bytes.length);
    position += count;
    return bytes;
  }

  float readFloat(String what) throws PlistDecodeException {
    require(4, what);
    float f = buffer.getFloat(position);
    position += 4;
    return f;
  }

  double readDouble(String what) throws PlistDecodeException {
    require(8, what);
    double d = buffer.getDouble(position);
    position += 8;
    return d;
  }

  /** Reads an entry of the offset table, which lies beyond {@link #limit()}. */
  long readTableEntry(long pos, int width) {
    return buffer.getUnsigned(pos, width);
  }
}
