package io.jplist.utils;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Random-access, big-endian view over property-list bytes.
 *
 * <p>The binary format addresses objects by absolute offset, so every read takes an explicit
 * position instead of advancing a cursor. Callers are responsible for bounds checks; reads outside
 * {@code [0, length())} throw {@link IndexOutOfBoundsException}.
 */
public interface CustomByteBuffer {
  /**
   * Maps a file read-only into memory.
   *
   * @param path the file to map
   * @return a buffer over the whole file
   * @throws IOException if the file cannot be read or is larger than 2 GiB
   */
  static CustomByteBuffer map(Path path) throws IOException {
    long size = Files.size(path);
    if (size > Integer.MAX_VALUE) {
      throw new IOException("File too large to decode in memory: " + path + " (" + size + " bytes)");
    }
    try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r");
        FileChannel channel = raf.getChannel()) {
      return new ByteBufferWrapper(channel.map(FileChannel.MapMode.READ_ONLY, 0, size));
    }
  }

  /**
   * Wraps an array without copying it.
   *
   * @param bytes the backing bytes
   * @return a buffer over {@code bytes}
   */
  static CustomByteBuffer wrap(byte[] bytes) {
    return new ByteBufferWrapper(ByteBuffer.wrap(bytes));
  }

  /**
   * @return the number of bytes in this buffer
   */
  long length();

  /**
   * Creates a view of part of this buffer. Positions in the view start at zero.
   *
   * @param pos the starting position
   * @param len the length of the view
   * @return a new buffer sharing content with this one
   */
  CustomByteBuffer slice(long pos, long len);

  byte get(long pos);

  /**
   * Copies bytes starting at {@code pos} into {@code buffer}.
   *
   * @param pos the source position
   * @param buffer the destination
   * @param offset the starting offset in the destination
   * @param length the number of bytes to copy
   */
  void get(long pos, byte[] buffer, int offset, int length);

  short getShort(long pos);

  int getInt(long pos);

  long getLong(long pos);

  float getFloat(long pos);

  double getDouble(long pos);

  /**
   * Reads a big-endian unsigned integer of 1 to 8 bytes. An 8-byte value above {@link
   * Long#MAX_VALUE} comes back negative.
   *
   * @param pos the position of the first byte
   * @param width number of bytes, 1 to 8
   * @return the value
   */
  default long getUnsigned(long pos, int width) {
    switch (width) {
      case 1:
        return get(pos) & 0xFFL;
      case 2:
        return getShort(pos) & 0xFFFFL;
      case 4:
        return getInt(pos) & 0xFFFFFFFFL;
      case 8:
        return getLong(pos);
      default:
        long v = 0;
        for (int i = 0; i < width; i++) {
          v = (v << 8) | (get(pos + i) & 0xFFL);
        }
        return v;
    }
  }

  /**
   * @return a copy of the whole buffer
   */
  default byte[] toArray() {
    byte[] bytes = new byte[(int) length()];
    get(0, bytes, 0, bytes.length);
    return bytes;
  }

  /** {@link CustomByteBuffer} backed by a heap or mapped {@link ByteBuffer}. */
  final class ByteBufferWrapper implements CustomByteBuffer {
    private final ByteBuffer delegate;

    /**
     * @param delegate the buffer to wrap; its position and limit delimit the view
     */
    public ByteBufferWrapper(ByteBuffer delegate) {
      this.delegate = delegate.slice().order(ByteOrder.BIG_ENDIAN);
    }

    @Override
    public long length() {
      return delegate.limit();
    }

    @Override
    public CustomByteBuffer slice(long pos, long len) {
      ByteBuffer dup = delegate.duplicate();
      dup.position((int) pos);
      dup.limit((int) (pos + len));
      return new ByteBufferWrapper(dup);
    }

    @Override
    public byte get(long pos) {
      return delegate.get((int) pos);
    }

    @Override
    public void get(long pos, byte[] buffer, int offset, int length) {
      ByteBuffer dup = delegate.duplicate();
      dup.position((int) pos);
      dup.get(buffer, offset, length);
    }

    @Override
    public short getShort(long pos) {
      return delegate.getShort((int) pos);
    }

    @Override
    public int getInt(long pos) {
      return delegate.getInt((int) pos);
    }

    @Override
    public long getLong(long pos) {
      return delegate.getLong((int) pos);
    }

    @Override
    public float getFloat(long pos) {
      return delegate.getFloat((int) pos);
    }

    @Override
    public double getDouble(long pos) {
      return delegate.getDouble((int) pos);
    }
  }
}
