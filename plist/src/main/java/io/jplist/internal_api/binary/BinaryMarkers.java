package io.jplist.internal_api.binary;

import java.nio.charset.StandardCharsets;

/** Object markers and fixed sizes of the {@code bplist00} container. */
final class BinaryMarkers {
  static final byte[] MAGIC = "bplist00".getBytes(StandardCharsets.US_ASCII);
  static final int HEADER_SIZE = 8;
  static final int TRAILER_SIZE = 32;

  // high nibble of an object marker
  static final int TYPE_SIMPLE = 0x0;
  static final int TYPE_INT = 0x1;
  static final int TYPE_REAL = 0x2;
  static final int TYPE_DATE = 0x3;
  static final int TYPE_DATA = 0x4;
  static final int TYPE_ASCII_STRING = 0x5;
  static final int TYPE_UTF16_STRING = 0x6;
  static final int TYPE_UID = 0x8;
  static final int TYPE_ARRAY = 0xA;
  static final int TYPE_DICT = 0xD;

  static final int SIMPLE_NULL = 0x00;
  static final int SIMPLE_FALSE = 0x08;
  static final int SIMPLE_TRUE = 0x09;
  static final int SIMPLE_FILL = 0x0F;

  /** Low nibble value meaning the length follows as an integer object. */
  static final int EXTENDED_LENGTH = 0xF;

  private BinaryMarkers() {}

  static boolean isValidTableWidth(int width) {
    return width == 1 || width == 2 || width == 3 || width == 4 || width == 8;
  }

  /** Smallest of 1, 2, 4 or 8 bytes that holds the unsigned value {@code max}. */
  static int widthFor(long max) {
    if (max < 0) {
      return 8;
    } else if (max <= 0xFFL) {
      return 1;
    } else if (max <= 0xFFFFL) {
      return 2;
    } else if (max <= 0xFFFFFFFFL) {
      return 4;
    }
    return 8;
  }
}
