package io.jplist.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CustomByteBufferTest {
  private static final byte[] BYTES = {
    0x01, 0x02, 0x03, (byte) 0xFF, (byte) 0xFE, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00
  };

  @Test
  void readsBigEndianUnsignedValuesOfAnyWidth() {
    CustomByteBuffer buffer = CustomByteBuffer.wrap(BYTES);

    assertEquals(0xFF, buffer.getUnsigned(3, 1));
    assertEquals(0xFFFE, buffer.getUnsigned(3, 2));
    assertEquals(0x0203FF, buffer.getUnsigned(1, 3));
    assertEquals(0x0102_03FFL, buffer.getUnsigned(0, 4));
    assertEquals(0xFFFE_0000_0000_00L, buffer.getUnsigned(3, 7));
    assertEquals(0xFFFE_0000_0000_0000L, buffer.getUnsigned(3, 8));
  }

  @Test
  void sliceStartsAtZero() {
    CustomByteBuffer slice = CustomByteBuffer.wrap(BYTES).slice(2, 3);

    assertEquals(3, slice.length());
    assertEquals(0x03, slice.get(0));
    assertArrayEquals(new byte[] {0x03, (byte) 0xFF, (byte) 0xFE}, slice.toArray());
    assertThrows(IndexOutOfBoundsException.class, () -> slice.get(3));
  }

  @Test
  void mapsFiles(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("data.bin");
    Files.write(file, BYTES);

    CustomByteBuffer buffer = CustomByteBuffer.map(file);

    assertEquals(BYTES.length, buffer.length());
    assertEquals(0x010203FF, buffer.getInt(0));
  }
}
