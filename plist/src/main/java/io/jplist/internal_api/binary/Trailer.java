package io.jplist.internal_api.binary;

import io.jplist.api.ErrorKind;
import io.jplist.api.PlistDecodeException;
import io.jplist.utils.CustomByteBuffer;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * The fixed 32-byte footer of a binary property list.
 *
 * <p>Counts and offsets are unsigned on disk; {@link #read(CustomByteBuffer)} rejects anything that
 * does not fit the buffer, so the accessors always return non-negative values.
 *
 * @param offsetSize width of an offset-table entry
 * @param refSize width of an object reference inside arrays and dictionaries
 * @param numObjects number of objects in the object table
 * @param topObject index of the root object
 * @param offsetTableStart absolute position of the offset table
 */
public record Trailer(
    int offsetSize, int refSize, long numObjects, long topObject, long offsetTableStart) {

  /**
   * Reads and validates the header magic and the trailer. The checks cover widths, offset-table
   * placement and the root index; object offsets are validated by the reader.
   *
   * @param buffer the whole input
   * @return the trailer
   * @throws PlistDecodeException if the header or trailer is invalid
   */
  public static Trailer read(CustomByteBuffer buffer) throws PlistDecodeException {
    long length = buffer.length();
    if (length < BinaryMarkers.HEADER_SIZE + BinaryMarkers.TRAILER_SIZE) {
      throw PlistDecodeException.truncated("header and trailer", length);
    }
    byte[] magic = new byte[BinaryMarkers.HEADER_SIZE];
    buffer.get(0, magic, 0, magic.length);
    for (int i = 0; i < magic.length; i++) {
      if (magic[i] != BinaryMarkers.MAGIC[i]) {
        StringBuilder found = new StringBuilder();
        for (byte b : magic) {
          found.append(b >= 0x20 && b < 0x7F ? (char) b : '?');
        }
        throw PlistDecodeException.malformedHeader(found.toString());
      }
    }

    long trailerStart = length - BinaryMarkers.TRAILER_SIZE;
    int offsetSize = buffer.get(trailerStart + 6) & 0xFF;
    int refSize = buffer.get(trailerStart + 7) & 0xFF;
    long numObjects = buffer.getLong(trailerStart + 8);
    long topObject = buffer.getLong(trailerStart + 16);
    long offsetTableStart = buffer.getLong(trailerStart + 24);

    if (!BinaryMarkers.isValidTableWidth(offsetSize)) {
      throw PlistDecodeException.unsupportedWidth("offset", offsetSize, trailerStart + 6);
    }
    if (!BinaryMarkers.isValidTableWidth(refSize)) {
      throw PlistDecodeException.unsupportedWidth("object reference", refSize, trailerStart + 7);
    }
    if (offsetTableStart < 0 || offsetTableStart > trailerStart) {
      throw PlistDecodeException.truncated("offset table", trailerStart + 24);
    }
    if (offsetTableStart < BinaryMarkers.HEADER_SIZE) {
      throw new PlistDecodeException(
          ErrorKind.OFFSET_OUT_OF_BOUNDS,
          "Offset table starts inside the header",
          trailerStart + 24);
    }
    long available = (trailerStart - offsetTableStart) / offsetSize;
    if (numObjects < 0 || numObjects > available) {
      throw PlistDecodeException.truncated("offset table", offsetTableStart);
    }
    long tableEnd = offsetTableStart + numObjects * offsetSize;
    if (tableEnd != trailerStart) {
      throw PlistDecodeException.trailingData(
          (trailerStart - tableEnd) + " byte(s) between offset table and trailer", tableEnd);
    }
    if (topObject < 0 || topObject >= numObjects) {
      throw PlistDecodeException.invalidReference(topObject, numObjects, trailerStart + 16);
    }
    return new Trailer(offsetSize, refSize, numObjects, topObject, offsetTableStart);
  }

  /** Writes the trailer, including its six leading unused bytes. */
  void write(DataOutputStream out) throws IOException {
    out.write(new byte[6]);
    out.writeByte(offsetSize);
    out.writeByte(refSize);
    out.writeLong(numObjects);
    out.writeLong(topObject);
    out.writeLong(offsetTableStart);
  }
}
