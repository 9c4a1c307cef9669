package io.jplist.api;

/**
 * Exception thrown when a physical format cannot be turned into events, or when an event stream
 * does not describe a well-formed value.
 */
public class PlistDecodeException extends PlistException {
  private final long offset;

  /**
   * Constructs a new PlistDecodeException without a known input position.
   *
   * @param kind the failure classification
   * @param message the detail message
   */
  public PlistDecodeException(ErrorKind kind, String message) {
    this(kind, message, -1, null);
  }

  /**
   * Constructs a new PlistDecodeException at the given input position.
   *
   * @param kind the failure classification
   * @param message the detail message
   * @param offset the byte (or character) offset where the problem was detected, -1 if unknown
   */
  public PlistDecodeException(ErrorKind kind, String message, long offset) {
    this(kind, message, offset, null);
  }

  /**
   * Constructs a new PlistDecodeException with a cause.
   *
   * @param kind the failure classification
   * @param message the detail message
   * @param offset the input offset, -1 if unknown
   * @param cause the underlying exception
   */
  public PlistDecodeException(ErrorKind kind, String message, long offset, Throwable cause) {
    super(kind, message, offset >= 0 ? "offset " + offset : null, cause);
    this.offset = offset;
  }

  /**
   * @return the input offset the error refers to, or -1 if unknown
   */
  public long getOffset() {
    return offset;
  }

  public static PlistDecodeException truncated(String what, long offset) {
    return new PlistDecodeException(
        ErrorKind.TRUNCATED_INPUT, "Input ends inside " + what, offset);
  }

  public static PlistDecodeException malformedHeader(String found) {
    return new PlistDecodeException(
        ErrorKind.MALFORMED_HEADER, "Not a bplist00 header: '" + found + "'", 0);
  }

  public static PlistDecodeException unsupportedWidth(String field, long width, long offset) {
    return new PlistDecodeException(
        ErrorKind.UNSUPPORTED_WIDTH,
        String.format("Unsupported %s width %d", field, width),
        offset);
  }

  public static PlistDecodeException offsetOutOfBounds(long index, long objectOffset) {
    return new PlistDecodeException(
        ErrorKind.OFFSET_OUT_OF_BOUNDS,
        String.format("Object %d starts outside the object table", index),
        objectOffset);
  }

  public static PlistDecodeException invalidReference(long index, long numObjects, long offset) {
    return new PlistDecodeException(
        ErrorKind.INVALID_OBJECT_REFERENCE,
        String.format("Object reference %d is not below object count %d", index, numObjects),
        offset);
  }

  public static PlistDecodeException cyclicReference(long index, long offset) {
    return new PlistDecodeException(
        ErrorKind.INVALID_OBJECT_REFERENCE,
        String.format("Object %d references one of its own ancestors", index),
        offset);
  }

  public static PlistDecodeException integerOverflow(String detail, long offset) {
    return new PlistDecodeException(ErrorKind.INTEGER_OVERFLOW, detail, offset);
  }

  public static PlistDecodeException trailingData(String detail, long offset) {
    return new PlistDecodeException(ErrorKind.TRAILING_DATA, detail, offset);
  }

  public static PlistDecodeException invalidData(String detail, long offset) {
    return new PlistDecodeException(ErrorKind.INVALID_DATA, detail, offset);
  }
}
