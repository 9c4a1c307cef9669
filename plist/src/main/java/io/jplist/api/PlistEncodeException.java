package io.jplist.api;

import java.io.IOException;

/** Exception thrown when an event stream or value cannot be written in the requested format. */
public class PlistEncodeException extends PlistException {

  public PlistEncodeException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public PlistEncodeException(ErrorKind kind, String message, String context) {
    super(kind, message, context);
  }

  public PlistEncodeException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }

  /**
   * Creates a PlistEncodeException for a failed write to the target stream.
   *
   * @param format the format being written
   * @param cause the underlying IOException
   * @return a new PlistEncodeException instance
   */
  public static PlistEncodeException writeFailed(String format, IOException cause) {
    return new PlistEncodeException(
        ErrorKind.IO, "Failed to write " + format + " property list", cause);
  }

  /**
   * Creates a PlistEncodeException for a value the format cannot represent.
   *
   * @param format the format being written
   * @param what description of the value
   * @return a new PlistEncodeException instance
   */
  public static PlistEncodeException unsupported(String format, String what) {
    return new PlistEncodeException(
        ErrorKind.UNSUPPORTED_VALUE, what + " cannot be represented", format);
  }

  /**
   * Creates a PlistEncodeException for an integer outside the enabled range.
   *
   * @param value the offending value, as text
   * @return a new PlistEncodeException instance
   */
  public static PlistEncodeException integerOverflow(String value) {
    return new PlistEncodeException(
        ErrorKind.INTEGER_OVERFLOW,
        "Integer "
            + value
            + " is outside the 64-bit range; enable unstable features to write 128-bit integers");
  }
}
