package io.jplist.mapper;

import io.jplist.api.ErrorKind;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;

/**
 * Exception thrown when events do not fit the host type being read, or a host value cannot be
 * written. The {@link #getPath() path} names the offending field, e.g. {@code items[2].count}.
 */
public class PlistMappingException extends PlistException {
  private final String path;

  public PlistMappingException(ErrorKind kind, String message, String path) {
    this(kind, message, path, null);
  }

  public PlistMappingException(ErrorKind kind, String message, String path, Throwable cause) {
    super(kind, message, "path " + path, cause);
    this.path = path;
  }

  /**
   * @return the field path, {@code <root>} for the value itself
   */
  public String getPath() {
    return path;
  }

  /**
   * Creates a PlistMappingException for an event of the wrong kind.
   *
   * @param path the field path
   * @param expected description of what the host type accepts
   * @param found the event that was read instead
   * @return a new PlistMappingException instance
   */
  public static PlistMappingException typeMismatch(String path, String expected, PlistEvent found) {
    return new PlistMappingException(
        ErrorKind.TYPE_MISMATCH, "Expected " + expected + " but found " + found, path);
  }

  public static PlistMappingException missingField(String path) {
    return new PlistMappingException(
        ErrorKind.MISSING_FIELD, "Required field '" + path + "' is missing", path);
  }

  public static PlistMappingException integerOverflow(
      String path, PlistInteger value, String target) {
    return new PlistMappingException(
        ErrorKind.INTEGER_OVERFLOW, "Integer " + value.value() + " does not fit " + target, path);
  }

  public static PlistMappingException invalidValue(String path, String detail) {
    return new PlistMappingException(ErrorKind.INVALID_DATA, detail, path);
  }

  public static PlistMappingException unsupportedValue(String path, String detail) {
    return new PlistMappingException(ErrorKind.UNSUPPORTED_VALUE, detail, path);
  }
}
