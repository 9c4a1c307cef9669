package io.jplist.api;

/**
 * Base exception for all property-list reading, writing and mapping errors. Provides contextual
 * information to help with debugging.
 */
public class PlistException extends Exception {
  private final ErrorKind kind;
  private final String context;

  public PlistException(ErrorKind kind, String message) {
    this(kind, message, null, null);
  }

  public PlistException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, cause);
  }

  public PlistException(ErrorKind kind, String message, String context) {
    this(kind, message, context, null);
  }

  public PlistException(ErrorKind kind, String message, String context, Throwable cause) {
    super(formatMessage(message, context, kind), cause);
    this.kind = kind;
    this.context = context;
  }

  private static String formatMessage(String message, String context, ErrorKind kind) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (kind != null) {
      sb.append(" [Error Code: ").append(kind).append("]");
    }
    return sb.toString();
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getContext() {
    return context;
  }
}
