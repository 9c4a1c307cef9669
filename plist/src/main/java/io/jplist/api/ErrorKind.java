package io.jplist.api;

/**
 * Classifies every failure reported by the codecs and bridges.
 *
 * <p>The kind is stable API: callers are expected to switch on it to build diagnostics instead of
 * parsing exception messages.
 */
public enum ErrorKind {
  /** The input ended before a complete structure could be read. */
  TRUNCATED_INPUT,
  /** The binary header magic or version is missing or wrong. */
  MALFORMED_HEADER,
  /** A binary trailer or object declares a byte width the format does not allow. */
  UNSUPPORTED_WIDTH,
  /** An offset-table entry points outside the object table. */
  OFFSET_OUT_OF_BOUNDS,
  /** An object index is out of range or refers to one of its own ancestors. */
  INVALID_OBJECT_REFERENCE,
  /** An integer does not fit the accepted range. */
  INTEGER_OVERFLOW,
  /** Bytes or events remain after the value is complete. */
  TRAILING_DATA,
  /** The input is structurally readable but its content is not valid. */
  INVALID_DATA,
  /** An event arrived where the nesting contract does not allow it. */
  UNEXPECTED_EVENT,
  /** The event stream ended while collections were still open. */
  UNEXPECTED_END_OF_EVENTS,
  /** The value has no representation in the target format. */
  UNSUPPORTED_VALUE,
  /** A host type expected a different event kind. */
  TYPE_MISMATCH,
  /** A required host field has no entry in the dictionary. */
  MISSING_FIELD,
  /** Reading or writing the underlying stream failed. */
  IO
}
