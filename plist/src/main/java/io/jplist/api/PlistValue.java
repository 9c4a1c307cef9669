package io.jplist.api;

/**
 * A property-list value: an array, a dictionary, or one of the fixed scalar kinds.
 *
 * <p>The hierarchy is closed. Consumers switch on {@link #kind()} and can rely on the compiler to
 * flag a missing case.
 */
public sealed interface PlistValue permits PlistArray, PlistDictionary, PlistScalar {

  /** The closed set of value kinds. */
  enum Kind {
    ARRAY,
    DICTIONARY,
    STRING,
    BOOLEAN,
    REAL,
    INTEGER,
    DATA,
    DATE,
    UID
  }

  /**
   * @return the kind of this value
   */
  Kind kind();
}
