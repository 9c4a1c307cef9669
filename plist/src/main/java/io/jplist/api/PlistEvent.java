package io.jplist.api;

/**
 * One token of the format-neutral event stream.
 *
 * <p>A well-formed stream describes exactly one value: a scalar, or a {@link StartArray} / {@link
 * StartDictionary} followed by its children and a matching {@link EndCollection}. Dictionary
 * children alternate key (always a {@link PlistString}) and value.
 */
public sealed interface PlistEvent
    permits PlistEvent.StartArray, PlistEvent.StartDictionary, PlistEvent.EndCollection, PlistScalar {

  /** Size hint value meaning the number of children is not known up front. */
  long UNKNOWN_SIZE = -1;

  /** The closed set of event kinds. */
  enum Kind {
    START_ARRAY,
    START_DICTIONARY,
    END_COLLECTION,
    STRING,
    BOOLEAN,
    REAL,
    INTEGER,
    DATA,
    DATE,
    UID
  }

  /**
   * @return the kind of this event
   */
  Kind eventKind();

  /**
   * Opens an array.
   *
   * @param sizeHint number of elements if known, otherwise {@link #UNKNOWN_SIZE}
   */
  record StartArray(long sizeHint) implements PlistEvent {
    public static final StartArray UNKNOWN = new StartArray(UNKNOWN_SIZE);

    @Override
    public Kind eventKind() {
      return Kind.START_ARRAY;
    }
  }

  /**
   * Opens a dictionary.
   *
   * @param sizeHint number of entries (not keys plus values) if known, otherwise {@link
   *     #UNKNOWN_SIZE}
   */
  record StartDictionary(long sizeHint) implements PlistEvent {
    public static final StartDictionary UNKNOWN = new StartDictionary(UNKNOWN_SIZE);

    @Override
    public Kind eventKind() {
      return Kind.START_DICTIONARY;
    }
  }

  /** Closes the innermost open collection. */
  record EndCollection() implements PlistEvent {
    public static final EndCollection INSTANCE = new EndCollection();

    @Override
    public Kind eventKind() {
      return Kind.END_COLLECTION;
    }
  }
}
