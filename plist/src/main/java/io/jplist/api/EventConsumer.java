package io.jplist.api;

/**
 * Push side of the event stream. Writers and the value-tree builder implement this interface.
 *
 * <p>Events must arrive in a well-nested order describing a single value, followed by one call to
 * {@link #finish()}. Implementations report contract violations as {@link PlistException}.
 */
public interface EventConsumer {
  /**
   * Called when an array opens.
   *
   * @param sizeHint element count if known, {@link PlistEvent#UNKNOWN_SIZE} otherwise
   */
  void onStartArray(long sizeHint) throws PlistException;

  /**
   * Called when a dictionary opens.
   *
   * @param sizeHint entry count if known, {@link PlistEvent#UNKNOWN_SIZE} otherwise
   */
  void onStartDictionary(long sizeHint) throws PlistException;

  /** Called when the innermost collection closes. */
  void onEndCollection() throws PlistException;

  /** Called for a string, including dictionary keys. */
  void onString(PlistString value) throws PlistException;

  void onBoolean(PlistBoolean value) throws PlistException;

  void onReal(PlistReal value) throws PlistException;

  void onInteger(PlistInteger value) throws PlistException;

  void onData(PlistData value) throws PlistException;

  void onDate(PlistDate value) throws PlistException;

  void onUid(PlistUid value) throws PlistException;

  /**
   * Called once after the last event.
   *
   * @throws PlistException if the stream ended before the value was complete, or the output could
   *     not be flushed
   */
  void finish() throws PlistException;

  /** Dispatches {@code event} to the matching callback. */
  default void accept(PlistEvent event) throws PlistException {
    Events.dispatch(event, this);
  }
}
