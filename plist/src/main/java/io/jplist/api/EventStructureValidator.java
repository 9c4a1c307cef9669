package io.jplist.api;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;

/**
 * Tracks collection nesting for a single value and rejects events that break it: non-string
 * dictionary keys, unmatched or premature {@code EndCollection}, anything after the root value
 * completes, and an end of stream while collections are still open.
 *
 * <p>Consumers call {@link #onEvent(PlistEvent)} before acting on each event and {@link
 * #onFinish()} from their own {@code finish()}.
 */
public final class EventStructureValidator {
  // one entry per open collection: true for dictionaries
  private final BooleanArrayList dictionaries = new BooleanArrayList();
  // for dictionaries: true while the next event must be a key
  private final BooleanArrayList expectingKey = new BooleanArrayList();
  private boolean rootComplete;
  private long eventCount;

  /**
   * @param event the next event
   * @throws PlistDecodeException if the event is not allowed at this position
   */
  public void onEvent(PlistEvent event) throws PlistDecodeException {
    if (rootComplete) {
      throw new PlistDecodeException(
          ErrorKind.TRAILING_DATA, "Event " + event + " after the root value completed");
    }
    eventCount++;
    int top = dictionaries.size() - 1;
    if (top >= 0 && dictionaries.getBoolean(top) && expectingKey.getBoolean(top)) {
      switch (event.eventKind()) {
        case STRING -> expectingKey.set(top, false);
        case END_COLLECTION -> close();
        default ->
            throw new PlistDecodeException(
                ErrorKind.UNEXPECTED_EVENT, "Dictionary key must be a string, got " + event);
      }
      return;
    }
    switch (event.eventKind()) {
      case START_ARRAY -> open(false);
      case START_DICTIONARY -> open(true);
      case END_COLLECTION -> {
        if (top < 0) {
          throw new PlistDecodeException(
              ErrorKind.UNEXPECTED_EVENT, "EndCollection without an open collection");
        }
        if (dictionaries.getBoolean(top)) {
          throw new PlistDecodeException(
              ErrorKind.UNEXPECTED_EVENT, "Dictionary closed after a key without a value");
        }
        close();
      }
      default -> valueCompleted();
    }
  }

  /**
   * @throws PlistDecodeException if the stream ends before the root value is complete
   */
  public void onFinish() throws PlistDecodeException {
    if (rootComplete) {
      return;
    }
    if (eventCount == 0) {
      throw new PlistDecodeException(ErrorKind.UNEXPECTED_END_OF_EVENTS, "Event stream is empty");
    }
    throw new PlistDecodeException(
        ErrorKind.UNEXPECTED_END_OF_EVENTS,
        "Event stream ended with " + dictionaries.size() + " open collection(s)");
  }

  /**
   * @return {@code true} once the root value has been completed
   */
  public boolean isComplete() {
    return rootComplete;
  }

  /**
   * @return number of currently open collections
   */
  public int depth() {
    return dictionaries.size();
  }

  /**
   * @return {@code true} if the innermost open collection is a dictionary awaiting a key
   */
  public boolean expectsKey() {
    int top = dictionaries.size() - 1;
    return top >= 0 && dictionaries.getBoolean(top) && expectingKey.getBoolean(top);
  }

  private void open(boolean dictionary) {
    dictionaries.add(dictionary);
    expectingKey.add(dictionary);
  }

  private void close() {
    int top = dictionaries.size() - 1;
    dictionaries.removeBoolean(top);
    expectingKey.removeBoolean(top);
    valueCompleted();
  }

  private void valueCompleted() {
    int top = dictionaries.size() - 1;
    if (top < 0) {
      rootComplete = true;
    } else if (dictionaries.getBoolean(top)) {
      expectingKey.set(top, true);
    }
  }
}
