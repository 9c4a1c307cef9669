package io.jplist.mapper.impl;

import io.jplist.api.ErrorKind;
import io.jplist.api.EventProducer;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.PlistDecodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;

/**
 * Pulls events for the mappings. Nesting is validated here, so mappings may rely on dictionary
 * keys being strings and collections being closed.
 */
public final class EventReader {
  private final EventProducer producer;
  private final EventStructureValidator validator = new EventStructureValidator();

  public EventReader(EventProducer producer) {
    this.producer = producer;
  }

  /**
   * @return the next event, never {@code null}
   * @throws PlistException if the producer fails, the stream ends early or breaks nesting
   */
  public PlistEvent next() throws PlistException {
    PlistEvent event = producer.next();
    if (event == null) {
      validator.onFinish();
      throw new PlistDecodeException(
          ErrorKind.UNEXPECTED_END_OF_EVENTS, "Event stream ended inside a value");
    }
    validator.onEvent(event);
    return event;
  }

  /** Consumes the rest of a value whose first event is {@code first}. */
  public void skip(PlistEvent first) throws PlistException {
    int depth = opensCollection(first) ? 1 : 0;
    while (depth > 0) {
      PlistEvent event = next();
      if (opensCollection(event)) {
        depth++;
      } else if (event.eventKind() == PlistEvent.Kind.END_COLLECTION) {
        depth--;
      }
    }
  }

  /**
   * Checks that the producer has no events left after the root value.
   *
   * @throws PlistException if it has
   */
  public void finish() throws PlistException {
    PlistEvent event = producer.next();
    if (event != null) {
      validator.onEvent(event);
    }
    validator.onFinish();
  }

  static boolean opensCollection(PlistEvent event) {
    return event.eventKind() == PlistEvent.Kind.START_ARRAY
        || event.eventKind() == PlistEvent.Kind.START_DICTIONARY;
  }
}
