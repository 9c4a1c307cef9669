package io.jplist.api;

import java.util.ArrayList;
import java.util.List;

/** Utility methods for driving and inspecting event streams. */
public final class Events {
  private Events() {}

  /**
   * Pulls every event from {@code producer}, pushes it into {@code consumer} and finally calls
   * {@link EventConsumer#finish()}.
   *
   * @throws PlistException the first error raised by either side
   */
  public static void pipe(EventProducer producer, EventConsumer consumer) throws PlistException {
    PlistEvent event;
    while ((event = producer.next()) != null) {
      dispatch(event, consumer);
    }
    consumer.finish();
  }

  /**
   * Drains {@code producer} into a list.
   *
   * @throws PlistException if the producer fails
   */
  public static List<PlistEvent> collect(EventProducer producer) throws PlistException {
    List<PlistEvent> events = new ArrayList<>();
    PlistEvent event;
    while ((event = producer.next()) != null) {
      events.add(event);
    }
    return events;
  }

  /** Replays {@code events} as a producer. The list is not checked for well-formedness. */
  public static EventProducer fromList(List<? extends PlistEvent> events) {
    List<PlistEvent> copy = List.copyOf(events);
    return new AbstractEventProducer() {
      private int index;

      @Override
      protected PlistEvent produce() {
        return index < copy.size() ? copy.get(index++) : null;
      }
    };
  }

  /** Calls the {@code consumer} callback matching the kind of {@code event}. */
  public static void dispatch(PlistEvent event, EventConsumer consumer) throws PlistException {
    switch (event.eventKind()) {
      case START_ARRAY -> consumer.onStartArray(((PlistEvent.StartArray) event).sizeHint());
      case START_DICTIONARY ->
          consumer.onStartDictionary(((PlistEvent.StartDictionary) event).sizeHint());
      case END_COLLECTION -> consumer.onEndCollection();
      case STRING -> consumer.onString((PlistString) event);
      case BOOLEAN -> consumer.onBoolean((PlistBoolean) event);
      case REAL -> consumer.onReal((PlistReal) event);
      case INTEGER -> consumer.onInteger((PlistInteger) event);
      case DATA -> consumer.onData((PlistData) event);
      case DATE -> consumer.onDate((PlistDate) event);
      case UID -> consumer.onUid((PlistUid) event);
    }
  }
}
