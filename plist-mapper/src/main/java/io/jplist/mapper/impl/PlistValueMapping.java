package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.Events;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistValue;
import io.jplist.impl.ValueEventProducer;
import io.jplist.impl.ValueTreeBuilder;
import io.jplist.mapper.PlistMappingException;

/**
 * Passes a subtree through as a {@link PlistValue}. Used for fields declared as {@code PlistValue}
 * or one of its implementations, which is how Date, Data and Uid keep their kind.
 */
final class PlistValueMapping implements TypeMapping {
  private final Class<?> type;

  PlistValueMapping(Class<?> type) {
    this.type = type;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    ValueTreeBuilder builder = new ValueTreeBuilder();
    Events.dispatch(first, builder);
    if (EventReader.opensCollection(first)) {
      int depth = 1;
      while (depth > 0) {
        PlistEvent event = in.next();
        if (EventReader.opensCollection(event)) {
          depth++;
        } else if (event.eventKind() == PlistEvent.Kind.END_COLLECTION) {
          depth--;
        }
        Events.dispatch(event, builder);
      }
    }
    builder.finish();
    PlistValue value = builder.result();
    if (!type.isInstance(value)) {
      throw PlistMappingException.typeMismatch(path.toString(), describe(type), first);
    }
    return value;
  }

  @Override
  public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
    ValueEventProducer events = new ValueEventProducer((PlistValue) value);
    PlistEvent event;
    while ((event = events.next()) != null) {
      Events.dispatch(event, out);
    }
  }

  private static String describe(Class<?> type) {
    String name = type.getSimpleName();
    return name.startsWith("Plist") ? name.substring("Plist".length()) : name;
  }
}
