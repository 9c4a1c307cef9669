package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistString;
import io.jplist.mapper.PlistMappingException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** {@code Map<String, V>}, written as a dictionary in iteration order. */
final class MapMapping implements TypeMapping {
  private final boolean sorted;
  private final TypeMapping value;

  MapMapping(Class<?> type, TypeMapping value) {
    this.sorted = SortedMap.class.isAssignableFrom(type);
    this.value = value;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    if (first.eventKind() != PlistEvent.Kind.START_DICTIONARY) {
      throw PlistMappingException.typeMismatch(path.toString(), "dictionary", first);
    }
    Map<String, Object> result = sorted ? new TreeMap<>() : new LinkedHashMap<>();
    PlistEvent event;
    while ((event = in.next()).eventKind() != PlistEvent.Kind.END_COLLECTION) {
      String key = ((PlistString) event).value();
      result.put(key, value.read(in.next(), in, path.field(key)));
    }
    return result;
  }

  @Override
  public void write(Object map, EventConsumer out, FieldPath path) throws PlistException {
    Map<?, ?> entries = (Map<?, ?>) map;
    int present = 0;
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw PlistMappingException.unsupportedValue(
            path.toString(), "Dictionary keys must be strings, got " + entry.getKey());
      }
      if (!value.isAbsent(entry.getValue())) {
        present++;
      }
    }
    out.onStartDictionary(present);
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (value.isAbsent(entry.getValue())) {
        continue;
      }
      String key = (String) entry.getKey();
      out.onString(PlistString.of(key));
      value.write(entry.getValue(), out, path.field(key));
    }
    out.onEndCollection();
  }
}
