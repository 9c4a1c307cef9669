package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.mapper.PlistMappingException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/** Java arrays other than {@code byte[]}, written as plist arrays. */
final class ArrayMapping implements TypeMapping {
  private final Class<?> componentType;
  private final TypeMapping element;

  ArrayMapping(Class<?> componentType, TypeMapping element) {
    this.componentType = componentType;
    this.element = element;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    if (first.eventKind() != PlistEvent.Kind.START_ARRAY) {
      throw PlistMappingException.typeMismatch(path.toString(), "array", first);
    }
    List<Object> items = new ArrayList<>();
    PlistEvent event;
    while ((event = in.next()).eventKind() != PlistEvent.Kind.END_COLLECTION) {
      items.add(element.read(event, in, path.index(items.size())));
    }
    Object array = Array.newInstance(componentType, items.size());
    for (int i = 0; i < items.size(); i++) {
      Array.set(array, i, items.get(i));
    }
    return array;
  }

  @Override
  public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
    int length = Array.getLength(value);
    out.onStartArray(length);
    for (int i = 0; i < length; i++) {
      Object item = Array.get(value, i);
      if (element.isAbsent(item)) {
        throw PlistMappingException.unsupportedValue(
            path.index(i).toString(), "Arrays cannot hold null or empty elements");
      }
      element.write(item, out, path.index(i));
    }
    out.onEndCollection();
  }
}
