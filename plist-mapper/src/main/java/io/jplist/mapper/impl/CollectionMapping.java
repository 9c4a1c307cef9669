package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.mapper.PlistConfigurationException;
import io.jplist.mapper.PlistMappingException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/** Lists, sets and other collections, written as arrays. */
final class CollectionMapping implements TypeMapping {
  private final Class<?> type;
  private final TypeMapping element;
  private final Supplier<Collection<Object>> factory;

  CollectionMapping(Class<?> type, TypeMapping element) throws PlistConfigurationException {
    this.type = type;
    this.element = element;
    this.factory = factoryFor(type);
  }

  @SuppressWarnings("unchecked")
  private static Supplier<Collection<Object>> factoryFor(Class<?> type)
      throws PlistConfigurationException {
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      if (SortedSet.class.isAssignableFrom(type)) {
        return TreeSet::new;
      } else if (Set.class.isAssignableFrom(type)) {
        return LinkedHashSet::new;
      }
      return ArrayList::new;
    }
    Constructor<?> constructor;
    try {
      constructor = type.getConstructor();
    } catch (NoSuchMethodException e) {
      // immutable JDK collections and the like can still be written
      return null;
    }
    return () -> {
      try {
        return (Collection<Object>) constructor.newInstance();
      } catch (ReflectiveOperationException e) {
        throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
      }
    };
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    if (first.eventKind() != PlistEvent.Kind.START_ARRAY) {
      throw PlistMappingException.typeMismatch(path.toString(), "array", first);
    }
    if (factory == null) {
      throw PlistConfigurationException.noDefaultConstructor(type);
    }
    Collection<Object> result = factory.get();
    int index = 0;
    PlistEvent event;
    while ((event = in.next()).eventKind() != PlistEvent.Kind.END_COLLECTION) {
      result.add(element.read(event, in, path.index(index++)));
    }
    return result;
  }

  @Override
  public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
    Collection<?> collection = (Collection<?>) value;
    out.onStartArray(collection.size());
    int index = 0;
    for (Object item : collection) {
      FieldPath itemPath = path.index(index++);
      if (element.isAbsent(item)) {
        throw PlistMappingException.unsupportedValue(
            itemPath.toString(), "Arrays cannot hold null or empty elements");
      }
      element.write(item, out, itemPath);
    }
    out.onEndCollection();
  }
}
