package io.jplist.mapper.impl;

import io.jplist.api.ErrorKind;
import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistString;
import io.jplist.mapper.PlistConfigurationException;
import io.jplist.mapper.PlistMappingException;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Records and plain classes, written as dictionaries with one entry per mapped field in
 * declaration order.
 *
 * <p>Field values are decoded into a buffer first and the instance is only created once the
 * whole dictionary was read, so a failing field never leaves a partially populated object behind.
 * Records are created through their canonical constructor; classes through their no-argument
 * constructor, after which the decoded fields are assigned.
 */
final class ObjectMapping implements TypeMapping {

  /** One mapped field or record component. */
  static final class Property {
    final String key;
    final Class<?> rawType;
    final Method accessor;
    final Field field;
    final boolean ignored;
    TypeMapping mapping;

    Property(String key, Class<?> rawType, Method accessor, Field field, boolean ignored) {
      this.key = key;
      this.rawType = rawType;
      this.accessor = accessor;
      this.field = field;
      this.ignored = ignored;
    }
  }

  private final Class<?> type;
  private final boolean record;
  private final Constructor<?> constructor;
  private Property[] properties;
  private final Map<String, Integer> byKey = new HashMap<>();
  private int mappedCount;

  /** Creates a mapping whose properties are attached later through {@link #initialize}. */
  ObjectMapping(Class<?> type, Constructor<?> constructor) {
    this.type = type;
    this.record = type.isRecord();
    this.constructor = constructor;
  }

  void initialize(List<Property> props) throws PlistConfigurationException {
    this.properties = props.toArray(new Property[0]);
    for (int i = 0; i < properties.length; i++) {
      if (properties[i].ignored) {
        continue;
      }
      if (byKey.put(properties[i].key, i) != null) {
        throw PlistConfigurationException.duplicateKey(type, properties[i].key);
      }
      mappedCount++;
    }
  }

  int mappedCount() {
    return mappedCount;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    if (first.eventKind() != PlistEvent.Kind.START_DICTIONARY) {
      throw PlistMappingException.typeMismatch(path.toString(), "dictionary", first);
    }
    Object[] values = new Object[properties.length];
    boolean[] present = new boolean[properties.length];
    PlistEvent event;
    while ((event = in.next()).eventKind() != PlistEvent.Kind.END_COLLECTION) {
      String key = ((PlistString) event).value();
      Integer index = byKey.get(key);
      PlistEvent valueEvent = in.next();
      if (index == null) {
        in.skip(valueEvent);
        continue;
      }
      Property property = properties[index];
      values[index] = property.mapping.read(valueEvent, in, path.field(property.key));
      present[index] = true;
    }
    for (int i = 0; i < properties.length; i++) {
      Property property = properties[i];
      if (present[i]) {
        continue;
      }
      if (property.ignored) {
        values[i] = record ? defaultValue(property.rawType) : null;
      } else {
        values[i] = property.mapping.absentValue(path.field(property.key));
      }
    }
    return record ? newRecord(values, path) : newObject(values, present, path);
  }

  private Object newRecord(Object[] values, FieldPath path) throws PlistException {
    try {
      return constructor.newInstance(values);
    } catch (InvocationTargetException e) {
      throw new PlistMappingException(
          ErrorKind.INVALID_DATA,
          "Constructor of " + type.getSimpleName() + " rejected the values",
          path.toString(),
          e.getCause());
    } catch (IllegalArgumentException e) {
      throw PlistMappingException.invalidValue(
          path.toString(), "Decoded values do not fit " + type.getSimpleName() + ": " + e);
    } catch (ReflectiveOperationException e) {
      throw PlistConfigurationException.inaccessible(type, e);
    }
  }

  private Object newObject(Object[] values, boolean[] present, FieldPath path)
      throws PlistException {
    try {
      Object instance = constructor.newInstance();
      for (int i = 0; i < properties.length; i++) {
        // fields without an entry keep what the constructor assigned
        if (present[i] || values[i] != null) {
          properties[i].field.set(instance, values[i]);
        }
      }
      return instance;
    } catch (InvocationTargetException e) {
      throw new PlistMappingException(
          ErrorKind.INVALID_DATA,
          "Constructor of " + type.getSimpleName() + " failed",
          path.toString(),
          e.getCause());
    } catch (IllegalArgumentException e) {
      throw PlistMappingException.invalidValue(
          path.toString(), "Decoded values do not fit " + type.getSimpleName() + ": " + e);
    } catch (ReflectiveOperationException e) {
      throw PlistConfigurationException.inaccessible(type, e);
    }
  }

  @Override
  public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
    Object[] values = new Object[properties.length];
    int present = 0;
    for (int i = 0; i < properties.length; i++) {
      if (properties[i].ignored) {
        continue;
      }
      values[i] = get(properties[i], value, path);
      if (!properties[i].mapping.isAbsent(values[i])) {
        present++;
      }
    }
    out.onStartDictionary(present);
    for (int i = 0; i < properties.length; i++) {
      Property property = properties[i];
      if (property.ignored || property.mapping.isAbsent(values[i])) {
        continue;
      }
      out.onString(PlistString.of(property.key));
      property.mapping.write(values[i], out, path.field(property.key));
    }
    out.onEndCollection();
  }

  private Object get(Property property, Object target, FieldPath path) throws PlistException {
    try {
      return property.accessor != null
          ? property.accessor.invoke(target)
          : property.field.get(target);
    } catch (InvocationTargetException e) {
      throw PlistMappingException.unsupportedValue(
          path.field(property.key).toString(),
          "Accessor of " + type.getSimpleName() + " failed: " + e.getCause());
    } catch (IllegalAccessException e) {
      throw PlistConfigurationException.inaccessible(type, e);
    }
  }

  private static Object defaultValue(Class<?> type) {
    return type.isPrimitive() ? Array.get(Array.newInstance(type, 1), 0) : null;
  }
}
