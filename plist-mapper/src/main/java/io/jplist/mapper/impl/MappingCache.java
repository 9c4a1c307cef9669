package io.jplist.mapper.impl;

import io.jplist.api.PlistValue;
import io.jplist.mapper.PlistConfigurationException;
import io.jplist.mapper.PlistIgnore;
import io.jplist.mapper.PlistKey;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and caches {@link TypeMapping}s per {@link Type}. Safe for concurrent use: a mapping is
 * published only after it and everything it references are complete. Recursive types resolve to
 * the mapping under construction.
 */
public final class MappingCache {
  private static final Logger log = LoggerFactory.getLogger(MappingCache.class);

  private final Map<Type, TypeMapping> mappings = new ConcurrentHashMap<>();
  private final DynamicMapping dynamic = new DynamicMapping(this);

  /**
   * @throws PlistConfigurationException if the type cannot be mapped
   */
  public TypeMapping mappingFor(Type type) throws PlistConfigurationException {
    TypeMapping mapping = mappings.get(type);
    if (mapping != null) {
      return mapping;
    }
    Map<Type, TypeMapping> building = new HashMap<>();
    mapping = resolve(type, building);
    building.forEach(mappings::putIfAbsent);
    log.debug("Built mapping for {} ({} types resolved)", type.getTypeName(), building.size());
    return mappings.get(type);
  }

  /** Mapping for the runtime class of {@code value}, as used by untyped writes. */
  public TypeMapping mappingForValue(Object value) throws PlistConfigurationException {
    Class<?> type = value.getClass();
    if (value instanceof Enum<?> e) {
      // constants with bodies are anonymous subclasses
      type = e.getDeclaringClass();
    }
    return mappingFor(type);
  }

  int size() {
    return mappings.size();
  }

  private TypeMapping resolve(Type type, Map<Type, TypeMapping> building)
      throws PlistConfigurationException {
    TypeMapping mapping = mappings.get(type);
    if (mapping == null) {
      mapping = building.get(type);
    }
    if (mapping != null) {
      return mapping;
    }
    if (type instanceof Class<?> c) {
      mapping = resolveClass(c, building);
    } else if (type instanceof ParameterizedType p) {
      mapping = resolveParameterized(p, building);
    } else if (type instanceof GenericArrayType g) {
      Type component = g.getGenericComponentType();
      mapping = new ArrayMapping(rawClass(component), resolve(component, building));
    } else if (type instanceof WildcardType w) {
      mapping = resolve(w.getUpperBounds()[0], building);
    } else {
      throw PlistConfigurationException.unsupportedType(type, "type variables are not bound");
    }
    building.put(type, mapping);
    return mapping;
  }

  private TypeMapping resolveParameterized(ParameterizedType type, Map<Type, TypeMapping> building)
      throws PlistConfigurationException {
    Class<?> raw = (Class<?>) type.getRawType();
    Type[] args = type.getActualTypeArguments();
    if (raw == Optional.class) {
      return new OptionalMapping(resolve(args[0], building));
    } else if (Collection.class.isAssignableFrom(raw)) {
      return new CollectionMapping(raw, resolve(args[0], building));
    } else if (Map.class.isAssignableFrom(raw)) {
      Type key = args[0] instanceof WildcardType w ? w.getUpperBounds()[0] : args[0];
      if (key != String.class && key != Object.class) {
        throw PlistConfigurationException.unsupportedType(type, "dictionary keys are strings");
      }
      return new MapMapping(raw, resolve(args[1], building));
    }
    return resolveClass(raw, building);
  }

  private TypeMapping resolveClass(Class<?> type, Map<Type, TypeMapping> building)
      throws PlistConfigurationException {
    TypeMapping scalar = ScalarMappings.forClass(type);
    if (scalar != null) {
      return scalar;
    } else if (PlistValue.class.isAssignableFrom(type)) {
      return new PlistValueMapping(type);
    } else if (type == Object.class) {
      return dynamic;
    } else if (type == Optional.class) {
      return new OptionalMapping(dynamic);
    } else if (type.isArray()) {
      return new ArrayMapping(
          type.getComponentType(), resolve(type.getComponentType(), building));
    } else if (Collection.class.isAssignableFrom(type)) {
      return new CollectionMapping(type, dynamic);
    } else if (Map.class.isAssignableFrom(type)) {
      return new MapMapping(type, dynamic);
    } else if (type.isPrimitive()
        || type.isInterface()
        || Modifier.isAbstract(type.getModifiers())) {
      throw PlistConfigurationException.unsupportedType(type, "no concrete mapping");
    }
    return type.isRecord() ? resolveRecord(type, building) : resolveObject(type, building);
  }

  private ObjectMapping resolveRecord(Class<?> type, Map<Type, TypeMapping> building)
      throws PlistConfigurationException {
    RecordComponent[] components = type.getRecordComponents();
    Class<?>[] parameterTypes = new Class<?>[components.length];
    for (int i = 0; i < components.length; i++) {
      parameterTypes[i] = components[i].getType();
    }
    Constructor<?> constructor;
    try {
      constructor = type.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
    } catch (NoSuchMethodException | RuntimeException e) {
      throw PlistConfigurationException.inaccessible(type, e);
    }
    ObjectMapping mapping = new ObjectMapping(type, constructor);
    building.put(type, mapping);

    List<ObjectMapping.Property> properties = new ArrayList<>();
    for (RecordComponent component : components) {
      Method accessor = component.getAccessor();
      try {
        accessor.setAccessible(true);
      } catch (RuntimeException e) {
        throw PlistConfigurationException.inaccessible(type, e);
      }
      boolean ignored = component.isAnnotationPresent(PlistIgnore.class);
      PlistKey key = component.getAnnotation(PlistKey.class);
      ObjectMapping.Property property =
          new ObjectMapping.Property(
              key != null ? key.value() : component.getName(),
              component.getType(),
              accessor,
              null,
              ignored);
      if (!ignored) {
        property.mapping = resolve(component.getGenericType(), building);
      }
      properties.add(property);
    }
    mapping.initialize(properties);
    return mapping;
  }

  private ObjectMapping resolveObject(Class<?> type, Map<Type, TypeMapping> building)
      throws PlistConfigurationException {
    Constructor<?> constructor;
    try {
      constructor = type.getDeclaredConstructor();
      constructor.setAccessible(true);
    } catch (NoSuchMethodException e) {
      throw PlistConfigurationException.noDefaultConstructor(type);
    } catch (RuntimeException e) {
      throw PlistConfigurationException.inaccessible(type, e);
    }
    ObjectMapping mapping = new ObjectMapping(type, constructor);
    building.put(type, mapping);

    // superclass fields first
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    List<ObjectMapping.Property> properties = new ArrayList<>();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers)
            || Modifier.isTransient(modifiers)
            || field.isSynthetic()
            || field.isAnnotationPresent(PlistIgnore.class)) {
          continue;
        }
        try {
          field.setAccessible(true);
        } catch (RuntimeException e) {
          throw PlistConfigurationException.inaccessible(type, e);
        }
        PlistKey key = field.getAnnotation(PlistKey.class);
        ObjectMapping.Property property =
            new ObjectMapping.Property(
                key != null ? key.value() : field.getName(), field.getType(), null, field, false);
        property.mapping = resolve(field.getGenericType(), building);
        properties.add(property);
      }
    }
    mapping.initialize(properties);
    return mapping;
  }

  private static Class<?> rawClass(Type type) throws PlistConfigurationException {
    if (type instanceof Class<?> c) {
      return c;
    } else if (type instanceof ParameterizedType p) {
      return (Class<?>) p.getRawType();
    } else if (type instanceof GenericArrayType g) {
      return rawClass(g.getGenericComponentType()).arrayType();
    }
    throw PlistConfigurationException.unsupportedType(type, "unsupported array component");
  }
}
