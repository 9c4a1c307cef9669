package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistValue;
import java.util.Optional;

/**
 * Mapping for {@code Object} and raw element types. Writes choose the mapping of the runtime
 * class; reads produce a {@link PlistValue}.
 */
final class DynamicMapping implements TypeMapping {
  private final MappingCache cache;
  private final PlistValueMapping values = new PlistValueMapping(PlistValue.class);

  DynamicMapping(MappingCache cache) {
    this.cache = cache;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    return values.read(first, in, path);
  }

  @Override
  public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
    cache.mappingForValue(value).write(value, out, path);
  }

  @Override
  public boolean isAbsent(Object value) {
    return value == null || (value instanceof Optional<?> o && o.isEmpty());
  }
}
