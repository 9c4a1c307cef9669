package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.mapper.PlistMappingException;

/** Converts one host type to and from events. Instances are immutable once built. */
public interface TypeMapping {

  /**
   * Reads one value whose first event has already been pulled.
   *
   * @param first the first event of the value
   * @param in source of the remaining events of the value
   * @param path location of the value, for error reporting
   * @return the host value
   * @throws PlistException if the events do not fit the host type
   */
  Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException;

  /**
   * Writes {@code value}, which is neither {@code null} nor {@linkplain #isAbsent absent}.
   *
   * @throws PlistException if the value cannot be represented or the consumer rejects it
   */
  void write(Object value, EventConsumer out, FieldPath path) throws PlistException;

  /**
   * @return {@code true} if {@code value} is written as a missing dictionary entry
   */
  default boolean isAbsent(Object value) {
    return value == null;
  }

  /**
   * @return the value of a field whose key is missing from the dictionary
   * @throws PlistMappingException if the field is required
   */
  default Object absentValue(FieldPath path) throws PlistMappingException {
    return null;
  }
}
