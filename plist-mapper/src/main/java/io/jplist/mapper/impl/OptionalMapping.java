package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import java.util.Optional;

/** {@code Optional<T>}: empty is written as a missing entry and read back from one. */
final class OptionalMapping implements TypeMapping {
  private final TypeMapping value;

  OptionalMapping(TypeMapping value) {
    this.value = value;
  }

  @Override
  public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
    return Optional.of(value.read(first, in, path));
  }

  @Override
  public void write(Object optional, EventConsumer out, FieldPath path) throws PlistException {
    value.write(((Optional<?>) optional).get(), out, path);
  }

  @Override
  public boolean isAbsent(Object optional) {
    return optional == null || ((Optional<?>) optional).isEmpty();
  }

  @Override
  public Object absentValue(FieldPath path) {
    return Optional.empty();
  }
}
