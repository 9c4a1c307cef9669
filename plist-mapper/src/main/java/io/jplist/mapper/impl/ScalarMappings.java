package io.jplist.mapper.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistEncodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistString;
import io.jplist.mapper.PlistMappingException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.LongFunction;

/** Mappings for Java scalar types, each reading exactly one plist scalar kind. */
final class ScalarMappings {
  private ScalarMappings() {}

  /**
   * @return the mapping for {@code type}, or {@code null} if it is not a scalar type
   */
  static TypeMapping forClass(Class<?> type) {
    if (type == String.class) {
      return new StringMapping();
    } else if (type == boolean.class || type == Boolean.class) {
      return new BooleanMapping(type.isPrimitive());
    } else if (type == char.class || type == Character.class) {
      return new CharMapping(type.isPrimitive());
    } else if (type == byte.class || type == Byte.class) {
      return new IntegralMapping("byte", Byte.MIN_VALUE, Byte.MAX_VALUE, v -> (byte) v, type);
    } else if (type == short.class || type == Short.class) {
      return new IntegralMapping("short", Short.MIN_VALUE, Short.MAX_VALUE, v -> (short) v, type);
    } else if (type == int.class || type == Integer.class) {
      return new IntegralMapping(
          "int", Integer.MIN_VALUE, Integer.MAX_VALUE, v -> (int) v, type);
    } else if (type == long.class || type == Long.class) {
      return new IntegralMapping("long", Long.MIN_VALUE, Long.MAX_VALUE, v -> v, type);
    } else if (type == BigInteger.class) {
      return new BigIntegerMapping();
    } else if (type == float.class || type == Float.class) {
      return new RealMapping(true, type.isPrimitive());
    } else if (type == double.class || type == Double.class) {
      return new RealMapping(false, type.isPrimitive());
    } else if (type == byte[].class) {
      return new BytesMapping();
    } else if (type == Instant.class) {
      return new InstantMapping();
    } else if (type.isEnum()) {
      return new EnumMapping(type);
    }
    return null;
  }

  private abstract static class ScalarMapping implements TypeMapping {
    private final String expected;
    private final PlistEvent.Kind kind;
    private final boolean primitive;

    ScalarMapping(String expected, PlistEvent.Kind kind, boolean primitive) {
      this.expected = expected;
      this.kind = kind;
      this.primitive = primitive;
    }

    @Override
    public final Object read(PlistEvent first, EventReader in, FieldPath path)
        throws PlistException {
      if (first.eventKind() != kind) {
        throw PlistMappingException.typeMismatch(path.toString(), expected, first);
      }
      return convert(first, path);
    }

    abstract Object convert(PlistEvent event, FieldPath path) throws PlistException;

    @Override
    public Object absentValue(FieldPath path) throws PlistMappingException {
      if (primitive) {
        throw PlistMappingException.missingField(path.toString());
      }
      return null;
    }
  }

  private static final class StringMapping extends ScalarMapping {
    StringMapping() {
      super("string", PlistEvent.Kind.STRING, false);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) {
      return ((PlistString) event).value();
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onString(PlistString.of((String) value));
    }
  }

  private static final class CharMapping extends ScalarMapping {
    CharMapping(boolean primitive) {
      super("single-character string", PlistEvent.Kind.STRING, primitive);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) throws PlistException {
      String s = ((PlistString) event).value();
      if (s.length() != 1) {
        throw PlistMappingException.typeMismatch(
            path.toString(), "single-character string", event);
      }
      return s.charAt(0);
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onString(PlistString.of(String.valueOf((char) (Character) value)));
    }
  }

  private static final class BooleanMapping extends ScalarMapping {
    BooleanMapping(boolean primitive) {
      super("boolean", PlistEvent.Kind.BOOLEAN, primitive);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) {
      return ((PlistBoolean) event).value();
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onBoolean(PlistBoolean.of((Boolean) value));
    }
  }

  private static final class IntegralMapping extends ScalarMapping {
    private final String target;
    private final long min;
    private final long max;
    private final LongFunction<Object> box;

    IntegralMapping(String target, long min, long max, LongFunction<Object> box, Class<?> type) {
      super("integer", PlistEvent.Kind.INTEGER, type.isPrimitive());
      this.target = target;
      this.min = min;
      this.max = max;
      this.box = box;
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) throws PlistException {
      PlistInteger integer = (PlistInteger) event;
      OptionalLong value = integer.asSigned();
      if (value.isEmpty() || value.getAsLong() < min || value.getAsLong() > max) {
        throw PlistMappingException.integerOverflow(path.toString(), integer, target);
      }
      return box.apply(value.getAsLong());
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onInteger(PlistInteger.of(((Number) value).longValue()));
    }
  }

  private static final class BigIntegerMapping extends ScalarMapping {
    BigIntegerMapping() {
      super("integer", PlistEvent.Kind.INTEGER, false);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) {
      return ((PlistInteger) event).value();
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      PlistInteger integer;
      try {
        integer = PlistInteger.of((BigInteger) value);
      } catch (IllegalArgumentException e) {
        throw PlistEncodeException.integerOverflow(value.toString());
      }
      out.onInteger(integer);
    }
  }

  private static final class RealMapping implements TypeMapping {
    private final boolean single;
    private final boolean primitive;

    RealMapping(boolean single, boolean primitive) {
      this.single = single;
      this.primitive = primitive;
    }

    @Override
    public Object read(PlistEvent first, EventReader in, FieldPath path) throws PlistException {
      double value =
          switch (first.eventKind()) {
            case REAL -> ((PlistReal) first).value();
            // integers widen to reals
            case INTEGER -> ((PlistInteger) first).value().doubleValue();
            default -> throw PlistMappingException.typeMismatch(path.toString(), "real", first);
          };
      return single ? (Object) (float) value : (Object) value;
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onReal(PlistReal.of(((Number) value).doubleValue()));
    }

    @Override
    public Object absentValue(FieldPath path) throws PlistMappingException {
      if (primitive) {
        throw PlistMappingException.missingField(path.toString());
      }
      return null;
    }
  }

  private static final class BytesMapping extends ScalarMapping {
    BytesMapping() {
      super("data", PlistEvent.Kind.DATA, false);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) {
      return ((PlistData) event).bytes();
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onData(PlistData.of((byte[]) value));
    }
  }

  private static final class InstantMapping extends ScalarMapping {
    InstantMapping() {
      super("date", PlistEvent.Kind.DATE, false);
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) {
      return ((PlistDate) event).toInstant();
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onDate(PlistDate.of((Instant) value));
    }
  }

  private static final class EnumMapping extends ScalarMapping {
    private final Class<?> type;
    private final Map<String, Object> constants = new HashMap<>();

    EnumMapping(Class<?> type) {
      super("string", PlistEvent.Kind.STRING, false);
      this.type = type;
      for (Object constant : type.getEnumConstants()) {
        constants.put(((Enum<?>) constant).name(), constant);
      }
    }

    @Override
    Object convert(PlistEvent event, FieldPath path) throws PlistException {
      String name = ((PlistString) event).value();
      Object constant = constants.get(name);
      if (constant == null) {
        throw PlistMappingException.invalidValue(
            path.toString(), "No constant '" + name + "' in " + type.getSimpleName());
      }
      return constant;
    }

    @Override
    public void write(Object value, EventConsumer out, FieldPath path) throws PlistException {
      out.onString(PlistString.of(((Enum<?>) value).name()));
    }
  }
}
