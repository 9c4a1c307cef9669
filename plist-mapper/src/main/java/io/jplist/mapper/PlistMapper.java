package io.jplist.mapper;

import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.Plist;
import io.jplist.api.PlistContext;
import io.jplist.api.PlistException;
import io.jplist.api.PlistValue;
import io.jplist.impl.ValueTreeBuilder;
import io.jplist.mapper.impl.EventReader;
import io.jplist.mapper.impl.FieldPath;
import io.jplist.mapper.impl.MappingCache;
import io.jplist.mapper.impl.TypeMapping;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.lang.reflect.Type;

/**
 * Reads and writes Java records and classes as property lists, straight from and to the event
 * stream of any format.
 *
 * <p>Mappings are built on first use of a type and cached, so a mapper should be shared. It is
 * safe for concurrent use.
 *
 * <pre>{@code
 * record Item(String name, int count) {}
 *
 * PlistMapper mapper = new PlistMapper();
 * byte[] bytes = mapper.writeBinary(new Item("apple", 3));
 * Item item = mapper.readValue(bytes, Item.class);
 * }</pre>
 */
public final class PlistMapper {
  private static final String BINARY = "binary";
  private static final String XML = "xml";

  private final PlistContext context;
  private final MappingCache mappings = new MappingCache();

  public PlistMapper() {
    this(PlistContext.create());
  }

  public PlistMapper(PlistContext context) {
    this.context = context;
  }

  public PlistContext context() {
    return context;
  }

  @SuppressWarnings("unchecked")
  public <T> T fromEvents(EventProducer producer, Class<T> type) throws PlistException {
    return (T) fromEvents(producer, (Type) type);
  }

  /**
   * Reads exactly one value of {@code type} from {@code producer}.
   *
   * @throws PlistMappingException if the events do not fit the type
   * @throws PlistConfigurationException if the type cannot be mapped at all
   * @throws PlistException if the producer fails or the stream is not well formed
   */
  public Object fromEvents(EventProducer producer, Type type) throws PlistException {
    TypeMapping mapping = mappings.mappingFor(type);
    EventReader in = new EventReader(producer);
    Object value = mapping.read(in.next(), in, FieldPath.root());
    in.finish();
    return value;
  }

  /** Writes {@code value} using the mapping of its runtime class. */
  public void toEvents(Object value, EventConsumer consumer) throws PlistException {
    if (value == null) {
      throw PlistMappingException.unsupportedValue(
          FieldPath.root().toString(), "Cannot write a null root value");
    }
    // constants with bodies are anonymous subclasses of their enum
    Class<?> type = value instanceof Enum<?> e ? e.getDeclaringClass() : value.getClass();
    toEvents(value, type, consumer);
  }

  /**
   * Writes {@code value} as {@code type}, then {@linkplain EventConsumer#finish() finishes} the
   * consumer. Use this form for generic roots such as {@code List<Item>}.
   */
  public void toEvents(Object value, Type type, EventConsumer consumer) throws PlistException {
    TypeMapping mapping = mappings.mappingFor(type);
    if (mapping.isAbsent(value)) {
      throw PlistMappingException.unsupportedValue(
          FieldPath.root().toString(), "Cannot write an absent root value");
    }
    mapping.write(value, consumer, FieldPath.root());
    consumer.finish();
  }

  /** Reads binary, XML or ASCII input, detecting the format. */
  public <T> T readValue(byte[] input, Class<T> type) throws PlistException {
    return fromEvents(context.newReader(input), type);
  }

  public byte[] writeBinary(Object value) throws PlistException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    toEvents(value, context.newWriter(BINARY, out));
    return out.toByteArray();
  }

  public void writeXml(Object value, OutputStream output) throws PlistException {
    toEvents(value, context.newWriter(XML, output));
  }

  /** Converts {@code value} to a value tree. */
  public PlistValue toValue(Object value) throws PlistException {
    ValueTreeBuilder builder = new ValueTreeBuilder();
    toEvents(value, builder);
    return builder.result();
  }

  public <T> T fromValue(PlistValue value, Class<T> type) throws PlistException {
    return fromEvents(Plist.toEvents(value), type);
  }
}
