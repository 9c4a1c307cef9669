package io.jplist.api;

import io.jplist.impl.ValueEventProducer;
import io.jplist.impl.ValueTreeBuilder;

/**
 * Static shortcuts over a default {@link PlistContext}. The default context reads the
 * unstable-features system property once, when this class is initialized.
 */
public final class Plist {
  private static final PlistContext DEFAULT = PlistContext.create();

  private Plist() {}

  public static PlistContext defaultContext() {
    return DEFAULT;
  }

  /** Decodes binary, XML or ASCII input, detecting the format. */
  public static PlistValue decode(byte[] input) throws PlistException {
    return DEFAULT.decode(input);
  }

  public static byte[] encodeBinary(PlistValue value) throws PlistException {
    return DEFAULT.encodeBinary(value);
  }

  /** Returns a producer emitting the events of {@code value}. */
  public static EventProducer toEvents(PlistValue value) {
    return new ValueEventProducer(value);
  }

  /** Builds a value from a well-formed event stream. */
  public static PlistValue fromEvents(EventProducer producer) throws PlistException {
    return ValueTreeBuilder.build(producer);
  }
}
