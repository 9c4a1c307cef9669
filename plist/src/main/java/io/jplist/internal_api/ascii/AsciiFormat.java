package io.jplist.internal_api.ascii;

import io.jplist.api.CodecOptions;
import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.PlistEncodeException;
import io.jplist.api.PlistFormat;
import io.jplist.utils.CustomByteBuffer;
import java.io.OutputStream;

/** The read-only OpenStep format. Matches any input, so it belongs last in a registry. */
public final class AsciiFormat implements PlistFormat {
  public static final String NAME = "ascii";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean matches(CustomByteBuffer input) {
    return true;
  }

  @Override
  public EventProducer newReader(CustomByteBuffer input, CodecOptions options) {
    return new AsciiPlistReader(input.toArray());
  }

  @Override
  public boolean canWrite() {
    return false;
  }

  @Override
  public EventConsumer newWriter(OutputStream output, CodecOptions options)
      throws PlistEncodeException {
    throw PlistEncodeException.unsupported(NAME, "ASCII output");
  }
}
