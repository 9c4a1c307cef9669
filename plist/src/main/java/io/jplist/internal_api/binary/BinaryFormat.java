package io.jplist.internal_api.binary;

import io.jplist.api.CodecOptions;
import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.PlistFormat;
import io.jplist.utils.CustomByteBuffer;
import java.io.OutputStream;

/** The {@code bplist00} format. Detected by its {@code bplist} magic. */
public final class BinaryFormat implements PlistFormat {
  public static final String NAME = "binary";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean matches(CustomByteBuffer input) {
    // claims every bplist version; the reader rejects all but 00
    if (input.length() < 6) {
      return false;
    }
    for (int i = 0; i < 6; i++) {
      if (input.get(i) != BinaryMarkers.MAGIC[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public EventProducer newReader(CustomByteBuffer input, CodecOptions options) {
    return new BinaryPlistReader(input, options.unstableFeatures());
  }

  @Override
  public EventConsumer newWriter(OutputStream output, CodecOptions options) {
    return new BinaryPlistWriter(output, options.unstableFeatures());
  }
}
