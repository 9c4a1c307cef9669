package io.jplist.internal_api.xml;

import io.jplist.api.CodecOptions;
import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.PlistException;
import io.jplist.api.PlistFormat;
import io.jplist.utils.CustomByteBuffer;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/** The XML format. Detected by a leading {@code <?xml}, {@code <!DOCTYPE} or {@code <plist}. */
public final class XmlFormat implements PlistFormat {
  public static final String NAME = "xml";
  private static final int PROBE_LENGTH = 256;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean matches(CustomByteBuffer input) {
    int len = (int) Math.min(input.length(), PROBE_LENGTH);
    byte[] head = new byte[len];
    input.get(0, head, 0, len);
    String s = new String(head, StandardCharsets.UTF_8);
    int i = 0;
    if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
      i = 1;
    }
    while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
      i++;
    }
    return s.startsWith("<?xml", i) || s.startsWith("<!DOCTYPE", i) || s.startsWith("<plist", i);
  }

  @Override
  public EventProducer newReader(CustomByteBuffer input, CodecOptions options)
      throws PlistException {
    return new XmlPlistReader(
        new ByteArrayInputStream(input.toArray()), options.unstableFeatures());
  }

  @Override
  public EventProducer newReader(InputStream input, CodecOptions options) throws PlistException {
    return new XmlPlistReader(input, options.unstableFeatures());
  }

  @Override
  public EventConsumer newWriter(OutputStream output, CodecOptions options)
      throws PlistException {
    return new XmlPlistWriter(output, options.xml(), options.unstableFeatures());
  }
}
