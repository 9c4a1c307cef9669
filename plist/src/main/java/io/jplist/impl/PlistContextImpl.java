package io.jplist.impl;

import io.jplist.api.CodecOptions;
import io.jplist.api.ErrorKind;
import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.Events;
import io.jplist.api.FormatRegistry;
import io.jplist.api.PlistContext;
import io.jplist.api.PlistDecodeException;
import io.jplist.api.PlistEncodeException;
import io.jplist.api.PlistException;
import io.jplist.api.PlistFormat;
import io.jplist.api.PlistValue;
import io.jplist.internal_api.binary.BinaryFormat;
import io.jplist.internal_api.xml.XmlFormat;
import io.jplist.utils.CustomByteBuffer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/** Default {@link PlistContext}: routes every call through the registry and the value bridge. */
public final class PlistContextImpl implements PlistContext {
  private final FormatRegistry formats;
  private final CodecOptions options;

  public PlistContextImpl(FormatRegistry formats, CodecOptions options) {
    this.formats = formats;
    this.options = options;
  }

  @Override
  public FormatRegistry formats() {
    return formats;
  }

  @Override
  public CodecOptions options() {
    return options;
  }

  @Override
  public PlistValue decode(byte[] input) throws PlistException {
    return ValueTreeBuilder.build(newReader(input));
  }

  @Override
  public PlistValue decode(Path path) throws PlistException {
    CustomByteBuffer buffer;
    try {
      buffer = CustomByteBuffer.map(path);
    } catch (IOException e) {
      throw new PlistDecodeException(ErrorKind.IO, "Failed to read " + path, -1, e);
    }
    PlistFormat format = formats.detect(buffer);
    return ValueTreeBuilder.build(format.newReader(buffer, options));
  }

  @Override
  public PlistValue decode(byte[] input, String format) throws PlistException {
    return ValueTreeBuilder.build(newReader(input, format));
  }

  @Override
  public PlistValue decodeBinary(byte[] input) throws PlistException {
    return decode(input, BinaryFormat.NAME);
  }

  @Override
  public PlistValue decodeXml(InputStream input) throws PlistException {
    return ValueTreeBuilder.build(newReader(input, XmlFormat.NAME));
  }

  @Override
  public byte[] encodeBinary(PlistValue value) throws PlistException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    encode(value, BinaryFormat.NAME, out);
    return out.toByteArray();
  }

  @Override
  public void encodeXml(PlistValue value, OutputStream output) throws PlistException {
    encode(value, XmlFormat.NAME, output);
  }

  @Override
  public void encode(PlistValue value, String format, OutputStream output)
      throws PlistException {
    Events.pipe(new ValueEventProducer(value), newWriter(format, output));
  }

  @Override
  public EventProducer newReader(byte[] input) throws PlistException {
    CustomByteBuffer buffer = CustomByteBuffer.wrap(input);
    return formats.detect(buffer).newReader(buffer, options);
  }

  @Override
  public EventProducer newReader(byte[] input, String format) throws PlistException {
    return formats.require(format).newReader(CustomByteBuffer.wrap(input), options);
  }

  @Override
  public EventProducer newReader(InputStream input, String format) throws PlistException {
    return formats.require(format).newReader(input, options);
  }

  @Override
  public EventConsumer newWriter(String format, OutputStream output) throws PlistException {
    PlistFormat f = formats.require(format);
    if (!f.canWrite()) {
      throw new PlistEncodeException(
          ErrorKind.UNSUPPORTED_VALUE, "Format '" + format + "' is read-only");
    }
    return f.newWriter(output, options);
  }
}
