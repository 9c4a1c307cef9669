package io.jplist.api;

import io.jplist.utils.CustomByteBuffer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A physical property-list encoding. Every format speaks the same event contract, so the value
 * tree and the mapper work with any registered format.
 */
public interface PlistFormat {
  /**
   * @return the registry name, e.g. {@code binary}
   */
  String name();

  /**
   * Checks whether {@code input} looks like this format. Only the first bytes are inspected.
   *
   * @param input the candidate input
   * @return {@code true} if this format should read it
   */
  boolean matches(CustomByteBuffer input);

  /**
   * Creates a reader over a complete input.
   *
   * @throws PlistException if the reader cannot be set up for this input
   */
  EventProducer newReader(CustomByteBuffer input, CodecOptions options) throws PlistException;

  /**
   * Creates a reader over a stream. The default implementation reads the whole stream first.
   *
   * @throws PlistException if the stream cannot be read
   */
  default EventProducer newReader(InputStream input, CodecOptions options) throws PlistException {
    try {
      return newReader(CustomByteBuffer.wrap(input.readAllBytes()), options);
    } catch (IOException e) {
      throw new PlistDecodeException(ErrorKind.IO, "Failed to read " + name() + " input", -1, e);
    }
  }

  /**
   * @return {@code false} for read-only formats
   */
  default boolean canWrite() {
    return true;
  }

  /**
   * Creates a writer. The writer flushes but never closes {@code output}.
   *
   * @throws PlistException if the format is read-only or the writer cannot be created
   */
  EventConsumer newWriter(OutputStream output, CodecOptions options) throws PlistException;
}
