package io.jplist.api;

import io.jplist.impl.PlistContextImpl;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point for decoding and encoding property lists. A context bundles the format registry,
 * XML layout and the unstable-features switch; it holds no per-call state and may be shared
 * between threads as long as its registry is not modified.
 *
 * <p>Integers outside [{@link Long#MIN_VALUE}, 2^64 - 1] are only accepted when unstable features
 * are enabled, either through {@link Builder#unstableFeatures(boolean)} or by starting the JVM
 * with {@code -Dio.jplist.unstable_features=true}. Support for them may change in minor releases.
 */
public interface PlistContext {
  /** System property providing the default of {@link Builder#unstableFeatures(boolean)}. */
  String UNSTABLE_FEATURES_PROPERTY = "io.jplist.unstable_features";

  /**
   * Creates a context with the standard formats and default settings.
   *
   * @return a new context
   */
  static PlistContext create() {
    return builder().build();
  }

  static Builder builder() {
    return new Builder();
  }

  FormatRegistry formats();

  CodecOptions options();

  /**
   * Decodes a property list, detecting its format.
   *
   * @throws PlistException if the input is malformed
   */
  PlistValue decode(byte[] input) throws PlistException;

  /**
   * Decodes a property list file, detecting its format. The file is mapped into memory.
   *
   * @throws PlistException if the file cannot be read or is malformed
   */
  PlistValue decode(Path path) throws PlistException;

  /**
   * Decodes a property list in the named format.
   *
   * @throws PlistException if the format is unknown or the input is malformed
   */
  PlistValue decode(byte[] input, String format) throws PlistException;

  PlistValue decodeBinary(byte[] input) throws PlistException;

  PlistValue decodeXml(InputStream input) throws PlistException;

  byte[] encodeBinary(PlistValue value) throws PlistException;

  void encodeXml(PlistValue value, OutputStream output) throws PlistException;

  /**
   * Encodes {@code value} in the named format.
   *
   * @throws PlistException if the format is unknown or read-only, or the value cannot be
   *     represented
   */
  void encode(PlistValue value, String format, OutputStream output) throws PlistException;

  /** Creates a reader for {@code input}, detecting its format. */
  EventProducer newReader(byte[] input) throws PlistException;

  EventProducer newReader(byte[] input, String format) throws PlistException;

  EventProducer newReader(InputStream input, String format) throws PlistException;

  EventConsumer newWriter(String format, OutputStream output) throws PlistException;

  /** Builder for {@link PlistContext}. */
  final class Builder {
    private FormatRegistry formats;
    private boolean unstableFeatures = Boolean.getBoolean(UNSTABLE_FEATURES_PROPERTY);
    private XmlWriteOptions xmlWriteOptions = XmlWriteOptions.DEFAULT;

    private Builder() {}

    /** Uses {@code formats} instead of {@link FormatRegistry#standard()}. */
    public Builder formats(FormatRegistry formats) {
      this.formats = Objects.requireNonNull(formats, "formats");
      return this;
    }

    public Builder unstableFeatures(boolean enabled) {
      this.unstableFeatures = enabled;
      return this;
    }

    public Builder xmlWriteOptions(XmlWriteOptions options) {
      this.xmlWriteOptions = Objects.requireNonNull(options, "options");
      return this;
    }

    public PlistContext build() {
      return new PlistContextImpl(
          formats != null ? formats : FormatRegistry.standard(),
          new CodecOptions(unstableFeatures, xmlWriteOptions));
    }
  }
}
