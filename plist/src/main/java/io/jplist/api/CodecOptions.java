package io.jplist.api;

import java.util.Objects;

/**
 * Options handed to a {@link PlistFormat} when creating readers and writers.
 *
 * @param unstableFeatures accept integers outside [{@link Long#MIN_VALUE}, 2^64 - 1]
 * @param xml layout of XML output
 */
public record CodecOptions(boolean unstableFeatures, XmlWriteOptions xml) {
  public static final CodecOptions DEFAULT = new CodecOptions(false, XmlWriteOptions.DEFAULT);

  public CodecOptions {
    Objects.requireNonNull(xml, "xml");
  }
}
