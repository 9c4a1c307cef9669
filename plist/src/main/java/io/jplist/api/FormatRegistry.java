package io.jplist.api;

import io.jplist.internal_api.ascii.AsciiFormat;
import io.jplist.internal_api.binary.BinaryFormat;
import io.jplist.internal_api.xml.XmlFormat;
import io.jplist.utils.CustomByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats known to a {@link PlistContext}, looked up by name or detected from content.
 *
 * <p>A registry is an ordinary value owned by its creator; there is no process-wide instance.
 * Detection asks formats in registration order, so catch-all formats must be registered last.
 * Instances are not thread-safe while being modified.
 */
public final class FormatRegistry {
  private static final Logger log = LoggerFactory.getLogger(FormatRegistry.class);

  private final Map<String, PlistFormat> formats = new LinkedHashMap<>();

  /**
   * @return a new registry holding the binary, XML and ASCII formats, in that detection order
   */
  public static FormatRegistry standard() {
    return new FormatRegistry()
        .register(new BinaryFormat())
        .register(new XmlFormat())
        .register(new AsciiFormat());
  }

  /** Creates an empty registry. */
  public FormatRegistry() {}

  /**
   * Adds or replaces a format under its {@link PlistFormat#name()}. A replaced format keeps its
   * detection position.
   *
   * @return this registry
   */
  public FormatRegistry register(PlistFormat format) {
    formats.put(format.name(), format);
    return this;
  }

  public Optional<PlistFormat> get(String name) {
    return Optional.ofNullable(formats.get(name));
  }

  /**
   * @throws PlistException of kind {@code UNSUPPORTED_VALUE} if no format has that name
   */
  public PlistFormat require(String name) throws PlistException {
    PlistFormat format = formats.get(name);
    if (format == null) {
      throw new PlistException(
          ErrorKind.UNSUPPORTED_VALUE,
          "Unknown property list format '" + name + "'",
          "known: " + names());
    }
    return format;
  }

  /**
   * @return the first format whose {@link PlistFormat#matches} accepts {@code input}
   * @throws PlistDecodeException of kind {@code INVALID_DATA} if none does
   */
  public PlistFormat detect(CustomByteBuffer input) throws PlistDecodeException {
    for (PlistFormat format : formats.values()) {
      if (format.matches(input)) {
        log.debug("Detected {} property list ({} bytes)", format.name(), input.length());
        return format;
      }
    }
    throw PlistDecodeException.invalidData("No registered format recognizes the input", 0);
  }

  public List<String> names() {
    return Collections.unmodifiableList(new ArrayList<>(formats.keySet()));
  }
}
