package io.jplist.internal_api.xml;

import io.jplist.api.AbstractEventProducer;
import io.jplist.api.ErrorKind;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDecodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistString;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.regex.Pattern;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Pull-based reader for XML property lists, built on StAX. DTD processing and external entities
 * are disabled. Collections carry no size hint.
 */
public final class XmlPlistReader extends AbstractEventProducer {
  private static final Pattern INTEGER_SYNTAX =
      Pattern.compile("[+-]?(0[xX][0-9a-fA-F]+|[0-9]+)");

  private final EofTrackingInputStream input;
  private final XMLStreamReader xml;
  private final boolean allowExtendedIntegers;
  private final EventStructureValidator validator = new EventStructureValidator();
  private boolean plistElementOpen;

  /**
   * @param input the document; not closed by the reader
   * @param allowExtendedIntegers accept integers outside [{@link Long#MIN_VALUE}, 2^64 - 1]
   * @throws PlistDecodeException if the XML parser cannot be created for the input
   */
  public XmlPlistReader(InputStream input, boolean allowExtendedIntegers)
      throws PlistDecodeException {
    this.allowExtendedIntegers = allowExtendedIntegers;
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    try {
      this.input = new EofTrackingInputStream(input);
      this.xml = factory.createXMLStreamReader(this.input);
    } catch (XMLStreamException e) {
      throw new PlistDecodeException(ErrorKind.INVALID_DATA, "Malformed XML prologue", -1, e);
    }
  }

  @Override
  protected PlistEvent produce() throws PlistDecodeException {
    try {
      PlistEvent event = readEvent();
      if (event != null) {
        validator.onEvent(event);
      }
      return event;
    } catch (XMLStreamException e) {
      throw syntaxError(e);
    }
  }

  private PlistEvent readEvent() throws XMLStreamException, PlistDecodeException {
    while (xml.hasNext()) {
      int type = xml.next();
      switch (type) {
        case XMLStreamConstants.START_ELEMENT:
          PlistEvent event = startElement(xml.getLocalName());
          if (event != null) {
            return event;
          }
          break;
        case XMLStreamConstants.END_ELEMENT:
          String name = xml.getLocalName();
          if (name.equals("array") || name.equals("dict")) {
            return PlistEvent.EndCollection.INSTANCE;
          } else if (name.equals("plist")) {
            plistElementOpen = false;
          }
          break;
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
          if (!xml.getText().isBlank()) {
            throw error(ErrorKind.INVALID_DATA, "Unexpected text outside a value element");
          }
          break;
        default:
          // declarations, comments, processing instructions and whitespace
          break;
      }
    }
    if (!validator.isComplete() || plistElementOpen) {
      throw error(ErrorKind.TRUNCATED_INPUT, "Document ends before the value is complete");
    }
    return null;
  }

  private PlistEvent startElement(String name) throws XMLStreamException, PlistDecodeException {
    switch (name) {
      case "plist":
        plistElementOpen = true;
        return null;
      case "array":
        return PlistEvent.StartArray.UNKNOWN;
      case "dict":
        return PlistEvent.StartDictionary.UNKNOWN;
      case "key":
      case "string":
        return PlistString.of(xml.getElementText());
      case "true":
        requireEmpty(name);
        return PlistBoolean.TRUE;
      case "false":
        requireEmpty(name);
        return PlistBoolean.FALSE;
      case "integer":
        return parseInteger(xml.getElementText());
      case "real":
        String real = xml.getElementText();
        try {
          return PlistReal.of(XmlPlistFormatting.parseReal(real));
        } catch (NumberFormatException e) {
          throw error(ErrorKind.INVALID_DATA, "Invalid real '" + real + "'");
        }
      case "date":
        String date = xml.getElementText();
        try {
          return XmlPlistFormatting.parseDate(date);
        } catch (DateTimeParseException e) {
          throw error(ErrorKind.INVALID_DATA, "Invalid date '" + date + "'");
        }
      case "data":
        String encoded = xml.getElementText().replaceAll("\\s+", "");
        try {
          return PlistData.of(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
          throw error(ErrorKind.INVALID_DATA, "Invalid base64 data");
        }
      default:
        throw error(ErrorKind.INVALID_DATA, "Unknown element <" + name + ">");
    }
  }

  private void requireEmpty(String name) throws XMLStreamException, PlistDecodeException {
    if (!xml.getElementText().isBlank()) {
      throw error(ErrorKind.INVALID_DATA, "Element <" + name + "> must be empty");
    }
  }

  private PlistInteger parseInteger(String text) throws PlistDecodeException {
    String trimmed = text.trim();
    if (!INTEGER_SYNTAX.matcher(trimmed).matches()) {
      throw error(ErrorKind.INVALID_DATA, "Invalid integer '" + text + "'");
    }
    PlistInteger value;
    try {
      value = PlistInteger.parse(trimmed);
    } catch (NumberFormatException e) {
      throw error(ErrorKind.INTEGER_OVERFLOW, "Integer " + trimmed + " exceeds 128 bits");
    }
    if (value.isExtended() && !allowExtendedIntegers) {
      throw error(
          ErrorKind.INTEGER_OVERFLOW,
          "Integer " + trimmed + " is outside the 64-bit range; unstable features are disabled");
    }
    return value;
  }

  private PlistDecodeException error(ErrorKind kind, String message) {
    return new PlistDecodeException(kind, message, characterOffset(xml.getLocation()));
  }

  private PlistDecodeException syntaxError(XMLStreamException e) {
    // a parser failure after the input ran out means the document was cut short
    ErrorKind kind = input.reachedEnd() ? ErrorKind.TRUNCATED_INPUT : ErrorKind.INVALID_DATA;
    return new PlistDecodeException(
        kind, "Malformed XML: " + e.getMessage(), characterOffset(e.getLocation()), e);
  }

  private static long characterOffset(Location location) {
    return location == null ? -1 : location.getCharacterOffset();
  }

  /** Remembers whether the underlying stream has reported end of input. */
  private static final class EofTrackingInputStream extends FilterInputStream {
    private boolean reachedEnd;

    EofTrackingInputStream(InputStream in) {
      super(in);
    }

    boolean reachedEnd() {
      return reachedEnd;
    }

    @Override
    public int read() throws IOException {
      int b = super.read();
      reachedEnd |= b < 0;
      return b;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
      int n = super.read(buffer, offset, length);
      reachedEnd |= n < 0;
      return n;
    }
  }
}
