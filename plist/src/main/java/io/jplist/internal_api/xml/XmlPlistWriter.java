package io.jplist.internal_api.xml;

import io.jplist.api.ErrorKind;
import io.jplist.api.EventConsumer;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistEncodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import io.jplist.api.XmlWriteOptions;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Base64;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Event consumer writing an XML property list as events arrive. Empty collections are written as
 * empty elements, which means the start tag of a collection is held back until its first child
 * or its end.
 */
public final class XmlPlistWriter implements EventConsumer {
  private final XMLStreamWriter xml;
  private final OutputStream target;
  private final XmlWriteOptions options;
  private final boolean allowExtendedIntegers;
  private final EventStructureValidator validator = new EventStructureValidator();

  private String pendingCollection;
  private int depth;
  private boolean started;
  private boolean wroteElement;

  /**
   * @param target receives the document; flushed on {@link #finish()} but not closed
   * @param options layout options
   * @param allowExtendedIntegers accept integers outside [{@link Long#MIN_VALUE}, 2^64 - 1]
   * @throws PlistEncodeException if the XML writer cannot be created
   */
  public XmlPlistWriter(OutputStream target, XmlWriteOptions options, boolean allowExtendedIntegers)
      throws PlistEncodeException {
    this.target = target;
    this.options = options;
    this.allowExtendedIntegers = allowExtendedIntegers;
    try {
      this.xml = XMLOutputFactory.newFactory().createXMLStreamWriter(target, "UTF-8");
    } catch (XMLStreamException e) {
      throw new PlistEncodeException(ErrorKind.IO, "Cannot create XML writer", e);
    }
  }

  public XmlPlistWriter(OutputStream target) throws PlistEncodeException {
    this(target, XmlWriteOptions.DEFAULT, false);
  }

  @Override
  public void onStartArray(long sizeHint) throws PlistException {
    startCollection(new PlistEvent.StartArray(sizeHint), "array");
  }

  @Override
  public void onStartDictionary(long sizeHint) throws PlistException {
    startCollection(new PlistEvent.StartDictionary(sizeHint), "dict");
  }

  private void startCollection(PlistEvent event, String element) throws PlistException {
    validator.onEvent(event);
    try {
      beforeElement();
      pendingCollection = element;
    } catch (XMLStreamException e) {
      throw writeFailed(e);
    }
  }

  @Override
  public void onEndCollection() throws PlistException {
    validator.onEvent(PlistEvent.EndCollection.INSTANCE);
    try {
      if (pendingCollection != null) {
        newLine(depth);
        xml.writeEmptyElement(pendingCollection);
        pendingCollection = null;
      } else {
        depth--;
        newLine(depth);
        xml.writeEndElement();
      }
    } catch (XMLStreamException e) {
      throw writeFailed(e);
    }
  }

  @Override
  public void onString(PlistString value) throws PlistException {
    boolean key = validator.expectsKey();
    validator.onEvent(value);
    leaf(key ? "key" : "string", value.value());
  }

  @Override
  public void onBoolean(PlistBoolean value) throws PlistException {
    validator.onEvent(value);
    try {
      beforeElement();
      newLine(depth);
      xml.writeEmptyElement(value.value() ? "true" : "false");
    } catch (XMLStreamException e) {
      throw writeFailed(e);
    }
  }

  @Override
  public void onReal(PlistReal value) throws PlistException {
    validator.onEvent(value);
    leaf("real", XmlPlistFormatting.formatReal(value.value()));
  }

  @Override
  public void onInteger(PlistInteger value) throws PlistException {
    if (value.isExtended() && !allowExtendedIntegers) {
      throw PlistEncodeException.integerOverflow(value.value().toString());
    }
    validator.onEvent(value);
    leaf("integer", value.value().toString());
  }

  @Override
  public void onData(PlistData value) throws PlistException {
    validator.onEvent(value);
    leaf("data", Base64.getEncoder().encodeToString(value.bytes()));
  }

  @Override
  public void onDate(PlistDate value) throws PlistException {
    validator.onEvent(value);
    leaf("date", XmlPlistFormatting.formatDate(value));
  }

  @Override
  public void onUid(PlistUid value) throws PlistException {
    throw PlistEncodeException.unsupported("xml", "Uid values");
  }

  @Override
  public void finish() throws PlistException {
    validator.onFinish();
    try {
      if (options.rootElement()) {
        if (!options.indent().isEmpty()) {
          xml.writeCharacters("\n");
        }
        xml.writeEndElement();
        xml.writeCharacters("\n");
        xml.writeEndDocument();
      }
      xml.flush();
      target.flush();
    } catch (XMLStreamException e) {
      throw writeFailed(e);
    } catch (IOException e) {
      throw PlistEncodeException.writeFailed("xml", e);
    }
  }

  private void leaf(String element, String text) throws PlistException {
    try {
      beforeElement();
      newLine(depth);
      xml.writeStartElement(element);
      xml.writeCharacters(text);
      xml.writeEndElement();
    } catch (XMLStreamException e) {
      throw writeFailed(e);
    }
  }

  /** Writes the prologue before the first element and flushes a held-back collection start. */
  private void beforeElement() throws XMLStreamException {
    if (!started) {
      started = true;
      if (options.rootElement()) {
        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeCharacters("\n");
        xml.writeDTD(XmlPlistFormatting.DOCTYPE);
        xml.writeCharacters("\n");
        xml.writeStartElement("plist");
        xml.writeAttribute("version", "1.0");
      }
    }
    if (pendingCollection != null) {
      newLine(depth);
      xml.writeStartElement(pendingCollection);
      pendingCollection = null;
      depth++;
    }
  }

  private void newLine(int level) throws XMLStreamException {
    boolean first = !wroteElement;
    wroteElement = true;
    if (options.indent().isEmpty() || (first && !options.rootElement())) {
      return;
    }
    xml.writeCharacters("\n" + options.indent().repeat(level));
  }

  private static PlistEncodeException writeFailed(XMLStreamException e) {
    return new PlistEncodeException(ErrorKind.IO, "Failed to write xml property list", e);
  }
}
