package io.jplist.api;

import java.util.Objects;

/**
 * Layout options for XML output.
 *
 * @param indent string written once per nesting level before each element; empty disables line
 *     breaks entirely
 * @param rootElement whether to write the XML declaration, DOCTYPE and {@code <plist>} wrapper
 */
public record XmlWriteOptions(String indent, boolean rootElement) {
  public static final XmlWriteOptions DEFAULT = new XmlWriteOptions("\t", true);

  public XmlWriteOptions {
    Objects.requireNonNull(indent, "indent");
    for (int i = 0; i < indent.length(); i++) {
      char c = indent.charAt(i);
      if (c != ' ' && c != '\t') {
        throw new IllegalArgumentException("Indent may only contain spaces and tabs");
      }
    }
  }

  public XmlWriteOptions withIndent(String indent) {
    return new XmlWriteOptions(indent, rootElement);
  }

  /** Indents with {@code count} copies of {@code c}. */
  public XmlWriteOptions withIndent(char c, int count) {
    return new XmlWriteOptions(String.valueOf(c).repeat(count), rootElement);
  }

  public XmlWriteOptions withRootElement(boolean rootElement) {
    return new XmlWriteOptions(indent, rootElement);
  }
}
