package io.jplist.internal_api.ascii;

import io.jplist.api.AbstractEventProducer;
import io.jplist.api.ErrorKind;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDecodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistString;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Pull-based reader for the legacy OpenStep ("ASCII") property-list format.
 *
 * <p>The format knows arrays {@code ( a, b )}, dictionaries {@code { key = value; }}, strings and
 * {@code <hex>} data. Numbers and booleans are plain strings. The separators {@code , ; =} are
 * skipped; nesting is checked by an {@link EventStructureValidator}. Offsets in errors are
 * character offsets.
 */
public final class AsciiPlistReader extends AbstractEventProducer {
  private final String text;
  private final EventStructureValidator validator = new EventStructureValidator();
  private int pos;

  public AsciiPlistReader(String text) {
    this.text = text;
    // byte order mark
    this.pos = !text.isEmpty() && text.charAt(0) == '\uFEFF' ? 1 : 0;
  }

  public AsciiPlistReader(byte[] utf8) {
    this(new String(utf8, StandardCharsets.UTF_8));
  }

  @Override
  protected PlistEvent produce() throws PlistDecodeException {
    PlistEvent event = readEvent();
    if (event == null) {
      if (!validator.isComplete()) {
        throw PlistDecodeException.truncated("ASCII property list", pos);
      }
      return null;
    }
    validator.onEvent(event);
    return event;
  }

  private PlistEvent readEvent() throws PlistDecodeException {
    while (skipWhitespaceAndComments()) {
      char c = text.charAt(pos);
      switch (c) {
        case '(':
          pos++;
          return PlistEvent.StartArray.UNKNOWN;
        case '{':
          pos++;
          return PlistEvent.StartDictionary.UNKNOWN;
        case ')':
        case '}':
          pos++;
          return PlistEvent.EndCollection.INSTANCE;
        case ',':
        case ';':
        case '=':
          pos++;
          break;
        case '"':
        case '\'':
          return readQuoted(c);
        case '<':
          return readData();
        default:
          if (isUnquotedChar(c)) {
            return readUnquoted();
          }
          throw PlistDecodeException.invalidData("Unexpected character '" + c + "'", pos);
      }
    }
    return null;
  }

  /**
   * @return {@code false} if the end of input was reached
   */
  private boolean skipWhitespaceAndComments() throws PlistDecodeException {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (text.startsWith("//", pos)) {
        int end = text.indexOf('\n', pos);
        pos = end < 0 ? text.length() : end + 1;
      } else if (text.startsWith("/*", pos)) {
        int end = text.indexOf("*/", pos + 2);
        if (end < 0) {
          throw PlistDecodeException.truncated("comment", pos);
        }
        pos = end + 2;
      } else {
        return true;
      }
    }
    return false;
  }

  private static boolean isUnquotedChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || c == '_'
        || c == '$'
        || c == '+'
        || c == '/'
        || c == ':'
        || c == '.'
        || c == '-';
  }

  private PlistString readUnquoted() {
    int start = pos;
    while (pos < text.length() && isUnquotedChar(text.charAt(pos))) {
      // a comment may follow without whitespace
      if (text.startsWith("//", pos) || text.startsWith("/*", pos)) {
        break;
      }
      pos++;
    }
    return PlistString.of(text.substring(start, pos));
  }

  private PlistString readQuoted(char quote) throws PlistDecodeException {
    int start = pos++;
    StringBuilder sb = new StringBuilder();
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == quote) {
        return PlistString.of(sb.toString());
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (pos >= text.length()) {
        break;
      }
      char e = text.charAt(pos++);
      switch (e) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'a' -> sb.append('\u0007');
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'v' -> sb.append('\u000B');
        case 'U', 'u' -> sb.append(readHexEscape());
        case '0', '1', '2', '3', '4', '5', '6', '7' -> sb.append(readOctalEscape(e));
        default -> sb.append(e);
      }
    }
    throw PlistDecodeException.truncated("quoted string", start);
  }

  private char readHexEscape() throws PlistDecodeException {
    if (pos + 4 > text.length()) {
      throw PlistDecodeException.truncated("unicode escape", pos);
    }
    int value = 0;
    for (int i = 0; i < 4; i++) {
      int digit = hexDigit(text.charAt(pos + i));
      if (digit < 0) {
        throw PlistDecodeException.invalidData(
            "Invalid unicode escape '\\U" + text.substring(pos, pos + 4) + "'", pos);
      }
      value = (value << 4) | digit;
    }
    pos += 4;
    return (char) value;
  }

  /** ASCII hex digits only; no signs or other Unicode digits. */
  private static int hexDigit(char c) {
    return c < 0x80 ? Character.digit(c, 16) : -1;
  }

  private char readOctalEscape(char first) {
    int value = first - '0';
    for (int i = 0; i < 2 && pos < text.length(); i++) {
      char c = text.charAt(pos);
      if (c < '0' || c > '7') {
        break;
      }
      value = value * 8 + (c - '0');
      pos++;
    }
    return (char) (value & 0xFF);
  }

  private PlistData readData() throws PlistDecodeException {
    int start = pos++;
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    int high = -1;
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == '>') {
        if (high >= 0) {
          throw PlistDecodeException.invalidData("Odd number of hex digits in data", start);
        }
        return PlistData.of(bytes.toByteArray());
      }
      if (Character.isWhitespace(c)) {
        continue;
      }
      int digit = hexDigit(c);
      if (digit < 0) {
        throw new PlistDecodeException(
            ErrorKind.INVALID_DATA, "Invalid hex digit '" + c + "' in data", pos - 1);
      }
      if (high < 0) {
        high = digit;
      } else {
        bytes.write((high << 4) | digit);
        high = -1;
      }
    }
    throw PlistDecodeException.truncated("data", start);
  }
}
