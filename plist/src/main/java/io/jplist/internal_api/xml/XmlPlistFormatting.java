package io.jplist.internal_api.xml;

import io.jplist.api.PlistDate;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Pattern;

/** Text forms shared by the XML reader and writer. */
final class XmlPlistFormatting {
  static final String DOCTYPE =
      "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\""
          + " \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">";

  // excludes the hex and suffixed forms Double.parseDouble accepts
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)(e[+-]?\\d+)?");

  private XmlPlistFormatting() {}

  static String formatReal(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    } else if (value == Double.POSITIVE_INFINITY) {
      return "inf";
    } else if (value == Double.NEGATIVE_INFINITY) {
      return "-inf";
    }
    return Double.toString(value);
  }

  /**
   * @throws NumberFormatException if {@code text} is not a real
   */
  static double parseReal(String text) {
    String s = text.trim().toLowerCase(Locale.ROOT);
    switch (s) {
      case "nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        if (!DECIMAL.matcher(s).matches()) {
          throw new NumberFormatException("Not a real: " + text);
        }
        return Double.parseDouble(s);
    }
  }

  /** Formats whole seconds in UTC, e.g. {@code 1981-05-16T11:32:06Z}. */
  static String formatDate(PlistDate date) {
    Instant instant = date.toInstant().truncatedTo(ChronoUnit.SECONDS);
    return DateTimeFormatter.ISO_INSTANT.format(instant);
  }

  /**
   * @throws java.time.format.DateTimeParseException if {@code text} is not an ISO-8601 instant
   */
  static PlistDate parseDate(String text) {
    return PlistDate.of(Instant.parse(text.trim()));
  }
}
