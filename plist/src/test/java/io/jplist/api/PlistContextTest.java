package io.jplist.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PlistContextTest {
  private static final PlistDictionary SAMPLE =
      PlistDictionary.builder()
          .put("name", "jplist")
          .put("count", 3)
          .put("tags", PlistArray.of(PlistString.of("a"), PlistString.of("b")))
          .build();

  private final PlistContext context = PlistContext.create();

  @Test
  void binaryAndXmlDecodeToTheSameValue() throws Exception {
    ByteArrayOutputStream xml = new ByteArrayOutputStream();
    context.encodeXml(SAMPLE, xml);
    byte[] binary = context.encodeBinary(SAMPLE);

    assertEquals(SAMPLE, context.decode(xml.toByteArray()));
    assertEquals(SAMPLE, context.decode(binary));
    assertEquals(SAMPLE, context.decode(binary, "binary"));
    assertEquals(SAMPLE, context.decodeXml(new ByteArrayInputStream(xml.toByteArray())));
  }

  @Test
  void decodesAsciiByFallback() throws Exception {
    byte[] ascii = "{ name = jplist; }".getBytes(StandardCharsets.UTF_8);
    assertEquals(PlistDictionary.of("name", PlistString.of("jplist")), context.decode(ascii));
  }

  @Test
  void decodesFiles(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("sample.plist");
    Files.write(file, context.encodeBinary(SAMPLE));

    assertEquals(SAMPLE, context.decode(file));
  }

  @Test
  void missingFileIsAnIoError(@TempDir Path dir) {
    PlistException e =
        assertThrows(PlistException.class, () -> context.decode(dir.resolve("missing.plist")));
    assertEquals(ErrorKind.IO, e.getKind());
  }

  @Test
  void asciiIsReadOnly() {
    PlistException e =
        assertThrows(
            PlistException.class,
            () -> context.encode(SAMPLE, "ascii", new ByteArrayOutputStream()));
    assertEquals(ErrorKind.UNSUPPORTED_VALUE, e.getKind());
  }

  @Test
  void unknownFormatName() {
    PlistException e =
        assertThrows(PlistException.class, () -> context.decode(new byte[0], "json"));
    assertEquals(ErrorKind.UNSUPPORTED_VALUE, e.getKind());
  }

  @Test
  void unstableFeaturesDefaultFromSystemProperty() {
    assertFalse(PlistContext.create().options().unstableFeatures());
    System.setProperty(PlistContext.UNSTABLE_FEATURES_PROPERTY, "true");
    try {
      assertTrue(PlistContext.create().options().unstableFeatures());
      assertFalse(PlistContext.builder().unstableFeatures(false).build().options().unstableFeatures());
    } finally {
      System.clearProperty(PlistContext.UNSTABLE_FEATURES_PROPERTY);
    }
  }

  @Test
  void extendedIntegersFollowTheContext() throws Exception {
    PlistInteger big = PlistInteger.of(BigInteger.ONE.shiftLeft(80));
    PlistContext unstable = PlistContext.builder().unstableFeatures(true).build();

    byte[] encoded = unstable.encodeBinary(big);
    assertEquals(big, unstable.decode(encoded));
    assertEquals(
        ErrorKind.INTEGER_OVERFLOW,
        assertThrows(PlistException.class, () -> context.decode(encoded)).getKind());
    assertEquals(
        ErrorKind.INTEGER_OVERFLOW,
        assertThrows(PlistException.class, () -> context.encodeBinary(big)).getKind());
  }

  @Test
  void xmlLayoutFollowsTheContext() throws Exception {
    PlistContext compact =
        PlistContext.builder()
            .xmlWriteOptions(XmlWriteOptions.DEFAULT.withIndent("").withRootElement(false))
            .build();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    compact.encodeXml(PlistArray.of(PlistBoolean.TRUE), out);

    assertEquals("<array><true/></array>", out.toString(StandardCharsets.UTF_8));
  }

  @Test
  void eventLevelAccess() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Events.pipe(Plist.toEvents(SAMPLE), context.newWriter("binary", out));

    assertThat(Events.collect(context.newReader(out.toByteArray())))
        .first()
        .isEqualTo(new PlistEvent.StartDictionary(3));
    assertEquals(SAMPLE, Plist.fromEvents(context.newReader(out.toByteArray(), "binary")));
    assertEquals(SAMPLE, Plist.decode(Plist.encodeBinary(SAMPLE)));
  }
}
