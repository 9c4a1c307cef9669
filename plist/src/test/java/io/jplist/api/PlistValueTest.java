package io.jplist.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

public class PlistValueTest {

  @Test
  void integerRanges() {
    assertEquals(OptionalLong.of(-1), PlistInteger.of(-1).asSigned());
    assertEquals(OptionalLong.empty(), PlistInteger.of(-1).asUnsigned());

    PlistInteger u64Max = PlistInteger.ofUnsigned(-1L);
    assertEquals(new BigInteger("18446744073709551615"), u64Max.value());
    assertEquals(OptionalLong.empty(), u64Max.asSigned());
    assertEquals(OptionalLong.of(-1L), u64Max.asUnsigned());
    assertFalse(u64Max.isExtended());

    assertTrue(PlistInteger.of(BigInteger.ONE.shiftLeft(64)).isExtended());
    assertTrue(PlistInteger.of(BigInteger.valueOf(Long.MIN_VALUE).subtract(BigInteger.ONE))
        .isExtended());
    assertThrows(
        IllegalArgumentException.class, () -> PlistInteger.of(BigInteger.ONE.shiftLeft(127)));
  }

  @Test
  void integerEqualityIgnoresConstruction() {
    assertEquals(PlistInteger.of(5), PlistInteger.ofUnsigned(5));
    assertEquals(PlistInteger.of(5), PlistInteger.of(BigInteger.valueOf(5)));
    assertEquals(PlistInteger.of(5).hashCode(), PlistInteger.ofUnsigned(5).hashCode());
    assertNotEquals(PlistInteger.of(-1), PlistInteger.ofUnsigned(-1L));
  }

  @Test
  void integerParsing() {
    assertEquals(PlistInteger.of(255), PlistInteger.parse("0xff"));
    assertEquals(PlistInteger.of(-16), PlistInteger.parse("-0x10"));
    assertEquals(PlistInteger.of(42), PlistInteger.parse(" +42 "));
    assertEquals(PlistInteger.ofUnsigned(-1L), PlistInteger.parse("18446744073709551615"));
    assertThrows(NumberFormatException.class, () -> PlistInteger.parse("12a"));
    assertThrows(
        NumberFormatException.class,
        () -> PlistInteger.parse("170141183460469231731687303715884105728"));
  }

  @Test
  void dataIsCopiedOnTheWayInAndOut() {
    byte[] source = {1, 2, 3};
    PlistData data = PlistData.of(source);
    source[0] = 9;
    data.bytes()[1] = 9;

    assertEquals(PlistData.of(new byte[] {1, 2, 3}), data);
    assertEquals(3, data.length());
    assertEquals("Data(010203)", data.toString());
  }

  @Test
  void datesUseTheCocoaEpoch() {
    assertEquals(Instant.parse("2001-01-01T00:00:00Z"), PlistDate.ofSeconds(0).toInstant());
    assertEquals(
        PlistDate.ofSeconds(-PlistDate.EPOCH_2001_UNIX_SECONDS), PlistDate.of(Instant.EPOCH));
    assertEquals(
        Instant.parse("2001-01-01T00:00:01.500Z"), PlistDate.ofSeconds(1.5).toInstant());
    assertThrows(IllegalArgumentException.class, () -> PlistDate.ofSeconds(Double.NaN));
    assertThrows(
        IllegalArgumentException.class, () -> PlistDate.ofSeconds(Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> PlistDate.ofSeconds(1e20));
    assertThrows(IllegalArgumentException.class, () -> PlistDate.ofSeconds(-1e20));
  }

  @Test
  void extremeDatesStayPrintable() {
    PlistDate latest = PlistDate.of(Instant.MAX);
    PlistDate earliest = PlistDate.of(Instant.MIN);

    assertEquals(Instant.MAX.getEpochSecond(), latest.toInstant().getEpochSecond());
    assertEquals(Instant.MIN, earliest.toInstant());
    assertTrue(latest.toString().startsWith("Date("));
  }

  @Test
  void uidPrintsUnsigned() {
    assertEquals("Uid(18446744073709551615)", PlistUid.of(-1L).toString());
  }

  @Test
  void arrayIsImmutable() {
    PlistArray array = PlistArray.of(PlistString.of("a"), PlistBoolean.TRUE);

    assertEquals(2, array.size());
    assertEquals(PlistBoolean.TRUE, array.get(1));
    assertThrows(UnsupportedOperationException.class, () -> array.elements().add(PlistBoolean.FALSE));
    assertThat(array).containsExactly(PlistString.of("a"), PlistBoolean.TRUE);
  }

  @Test
  void dictionaryKeepsInsertionOrder() {
    PlistDictionary dict =
        PlistDictionary.builder().put("z", 1).put("a", "x").put("m", true).put("z", 2).build();

    assertThat(dict.keys()).containsExactly("z", "a", "m");
    assertEquals(PlistInteger.of(2), dict.get("z"));
    assertTrue(dict.containsKey("m"));
    assertEquals(null, dict.get("missing"));
    assertThrows(
        UnsupportedOperationException.class, () -> dict.entries().put("b", PlistBoolean.TRUE));
  }

  @Test
  void dictionaryEqualityIgnoresOrder() {
    Map<String, PlistValue> first = new LinkedHashMap<>();
    first.put("a", PlistBoolean.TRUE);
    first.put("b", PlistBoolean.FALSE);
    Map<String, PlistValue> second = new LinkedHashMap<>();
    second.put("b", PlistBoolean.FALSE);
    second.put("a", PlistBoolean.TRUE);

    assertEquals(PlistDictionary.of(first), PlistDictionary.of(second));
  }

  @Test
  void kindsMatchEventKinds() {
    assertEquals(PlistValue.Kind.STRING, PlistString.of("x").kind());
    assertEquals(PlistEvent.Kind.STRING, PlistString.of("x").eventKind());
    assertEquals(PlistValue.Kind.UID, PlistUid.of(1).kind());
    assertEquals(PlistEvent.Kind.UID, PlistUid.of(1).eventKind());
    assertEquals(PlistValue.Kind.BOOLEAN, PlistBoolean.TRUE.kind());
    assertEquals(PlistValue.Kind.REAL, PlistReal.of(1.5).kind());
    assertEquals(PlistValue.Kind.INTEGER, PlistInteger.of(1).kind());
    assertEquals(PlistValue.Kind.DATA, PlistData.of(new byte[0]).kind());
    assertEquals(PlistValue.Kind.DATE, PlistDate.ofSeconds(0).kind());
    assertEquals(PlistValue.Kind.DICTIONARY, PlistDictionary.empty().kind());
    assertEquals(PlistEvent.Kind.END_COLLECTION, PlistEvent.EndCollection.INSTANCE.eventKind());
  }
}
