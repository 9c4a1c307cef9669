package io.jplist.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.jplist.api.ErrorKind;
import io.jplist.api.Events;
import io.jplist.api.PlistArray;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistDictionary;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import io.jplist.api.PlistValue;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ValueTreeBuilderTest {
  private static final PlistEvent END = PlistEvent.EndCollection.INSTANCE;

  private static PlistValue build(PlistEvent... events) throws PlistException {
    return ValueTreeBuilder.build(Events.fromList(List.of(events)));
  }

  @Test
  void buildsNestedTree() throws Exception {
    PlistValue value =
        build(
            PlistEvent.StartDictionary.UNKNOWN,
            PlistString.of("items"),
            new PlistEvent.StartArray(2),
            PlistInteger.of(1),
            PlistUid.of(2),
            END,
            PlistString.of("ok"),
            PlistBoolean.TRUE,
            END);

    PlistValue expected =
        PlistDictionary.builder()
            .put("items", PlistArray.of(PlistInteger.of(1), PlistUid.of(2)))
            .put("ok", true)
            .build();
    assertEquals(expected, value);
  }

  @Test
  void scalarRoot() throws Exception {
    assertEquals(PlistString.of("x"), build(PlistString.of("x")));
  }

  @Test
  void duplicateKeyKeepsLastValueAtFirstPosition() throws Exception {
    PlistDictionary dict =
        (PlistDictionary)
            build(
                PlistEvent.StartDictionary.UNKNOWN,
                PlistString.of("a"),
                PlistInteger.of(1),
                PlistString.of("b"),
                PlistInteger.of(2),
                PlistString.of("a"),
                PlistInteger.of(3),
                END);

    assertEquals(List.of("a", "b"), List.copyOf(dict.keys()));
    assertEquals(PlistInteger.of(3), dict.get("a"));
  }

  @Test
  void hugeSizeHintDoesNotPreallocate() throws Exception {
    assertEquals(
        PlistArray.of(), build(new PlistEvent.StartArray(Long.MAX_VALUE), END));
  }

  @Test
  void stringValuesFollowKeys() throws Exception {
    PlistDictionary dict =
        (PlistDictionary)
            build(
                PlistEvent.StartDictionary.UNKNOWN,
                PlistString.of("k"),
                PlistString.of("v"),
                END);
    assertEquals(PlistString.of("v"), dict.get("k"));
  }

  @Test
  void malformedStreamsFail() {
    assertEquals(
        ErrorKind.UNEXPECTED_EVENT,
        assertThrows(
                PlistException.class,
                () -> build(PlistEvent.StartDictionary.UNKNOWN, PlistBoolean.TRUE, END))
            .getKind());
    assertEquals(
        ErrorKind.UNEXPECTED_END_OF_EVENTS,
        assertThrows(PlistException.class, () -> build(PlistEvent.StartArray.UNKNOWN))
            .getKind());
    assertEquals(
        ErrorKind.TRAILING_DATA,
        assertThrows(PlistException.class, () -> build(PlistBoolean.TRUE, PlistBoolean.TRUE))
            .getKind());
  }

  @Test
  void resultRequiresFinish() throws Exception {
    ValueTreeBuilder builder = new ValueTreeBuilder();
    builder.onStartArray(0);
    builder.onEndCollection();

    assertThrows(IllegalStateException.class, builder::result);
    builder.finish();
    assertEquals(PlistArray.of(), builder.result());
  }
}
