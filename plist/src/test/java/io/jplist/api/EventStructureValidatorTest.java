package io.jplist.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

public class EventStructureValidatorTest {
  private static final PlistEvent END = PlistEvent.EndCollection.INSTANCE;

  private static EventStructureValidator feed(PlistEvent... events) throws PlistException {
    EventStructureValidator validator = new EventStructureValidator();
    for (PlistEvent event : events) {
      validator.onEvent(event);
    }
    return validator;
  }

  private static ErrorKind failureOf(PlistEvent... events) {
    PlistException e =
        assertThrows(
            PlistException.class,
            () -> {
              EventStructureValidator validator = feed(events);
              validator.onFinish();
            });
    return e.getKind();
  }

  @Test
  void acceptsNestedValue() throws Exception {
    EventStructureValidator validator =
        feed(
            PlistEvent.StartDictionary.UNKNOWN,
            PlistString.of("list"),
            new PlistEvent.StartArray(2),
            PlistBoolean.TRUE,
            PlistEvent.StartDictionary.UNKNOWN,
            END,
            END,
            PlistString.of("n"),
            PlistInteger.of(1),
            END);

    assertTrue(validator.isComplete());
    assertEquals(0, validator.depth());
    assertDoesNotThrow(validator::onFinish);
  }

  @Test
  void scalarRootCompletesImmediately() throws Exception {
    EventStructureValidator validator = feed(PlistReal.of(1.0));
    assertTrue(validator.isComplete());
  }

  @Test
  void tracksKeyPosition() throws Exception {
    EventStructureValidator validator = feed(PlistEvent.StartDictionary.UNKNOWN);
    assertTrue(validator.expectsKey());
    validator.onEvent(PlistString.of("k"));
    assertFalse(validator.expectsKey());
    validator.onEvent(new PlistEvent.StartArray(0));
    assertFalse(validator.expectsKey());
    assertEquals(2, validator.depth());
    validator.onEvent(END);
    assertTrue(validator.expectsKey());
  }

  @Test
  void rejectsNonStringKey() {
    assertEquals(
        ErrorKind.UNEXPECTED_EVENT,
        failureOf(PlistEvent.StartDictionary.UNKNOWN, PlistInteger.of(1)));
    assertEquals(
        ErrorKind.UNEXPECTED_EVENT,
        failureOf(PlistEvent.StartDictionary.UNKNOWN, PlistEvent.StartArray.UNKNOWN));
  }

  @Test
  void rejectsDictionaryEndingAfterKey() {
    assertEquals(
        ErrorKind.UNEXPECTED_EVENT,
        failureOf(PlistEvent.StartDictionary.UNKNOWN, PlistString.of("k"), END));
  }

  @Test
  void rejectsUnmatchedEnd() {
    assertEquals(ErrorKind.UNEXPECTED_EVENT, failureOf(END));
  }

  @Test
  void rejectsEventsAfterRoot() {
    assertEquals(ErrorKind.TRAILING_DATA, failureOf(PlistBoolean.TRUE, PlistBoolean.FALSE));
    assertEquals(
        ErrorKind.TRAILING_DATA, failureOf(PlistEvent.StartArray.UNKNOWN, END, END));
  }

  @Test
  void rejectsPrematureEnd() {
    for (List<PlistEvent> events :
        List.of(
            List.<PlistEvent>of(),
            List.<PlistEvent>of(PlistEvent.StartArray.UNKNOWN),
            List.<PlistEvent>of(PlistEvent.StartDictionary.UNKNOWN, PlistString.of("k")))) {
      assertEquals(
          ErrorKind.UNEXPECTED_END_OF_EVENTS, failureOf(events.toArray(new PlistEvent[0])));
    }
  }
}
