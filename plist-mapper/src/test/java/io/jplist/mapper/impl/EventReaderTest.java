package io.jplist.mapper.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.jplist.api.ErrorKind;
import io.jplist.api.Events;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistString;
import java.util.List;
import org.junit.jupiter.api.Test;

public class EventReaderTest {
  private static final PlistEvent END = PlistEvent.EndCollection.INSTANCE;

  private static EventReader reader(PlistEvent... events) {
    return new EventReader(Events.fromList(List.of(events)));
  }

  @Test
  void skipConsumesWholeSubtree() throws Exception {
    EventReader in =
        reader(
            new PlistEvent.StartArray(2),
            PlistEvent.StartDictionary.UNKNOWN,
            PlistString.of("k"),
            new PlistEvent.StartArray(0),
            END,
            END,
            PlistInteger.of(1),
            END);

    assertEquals(new PlistEvent.StartArray(2), in.next());
    in.skip(in.next());
    // continues after the skipped dictionary
    assertEquals(PlistInteger.of(1), in.next());
  }

  @Test
  void skipOfScalarReadsNothing() throws Exception {
    EventReader in = reader(PlistBoolean.TRUE);
    PlistEvent first = in.next();

    in.skip(first);
    in.finish();
  }

  @Test
  void nextFailsAtEndOfStream() throws Exception {
    EventReader in = reader(new PlistEvent.StartArray(1));
    in.next();

    PlistException e = assertThrows(PlistException.class, in::next);
    assertEquals(ErrorKind.UNEXPECTED_END_OF_EVENTS, e.getKind());
  }

  @Test
  void emptyStreamFails() {
    PlistException e = assertThrows(PlistException.class, () -> reader().next());
    assertEquals(ErrorKind.UNEXPECTED_END_OF_EVENTS, e.getKind());
  }

  @Test
  void rejectsNonStringKeys() throws Exception {
    EventReader in = reader(PlistEvent.StartDictionary.UNKNOWN, PlistInteger.of(1));
    in.next();

    PlistException e = assertThrows(PlistException.class, in::next);
    assertEquals(ErrorKind.UNEXPECTED_EVENT, e.getKind());
  }
}
