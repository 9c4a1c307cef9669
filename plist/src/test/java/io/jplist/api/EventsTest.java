package io.jplist.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class EventsTest {
  @Mock private EventConsumer consumer;
  @Mock private EventProducer producer;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
  }

  @Test
  void pipeDispatchesEveryKindInOrder() throws Exception {
    PlistData data = PlistData.of(new byte[] {1});
    PlistDate date = PlistDate.ofSeconds(0);
    List<PlistEvent> events =
        List.of(
            new PlistEvent.StartArray(8),
            PlistString.of("s"),
            PlistBoolean.FALSE,
            PlistReal.of(0.5),
            PlistInteger.of(3),
            data,
            date,
            PlistUid.of(4),
            new PlistEvent.StartDictionary(0),
            PlistEvent.EndCollection.INSTANCE,
            PlistEvent.EndCollection.INSTANCE);

    Events.pipe(Events.fromList(events), consumer);

    InOrder order = inOrder(consumer);
    order.verify(consumer).onStartArray(8);
    order.verify(consumer).onString(PlistString.of("s"));
    order.verify(consumer).onBoolean(PlistBoolean.FALSE);
    order.verify(consumer).onReal(PlistReal.of(0.5));
    order.verify(consumer).onInteger(PlistInteger.of(3));
    order.verify(consumer).onData(data);
    order.verify(consumer).onDate(date);
    order.verify(consumer).onUid(PlistUid.of(4));
    order.verify(consumer).onStartDictionary(0);
    order.verify(consumer, times(2)).onEndCollection();
    order.verify(consumer).finish();
    verifyNoMoreInteractions(consumer);
  }

  @Test
  void producerFailureStopsPipe() throws Exception {
    PlistDecodeException failure =
        new PlistDecodeException(ErrorKind.INVALID_DATA, "broken", 12);
    when(producer.next()).thenReturn(PlistEvent.StartArray.UNKNOWN).thenThrow(failure);

    PlistException e = assertThrows(PlistException.class, () -> Events.pipe(producer, consumer));

    assertSame(failure, e);
    verify(consumer).onStartArray(PlistEvent.UNKNOWN_SIZE);
    verify(consumer, never()).finish();
  }

  @Test
  void consumerFailurePropagates() throws Exception {
    doThrow(new PlistEncodeException(ErrorKind.UNSUPPORTED_VALUE, "no uids"))
        .when(consumer)
        .onUid(any());

    PlistException e =
        assertThrows(
            PlistException.class,
            () -> Events.pipe(Events.fromList(List.of(PlistUid.of(1))), consumer));

    assertEquals(ErrorKind.UNSUPPORTED_VALUE, e.getKind());
    verify(consumer, never()).finish();
  }

  @Test
  void fromListEndsWithNull() throws Exception {
    EventProducer replay = Events.fromList(List.of(PlistBoolean.TRUE));

    assertEquals(PlistBoolean.TRUE, replay.next());
    assertNull(replay.next());
    assertNull(replay.next());
  }

  @Test
  void collectDrainsProducer() throws Exception {
    List<PlistEvent> events =
        List.of(PlistEvent.StartArray.UNKNOWN, PlistInteger.of(1), PlistEvent.EndCollection.INSTANCE);
    assertEquals(events, Events.collect(Events.fromList(events)));
  }

  @Test
  void failedProducerCannotResume() throws Exception {
    EventProducer failing =
        new AbstractEventProducer() {
          @Override
          protected PlistEvent produce() throws PlistException {
            throw new PlistDecodeException(ErrorKind.TRUNCATED_INPUT, "cut");
          }
        };

    assertThrows(PlistDecodeException.class, failing::next);
    assertThrows(IllegalStateException.class, failing::next);
  }

  @Test
  void exceptionMessageCarriesContextAndKind() {
    PlistDecodeException e = PlistDecodeException.truncated("trailer", 40);

    assertEquals(40, e.getOffset());
    assertEquals("offset 40", e.getContext());
    assertEquals(
        "Input ends inside trailer [Context: offset 40] [Error Code: TRUNCATED_INPUT]",
        e.getMessage());
  }
}
