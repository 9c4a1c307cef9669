package io.jplist.mapper;

import io.jplist.api.EventConsumer;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import java.util.ArrayList;
import java.util.List;

/** Consumer keeping every event it receives, in order. */
final class EventRecorder implements EventConsumer {
  final List<PlistEvent> events = new ArrayList<>();
  boolean finished;

  @Override
  public void onStartArray(long sizeHint) {
    events.add(new PlistEvent.StartArray(sizeHint));
  }

  @Override
  public void onStartDictionary(long sizeHint) {
    events.add(new PlistEvent.StartDictionary(sizeHint));
  }

  @Override
  public void onEndCollection() {
    events.add(PlistEvent.EndCollection.INSTANCE);
  }

  @Override
  public void onString(PlistString value) {
    events.add(value);
  }

  @Override
  public void onBoolean(PlistBoolean value) {
    events.add(value);
  }

  @Override
  public void onReal(PlistReal value) {
    events.add(value);
  }

  @Override
  public void onInteger(PlistInteger value) {
    events.add(value);
  }

  @Override
  public void onData(PlistData value) {
    events.add(value);
  }

  @Override
  public void onDate(PlistDate value) {
    events.add(value);
  }

  @Override
  public void onUid(PlistUid value) {
    events.add(value);
  }

  @Override
  public void finish() {
    finished = true;
  }
}
