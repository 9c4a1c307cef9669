package io.jplist.impl;

import io.jplist.api.EventConsumer;
import io.jplist.api.EventProducer;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.Events;
import io.jplist.api.PlistArray;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistDictionary;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistScalar;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import io.jplist.api.PlistValue;
import java.util.ArrayList;

/**
 * Event consumer that assembles a {@link PlistValue} tree.
 *
 * <p>Any event sequence accepted by {@link EventStructureValidator} produces a value; everything
 * else fails with the validator's error. The result is available after {@link #finish()}.
 */
public final class ValueTreeBuilder implements EventConsumer {
  // upper bound for trusting a size hint when preallocating
  private static final int MAX_PREALLOCATION = 1024;

  private final EventStructureValidator validator = new EventStructureValidator();
  private final MultiTypeStack stack = new MultiTypeStack(16);
  private PlistValue root;
  private boolean finished;

  private static final class ArrayFrame {
    final ArrayList<PlistValue> elements;

    ArrayFrame(long sizeHint) {
      elements = new ArrayList<>((int) Math.max(0, Math.min(sizeHint, MAX_PREALLOCATION)));
    }
  }

  private static final class DictionaryFrame {
    final PlistDictionary.Builder builder = PlistDictionary.builder();
    String pendingKey;
  }

  /**
   * Drains {@code producer} into a value.
   *
   * @throws PlistException if the producer fails or its events are not well-nested
   */
  public static PlistValue build(EventProducer producer) throws PlistException {
    ValueTreeBuilder builder = new ValueTreeBuilder();
    Events.pipe(producer, builder);
    return builder.result();
  }

  /**
   * @return the completed value
   * @throws IllegalStateException if {@link #finish()} has not completed successfully
   */
  public PlistValue result() {
    if (!finished) {
      throw new IllegalStateException("Value is not complete");
    }
    return root;
  }

  @Override
  public void onStartArray(long sizeHint) throws PlistException {
    validator.onEvent(new PlistEvent.StartArray(sizeHint));
    stack.push(new ArrayFrame(sizeHint));
  }

  @Override
  public void onStartDictionary(long sizeHint) throws PlistException {
    validator.onEvent(new PlistEvent.StartDictionary(sizeHint));
    stack.push(new DictionaryFrame());
  }

  @Override
  public void onEndCollection() throws PlistException {
    validator.onEvent(PlistEvent.EndCollection.INSTANCE);
    if (stack.peek(ArrayFrame.class) != null) {
      attach(PlistArray.of(stack.pop(ArrayFrame.class).elements));
    } else {
      attach(stack.pop(DictionaryFrame.class).builder.build());
    }
  }

  @Override
  public void onString(PlistString value) throws PlistException {
    validator.onEvent(value);
    DictionaryFrame dict = stack.peek(DictionaryFrame.class);
    if (dict != null && dict.pendingKey == null) {
      dict.pendingKey = value.value();
    } else {
      attach(value);
    }
  }

  @Override
  public void onBoolean(PlistBoolean value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onReal(PlistReal value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onInteger(PlistInteger value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onData(PlistData value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onDate(PlistDate value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onUid(PlistUid value) throws PlistException {
    scalar(value);
  }

  @Override
  public void finish() throws PlistException {
    validator.onFinish();
    finished = true;
  }

  private void scalar(PlistScalar value) throws PlistException {
    validator.onEvent(value);
    attach(value);
  }

  private void attach(PlistValue value) {
    if (stack.isEmpty()) {
      root = value;
      return;
    }
    ArrayFrame array = stack.peek(ArrayFrame.class);
    if (array != null) {
      array.elements.add(value);
    } else {
      DictionaryFrame dict = stack.peek(DictionaryFrame.class);
      dict.builder.put(dict.pendingKey, value);
      dict.pendingKey = null;
    }
  }
}
