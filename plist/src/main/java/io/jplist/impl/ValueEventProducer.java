package io.jplist.impl;

import io.jplist.api.AbstractEventProducer;
import io.jplist.api.PlistArray;
import io.jplist.api.PlistDictionary;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistScalar;
import io.jplist.api.PlistString;
import io.jplist.api.PlistValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/** Walks a {@link PlistValue} tree depth-first and emits its events. Never fails. */
public final class ValueEventProducer extends AbstractEventProducer {
  private final PlistValue root;
  private final Deque<Iterator<?>> stack = new ArrayDeque<>();
  private PlistValue pendingValue;
  private boolean started;

  public ValueEventProducer(PlistValue root) {
    this.root = root;
  }

  @Override
  protected PlistEvent produce() {
    if (!started) {
      started = true;
      return enter(root);
    }
    if (pendingValue != null) {
      PlistValue value = pendingValue;
      pendingValue = null;
      return enter(value);
    }
    Iterator<?> it = stack.peek();
    if (it == null) {
      return null;
    }
    if (!it.hasNext()) {
      stack.pop();
      return PlistEvent.EndCollection.INSTANCE;
    }
    Object next = it.next();
    if (next instanceof Map.Entry<?, ?> entry) {
      pendingValue = (PlistValue) entry.getValue();
      return PlistString.of((String) entry.getKey());
    }
    return enter((PlistValue) next);
  }

  private PlistEvent enter(PlistValue value) {
    switch (value.kind()) {
      case ARRAY:
        PlistArray array = (PlistArray) value;
        stack.push(array.iterator());
        return new PlistEvent.StartArray(array.size());
      case DICTIONARY:
        PlistDictionary dict = (PlistDictionary) value;
        stack.push(dict.entries().entrySet().iterator());
        return new PlistEvent.StartDictionary(dict.size());
      default:
        return (PlistScalar) value;
    }
  }
}
