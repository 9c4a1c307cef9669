package io.jplist.impl;

import java.util.ArrayDeque;
import java.util.Deque;

/** Stack of heterogeneous frames with typed access to the top element. */
final class MultiTypeStack {
  private final Deque<Object> stack;

  MultiTypeStack(int capacity) {
    stack = new ArrayDeque<>(capacity);
  }

  void push(Object value) {
    stack.push(value);
  }

  /**
   * @return the top element if it is a {@code clz}, otherwise {@code null}
   */
  <T> T peek(Class<T> clz) {
    Object v = stack.peek();
    return clz.isInstance(v) ? clz.cast(v) : null;
  }

  /**
   * Removes the top element.
   *
   * @throws IllegalStateException if the stack is empty or the top element is not a {@code clz}
   */
  <T> T pop(Class<T> clz) {
    Object v = stack.peek();
    if (!clz.isInstance(v)) {
      throw new IllegalStateException(
          "Expected " + clz.getSimpleName() + " on top of the stack but found " + v);
    }
    return clz.cast(stack.pop());
  }

  boolean isEmpty() {
    return stack.isEmpty();
  }
}
