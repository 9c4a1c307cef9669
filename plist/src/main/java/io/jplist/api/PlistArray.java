package io.jplist.api;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/** An immutable ordered sequence of values. */
public final class PlistArray implements PlistValue, Iterable<PlistValue> {
  private static final PlistArray EMPTY = new PlistArray(List.of());

  private final List<PlistValue> elements;

  private PlistArray(List<PlistValue> elements) {
    this.elements = elements;
  }

  public static PlistArray of(PlistValue... elements) {
    return of(Arrays.asList(elements));
  }

  /**
   * @param elements the elements; copied, must not contain {@code null}
   * @return the array
   */
  public static PlistArray of(List<? extends PlistValue> elements) {
    if (elements.isEmpty()) {
      return EMPTY;
    }
    return new PlistArray(List.copyOf(elements));
  }

  public List<PlistValue> elements() {
    return elements;
  }

  public PlistValue get(int index) {
    return elements.get(index);
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<PlistValue> iterator() {
    return elements.iterator();
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PlistArray other && elements.equals(other.elements));
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return "Array" + elements;
  }
}
