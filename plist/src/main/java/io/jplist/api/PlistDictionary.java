package io.jplist.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable dictionary with unique string keys. Iteration follows insertion order, which is
 * also the order in which the codecs emit entries.
 */
public final class PlistDictionary implements PlistValue {
  private static final PlistDictionary EMPTY = new PlistDictionary(Collections.emptyMap());

  private final Map<String, PlistValue> entries;

  private PlistDictionary(Map<String, PlistValue> entries) {
    this.entries = entries;
  }

  public static PlistDictionary empty() {
    return EMPTY;
  }

  /**
   * @param entries source entries, copied in their iteration order
   * @return the dictionary
   */
  public static PlistDictionary of(Map<String, ? extends PlistValue> entries) {
    Builder b = builder();
    entries.forEach(b::put);
    return b.build();
  }

  public static PlistDictionary of(String key, PlistValue value) {
    return builder().put(key, value).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, PlistValue> entries() {
    return entries;
  }

  public Set<String> keys() {
    return entries.keySet();
  }

  /**
   * @return the value for {@code key}, or {@code null} if absent
   */
  public PlistValue get(String key) {
    return entries.get(key);
  }

  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Kind kind() {
    return Kind.DICTIONARY;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PlistDictionary other && entries.equals(other.entries));
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "Dictionary" + entries;
  }

  /**
   * Accumulates entries. Putting an existing key replaces its value but keeps its original
   * position.
   */
  public static final class Builder {
    private LinkedHashMap<String, PlistValue> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, PlistValue value) {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      entries.put(key, value);
      return this;
    }

    public Builder put(String key, String value) {
      return put(key, PlistString.of(value));
    }

    public Builder put(String key, long value) {
      return put(key, PlistInteger.of(value));
    }

    public Builder put(String key, boolean value) {
      return put(key, PlistBoolean.of(value));
    }

    public int size() {
      return entries.size();
    }

    public PlistDictionary build() {
      if (entries.isEmpty()) {
        return EMPTY;
      }
      PlistDictionary d = new PlistDictionary(Collections.unmodifiableMap(entries));
      entries = new LinkedHashMap<>();
      return d;
    }
  }
}
