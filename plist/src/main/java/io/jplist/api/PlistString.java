package io.jplist.api;

import java.util.Objects;

/** A Unicode string. */
public record PlistString(String value) implements PlistScalar {
  public PlistString {
    Objects.requireNonNull(value, "value");
  }

  public static PlistString of(String value) {
    return new PlistString(value);
  }

  @Override
  public PlistValue.Kind kind() {
    return PlistValue.Kind.STRING;
  }

  @Override
  public PlistEvent.Kind eventKind() {
    return PlistEvent.Kind.STRING;
  }

  @Override
  public String toString() {
    return "String(" + value + ")";
  }
}
