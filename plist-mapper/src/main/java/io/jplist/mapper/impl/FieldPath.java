package io.jplist.mapper.impl;

/**
 * Immutable location of a value inside the mapped tree, rendered like {@code items[2].count}. The
 * root renders as {@code <root>}.
 */
public final class FieldPath {
  private static final FieldPath ROOT = new FieldPath(null, null, -1);

  private final FieldPath parent;
  private final String name;
  private final int index;

  private FieldPath(FieldPath parent, String name, int index) {
    this.parent = parent;
    this.name = name;
    this.index = index;
  }

  public static FieldPath root() {
    return ROOT;
  }

  public FieldPath field(String name) {
    return new FieldPath(this, name, -1);
  }

  public FieldPath index(int index) {
    return new FieldPath(this, null, index);
  }

  public boolean isRoot() {
    return parent == null;
  }

  @Override
  public String toString() {
    if (isRoot()) {
      return "<root>";
    }
    StringBuilder sb = new StringBuilder();
    append(sb);
    return sb.toString();
  }

  private void append(StringBuilder sb) {
    if (isRoot()) {
      return;
    }
    parent.append(sb);
    if (name != null) {
      if (sb.length() > 0) {
        sb.append('.');
      }
      sb.append(name);
    } else {
      sb.append('[').append(index).append(']');
    }
  }
}
