package io.jplist.mapper.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class FieldPathTest {

  @Test
  void rendersRoot() {
    assertTrue(FieldPath.root().isRoot());
    assertEquals("<root>", FieldPath.root().toString());
  }

  @Test
  void rendersFieldsAndIndices() {
    FieldPath items = FieldPath.root().field("items");

    assertFalse(items.isRoot());
    assertEquals("items", items.toString());
    assertEquals("items[2].count", items.index(2).field("count").toString());
    assertEquals("[0][1]", FieldPath.root().index(0).index(1).toString());
    assertEquals("[3].name", FieldPath.root().index(3).field("name").toString());
  }
}
