package io.intellixity.tenancy.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class NameTransformerTest {

  private final NameTransformer names = new NameTransformer("team-a");

  @Test
  void roundTripsVisibleNames() {
    for (String n : List.of("model", "my model", "a:b", "", "team-b::x")) {
      assertEquals(n, names.fromInternal(names.toInternal(n)), n);
    }
  }

  @Test
  void toInternal_isIdempotent() {
    String once = names.toInternal("model");
    assertEquals("team-a::model", once);
    assertEquals(once, names.toInternal(once));
  }

  @Test
  void fromInternal_leavesForeignAndStrippedNamesAlone() {
    assertEquals("team-b::model", names.fromInternal("team-b::model"));
    assertEquals("model", names.fromInternal("model"));
    assertNull(names.fromInternal(null));
  }

  @Test
  void belongsTo_checksOwnPrefixOnly() {
    assertTrue(names.belongsTo("team-a::m"));
    assertFalse(names.belongsTo("team-ab::m"));
    assertFalse(names.belongsTo("m"));
  }
}
