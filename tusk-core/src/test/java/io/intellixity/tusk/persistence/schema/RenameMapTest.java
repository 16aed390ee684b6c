package io.intellixity.tusk.persistence.schema;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RenameMapTest {
  @Test
  void keepsDeclarationOrder() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("b_old", "b");
    m.put("a_old", "a");
    RenameMap r = RenameMap.of(m);
    assertEquals(List.of(new ColumnRename("b_old", "b"), new ColumnRename("a_old", "a")), r.entries());
    assertEquals(Set.of("b_old", "a_old"), r.sources());
    assertEquals(Set.of("a", "b"), r.targets());
  }

  @Test
  void rejectsSharedTarget() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("x", "name");
    m.put("y", "name");
    assertThrows(IllegalArgumentException.class, () -> RenameMap.of(m));
  }

  @Test
  void rejectsSelfRename() {
    assertThrows(IllegalArgumentException.class, () -> RenameMap.of("name", "name"));
  }

  @Test
  void emptyForNullOrEmptyInput() {
    assertTrue(RenameMap.of(null).isEmpty());
    assertSame(RenameMap.empty(), RenameMap.of(Map.of()));
  }
}
