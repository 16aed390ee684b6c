package io.intellixity.tusk.persistence.jdbc.postgres;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresBinderTest {
  @Test
  void homogeneousListsBecomeNativeArrays() {
    assertEquals("text", PostgresBinder.arrayElementType(List.of("a", "b")));
    assertEquals("int4", PostgresBinder.arrayElementType(List.of(1, 2)));
    assertEquals("int8", PostgresBinder.arrayElementType(Arrays.asList(null, 2L)));
    assertEquals("uuid", PostgresBinder.arrayElementType(List.of(UUID.randomUUID())));
    assertEquals("text", PostgresBinder.arrayElementType(List.of()));
  }

  @Test
  void mixedOrStructuredListsFallBackToJson() {
    assertNull(PostgresBinder.arrayElementType(List.of(1, "a")));
    assertNull(PostgresBinder.arrayElementType(List.of(Map.of("k", 1))));
  }
}
