package io.intellixity.tusk.persistence.authoring;

import io.intellixity.tusk.persistence.schema.ColumnRename;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RecordShapeTest {
  @Test
  void undeclaredPrimaryKeyIsAddedAsUuid() {
    RecordShape s = RecordShape.builder("users").field("name", "string").build();
    assertEquals("id", s.primaryKey());
    assertEquals(FieldSpec.of("id", TypeIds.UUID), s.fields().get(0));
    assertEquals(2, s.fields().size());
  }

  @Test
  void declaredPrimaryKeyKeepsItsType() {
    RecordShape s = RecordShape.builder("events")
        .primaryKey("seq")
        .field("seq", "long")
        .build();
    assertEquals(1, s.fields().size());
    assertEquals("long", s.field("seq").type());
  }

  @Test
  void mergesExplicitAndFieldLevelRenames() {
    RecordShape s = RecordShape.builder("users")
        .field(FieldSpec.of("full_name", "string").renamedFrom("name"))
        .field("mail", "string")
        .rename("email", "mail")
        .build();
    assertEquals(List.of(new ColumnRename("email", "mail"), new ColumnRename("name", "full_name")),
        s.renames().entries());
  }

  @Test
  void conflictingRenamesAreRejected() {
    RecordShape.Builder b = RecordShape.builder("users")
        .field(FieldSpec.of("full_name", "string").renamedFrom("name"))
        .rename("name", "display_name");
    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void duplicateFieldIsRejected() {
    RecordShape.Builder b = RecordShape.builder("users").field("a", "int").field("a", "string");
    assertThrows(IllegalArgumentException.class, b::build);
  }

  @Test
  void typeIdsAreNormalized() {
    FieldSpec f = FieldSpec.of("age", "  INT ");
    assertEquals("int", f.type());
    assertFalse(TypeIds.isTextLike(f.type()));
    assertTrue(TypeIds.isTextLike("geometry"));
    assertTrue(TypeIds.isTextLike(null));
  }

  @Test
  void nullDefaultIsNoDefault() {
    assertFalse(FieldSpec.withDefault("age", "int", null).effectiveDefault());
    assertTrue(FieldSpec.withDefault("age", "int", 0).effectiveDefault());
  }
}
