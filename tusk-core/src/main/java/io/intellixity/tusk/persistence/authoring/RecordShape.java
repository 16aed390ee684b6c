package io.intellixity.tusk.persistence.authoring;

import io.intellixity.tusk.persistence.schema.RenameMap;

import java.util.*;

/**
 * Static description of a table-backed record type.\n
 *
 * Built once per record type at registration time; nothing is discovered by reflection.
 */
public final class RecordShape {
  public static final String DEFAULT_PRIMARY_KEY = "id";

  private final String table;
  private final String primaryKey;
  private final List<FieldSpec> fields;
  private final Map<String, FieldSpec> byName;
  private final RenameMap renames;

  private RecordShape(String table, String primaryKey, List<FieldSpec> fields, Map<String, String> explicitRenames) {
    this.table = Objects.requireNonNull(table, "table");
    this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey");
    this.fields = List.copyOf(fields);

    Map<String, FieldSpec> idx = new LinkedHashMap<>();
    for (FieldSpec f : this.fields) {
      if (idx.put(f.name(), f) != null) {
        throw new IllegalArgumentException("Duplicate field '" + f.name() + "' in shape for table '" + table + "'");
      }
    }
    this.byName = Collections.unmodifiableMap(idx);

    Map<String, String> merged = new LinkedHashMap<>(explicitRenames);
    for (FieldSpec f : this.fields) {
      if (f.renamedFrom() == null) continue;
      String prev = merged.putIfAbsent(f.renamedFrom(), f.name());
      if (prev != null && !prev.equals(f.name())) {
        throw new IllegalArgumentException("Column '" + f.renamedFrom() + "' renamed to both '" + prev + "' and '" + f.name() + "'");
      }
    }
    this.renames = RenameMap.of(merged);
  }

  public String table() { return table; }
  public String primaryKey() { return primaryKey; }
  public List<FieldSpec> fields() { return fields; }
  public RenameMap renames() { return renames; }

  public boolean hasField(String name) { return byName.containsKey(name); }

  public FieldSpec field(String name) {
    FieldSpec f = byName.get(name);
    if (f == null) throw new IllegalArgumentException("Unknown field '" + name + "' in shape for table '" + table + "'");
    return f;
  }

  public static Builder builder(String table) {
    return new Builder(table);
  }

  public static final class Builder {
    private final String table;
    private String primaryKey = DEFAULT_PRIMARY_KEY;
    private final List<FieldSpec> fields = new ArrayList<>();
    private final Map<String, String> renames = new LinkedHashMap<>();

    private Builder(String table) {
      if (table == null || table.isBlank()) throw new IllegalArgumentException("table must not be blank");
      this.table = table;
    }

    public Builder primaryKey(String primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder field(FieldSpec field) { this.fields.add(Objects.requireNonNull(field, "field")); return this; }
    public Builder field(String name, String type) { return field(FieldSpec.of(name, type)); }
    public Builder rename(String oldName, String newName) { this.renames.put(oldName, newName); return this; }

    /** A primary key not declared as a field is added first as a {@code uuid} column. */
    public RecordShape build() {
      boolean declaresKey = fields.stream().anyMatch(f -> f.name().equals(primaryKey));
      List<FieldSpec> all = new ArrayList<>(fields.size() + 1);
      if (!declaresKey) all.add(FieldSpec.of(primaryKey, TypeIds.UUID));
      all.addAll(fields);
      return new RecordShape(table, primaryKey, all, renames);
    }
  }
}
