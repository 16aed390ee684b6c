package io.intellixity.tusk.persistence.schema;

import java.util.*;

/** Ordered {@code old -> new} column renames, unique on both sides. */
public final class RenameMap {
  private static final RenameMap EMPTY = new RenameMap(List.of());

  private final List<ColumnRename> entries;
  private final Set<String> sources;
  private final Set<String> targets;

  private RenameMap(List<ColumnRename> entries) {
    this.entries = List.copyOf(entries);
    Set<String> s = new LinkedHashSet<>();
    Set<String> t = new LinkedHashSet<>();
    for (ColumnRename r : this.entries) {
      if (r.from().equals(r.to())) throw new IllegalArgumentException("Column '" + r.from() + "' renamed to itself");
      if (!s.add(r.from())) throw new IllegalArgumentException("Column '" + r.from() + "' renamed more than once");
      if (!t.add(r.to())) throw new IllegalArgumentException("Column '" + r.to() + "' is the target of more than one rename");
    }
    this.sources = Collections.unmodifiableSet(s);
    this.targets = Collections.unmodifiableSet(t);
  }

  public static RenameMap empty() { return EMPTY; }

  public static RenameMap of(Map<String, String> oldToNew) {
    if (oldToNew == null || oldToNew.isEmpty()) return EMPTY;
    List<ColumnRename> out = new ArrayList<>(oldToNew.size());
    for (Map.Entry<String, String> e : oldToNew.entrySet()) out.add(new ColumnRename(e.getKey(), e.getValue()));
    return new RenameMap(out);
  }

  public static RenameMap of(String from, String to) {
    return new RenameMap(List.of(new ColumnRename(from, to)));
  }

  public List<ColumnRename> entries() { return entries; }
  /** Old names. */
  public Set<String> sources() { return sources; }
  /** New names. */
  public Set<String> targets() { return targets; }
  public boolean isEmpty() { return entries.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RenameMap r && entries.equals(r.entries));
  }

  @Override
  public int hashCode() { return entries.hashCode(); }

  @Override
  public String toString() { return "RenameMap" + entries; }
}
