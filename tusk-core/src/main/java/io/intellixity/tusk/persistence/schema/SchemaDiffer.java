package io.intellixity.tusk.persistence.schema;

import io.intellixity.tusk.persistence.authoring.FieldSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes a {@link SchemaDiff} from declared fields, live columns and a rename map.\n
 *
 * Pure and stateless. Additions, type changes and removals are computed against the live columns
 * as they will look once the applicable renames have run, so a renamed column is never seen as
 * removed-then-added. Rename sources and targets are protected from removal.
 */
public final class SchemaDiffer {
  private static final Logger log = LoggerFactory.getLogger(SchemaDiffer.class);

  private final ColumnTypeMapper types;

  public SchemaDiffer(ColumnTypeMapper types) {
    this.types = Objects.requireNonNull(types, "types");
  }

  /** Renames whose old name is live and whose new name is not. */
  public List<ColumnRename> applicableRenames(List<ColumnInfo> live, RenameMap renames) {
    if (renames == null || renames.isEmpty()) return List.of();
    Set<String> liveNames = names(live);
    List<ColumnRename> out = new ArrayList<>();
    for (ColumnRename r : renames.entries()) {
      if (liveNames.contains(r.from()) && !liveNames.contains(r.to())) {
        out.add(r);
      } else if (liveNames.contains(r.from())) {
        log.warn("tusk.schema rename_skipped from={} to={} reason=target_exists", r.from(), r.to());
      }
    }
    return out;
  }

  public SchemaDiff diff(List<FieldSpec> declared, List<ColumnInfo> live, RenameMap renames) {
    List<ColumnInfo> liveCols = (live == null) ? List.of() : live;
    RenameMap rm = (renames == null) ? RenameMap.empty() : renames;
    return diff(declared, liveCols, rm, applicableRenames(liveCols, rm));
  }

  /**
   * Diff for columns read back after the renames have been committed: no rename is re-evaluated,
   * but rename sources and targets stay protected from removal.
   */
  public SchemaDiff diffAfterRenames(List<FieldSpec> declared, List<ColumnInfo> live, RenameMap renames) {
    return diff(declared, (live == null) ? List.of() : live,
        (renames == null) ? RenameMap.empty() : renames, List.of());
  }

  private SchemaDiff diff(List<FieldSpec> declared, List<ColumnInfo> liveCols, RenameMap rm,
                          List<ColumnRename> renameOps) {
    Objects.requireNonNull(declared, "declared");
    Map<String, ColumnInfo> after = afterRenames(liveCols, renameOps);

    List<FieldSpec> additions = new ArrayList<>();
    List<TypeChange> typeChanges = new ArrayList<>();
    Set<String> declaredNames = new HashSet<>();

    for (FieldSpec f : declared) {
      declaredNames.add(f.name());
      ColumnInfo col = after.get(f.name());
      if (col == null) {
        additions.add(f);
        continue;
      }
      String wanted = types.columnType(f.type());
      if (!types.sameType(wanted, col.databaseType())) {
        typeChanges.add(new TypeChange(f.name(), col.databaseType(), wanted));
      }
    }

    Set<String> protectedColumns = new HashSet<>(rm.targets());
    protectedColumns.addAll(rm.sources());

    List<String> removals = new ArrayList<>();
    for (String name : after.keySet()) {
      if (declaredNames.contains(name)) continue;
      if (protectedColumns.contains(name)) {
        log.warn("tusk.schema drop_skipped column={} reason=rename_participant", name);
        continue;
      }
      removals.add(name);
    }

    return new SchemaDiff(renameOps, additions, typeChanges, removals);
  }

  private static Map<String, ColumnInfo> afterRenames(List<ColumnInfo> live, List<ColumnRename> renames) {
    Map<String, String> oldToNew = new HashMap<>();
    for (ColumnRename r : renames) oldToNew.put(r.from(), r.to());

    Map<String, ColumnInfo> out = new LinkedHashMap<>();
    for (ColumnInfo c : live) {
      String renamed = oldToNew.get(c.name());
      if (renamed == null) out.put(c.name(), c);
      else out.put(renamed, new ColumnInfo(renamed, c.databaseType()));
    }
    return out;
  }

  private static Set<String> names(List<ColumnInfo> cols) {
    Set<String> out = new HashSet<>();
    for (ColumnInfo c : cols) out.add(c.name());
    return out;
  }
}
