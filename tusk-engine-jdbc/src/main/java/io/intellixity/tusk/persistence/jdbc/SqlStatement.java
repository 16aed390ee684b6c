package io.intellixity.tusk.persistence.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Rendered SQL with positional ({@code $n}) parameters. Parameters may contain nulls. */
public record SqlStatement(String sql, List<Object> params, ExecKind execKind) {
  public enum ExecKind {
    /** Produces rows (SELECT, or DML with RETURNING). */
    QUERY,
    /** Produces an affected-row count (DDL, DML without RETURNING). */
    UPDATE
  }

  public SqlStatement {
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> params) {
    this(sql, params, ExecKind.QUERY);
  }

  public static SqlStatement update(String sql, List<Object> params) {
    return new SqlStatement(sql, params, ExecKind.UPDATE);
  }
}
