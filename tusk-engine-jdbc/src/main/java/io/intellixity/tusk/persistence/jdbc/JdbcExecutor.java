package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.exec.ConstraintViolationException;
import io.intellixity.tusk.persistence.exec.SqlExecutionException;
import io.intellixity.tusk.persistence.exec.SqlExecutor;
import io.intellixity.tusk.persistence.exec.TxHandle;
import io.intellixity.tusk.persistence.jdbc.bind.DefaultJdbcBinder;
import io.intellixity.tusk.persistence.jdbc.bind.JdbcBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * {@link SqlExecutor} over a JDBC {@link DataSource}.
 *
 * One connection per transaction; non-transactional calls borrow and close their own.
 */
public final class JdbcExecutor implements SqlExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutor.class);

  private final JdbcHandle handle;
  private final DataSource ds;
  private final JdbcBinder binder;

  public JdbcExecutor(JdbcHandle handle, JdbcBinder binder) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ds = handle.client();
    this.binder = (binder == null) ? new DefaultJdbcBinder() : binder;
  }

  public JdbcExecutor(JdbcHandle handle) {
    this(handle, null);
  }

  public JdbcHandle handle() { return handle; }

  @Override
  public TxHandle begin() {
    try {
      Connection c = ds.getConnection();
      try {
        c.setAutoCommit(false);
      } catch (SQLException e) {
        c.close();
        throw e;
      }
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      throw translate(e, "BEGIN");
    }
  }

  @Override
  public void commit(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.commit();
    } catch (SQLException e) {
      throw translate(e, "COMMIT");
    }
  }

  @Override
  public void rollback(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.rollback();
    } catch (SQLException e) {
      throw translate(e, "ROLLBACK");
    }
  }

  @Override
  public long execute(TxHandle txOrNull, String sql, List<Object> params) {
    PositionalSql.JdbcSql js = PositionalSql.toJdbc(sql, params);
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        long start = System.nanoTime();
        debugSql("EXECUTE", js);
        try (PreparedStatement ps = c.prepareStatement(js.sql())) {
          bindAll(ps, js.params());
          long n = ps.executeUpdate();
          debugDone("EXECUTE", n, System.nanoTime() - start);
          return n;
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw translate(e, sql);
    }
  }

  @Override
  public List<Map<String, Object>> fetch(TxHandle txOrNull, String sql, List<Object> params) {
    PositionalSql.JdbcSql js = PositionalSql.toJdbc(sql, params);
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        long start = System.nanoTime();
        debugSql("FETCH", js);
        try (PreparedStatement ps = c.prepareStatement(js.sql())) {
          bindAll(ps, js.params());
          try (ResultSet rs = ps.executeQuery()) {
            List<Map<String, Object>> out = readRows(rs);
            debugDone("FETCH", out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw translate(e, sql);
    }
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  /** Maps SQLSTATE class 23 to {@link ConstraintViolationException}; everything else to {@link SqlExecutionException}. */
  public static SqlExecutionException translate(SQLException e, String sql) {
    String state = e.getSQLState();
    String msg = "SQL failed (sqlState=" + state + "): " + e.getMessage();
    if (state != null && state.startsWith("23")) {
      return new ConstraintViolationException(msg, state, sql, e);
    }
    return new SqlExecutionException(msg, state, sql, e);
  }

  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    String[] labels = new String[cols];
    for (int i = 0; i < cols; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(cols * 2);
      for (int i = 0; i < cols; i++) row.put(labels[i], rs.getObject(i + 1));
      out.add(row);
    }
    return out;
  }

  private void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      binder.bind(ps, i + 1, params.get(i));
    }
  }

  private void debugSql(String op, PositionalSql.JdbcSql js) {
    if (!log.isDebugEnabled()) return;
    log.debug("tusk.jdbc op={} bindCount={} handleId={} schema={} sql={}",
        op, js.params().size(), handle.id(), handle.schema(), js.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : js.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("tusk.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tusk.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
