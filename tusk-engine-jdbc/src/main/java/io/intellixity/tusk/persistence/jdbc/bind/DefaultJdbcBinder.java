package io.intellixity.tusk.persistence.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/** Portable JDBC fallback: nulls as untyped NULL, {@link Instant} as timestamp, enums by name. */
public class DefaultJdbcBinder implements JdbcBinder {
  @Override
  public void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(position1Based, Types.NULL);
      return;
    }
    if (value instanceof Instant i) {
      ps.setTimestamp(position1Based, Timestamp.from(i));
      return;
    }
    if (value instanceof Enum<?> e) {
      ps.setString(position1Based, e.name());
      return;
    }
    ps.setObject(position1Based, value);
  }
}
