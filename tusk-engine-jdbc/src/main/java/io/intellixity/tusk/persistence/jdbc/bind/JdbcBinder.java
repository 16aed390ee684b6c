package io.intellixity.tusk.persistence.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Binds one parameter value into a prepared statement. Dialect modules supply richer binders. */
public interface JdbcBinder {
  void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException;
}
