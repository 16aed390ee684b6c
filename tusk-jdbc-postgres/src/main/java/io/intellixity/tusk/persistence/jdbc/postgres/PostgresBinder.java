package io.intellixity.tusk.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tusk.persistence.jdbc.bind.DefaultJdbcBinder;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Postgres-specific JDBC binding.\n
 *
 * - {@link UUID} natively\n
 * - {@link Map} as {@code jsonb}\n
 * - {@link List} as a native array when the element type is known, otherwise as {@code jsonb}\n
 */
public class PostgresBinder extends DefaultJdbcBinder {
  private final ObjectMapper json;

  public PostgresBinder(ObjectMapper json) {
    this.json = (json == null) ? new ObjectMapper() : json;
  }

  public PostgresBinder() {
    this(null);
  }

  @Override
  public void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException {
    if (value instanceof UUID) {
      ps.setObject(position1Based, value);
      return;
    }
    if (value instanceof Map<?, ?>) {
      ps.setObject(position1Based, jsonb(value));
      return;
    }
    if (value instanceof List<?> list) {
      String pgElem = arrayElementType(list);
      if (pgElem == null) {
        ps.setObject(position1Based, jsonb(value));
        return;
      }
      Array sqlArr = ps.getConnection().createArrayOf(pgElem, list.toArray());
      ps.setArray(position1Based, sqlArr);
      return;
    }
    super.bind(ps, position1Based, value);
  }

  /** Postgres element type for a homogeneous list, or {@code null} when it should go as JSON. */
  static String arrayElementType(List<?> list) {
    if (list.isEmpty()) return "text";
    Object first = null;
    for (Object o : list) {
      if (o != null) {
        first = o;
        break;
      }
    }
    if (first == null) return "text";
    String t = elementType(first);
    if (t == null) return null;
    for (Object o : list) {
      if (o != null && !t.equals(elementType(o))) return null;
    }
    return t;
  }

  private static String elementType(Object o) {
    if (o instanceof String) return "text";
    if (o instanceof Integer) return "int4";
    if (o instanceof Long) return "int8";
    if (o instanceof Double) return "float8";
    if (o instanceof Boolean) return "bool";
    if (o instanceof UUID) return "uuid";
    return null;
  }

  private PGobject jsonb(Object value) throws SQLException {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    try {
      obj.setValue(json.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new SQLException("Cannot encode value as jsonb: " + value.getClass().getName(), e);
    }
    return obj;
  }
}
