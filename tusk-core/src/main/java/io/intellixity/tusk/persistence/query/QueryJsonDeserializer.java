package io.intellixity.tusk.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * JSON deserializer for {@link Query}.\n
 *
 * The {@code filter} node accepts the canonical tree written by {@link QueryJsonSerializer}
 * as well as the shorthand call shapes understood by {@link FilterSpecs}.
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    Query q = new Query();

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode proj = root.get("projection");
    if (proj != null && proj.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode x : proj) if (x.isTextual()) out.add(x.asText());
      q.withProjection(out);
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (s.isTextual()) {
          fields.add(SortField.parse(s.asText()));
          continue;
        }
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      q.withSort(fields);
    }

    q.withLimit(intOrNull(root.get("limit")));
    q.withOffset(intOrNull(root.get("offset")));
    q.withDistinct(boolOrDefault(root.get("distinct"), false));
    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    if (n.isArray()) {
      List<QueryElement> groups = new ArrayList<>();
      for (JsonNode x : n) {
        if (!x.isObject()) throw new IllegalArgumentException("Filter list entries must be objects: " + x);
        groups.add(parseElement(x, codec));
      }
      return new LogicalGroup(Clause.OR, groups);
    }

    if (!n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.size() == 1 && n.has("and") && n.get("and").isArray()) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.size() == 1 && n.has("or") && n.get("or").isArray()) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // Canonical condition form: { "greaterEq": { "field": ..., "value": ... } }
    if (n.size() == 1) {
      String k = n.fieldNames().next();
      JsonNode body = n.get(k);
      if (body.isObject() && body.has("field")) {
        return parseCondition(Operator.fromToken(k), body, codec);
      }
    }

    // Shorthand: { "age__greater": 5, "name": "x" }
    @SuppressWarnings("unchecked")
    Map<String, Object> m = codec.treeToValue(n, LinkedHashMap.class);
    return FilterSpecs.parse(m);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static Condition parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op.token() + " requires field");
    Object value = switch (op.arity()) {
      case LIST -> decodeValue(body.has("values") ? body.get("values") : body.get("value"), codec);
      case ONE -> decodeValue(body.get("value"), codec);
      case NONE -> null;
    };
    return Condition.of(field, op, value);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
