package io.intellixity.tusk.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (q.projection() != null && !q.projection().isEmpty()) {
      g.writeObjectField("projection", q.projection());
    }

    if (q.sort() != null && !q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());
    if (q.distinct()) g.writeBooleanField("distinct", true);

    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().token());
      g.writeStringField("field", c.field());
      switch (c.operator().arity()) {
        case LIST -> {
          g.writeFieldName("values");
          serializers.defaultSerializeValue(c.value(), g);
        }
        case ONE -> {
          g.writeFieldName("value");
          serializers.defaultSerializeValue(c.value(), g);
        }
        case NONE -> { }
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }
}
