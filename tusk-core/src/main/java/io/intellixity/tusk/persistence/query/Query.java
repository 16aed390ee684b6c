package io.intellixity.tusk.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/** Filter plus projection, ordering, pagination and distinctness for a single select. */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private QueryElement filter;
  private List<String> projection = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();
  private Integer limit;
  private Integer offset;
  private boolean distinct;

  public Query() {}

  public QueryElement filter() { return filter; }
  public List<String> projection() { return projection; }
  public List<SortField> sort() { return sort; }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }
  public boolean distinct() { return distinct; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  /** Shorthand filter: a map (AND) or a list of maps (OR of ANDs). */
  public Query filterBy(Object spec) { this.filter = FilterSpecs.parseAny(spec); return this; }
  public Query withProjection(List<String> projection) { this.projection = new ArrayList<>(projection == null ? List.of() : projection); return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public Query orderBy(String... entries) {
    List<SortField> out = new ArrayList<>(entries.length);
    for (String e : entries) out.add(SortField.parse(e));
    return withSort(out);
  }
  public Query withLimit(Integer limit) { this.limit = limit; return this; }
  public Query withOffset(Integer offset) { this.offset = offset; return this; }
  public Query withDistinct(boolean distinct) { this.distinct = distinct; return this; }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query where(Map<String, ?> spec) {
    return new Query().withFilter(FilterSpecs.parse(spec));
  }

  public static Query anyOf(List<? extends Map<String, ?>> specs) {
    return new Query().withFilter(FilterSpecs.parse(specs));
  }
}
