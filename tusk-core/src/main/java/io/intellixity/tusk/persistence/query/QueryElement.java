package io.intellixity.tusk.persistence.query;

/** Node of a filter tree: a {@link Condition} leaf or a {@link LogicalGroup}. */
public interface QueryElement {
}
