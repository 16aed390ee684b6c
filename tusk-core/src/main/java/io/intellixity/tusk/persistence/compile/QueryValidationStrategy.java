package io.intellixity.tusk.persistence.compile;

import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.query.Query;

/**
 * Hook to validate queries against a record shape before dialect compilation.
 * <p>
 * Applications may plug in stricter rules (e.g. forbidding {@code like} on large text columns).
 */
public interface QueryValidationStrategy {
  void validate(RecordShape shape, Query query);
}
