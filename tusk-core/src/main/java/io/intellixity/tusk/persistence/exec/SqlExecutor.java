package io.intellixity.tusk.persistence.exec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Executes SQL text with positional parameters ({@code $1, $2, ...}).\n
 *
 * Statements run in submission order. A {@link TxHandle} scopes all-or-nothing visibility;
 * passing {@code null} runs the statement outside any transaction.
 */
public interface SqlExecutor {
  TxHandle begin();

  void commit(TxHandle tx);

  void rollback(TxHandle tx);

  /** Affected row count. */
  long execute(TxHandle txOrNull, String sql, List<Object> params);

  /** Rows as column-label to value maps, in result order. */
  List<Map<String, Object>> fetch(TxHandle txOrNull, String sql, List<Object> params);

  /**
   * Runs {@code work} in a new transaction: commit on success, rollback on any failure.
   * A failing rollback is attached to the original failure as suppressed.
   */
  default <T> T inTx(Function<TxHandle, T> work) {
    Objects.requireNonNull(work, "work");
    TxHandle tx = begin();
    T result;
    try {
      result = work.apply(tx);
    } catch (RuntimeException | Error e) {
      try {
        rollback(tx);
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      throw e;
    }
    commit(tx);
    return result;
  }
}
