package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.exec.SqlExecutor;
import io.intellixity.tusk.persistence.exec.TxHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Records every call; fetches answer from a canned function. */
final class RecordingExecutor implements SqlExecutor {
  record Call(String kind, boolean inTx, String sql, List<Object> params) {}

  private record Tx(int id) implements TxHandle {}

  final List<Call> calls = new ArrayList<>();
  final List<String> txEvents = new ArrayList<>();
  private int nextTx = 1;
  private Function<String, List<Map<String, Object>>> rows = sql -> List.of();
  private long updateCount = 1;

  RecordingExecutor answering(Function<String, List<Map<String, Object>>> rows) {
    this.rows = rows;
    return this;
  }

  RecordingExecutor updating(long n) {
    this.updateCount = n;
    return this;
  }

  @Override
  public TxHandle begin() {
    Tx tx = new Tx(nextTx++);
    txEvents.add("begin");
    return tx;
  }

  @Override
  public void commit(TxHandle tx) { txEvents.add("commit"); }

  @Override
  public void rollback(TxHandle tx) { txEvents.add("rollback"); }

  @Override
  public long execute(TxHandle txOrNull, String sql, List<Object> params) {
    calls.add(new Call("execute", txOrNull != null, sql, new ArrayList<>(params)));
    return updateCount;
  }

  @Override
  public List<Map<String, Object>> fetch(TxHandle txOrNull, String sql, List<Object> params) {
    calls.add(new Call("fetch", txOrNull != null, sql, new ArrayList<>(params)));
    return rows.apply(sql);
  }

  Call last() {
    return calls.get(calls.size() - 1);
  }
}
