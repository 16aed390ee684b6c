package io.intellixity.tusk.persistence.exec;

/** Opaque transaction token issued by {@link SqlExecutor#begin()}. */
public interface TxHandle {
}
