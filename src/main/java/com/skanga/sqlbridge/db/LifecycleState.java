package com.skanga.sqlbridge.db;

/**
 * States of one tool invocation's connection and transaction.
 * {@code IDLE -> ACQUIRED -> TX_STARTED -> EXECUTED -> (COMMITTED | ROLLED_BACK) -> RELEASED}
 */
public enum LifecycleState {
    IDLE,
    ACQUIRED,
    TX_STARTED,
    EXECUTED,
    COMMITTED,
    ROLLED_BACK,
    RELEASED;

    boolean hasOpenTransaction() {
        return this == TX_STARTED || this == EXECUTED || this == COMMITTED;
    }
}
