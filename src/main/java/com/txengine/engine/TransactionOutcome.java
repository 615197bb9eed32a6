package com.txengine.engine;

/**
 * Result of applying one valid record to its account.
 */
public enum TransactionOutcome {
    /**
     * The record changed the account's state.
     */
    APPLIED,

    /**
     * The record was consumed without effect: locked account, insufficient
     * funds, unknown transaction id, repeated dispute, or resolve/chargeback
     * of a transaction that is not under dispute.
     */
    IGNORED
}
