package com.txengine.common.exception;

/**
 * Thrown when ledger state expected to exist is missing. Never caused by
 * input data; indicates a defect in the engine itself.
 */
public class LedgerConsistencyException extends TxEngineException {

    public LedgerConsistencyException(String message) {
        super(message);
    }
}
