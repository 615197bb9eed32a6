package com.txengine.common.exception;

/**
 * Base exception for all transaction engine exceptions.
 *
 * Every subclass is fatal for the current run: processing stops and
 * transitions applied before the failure are kept.
 */
public class TxEngineException extends RuntimeException {

    public TxEngineException(String message) {
        super(message);
    }

    public TxEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
