package com.txengine.common.exception;

import com.txengine.transactions.TransactionRecord;

/**
 * Thrown when a decoded record violates the structural validity rule:
 * deposits and withdrawals must carry an amount, disputes, resolves and
 * chargebacks must not.
 */
public class InvalidTransactionException extends TxEngineException {

    public InvalidTransactionException(TransactionRecord record) {
        super(String.format("Invalid transaction %d for client %d: type %s %s an amount",
            record.getTransactionId(),
            record.getClientId(),
            record.getType(),
            record.getAmount().isPresent() ? "must not carry" : "requires"));
    }
}
