package com.txengine.transactions;

import com.txengine.common.Money;

/**
 * Shorthand builders for transaction records in tests.
 */
public final class Records {

    private Records() {
    }

    public static TransactionRecord deposit(int client, long tx, String amount) {
        return withAmount(TransactionType.DEPOSIT, client, tx, amount);
    }

    public static TransactionRecord withdrawal(int client, long tx, String amount) {
        return withAmount(TransactionType.WITHDRAWAL, client, tx, amount);
    }

    public static TransactionRecord dispute(int client, long tx) {
        return reference(TransactionType.DISPUTE, client, tx);
    }

    public static TransactionRecord resolve(int client, long tx) {
        return reference(TransactionType.RESOLVE, client, tx);
    }

    public static TransactionRecord chargeback(int client, long tx) {
        return reference(TransactionType.CHARGEBACK, client, tx);
    }

    private static TransactionRecord withAmount(TransactionType type, int client, long tx, String amount) {
        return TransactionRecord.builder()
            .type(type)
            .clientId(client)
            .transactionId(tx)
            .amount(Money.of(amount))
            .build();
    }

    private static TransactionRecord reference(TransactionType type, int client, long tx) {
        return TransactionRecord.builder()
            .type(type)
            .clientId(client)
            .transactionId(tx)
            .build();
    }
}
