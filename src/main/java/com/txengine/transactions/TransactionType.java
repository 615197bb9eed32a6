package com.txengine.transactions;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Types of transaction events a client account can receive.
 *
 * Deposits and withdrawals move money and carry an amount. Disputes,
 * resolves and chargebacks refer back to an earlier deposit or withdrawal
 * by its transaction id and carry no amount of their own.
 */
public enum TransactionType {
    /**
     * Credit to the client's available funds.
     */
    DEPOSIT("deposit", true),

    /**
     * Debit from the client's available funds, skipped when funds are insufficient.
     */
    WITHDRAWAL("withdrawal", true),

    /**
     * Claim against an earlier transaction. Moves its amount from available to held.
     */
    DISPUTE("dispute", false),

    /**
     * Closes a dispute in the client's favour. Releases the held amount.
     */
    RESOLVE("resolve", false),

    /**
     * Closes a dispute against the client. Removes the held amount and locks the account.
     */
    CHARGEBACK("chargeback", false);

    private final String code;
    private final boolean carriesAmount;

    TransactionType(String code, boolean carriesAmount) {
        this.code = code;
        this.carriesAmount = carriesAmount;
    }

    /**
     * Name used in transaction files.
     */
    public String getCode() {
        return code;
    }

    public boolean carriesAmount() {
        return carriesAmount;
    }

    public static Optional<TransactionType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.getCode().equals(normalized))
            .findFirst();
    }
}
