package com.txengine.transactions;

import com.txengine.common.Money;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;

/**
 * A single transaction event as read from the input.
 *
 * Records are immutable. They are built by a transaction source, applied
 * once by the engine and then discarded.
 */
@Value
@Builder
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TRANSACTION_ID = 0xFFFFFFFFL;

    TransactionType type;

    /**
     * Client the transaction belongs to (unsigned 16-bit).
     */
    int clientId;

    /**
     * Globally unique transaction id (unsigned 32-bit). Disputes, resolves and
     * chargebacks reuse the id of the transaction they refer to.
     */
    long transactionId;

    @Getter(AccessLevel.NONE)
    Money amount;

    public Optional<Money> getAmount() {
        return Optional.ofNullable(amount);
    }

    /**
     * Validate the record's shape.
     *
     * A record is valid when its type carries an amount and one is present
     * (deposit, withdrawal), or its type carries none and none is present
     * (dispute, resolve, chargeback). Zero counts as present.
     */
    public boolean isValid() {
        if (type == null) {
            return false;
        }
        return type.carriesAmount() == (amount != null);
    }
}
