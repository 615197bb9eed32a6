package com.txengine.accounts;

import com.txengine.common.Money;
import lombok.Getter;
import lombok.ToString;

/**
 * Dispute tracking for one deposit or withdrawal applied to an account.
 *
 * Created when the transaction is recorded and never removed. Only the
 * disputed flag changes afterwards.
 */
@Getter
@ToString
public class TransactionDetails {

    private final Money amount;

    private boolean disputed;

    public TransactionDetails(Money amount) {
        this.amount = amount;
        this.disputed = false;
    }

    void markDisputed() {
        this.disputed = true;
    }

    void clearDispute() {
        this.disputed = false;
    }
}
