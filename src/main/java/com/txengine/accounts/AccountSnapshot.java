package com.txengine.accounts;

import com.txengine.common.Money;
import lombok.Value;

/**
 * Point-in-time copy of an account's balances, used for reporting.
 */
@Value
public class AccountSnapshot {
    int clientId;
    Money available;
    Money held;
    boolean locked;

    /**
     * Available plus held funds.
     */
    public Money getTotal() {
        return available.add(held);
    }
}
