package com.txengine.accounts;

import com.txengine.common.Money;
import com.txengine.common.exception.LedgerConsistencyException;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable ledger state of a single client.
 *
 * Every account carries its own lock so that different clients can be
 * updated concurrently. All mutators require the calling thread to hold
 * that lock for the duration of one transition:
 *
 * <pre>
 * account.lock();
 * try {
 *     ...
 * } finally {
 *     account.unlock();
 * }
 * </pre>
 *
 * Invariant: {@code held} equals the sum of the amounts of all disputed
 * transactions. Once locked, an account stays locked.
 */
@Getter
public class Account {

    private final int clientId;

    /**
     * Funds the client can use. May become negative when a disputed
     * transaction's amount exceeds what is left.
     */
    private Money available = Money.ZERO;

    /**
     * Funds frozen by open disputes.
     */
    private Money held = Money.ZERO;

    private boolean locked;

    @Getter(AccessLevel.NONE)
    private final Map<Long, TransactionDetails> transactions = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public Account(int clientId) {
        this.clientId = clientId;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public Money getTotal() {
        return available.add(held);
    }

    /**
     * Remember a deposit or withdrawal so it can be disputed later.
     * A repeated transaction id replaces the earlier details.
     */
    public void recordTransaction(long transactionId, Money amount) {
        requireLock();
        transactions.put(transactionId, new TransactionDetails(amount));
    }

    public Optional<TransactionDetails> findTransaction(long transactionId) {
        requireLock();
        return Optional.ofNullable(transactions.get(transactionId));
    }

    public void credit(Money amount) {
        requireLock();
        available = available.add(amount);
    }

    public void debit(Money amount) {
        requireLock();
        available = available.subtract(amount);
    }

    /**
     * Freeze a transaction's amount: available to held.
     */
    public void hold(TransactionDetails details) {
        requireLock();
        details.markDisputed();
        available = available.subtract(details.getAmount());
        held = held.add(details.getAmount());
    }

    /**
     * Unfreeze a transaction's amount: held back to available.
     */
    public void release(TransactionDetails details) {
        requireLock();
        details.clearDispute();
        available = available.add(details.getAmount());
        held = held.subtract(details.getAmount());
    }

    /**
     * Remove a disputed transaction's amount from held funds and lock the account.
     */
    public void chargeBack(TransactionDetails details) {
        requireLock();
        details.clearDispute();
        held = held.subtract(details.getAmount());
        locked = true;
    }

    public AccountSnapshot snapshot() {
        lock.lock();
        try {
            return new AccountSnapshot(clientId, available, held, locked);
        } finally {
            lock.unlock();
        }
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new LedgerConsistencyException(
                "Account " + clientId + " mutated without holding its lock");
        }
    }
}
