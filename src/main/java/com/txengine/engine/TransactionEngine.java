package com.txengine.engine;

import com.txengine.accounts.Account;
import com.txengine.accounts.AccountRegistry;
import com.txengine.accounts.AccountSnapshot;
import com.txengine.accounts.TransactionDetails;
import com.txengine.common.Money;
import com.txengine.common.exception.InvalidTransactionException;
import com.txengine.common.exception.LedgerConsistencyException;
import com.txengine.transactions.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Applies transaction records to client accounts.
 *
 * Processing flow for one record:
 * 1. Reject structurally invalid records (fatal for the run)
 * 2. Find or create the client's account
 * 3. Lock that account only
 * 4. Skip everything if the account is locked
 * 5. Remember deposits and withdrawals for later disputes
 * 6. Run the type-specific transition
 * 7. Unlock the account
 *
 * Business rule violations (insufficient funds, unknown or undisputed
 * transaction references, repeated disputes, records for a locked account)
 * are expected outcomes and end in {@link TransactionOutcome#IGNORED},
 * never in an exception.
 *
 * An engine owns its registry and serves a single run.
 */
@Slf4j
public class TransactionEngine {

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final AccountRegistry accountRegistry;
    private final int workers;
    private final int workerQueueCapacity;

    private final LongAdder recordsRead = new LongAdder();
    private final LongAdder applied = new LongAdder();
    private final LongAdder ignored = new LongAdder();

    public TransactionEngine() {
        this(new AccountRegistry(), 1, DEFAULT_QUEUE_CAPACITY);
    }

    public TransactionEngine(AccountRegistry accountRegistry, int workers, int workerQueueCapacity) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + workers);
        }
        if (workerQueueCapacity < 1) {
            throw new IllegalArgumentException("Worker queue capacity must be at least 1, got " + workerQueueCapacity);
        }
        this.accountRegistry = accountRegistry;
        this.workers = workers;
        this.workerQueueCapacity = workerQueueCapacity;
    }

    /**
     * Process all records from the given iterator, in order.
     *
     * The iterator may throw a {@link com.txengine.common.exception.RecordDecodeException}
     * for input it cannot decode. Decode and validity failures stop processing;
     * records applied before the failure are kept.
     *
     * With more than one worker, records are spread over worker threads by
     * client id. Records of one client are still applied in iteration order.
     */
    public ProcessingSummary processRecords(Iterator<TransactionRecord> records) {
        if (workers == 1) {
            while (records.hasNext()) {
                TransactionRecord record = records.next();
                recordsRead.increment();
                apply(record);
            }
        } else {
            try (PartitionedDispatcher dispatcher =
                     new PartitionedDispatcher(this::apply, workers, workerQueueCapacity)) {
                while (records.hasNext()) {
                    TransactionRecord record = records.next();
                    recordsRead.increment();
                    validate(record);
                    dispatcher.submit(record);
                }
                dispatcher.awaitCompletion();
            }
        }

        ProcessingSummary summary = summary();
        log.info("Processed {} records: {} applied, {} ignored, {} accounts",
            summary.getRecordsRead(), summary.getApplied(), summary.getIgnored(), summary.getAccounts());
        return summary;
    }

    /**
     * Apply a single record to its client's account.
     *
     * @throws InvalidTransactionException if the record is structurally invalid
     */
    public TransactionOutcome apply(TransactionRecord record) {
        validate(record);

        Account account = accountRegistry.getOrCreate(record.getClientId());

        account.lock();
        try {
            TransactionOutcome outcome = transition(account, record);
            if (outcome == TransactionOutcome.APPLIED) {
                applied.increment();
            } else {
                ignored.increment();
            }
            return outcome;
        } finally {
            account.unlock();
        }
    }

    /**
     * Return the state of every known account, ordered by client id.
     *
     * Only call this after processing has finished. It locks every account in
     * turn and is the most expensive operation of the engine.
     */
    public List<AccountSnapshot> accounts() {
        return accountRegistry.snapshotAll();
    }

    public ProcessingSummary summary() {
        return ProcessingSummary.builder()
            .recordsRead(recordsRead.sum())
            .applied(applied.sum())
            .ignored(ignored.sum())
            .accounts(accountRegistry.size())
            .build();
    }

    private void validate(TransactionRecord record) {
        if (!record.isValid()) {
            log.warn("Rejecting invalid record {}", record);
            throw new InvalidTransactionException(record);
        }
    }

    private TransactionOutcome transition(Account account, TransactionRecord record) {
        if (account.isLocked()) {
            log.debug("Ignoring {} {} for locked account {}",
                record.getType(), record.getTransactionId(), account.getClientId());
            return TransactionOutcome.IGNORED;
        }

        // Recorded before the sufficiency check, declined withdrawals included
        record.getAmount().ifPresent(amount -> account.recordTransaction(record.getTransactionId(), amount));

        return switch (record.getType()) {
            case DEPOSIT -> deposit(account, record);
            case WITHDRAWAL -> withdraw(account, record);
            case DISPUTE -> dispute(account, record);
            case RESOLVE -> resolve(account, record);
            case CHARGEBACK -> chargeBack(account, record);
        };
    }

    private TransactionOutcome deposit(Account account, TransactionRecord record) {
        account.credit(requireAmount(record));
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome withdraw(Account account, TransactionRecord record) {
        Money amount = requireAmount(record);

        if (account.getAvailable().subtract(amount).isNegative()) {
            log.debug("Insufficient funds for withdrawal {} on client {}: available {}, requested {}",
                record.getTransactionId(), account.getClientId(), account.getAvailable(), amount);
            return TransactionOutcome.IGNORED;
        }

        account.debit(amount);
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome dispute(Account account, TransactionRecord record) {
        Optional<TransactionDetails> original = account.findTransaction(record.getTransactionId());
        if (original.isEmpty()) {
            // Unknown reference is the partner's error, not ours
            log.debug("Ignoring dispute of unknown transaction {} on client {}",
                record.getTransactionId(), account.getClientId());
            return TransactionOutcome.IGNORED;
        }

        TransactionDetails details = original.get();
        if (details.isDisputed()) {
            log.debug("Transaction {} on client {} is already disputed",
                record.getTransactionId(), account.getClientId());
            return TransactionOutcome.IGNORED;
        }

        account.hold(details);
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome resolve(Account account, TransactionRecord record) {
        Optional<TransactionDetails> original = findDisputed(account, record);
        if (original.isEmpty()) {
            return TransactionOutcome.IGNORED;
        }

        account.release(original.get());
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome chargeBack(Account account, TransactionRecord record) {
        Optional<TransactionDetails> original = findDisputed(account, record);
        if (original.isEmpty()) {
            return TransactionOutcome.IGNORED;
        }

        account.chargeBack(original.get());
        log.info("Chargeback of transaction {} locked account {}",
            record.getTransactionId(), account.getClientId());
        return TransactionOutcome.APPLIED;
    }

    private Optional<TransactionDetails> findDisputed(Account account, TransactionRecord record) {
        Optional<TransactionDetails> original = account.findTransaction(record.getTransactionId())
            .filter(TransactionDetails::isDisputed);
        if (original.isEmpty()) {
            log.debug("Ignoring {} of transaction {} on client {}: not under dispute",
                record.getType(), record.getTransactionId(), account.getClientId());
        }
        return original;
    }

    private static Money requireAmount(TransactionRecord record) {
        return record.getAmount().orElseThrow(() -> new LedgerConsistencyException(
            "Validated " + record.getType() + " " + record.getTransactionId() + " has no amount"));
    }
}
