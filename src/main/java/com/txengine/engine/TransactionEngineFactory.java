package com.txengine.engine;

import com.txengine.accounts.AccountRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh engine, with its own empty account registry, for each run.
 */
@Component
@Slf4j
public class TransactionEngineFactory {

    private final int workers;
    private final int workerQueueCapacity;

    public TransactionEngineFactory(
            @Value("${tx-engine.workers:1}") int workers,
            @Value("${tx-engine.worker-queue-capacity:1024}") int workerQueueCapacity) {

        if (workers < 1) {
            throw new IllegalArgumentException("tx-engine.workers must be at least 1, got " + workers);
        }
        if (workerQueueCapacity < 1) {
            throw new IllegalArgumentException(
                "tx-engine.worker-queue-capacity must be at least 1, got " + workerQueueCapacity);
        }
        this.workers = workers;
        this.workerQueueCapacity = workerQueueCapacity;

        log.info("Transaction engine configured: workers={}, workerQueueCapacity={}", workers, workerQueueCapacity);
    }

    public TransactionEngine create() {
        return new TransactionEngine(new AccountRegistry(), workers, workerQueueCapacity);
    }
}
