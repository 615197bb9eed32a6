package com.txengine.engine;

import com.txengine.common.exception.TxEngineException;
import com.txengine.transactions.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Spreads records over a fixed set of worker threads by client id.
 *
 * Each worker owns a bounded FIFO queue and is the only thread that handles
 * the clients mapped to it ({@code clientId % workers}). Records of one client
 * are therefore handled in submission order, while different clients proceed
 * in parallel. A full queue blocks the submitting thread.
 *
 * The first exception thrown by the handler is kept and rethrown to the
 * submitter exactly once, from {@link #submit}, {@link #awaitCompletion} or
 * {@link #close}. When the submitter is already failing on its own inside a
 * try-with-resources block, the worker failure ends up suppressed on that
 * exception. Workers keep draining their queues afterwards without handling
 * records, so the submitter never blocks on a dead worker.
 */
@Slf4j
class PartitionedDispatcher implements AutoCloseable {

    private static final TransactionRecord END_OF_STREAM = TransactionRecord.builder().build();

    private final Consumer<TransactionRecord> handler;
    private final List<BlockingQueue<TransactionRecord>> queues;
    private final List<Thread> threads;
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    private boolean closed;
    private boolean failureReported;

    PartitionedDispatcher(Consumer<TransactionRecord> handler, int workers, int queueCapacity) {
        this.handler = handler;
        this.queues = new ArrayList<>(workers);
        this.threads = new ArrayList<>(workers);

        for (int i = 0; i < workers; i++) {
            BlockingQueue<TransactionRecord> queue = new ArrayBlockingQueue<>(queueCapacity);
            Thread thread = new Thread(() -> drain(queue), "tx-worker-" + i);
            thread.setDaemon(true);
            queues.add(queue);
            threads.add(thread);
        }
        threads.forEach(Thread::start);

        log.debug("Started {} workers with queue capacity {}", workers, queueCapacity);
    }

    /**
     * Queue a record for the worker that owns its client.
     *
     * @throws RuntimeException the first failure raised by a worker so far
     */
    void submit(TransactionRecord record) {
        if (closed) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        rethrowFailure();
        put(queues.get(record.getClientId() % queues.size()), record);
    }

    /**
     * Wait until every submitted record has been handled.
     *
     * @throws RuntimeException the first failure raised by a worker
     */
    void awaitCompletion() {
        close();
    }

    /**
     * Let workers finish their queued records, then stop them.
     *
     * @throws RuntimeException the first failure raised by a worker, unless already reported
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            stopWorkers();
        }
        rethrowFailure();
    }

    private void stopWorkers() {
        queues.forEach(queue -> put(queue, END_OF_STREAM));
        for (Thread thread : threads) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                threads.forEach(Thread::interrupt);
                throw new TxEngineException("Interrupted while waiting for workers", e);
            }
        }

        log.debug("All workers stopped");
    }

    private void drain(BlockingQueue<TransactionRecord> queue) {
        while (true) {
            TransactionRecord record;
            try {
                record = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (record == END_OF_STREAM) {
                return;
            }
            if (failure.get() != null) {
                continue;
            }

            try {
                handler.accept(record);
            } catch (RuntimeException e) {
                if (failure.compareAndSet(null, e)) {
                    log.error("Worker {} failed on transaction {}",
                        Thread.currentThread().getName(), record.getTransactionId(), e);
                }
            }
        }
    }

    private void put(BlockingQueue<TransactionRecord> queue, TransactionRecord record) {
        try {
            queue.put(record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TxEngineException("Interrupted while dispatching transaction records", e);
        }
    }

    private void rethrowFailure() {
        RuntimeException e = failure.get();
        if (e != null && !failureReported) {
            failureReported = true;
            throw e;
        }
    }
}
