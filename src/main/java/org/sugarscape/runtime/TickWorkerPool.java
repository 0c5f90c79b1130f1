package org.sugarscape.runtime;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A bounded pool of long-lived threads for the per-tick agent fan-out.
 * <p>
 * The pool keeps {@code P-1} daemon threads parked between ticks. The calling (scheduler)
 * thread takes part as worker 0, so a dispatch runs on at most P threads. Each dispatch splits
 * the index range [0, size) into equal contiguous slices, one per active thread, and returns
 * only after every slice has been processed. A tick therefore always runs to completion.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>The scheduler publishes one immutable job (generation, size, active thread count, task)
 *       through a single volatile reference, so a worker never mixes fields of two dispatches.</li>
 *   <li>It unparks the active workers and processes slice 0 itself.</li>
 *   <li>Each active worker sees the new generation, processes its slice and counts itself done.</li>
 *   <li>The scheduler spins until all active workers are done, then rethrows the first failure.</li>
 * </ol>
 * <p>
 * <b>Thread safety:</b> {@link #dispatch} must only be called from one thread at a time and is
 * not reentrant. {@link #shutdown()} is idempotent.
 */
public class TickWorkerPool {

    /**
     * Work over a contiguous index slice.
     */
    @FunctionalInterface
    public interface RangeTask {
        /**
         * @param fromInclusive first index of the slice
         * @param toExclusive   one past the last index of the slice
         */
        void run(int fromInclusive, int toExclusive);
    }

    private record Job(long generation, int size, int activeThreads, RangeTask task) {
    }

    private final Thread[] workers;
    private final int parallelism;

    private long generation;
    private volatile Job job = new Job(0L, 0, 0, null);
    private volatile boolean shutdown;

    private final AtomicInteger parkedOnce = new AtomicInteger();
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    /**
     * Starts {@code parallelism - 1} worker threads and waits until each has recorded the
     * initial generation, so the first dispatch cannot be mistaken for a spurious wakeup.
     *
     * @param parallelism total threads including the caller, at least 2
     * @throws IllegalArgumentException if parallelism &lt; 2
     */
    public TickWorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.workers = new Thread[parallelism - 1];
        for (int i = 0; i < workers.length; i++) {
            final int index = i + 1;
            Thread worker = new Thread(() -> runWorker(index), "agent-worker-" + index);
            worker.setDaemon(true);
            workers[i] = worker;
            worker.start();
        }
        while (parkedOnce.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    /**
     * Runs {@code task} over [0, size) on all threads of the pool.
     *
     * @see #dispatch(int, int, RangeTask)
     */
    public void dispatch(int size, RangeTask task) {
        dispatch(size, parallelism, task);
    }

    /**
     * Runs {@code task} over [0, size) on {@code requestedThreads} threads and blocks until
     * every slice is done. The thread count is clamped to [1, parallelism].
     * <p>
     * If any slice throws, the first failure is rethrown after all slices have finished;
     * later failures are attached as suppressed exceptions where possible.
     *
     * @param size             number of items, nothing happens if &lt;= 0
     * @param requestedThreads threads to use for this dispatch
     * @param task             the work
     * @throws RuntimeException the failure of any slice, wrapped if it was checked
     */
    public void dispatch(int size, int requestedThreads, RangeTask task) {
        if (size <= 0) {
            return;
        }
        int active = Math.max(1, Math.min(requestedThreads, parallelism));

        failure.set(null);
        finished.set(0);
        job = new Job(++generation, size, active, task);

        for (int i = 0; i < active - 1; i++) {
            LockSupport.unpark(workers[i]);
        }

        Throwable ownFailure = null;
        try {
            runSlice(0, size, active, task);
        } catch (Throwable t) {
            ownFailure = t;
        }

        while (finished.get() < active - 1) {
            Thread.onSpinWait();
        }

        Throwable workerFailure = failure.get();
        Throwable first = workerFailure != null ? workerFailure : ownFailure;
        if (first == null) {
            return;
        }
        if (workerFailure != null && ownFailure != null) {
            workerFailure.addSuppressed(ownFailure);
        }
        if (first instanceof RuntimeException re) {
            throw re;
        }
        if (first instanceof Error err) {
            throw err;
        }
        throw new RuntimeException("Agent update failed during dispatch", first);
    }

    /**
     * Stops and joins all workers. Safe to call repeatedly.
     */
    public void shutdown() {
        shutdown = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runWorker(int index) {
        long seen = job.generation();
        parkedOnce.incrementAndGet();

        while (!shutdown) {
            LockSupport.park(this);
            if (shutdown) {
                return;
            }
            Job current = job;
            if (current.generation() == seen) {
                continue;
            }
            seen = current.generation();
            if (index >= current.activeThreads()) {
                continue;
            }
            try {
                runSlice(index, current.size(), current.activeThreads(), current.task());
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            }
            finished.incrementAndGet();
        }
    }

    private static void runSlice(int index, int size, int active, RangeTask task) {
        int slice = (size + active - 1) / active;
        int from = index * slice;
        int to = Math.min(from + slice, size);
        if (from < to) {
            task.run(from, to);
        }
    }
}
