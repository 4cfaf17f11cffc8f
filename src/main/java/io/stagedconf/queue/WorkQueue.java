package io.stagedconf.queue;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared worker pool for commit and activation work.
 * <p>
 * Callers group their tasks in a {@link Batch}; a batch only ever reports the failures of its
 * own tasks, so concurrent callers never see each other's exceptions.
 */
@Slf4j
public final class WorkQueue implements AutoCloseable {
    @Getter
    private final String name;
    private final ExecutorService executor;

    public WorkQueue(final String name, final int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.name = name;
        final AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            final Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Batch newBatch(final String batchName) {
        return new Batch(batchName);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Work queue {} did not drain in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    public final class Batch {
        @Getter
        private final String name;
        private final List<Future<?>> pending = new ArrayList<>();
        private final List<Throwable> exceptions = new ArrayList<>();

        private Batch(final String name) {
            this.name = name;
        }

        public synchronized void submit(final Task task) {
            pending.add(executor.submit(() -> {
                task.run();
                return null;
            }));
        }

        /**
         * Waits for every submitted task.
         *
         * @return true if none of them failed since the last drain
         */
        public boolean join() {
            final List<Future<?>> snapshot;
            synchronized (this) {
                snapshot = new ArrayList<>(pending);
                pending.clear();
            }

            for (final Future<?> f : snapshot) {
                try {
                    f.get();
                } catch (final ExecutionException e) {
                    addException(e.getCause() != null ? e.getCause() : e);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    addException(e);
                }
            }

            synchronized (this) {
                return exceptions.isEmpty();
            }
        }

        public synchronized boolean hasExceptions() {
            return !exceptions.isEmpty();
        }

        /**
         * Returns and clears the failures collected so far.
         */
        public synchronized List<Throwable> drainExceptions() {
            final List<Throwable> drained = new ArrayList<>(exceptions);
            exceptions.clear();
            return Collections.unmodifiableList(drained);
        }

        private synchronized void addException(final Throwable t) {
            log.debug("Task in batch {}/{} failed: {}", WorkQueue.this.name, name, t.toString());
            exceptions.add(t);
        }
    }
}
