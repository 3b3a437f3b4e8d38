package com.critfumble.fumblebot.util.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared delegate executor.
 *
 * <p>Many serial executors can share one pool: each holds at most one task on the delegate
 * at any moment, so tasks of the same executor never overlap while tasks of different
 * executors run in parallel.
 *
 * <p>After {@link #shutdown()} pending tasks are discarded and new submissions are dropped.
 * A task already running is allowed to finish.
 *
 * <p><b>Thread Safety:</b> all state is guarded by a {@link ReentrantLock}. The delegate is
 * always invoked outside the lock so a caller-runs delegate cannot deadlock.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Executor delegate;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Runnable> tasks = new ArrayDeque<>();

    // Guarded by lock
    private Runnable active;
    private boolean shutdown;

    public SerialExecutor(Executor delegate, String name) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public void execute(Runnable task) {
        trySubmit(task);
    }

    /**
     * Queues a task.
     *
     * @return false if the executor is shut down and the task was dropped
     */
    public boolean trySubmit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Runnable toRun = null;
        lock.lock();
        try {
            if (shutdown) {
                LOG.debug("Serial executor {} is shut down; dropping task", name);
                return false;
            }
            tasks.addLast(wrap(task));
            if (active == null) {
                active = tasks.pollFirst();
                toRun = active;
            }
        } finally {
            lock.unlock();
        }
        dispatch(toRun);
        return true;
    }

    /**
     * Stops accepting tasks and discards the queued ones.
     *
     * @return number of tasks discarded
     */
    public int shutdown() {
        lock.lock();
        try {
            shutdown = true;
            int dropped = tasks.size();
            tasks.clear();
            if (dropped > 0) {
                LOG.debug("Serial executor {} discarded {} pending task(s)", name, dropped);
            }
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of tasks waiting behind the active one.
     */
    public int pendingCount() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    private Runnable wrap(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Task failed on serial executor {}: {}", name, e.getMessage(), e);
            } finally {
                scheduleNext();
            }
        };
    }

    private void scheduleNext() {
        Runnable next;
        lock.lock();
        try {
            active = shutdown ? null : tasks.pollFirst();
            next = active;
        } finally {
            lock.unlock();
        }
        dispatch(next);
    }

    private void dispatch(Runnable next) {
        if (next == null) {
            return;
        }
        try {
            delegate.execute(next);
        } catch (RejectedExecutionException e) {
            LOG.warn("Delegate rejected task for serial executor {}; discarding queue", name, e);
            lock.lock();
            try {
                active = null;
                tasks.clear();
            } finally {
                lock.unlock();
            }
        }
    }
}
