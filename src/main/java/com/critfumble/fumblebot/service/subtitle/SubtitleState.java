package com.critfumble.fumblebot.service.subtitle;

import com.critfumble.fumblebot.platform.MessageRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling subtitle window of one session.
 *
 * <p>Holds the most recent formatted lines (oldest evicted beyond capacity), the live message being
 * edited, the time of the last render and the pending debounce timer.
 *
 * <p><b>Thread Safety:</b> all methods synchronize on this instance. Lines are appended from the session
 * queue while renders run on the subtitle scheduler.
 */
public final class SubtitleState {

    private final int capacity;
    private final Deque<String> lines;
    private final ReentrantLock renderLock = new ReentrantLock();
    private MessageRef message;
    private long lastUpdateMs;
    private ScheduledFuture<?> pending;
    private boolean cancelled;

    public SubtitleState(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Appends a line, evicting the oldest once capacity is exceeded.
     */
    public synchronized void append(String line) {
        lines.addLast(line);
        while (lines.size() > capacity) {
            lines.removeFirst();
        }
    }

    public synchronized List<String> lines() {
        return new ArrayList<>(lines);
    }

    public synchronized MessageRef message() {
        return message;
    }

    public synchronized void message(MessageRef message) {
        this.message = message;
    }

    public synchronized long lastUpdateMs() {
        return lastUpdateMs;
    }

    public synchronized void markRendered(long nowMs) {
        this.lastUpdateMs = nowMs;
    }

    /**
     * Replaces the pending timer, cancelling the previous one.
     *
     * @return false if the state was cancelled; the new timer is then cancelled too
     */
    public synchronized boolean rearm(ScheduledFuture<?> next) {
        if (pending != null) {
            pending.cancel(false);
        }
        if (cancelled) {
            next.cancel(false);
            pending = null;
            return false;
        }
        pending = next;
        return true;
    }

    /**
     * Cancels the pending timer and refuses new ones.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }

    /**
     * Serializes renders of this session. Held across platform calls, so it is separate from the
     * monitor guarding the line buffer.
     */
    public ReentrantLock renderLock() {
        return renderLock;
    }

    public int capacity() {
        return capacity;
    }
}
