package io.meshward.runtime;

import io.meshward.observability.AuditLogger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one tick on a dedicated thread every {@code intervalMs}.
 *
 * <p>A tick that throws is logged as {@code loop.error} and the loop sleeps
 * until the next interval as usual. An audit log that cannot be written does
 * not stop the loop either. {@link #stop()} never interrupts a running
 * tick: the flag is cleared, the sleeper is woken and the thread exits after
 * the current tick returns.
 */
public final class PeriodicLoop {
    private final String name;
    private final long intervalMs;
    private final Runnable tick;
    private final AuditLogger auditLogger;
    private final AtomicBoolean running;
    private final AtomicLong ticks;
    private final AtomicLong errors;
    private final Object monitor;
    private Thread thread;

    public PeriodicLoop(String name, long intervalMs, Runnable tick, AuditLogger auditLogger) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0, got " + intervalMs);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.intervalMs = intervalMs;
        this.tick = Objects.requireNonNull(tick, "tick");
        this.auditLogger = auditLogger;
        this.running = new AtomicBoolean(false);
        this.ticks = new AtomicLong(0L);
        this.errors = new AtomicLong(0L);
        this.monitor = new Object();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this::runLoop, "meshward-" + name);
        thread.setDaemon(true);
        thread.start();
    }

    /** Signals the loop to exit and waits up to {@code joinTimeoutMs} for the current tick. */
    public void stop(long joinTimeoutMs) {
        Thread current;
        synchronized (this) {
            running.set(false);
            current = thread;
            thread = null;
        }
        synchronized (monitor) {
            monitor.notifyAll();
        }
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(Math.max(1L, joinTimeoutMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public void stop() {
        stop(intervalMs + 5_000L);
    }

    /**
     * Runs a single tick in the calling thread.
     *
     * @return {@code false} when the tick threw
     */
    public boolean runOnce() {
        try {
            tick.run();
            ticks.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            if (auditLogger != null) {
                auditLogger.tryLog(AuditLogger.AuditEvent.of("loop.error", "loop/" + name, "error", Map.of(
                        "error", e.getClass().getSimpleName(),
                        "message", String.valueOf(e.getMessage())
                )));
            }
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String name() {
        return name;
    }

    public long ticks() {
        return ticks.get();
    }

    public long errors() {
        return errors.get();
    }

    private void runLoop() {
        while (running.get()) {
            runOnce();
            synchronized (monitor) {
                if (!running.get()) {
                    break;
                }
                try {
                    monitor.wait(intervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    running.set(false);
                }
            }
        }
    }
}
