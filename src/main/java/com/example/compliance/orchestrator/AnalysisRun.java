package com.example.compliance.orchestrator;

import com.example.compliance.model.AggregateReport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a submitted analysis run.
 * <p>
 * {@link #cancel()} interrupts the worker thread, which aborts the in-flight gateway call; the
 * orchestrator then marks the remaining stages cancelled and still completes {@link #report()}.
 */
public class AnalysisRun {

    private final String runId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<AggregateReport> report = new CompletableFuture<>();

    // guarded by this
    private Thread worker;

    public AnalysisRun(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public CompletableFuture<AggregateReport> report() {
        return report;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Requests cancellation. Idempotent; has no effect once the report is complete.
     */
    public void cancel() {
        if (report.isDone() || !cancelled.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    synchronized void attach(Thread thread) {
        worker = thread;
        if (cancelled.get()) {
            thread.interrupt();
        }
    }

    synchronized void detach() {
        worker = null;
    }
}
