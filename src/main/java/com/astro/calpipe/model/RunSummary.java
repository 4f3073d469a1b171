package com.astro.calpipe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters and isolated failures of one run. Safe to update from worker threads.
 */
public class RunSummary {

    public enum ErrorKind {
        MISSING_MANDATORY_CALIBRATION,
        INSUFFICIENT_FRAMES,
        IO,
        LEDGER_CORRUPTION,
        LEDGER_LOCK,
        COMBINATION_TIMEOUT,
        PLATE_SOLVE
    }

    public record Failure(ErrorKind kind, String subject, String message) {
        @Override
        public String toString() {
            return kind + " " + subject + ": " + message;
        }
    }

    public final AtomicInteger mastersBuilt = new AtomicInteger();
    public final AtomicInteger lightsReduced = new AtomicInteger();
    public final AtomicInteger pendingLogged = new AtomicInteger();
    public final AtomicInteger pendingResolved = new AtomicInteger();
    public final AtomicInteger pendingExpired = new AtomicInteger();
    public final AtomicInteger platesSolved = new AtomicInteger();

    private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean ledgerPassFailed;

    public void fail(ErrorKind kind, Object subject, String message) {
        failures.add(new Failure(kind, String.valueOf(subject), message));
    }

    public void fail(ErrorKind kind, Object subject, Throwable cause) {
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        fail(kind, subject, msg);
    }

    public void markLedgerPassFailed() {
        ledgerPassFailed = true;
    }

    public boolean ledgerPassFailed() {
        return ledgerPassFailed;
    }

    public int errorCount() {
        return failures.size();
    }

    public List<Failure> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public long count(ErrorKind kind) {
        return failures().stream().filter(f -> f.kind() == kind).count();
    }

    /** 0 clean, 1 isolated failures, 2 ledger pass failed. */
    public int exitCode() {
        if (ledgerPassFailed) return 2;
        return failures.isEmpty() ? 0 : 1;
    }

    @Override
    public String toString() {
        return String.format("masters=%d reduced=%d pending(logged=%d resolved=%d expired=%d) solved=%d errors=%d",
                mastersBuilt.get(), lightsReduced.get(), pendingLogged.get(), pendingResolved.get(),
                pendingExpired.get(), platesSolved.get(), errorCount());
    }
}
