package com.astro.calpipe.model;

/** Outcome of re-evaluating a pending entry during a ledger pass. */
public enum PendingState {
    /** Ages still non-zero and not expired; the row is written back. */
    LOGGED,
    /** All ages zero; the row is dropped. */
    RESOLVED,
    /** Current date past the expiration date; the row is dropped and the product kept as final. */
    EXPIRED
}
