package com.astro.calpipe.error;

/** A ledger row that cannot be parsed. Reported per row; the rest of the ledger is still used. */
public class LedgerCorruptionException extends CalPipeException {
    private final long line;

    public LedgerCorruptionException(long line, String message) {
        super("Ledger line " + line + ": " + message);
        this.line = line;
    }

    public LedgerCorruptionException(long line, String message, Throwable cause) {
        super("Ledger line " + line + ": " + message, cause);
        this.line = line;
    }

    public long line() {
        return line;
    }
}
