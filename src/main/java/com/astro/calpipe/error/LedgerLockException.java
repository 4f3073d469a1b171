package com.astro.calpipe.error;

public class LedgerLockException extends CalPipeException {
    public LedgerLockException(String message) {
        super(message);
    }

    public LedgerLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
