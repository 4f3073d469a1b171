package com.astro.calpipe.error;

/** Base of the pipeline's checked failures. Each one is isolated to a frame, a cluster or a ledger pass. */
public class CalPipeException extends Exception {
    public CalPipeException(String message) {
        super(message);
    }

    public CalPipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
