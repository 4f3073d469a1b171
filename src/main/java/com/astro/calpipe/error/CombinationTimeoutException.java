package com.astro.calpipe.error;

import java.time.Duration;

public class CombinationTimeoutException extends CalPipeException {
    public CombinationTimeoutException(String subject, Duration budget) {
        super("Combining " + subject + " exceeded " + budget.toMillis() + " ms");
    }
}
