package com.astro.calpipe.error;

public class PipelinePlanException extends CalPipeException {
    public PipelinePlanException(String message) {
        super(message);
    }
}
