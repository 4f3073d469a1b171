package com.astro.calpipe.error;

public class InsufficientFramesException extends CalPipeException {
    public InsufficientFramesException(String message) {
        super(message);
    }
}
