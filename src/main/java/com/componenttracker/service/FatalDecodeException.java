package com.componenttracker.service;

public class FatalDecodeException extends RuntimeException {
    /**
     * Creates an exception for a payload that cannot be parsed in its declared format.
     */
    public FatalDecodeException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating parse failure.
     */
    public FatalDecodeException(String m, Throwable c) { super(m, c); }
}
