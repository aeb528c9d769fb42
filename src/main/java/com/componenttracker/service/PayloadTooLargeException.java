package com.componenttracker.service;

public class PayloadTooLargeException extends RuntimeException {

    private final long size;
    private final long limit;

    public PayloadTooLargeException(long size, long limit) {
        super("Payload of " + size + " bytes exceeds the limit of " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public long getSize() { return size; }

    public long getLimit() { return limit; }
}
