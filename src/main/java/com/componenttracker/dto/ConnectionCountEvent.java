package com.componenttracker.dto;

import lombok.Getter;

import java.time.OffsetDateTime;

@Getter
public class ConnectionCountEvent implements BroadcastEvent {

    private final String type = "connection_count";
    private final int count;
    private final OffsetDateTime timestamp;

    public ConnectionCountEvent(int count) {
        this.count = count;
        this.timestamp = OffsetDateTime.now();
    }
}
