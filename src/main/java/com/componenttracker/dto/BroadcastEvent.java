package com.componenttracker.dto;

import java.time.OffsetDateTime;

/**
 * Message pushed to real-time subscribers. Serialized with Jackson as-is.
 */
public interface BroadcastEvent {

    String getType();

    OffsetDateTime getTimestamp();
}
