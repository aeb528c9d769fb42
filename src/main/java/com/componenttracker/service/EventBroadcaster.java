package com.componenttracker.service;

import com.componenttracker.dto.BroadcastEvent;

/**
 * Fan-out channel for real-time events. Delivery is best-effort; implementations
 * own their subscriber state.
 */
public interface EventBroadcaster {

    void publish(BroadcastEvent event);
}
