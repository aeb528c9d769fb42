package com.componenttracker.service;

import com.componenttracker.dto.BroadcastEvent;
import com.componenttracker.dto.UploadProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Emits the started / midpoint / completed progress sequence for an upload.
 * Every emission is best-effort: a broadcaster failure is logged and swallowed here so
 * that ingestion never aborts because a subscriber went away.
 */
@Service
public class UploadProgressService {

    private static final Logger logger = LoggerFactory.getLogger(UploadProgressService.class);

    static final int STARTED = 0;
    static final int MIDPOINT = 50;
    static final int COMPLETED = 100;

    private final EventBroadcaster broadcaster;

    public UploadProgressService(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    public void started(String filename) {
        emit(new UploadProgressEvent(filename, STARTED, UploadProgressEvent.STATUS_PROCESSING));
    }

    public void midpoint(String filename) {
        emit(new UploadProgressEvent(filename, MIDPOINT, UploadProgressEvent.STATUS_PROCESSING));
    }

    public void completed(String filename) {
        emit(new UploadProgressEvent(filename, COMPLETED, UploadProgressEvent.STATUS_COMPLETED));
    }

    public void failed(String filename) {
        emit(new UploadProgressEvent(filename, STARTED, UploadProgressEvent.STATUS_ERROR));
    }

    /**
     * Publishes any event without letting a delivery failure escape.
     */
    public void emit(BroadcastEvent event) {
        try {
            broadcaster.publish(event);
            logger.debug("Published {}", event);
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event: {}", event.getType(), e.getMessage());
        }
    }
}
