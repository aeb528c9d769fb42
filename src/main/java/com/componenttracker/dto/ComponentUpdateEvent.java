package com.componenttracker.dto;

import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class ComponentUpdateEvent implements BroadcastEvent {

    public static final String TYPE = "component_update";

    private final String type = TYPE;
    private final String action;
    private final Map<String, Object> data;
    private final OffsetDateTime timestamp;

    public ComponentUpdateEvent(String action, String externalKey, String name, String tower, String user) {
        this.action = action;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("externalKey", externalKey);
        payload.put("name", name);
        payload.put("tower", tower);
        payload.put("user", user);
        this.data = payload;
        this.timestamp = OffsetDateTime.now();
    }
}
