package com.componenttracker;

import com.componenttracker.service.EventBroadcaster;
import com.componenttracker.websocket.ComponentEventsWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ComponentTrackerApplicationTests {

    @Autowired
    private EventBroadcaster eventBroadcaster;

    @Test
    void contextLoads() {
        assertThat(eventBroadcaster).isInstanceOf(ComponentEventsWebSocketHandler.class);
    }
}
