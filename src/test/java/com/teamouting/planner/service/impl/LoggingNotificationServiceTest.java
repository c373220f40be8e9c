package com.teamouting.planner.service.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingNotificationServiceTest {

    @Test
    void notifications_AreCountedByType() {
        // Given
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        LoggingNotificationService service = new LoggingNotificationService(meterRegistry);

        // When
        service.notifyActivitySelected("event-1", "room-1", "bowling", false);
        service.notifyActivitySelected("event-2", "room-1", "karaoke", true);
        service.notifyDateFinalized("event-1", "room-1", "option-1");

        // Then
        assertThat(meterRegistry.counter("event.notifications", "type", "activity_selected").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("event.notifications", "type", "date_finalized").count()).isEqualTo(1.0);
    }
}
