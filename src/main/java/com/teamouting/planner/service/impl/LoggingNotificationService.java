package com.teamouting.planner.service.impl;

import com.teamouting.planner.service.NotificationService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Default notification collaborator used until a delivery channel is wired in: records the
 * notification in the log and in the {@code event.notifications} counter.
 */
@Service
public class LoggingNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationService.class);

    private final MeterRegistry meterRegistry;

    @Autowired
    public LoggingNotificationService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void notifyActivitySelected(String eventId, String roomId, String activityId, boolean automatic) {
        logger.info("Room {}: activity {} chosen for event {}{}", roomId, activityId, eventId,
            automatic ? " after the voting deadline" : "");
        meterRegistry.counter("event.notifications", "type", "activity_selected").increment();
    }

    @Override
    public void notifyDateFinalized(String eventId, String roomId, String dateOptionId) {
        logger.info("Room {}: date option {} finalized for event {}", roomId, dateOptionId, eventId);
        meterRegistry.counter("event.notifications", "type", "date_finalized").increment();
    }
}
