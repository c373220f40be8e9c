package com.teamouting.planner.listener;

import com.teamouting.planner.event.EventPhaseChangedEvent;
import com.teamouting.planner.service.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards saved phase changes to the notification collaborator.
 * Runs asynchronously; a failure here is logged and never affects the event.
 */
@Component
public class EventPhaseChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(EventPhaseChangeListener.class);

    private final NotificationService notificationService;

    @Autowired
    public EventPhaseChangeListener(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Async
    @EventListener
    public void onPhaseChanged(EventPhaseChangedEvent change) {
        logger.debug("Phase change {} -> {} for event {}", change.fromPhase(), change.toPhase(), change.eventId());
        try {
            if (change.activitySelected()) {
                notificationService.notifyActivitySelected(
                    change.eventId(), change.roomId(), change.chosenActivityId(), change.automatic());
            } else if (change.dateFinalized()) {
                notificationService.notifyDateFinalized(change.eventId(), change.roomId(), change.finalDateOptionId());
            }
        } catch (RuntimeException e) {
            logger.error("Notification for event {} ({} -> {}) failed: {}",
                change.eventId(), change.fromPhase(), change.toPhase(), e.getMessage(), e);
        }
    }
}
