package com.teamouting.planner.service;

/**
 * Outbound notification collaborator. Implementations deliver emails or pushes to the room; the
 * engine never waits on them for correctness.
 */
public interface NotificationService {

    /**
     * Notify the room that an activity was chosen and date scheduling has started.
     *
     * @param eventId The event
     * @param roomId The room owning the event
     * @param activityId The chosen activity
     * @param automatic Whether the voting deadline chose the activity
     */
    void notifyActivitySelected(String eventId, String roomId, String activityId, boolean automatic);

    /**
     * Notify the room that the outing date is fixed.
     */
    void notifyDateFinalized(String eventId, String roomId, String dateOptionId);
}
