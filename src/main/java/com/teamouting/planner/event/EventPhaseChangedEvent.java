package com.teamouting.planner.event;

import com.teamouting.planner.model.EventPhase;

/**
 * Published after an event's phase change has been saved. Downstream collaborators (invites,
 * reminders) react to the chosen activity and the final date carried here.
 *
 * @param automatic true when the voting deadline triggered the change
 */
public record EventPhaseChangedEvent(
        String eventId,
        String roomId,
        EventPhase fromPhase,
        EventPhase toPhase,
        String chosenActivityId,
        String finalDateOptionId,
        boolean automatic) {

    public boolean activitySelected() {
        return toPhase == EventPhase.SCHEDULING;
    }

    public boolean dateFinalized() {
        return toPhase == EventPhase.INFO;
    }
}
