package com.teamouting.planner.model;

/**
 * One accepted phase transition of an event.
 *
 * @param from phase before the transition
 * @param to phase after the transition
 * @param automatic true when the voting deadline triggered the transition
 */
public record PhaseChange(EventPhase from, EventPhase to, boolean automatic) {

    public static PhaseChange manual(EventPhase from, EventPhase to) {
        return new PhaseChange(from, to, false);
    }

    public static PhaseChange deadline(EventPhase from, EventPhase to) {
        return new PhaseChange(from, to, true);
    }
}
