package com.teamouting.planner.repository;

import com.teamouting.planner.model.Event;

import java.util.Optional;

/**
 * Persistence of the event aggregate. Each event is stored and read as a whole.
 */
public interface EventRepository {

    /**
     * Find an event by ID with a strongly consistent read.
     * @param eventId The event ID
     * @return Optional containing the event if found
     */
    Optional<Event> findById(String eventId);

    /**
     * Save an event (create or update) guarded by its version.
     * @param event The event to save; its version must match the stored one (null for a new event)
     * @return The saved event carrying its new version
     * @throws com.teamouting.planner.exception.VersionConflictException if another writer saved first
     */
    Event save(Event event);
}
