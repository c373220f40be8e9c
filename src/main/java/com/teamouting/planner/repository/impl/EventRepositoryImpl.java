package com.teamouting.planner.repository.impl;

import com.teamouting.planner.exception.RepositoryException;
import com.teamouting.planner.exception.VersionConflictException;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.repository.EventRepository;
import com.teamouting.planner.util.OutingKeyFactory;
import com.teamouting.planner.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.Optional;

/**
 * DynamoDB implementation of EventRepository.
 * The Enhanced Client's versioned record extension turns every write into a conditional write on
 * the {@code version} attribute; a failed condition surfaces as {@link VersionConflictException}.
 */
@Repository
public class EventRepositoryImpl implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(EventRepositoryImpl.class);
    static final String TABLE_NAME = "OutingTable";

    private final DynamoDbTable<Event> eventTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public EventRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.eventTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Event.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<Event> findById(String eventId) {
        return performanceTracker.trackQuery("findEventById", TABLE_NAME, () -> {
            Key key = Key.builder()
                    .partitionValue(OutingKeyFactory.getEventPk(eventId))
                    .sortValue(OutingKeyFactory.getMetadataSk())
                    .build();

            try {
                Event event = eventTable.getItem(r -> r.key(key).consistentRead(true));
                logger.debug("Lookup of event {} found={}", eventId, event != null);
                return Optional.ofNullable(event);
            } catch (DynamoDbException e) {
                throw new RepositoryException("Failed to read event " + eventId, e);
            }
        });
    }

    @Override
    public Event save(Event event) {
        return performanceTracker.trackQuery("saveEvent", TABLE_NAME, () -> {
            event.touch();
            try {
                // updateItem returns the stored image, including the incremented version
                Event saved = eventTable.updateItem(event);
                logger.debug("Saved event {} at version {}", saved.getEventId(), saved.getVersion());
                return saved;
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Version conflict saving event {} (expected version {})", event.getEventId(), event.getVersion());
                throw new VersionConflictException("Event " + event.getEventId() + " was modified concurrently", e);
            } catch (DynamoDbException e) {
                throw new RepositoryException("Failed to save event " + event.getEventId(), e);
            }
        });
    }
}
