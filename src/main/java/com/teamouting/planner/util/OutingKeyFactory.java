package com.teamouting.planner.util;

import com.teamouting.planner.exception.InvalidKeyException;

import java.util.regex.Pattern;

/**
 * Type-safe key factory for the OutingTable single-table design.
 */
public final class OutingKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String EVENT_PREFIX = "EVENT";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String EVENT_ITEM_TYPE = "EVENT";

    private OutingKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    public static String getEventPk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }
}
