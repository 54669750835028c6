package com.example.place_service.model;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A local event from the events provider.
 */
public record Event(
        String id,
        String name,
        Coordinate coordinate,   // nullable: venue not geocoded
        ZonedDateTime startTime,
        List<String> categories
) {

    public static final String PLACE_ID_PREFIX = "event:";

    /**
     * Adapts the event to a place so it can be filtered and ranked with the others.
     * Events without a coordinate cannot be placed.
     */
    public Optional<Place> toPlace() {
        if (coordinate == null) {
            return Optional.empty();
        }
        return Optional.of(new Place(PLACE_ID_PREFIX + id, name, coordinate, categories, null, List.of()));
    }
}
