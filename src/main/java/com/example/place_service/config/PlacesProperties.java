package com.example.place_service.config;

import com.example.place_service.model.FilterSet;
import com.example.place_service.model.PlaceFilter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Set;

/**
 * Settings under the {@code places.} prefix.
 *
 * @param searchRadiusKm     radius of the places query around the user
 * @param travelTimeTimeout  how long ranking waits for travel-time fetches before falling back to distance order
 * @param eventsTimeout      how long an update waits for the events provider
 * @param defaultFilters     buckets enabled before the user picks any
 */
@ConfigurationProperties(prefix = "places")
public record PlacesProperties(
        @DefaultValue("4.0") double searchRadiusKm,
        @DefaultValue("5s") Duration travelTimeTimeout,
        @DefaultValue("10s") Duration eventsTimeout,
        @DefaultValue({"DISCOVER", "LOCAL_EVENTS"}) Set<PlaceFilter> defaultFilters
) {

    public PlacesProperties {
        if (searchRadiusKm <= 0) {
            throw new IllegalArgumentException("places.search-radius-km must be positive: " + searchRadiusKm);
        }
    }

    public FilterSet defaultFilterSet() {
        return new FilterSet(defaultFilters, false);
    }
}
