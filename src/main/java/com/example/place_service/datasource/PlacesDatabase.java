package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Backing geo-database of places.
 */
public interface PlacesDatabase {

    /**
     * Places within {@code radiusKm} of {@code location}. Records that cannot be read are left out.
     */
    CompletableFuture<List<Place>> getPlaces(Coordinate location, double radiusKm);

    /**
     * Completes exceptionally when the key is unknown or the lookup fails.
     */
    CompletableFuture<Place> getPlace(String key);
}
