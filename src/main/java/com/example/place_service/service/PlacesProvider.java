package com.example.place_service.service;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.FilterSet;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlacesSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface PlacesProvider {

    // Read Methods

    /**
     * The displayed place at {@code index}.
     *
     * @throws PlaceNotFoundException if {@code index} is outside {@code [0, count())}
     */
    Place place(int index);

    /**
     * Looks a place up by key, locally first and then in the backing database.
     * Completes with empty if the place cannot be found.
     */
    CompletableFuture<Optional<Place>> place(String key);

    /**
     * The displayed place after the one with {@code placeId}. A place that is not displayed is
     * followed by the first displayed place.
     */
    Optional<Place> next(String placeId);

    /**
     * The displayed place before the one with {@code placeId}; empty for the first place and for
     * places not displayed.
     */
    Optional<Place> previous(String placeId);

    default Optional<Place> next(Place place) {
        return next(place.id());
    }

    default Optional<Place> previous(Place place) {
        return previous(place.id());
    }

    int count();

    Optional<Integer> index(Place place);

    /**
     * All places and displayed places from the same commit.
     */
    PlacesSnapshot getSnapshot();

    FilterSet currentFilters();

    // Mutations

    /**
     * Fetches places around {@code location}, ranks them by travel time and commits them.
     * Completes with the new displayed places.
     */
    CompletableFuture<List<Place>> updateFromLocation(Coordinate location);

    /**
     * Re-applies filtering and ranking to the current places without fetching.
     * Must be called from the UI-owning context.
     */
    List<Place> refresh(FilterSet filters);

    /**
     * Re-sorts the displayed places by distance. Does nothing in top-rated mode.
     */
    List<Place> sortByDistance(Coordinate location);

    ListenerRegistration register(PlacesProviderListener listener);
}
