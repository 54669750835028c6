package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Travel-routing backend.
 * The returned future is not guaranteed to ever complete; callers must bound their wait.
 */
public interface TravelTimesProvider {

    CompletableFuture<TravelTimes> computeTravelTimes(Place place, Coordinate from, Set<TransitMode> transitModes);
}
