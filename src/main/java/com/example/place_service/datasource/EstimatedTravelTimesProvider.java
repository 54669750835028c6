package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Estimates travel times from straight-line distance at fixed speeds.
 * Stands in for a routing backend.
 */
@Component
public class EstimatedTravelTimesProvider implements TravelTimesProvider {

    static final double WALKING_METERS_PER_SECOND = 1.4;
    static final double DRIVING_METERS_PER_SECOND = 11.0;

    @Override
    public CompletableFuture<TravelTimes> computeTravelTimes(Place place, Coordinate from, Set<TransitMode> transitModes) {
        double meters = from.distanceTo(place.coordinate());
        Double walking = transitModes.contains(TransitMode.WALKING) ? meters / WALKING_METERS_PER_SECOND : null;
        Double driving = transitModes.contains(TransitMode.DRIVING) ? meters / DRIVING_METERS_PER_SECOND : null;
        return CompletableFuture.completedFuture(new TravelTimes(walking, driving));
    }
}
