package com.example.place_service.model;

import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * Travel durations from a reference location, in seconds. Either value may be absent.
 */
public record TravelTimes(Double walkingTime, Double drivingTime) {

    public OptionalDouble shortestTravelTime() {
        return Stream.of(walkingTime, drivingTime)
                .filter(t -> t != null)
                .mapToDouble(Double::doubleValue)
                .min();
    }
}
