package com.example.place_service.filter;

import com.example.place_service.model.FilterSet;
import com.example.place_service.model.OpeningHours;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlaceFilter;
import com.example.place_service.rating.CategoryClassifier;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Selects the places the user asked to see.
 * Places that are closed and will not open again today are always dropped.
 */
public class PlaceFilterEngine {

    private final Clock clock;

    public PlaceFilterEngine(Clock clock) {
        this.clock = clock;
    }

    public List<Place> filter(List<Place> places, FilterSet filters) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        return places.stream()
                .filter(place -> isOpenOrOpensLater(place, now))
                .filter(place -> {
                    Optional<PlaceFilter> bucket = CategoryClassifier.classify(place);
                    return bucket.isPresent() && filters.isEnabled(bucket.get());
                })
                .toList();
    }

    static boolean isOpenOrOpensLater(Place place, ZonedDateTime now) {
        OpeningHours hours = place.hours();
        if (hours == null) {
            return true;
        }
        return hours.isOpen(now) || hours.nextOpeningTime(now).isPresent();
    }
}
