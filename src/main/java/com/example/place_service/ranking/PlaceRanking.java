package com.example.place_service.ranking;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;
import com.example.place_service.rating.PlaceRating;
import com.example.place_service.traveltime.TravelTimesCache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Orderings over a list of places. All sorts are stable: places that compare equal keep
 * their input order.
 */
public class PlaceRanking {

    // Only walking directions are requested while ranking.
    private static final Set<TransitMode> RANKING_TRANSIT_MODES = EnumSet.of(TransitMode.WALKING);

    private final TravelTimesCache travelTimesCache;

    public PlaceRanking(TravelTimesCache travelTimesCache) {
        this.travelTimesCache = travelTimesCache;
    }

    public List<Place> sortByDistance(List<Place> places, Coordinate location, boolean ascending) {
        Map<String, Double> distances = places.stream()
                .collect(Collectors.toMap(Place::id, p -> location.distanceTo(p.coordinate()), (a, b) -> a));
        Comparator<Place> byDistance = Comparator.comparingDouble(p -> distances.get(p.id()));
        return sorted(places, ascending ? byDistance : byDistance.reversed());
    }

    public List<Place> sortByDistance(List<Place> places, Coordinate location) {
        return sortByDistance(places, location, true);
    }

    /**
     * Orders places by shortest known travel time, seeded by distance order.
     * <p>
     * Waits for the travel-time fetches at most for the cache's timeout. Places whose travel
     * time is still unknown sort as if infinitely far and keep their distance order among
     * themselves. The result contains exactly the input places and completes on the default
     * async executor.
     */
    public CompletableFuture<List<Place>> sortByTravelTime(List<Place> places, Coordinate location, boolean ascending) {
        List<Place> seed = sortByDistance(places, location, true);

        List<CompletableFuture<TravelTimes>> fetches = seed.stream()
                .map(place -> travelTimesCache.travelTimes(place, location, RANKING_TRANSIT_MODES))
                .toList();

        // Never sort on the JDK timeout scheduler thread that may have settled the batch.
        return travelTimesCache.awaitAll(fetches).thenApplyAsync(ignored -> {
            Map<String, Double> etas = seed.stream()
                    .collect(Collectors.toMap(Place::id, p -> travelTimesCache.lastTravelTimes(p, location)
                            .map(times -> times.shortestTravelTime().orElse(Double.MAX_VALUE))
                            .orElse(Double.MAX_VALUE), (a, b) -> a));
            Comparator<Place> byEta = Comparator.comparingDouble(p -> etas.get(p.id()));
            return sorted(seed, ascending ? byEta : byEta.reversed());
        });
    }

    public CompletableFuture<List<Place>> sortByTravelTime(List<Place> places, Coordinate location) {
        return sortByTravelTime(places, location, true);
    }

    /**
     * Orders places by composite score, best first. The review-count scale is taken from this
     * candidate set, so the same place may score differently in another set.
     */
    public List<Place> sortByTopRated(List<Place> places) {
        int maxReviews = PlaceRating.maxReviewCount(places);
        Map<String, Double> scores = places.stream()
                .collect(Collectors.toMap(Place::id, p -> PlaceRating.score(p, maxReviews), (a, b) -> a));
        return sorted(places, Comparator.comparingDouble((Place p) -> scores.get(p.id())).reversed());
    }

    private static List<Place> sorted(List<Place> places, Comparator<Place> comparator) {
        List<Place> copy = new ArrayList<>(places);
        copy.sort(comparator);  // List.sort is a stable merge sort
        return copy;
    }
}
