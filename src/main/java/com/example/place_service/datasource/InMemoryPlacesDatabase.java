package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.OpeningHours;
import com.example.place_service.model.Place;
import com.example.place_service.model.ProviderRating;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Places held in memory, seeded with sample data at startup.
 */
@Component
public class InMemoryPlacesDatabase implements PlacesDatabase {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPlacesDatabase.class);

    // Place ID -> Place
    private final Map<String, Place> places = new ConcurrentHashMap<>();

    @PostConstruct
    public void initData() {
        getInitialSampleData().forEach(this::save);
        log.info("Initialized {} sample places", places.size());
    }

    public void save(Place place) {
        places.put(place.id(), place);
    }

    @Override
    public CompletableFuture<List<Place>> getPlaces(Coordinate location, double radiusKm) {
        double radiusMeters = radiusKm * 1000;
        List<Place> nearby = places.values().stream()
                .filter(p -> p.coordinate().distanceTo(location) <= radiusMeters)
                .sorted(Comparator.comparing(Place::id))
                .toList();
        return CompletableFuture.completedFuture(nearby);
    }

    @Override
    public CompletableFuture<Place> getPlace(String key) {
        Place place = places.get(key);
        if (place == null) {
            return CompletableFuture.failedFuture(new NoSuchElementException("No place with key: " + key));
        }
        return CompletableFuture.completedFuture(place);
    }

    private Place createPlace(String id, String name, double lat, double lon, String category,
                              OpeningHours hours, Double yelpRating, int yelpReviews) {
        return new Place(id, name, new Coordinate(lat, lon), List.of(category), hours,
                List.of(new ProviderRating(ProviderRating.YELP, yelpRating, yelpReviews)));
    }

    private List<Place> getInitialSampleData() {
        OpeningHours daytime = OpeningHours.builder().everyDay(LocalTime.of(9, 0), LocalTime.of(18, 0)).build();
        OpeningHours lateNight = OpeningHours.builder().everyDay(LocalTime.of(17, 0), LocalTime.of(2, 0)).build();

        return List.of(
                createPlace("millennium-park", "Millennium Park", 41.8826, -87.6226, "parks", null, 4.7, 3120),
                createPlace("art-institute", "Art Institute of Chicago", 41.8796, -87.6237, "arts", daytime, 4.8, 2874),
                createPlace("shedd-aquarium", "Shedd Aquarium", 41.8676, -87.6140, "aquariums", daytime, 4.5, 1980),
                createPlace("navy-pier", "Navy Pier", 41.8917, -87.6086, "landmarks", null, 3.9, 2210),
                createPlace("lou-malnatis", "Lou Malnati's", 41.8903, -87.6337, "restaurants", daytime, 4.3, 1650),
                createPlace("the-violet-hour", "The Violet Hour", 41.9087, -87.6776, "nightlife", lateNight, 4.4, 980),
                createPlace("au-cheval", "Au Cheval", 41.8847, -87.6477, "food", lateNight, 4.5, 4100),
                createPlace("water-tower-place", "Water Tower Place", 41.8977, -87.6233, "shopping", daytime, 3.8, 540),
                createPlace("chicago-public-library", "Harold Washington Library", 41.8763, -87.6282, "libraries", daytime, 4.2, 310),
                createPlace("wicker-park-bikes", "Wicker Park Bikes", 41.9088, -87.6796, "bicycles", daytime, 4.9, 45)
        );
    }
}
