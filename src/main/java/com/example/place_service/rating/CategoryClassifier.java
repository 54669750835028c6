package com.example.place_service.rating;

import com.example.place_service.model.Event;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlaceFilter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a place onto exactly one {@link PlaceFilter} bucket from its category tags.
 */
public final class CategoryClassifier {

    /** Synthetic entries with this id prefix always land in {@link PlaceFilter#SERVICES}. */
    public static final String SYNTHETIC_SERVICE_PREFIX = "synthetic-service:";

    private static final Map<String, PlaceFilter> CATEGORY_TO_FILTER = buildCategoryTable();

    private CategoryClassifier() {
    }

    public static Optional<PlaceFilter> classify(Place place) {
        if (place.id().startsWith(SYNTHETIC_SERVICE_PREFIX)) {
            return Optional.of(PlaceFilter.SERVICES);
        }
        if (place.id().startsWith(Event.PLACE_ID_PREFIX)) {
            return Optional.of(PlaceFilter.LOCAL_EVENTS);
        }
        return place.categories().stream()
                .map(CATEGORY_TO_FILTER::get)
                .filter(Objects::nonNull)
                .findFirst();
    }

    private static Map<String, PlaceFilter> buildCategoryTable() {
        Map<String, PlaceFilter> table = new HashMap<>();
        register(table, PlaceFilter.DISCOVER,
                "arts", "localflavor",
                // active life
                "amusementparks", "aquariums", "battingcages", "beaches", "boating", "escapegames",
                "experiences", "flyboarding", "gliding", "golf", "hanggliding", "hiking",
                "horsebackriding", "hot_air_balloons", "jetskis", "lakes", "lasertag", "mini_golf",
                "mountainbiking", "paddleboarding", "paintball", "parasailing", "parks", "publicplazas",
                "rafting", "rock_climbing", "sailing", "scavengerhunts", "skatingrinks", "skiing",
                "skydiving", "sledding", "snorkeling", "surfing", "trampoline", "tubing", "waterparks",
                "wildlifehunting", "zipline", "zoos", "zorbing",
                // hotels & travel
                "tours",
                // public services
                "landmarks", "courthouses", "libraries", "townhall",
                "musicvenues",
                "boatcharters", "silentdisco");
        register(table, PlaceFilter.EAT_AND_DRINK,
                "food", "nightlife", "restaurants");
        register(table, PlaceFilter.SHOP,
                "shopping");
        register(table, PlaceFilter.SERVICES,
                "active", "adultentertainment", "auto", "beautysvc", "bicycles", "education",
                "eventservices", "financialservices", "health", "homeservices", "hotelstravel",
                "localservices", "professional", "massmedia", "pets", "publicservicesgovt",
                "realestate", "religiousorgs",
                "convenience");
        return Collections.unmodifiableMap(table);
    }

    private static void register(Map<String, PlaceFilter> table, PlaceFilter filter, String... categories) {
        for (String category : categories) {
            PlaceFilter previous = table.put(category, filter);
            if (previous != null) {
                throw new IllegalStateException("Category " + category + " mapped to both " + previous + " and " + filter);
            }
        }
    }
}
