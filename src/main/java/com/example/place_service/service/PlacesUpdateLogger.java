package com.example.place_service.service;

import com.example.place_service.model.Place;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs every published change to the displayed places.
 */
@Component
public class PlacesUpdateLogger implements PlacesProviderListener {

    private static final Logger log = LoggerFactory.getLogger(PlacesUpdateLogger.class);

    private final PlacesProvider placesProvider;
    private ListenerRegistration registration;

    public PlacesUpdateLogger(PlacesProvider placesProvider) {
        this.placesProvider = placesProvider;
    }

    @PostConstruct
    public void start() {
        registration = placesProvider.register(this);
    }

    @PreDestroy
    public void stop() {
        if (registration != null) {
            registration.unregister();
        }
    }

    @Override
    public void onPlacesUpdated(List<Place> displayedPlaces) {
        log.info("Displayed places updated: {} places, first={}", displayedPlaces.size(),
                displayedPlaces.isEmpty() ? "-" : displayedPlaces.get(0).id());
    }
}
