package com.example.place_service.service;

import com.example.place_service.model.Place;

import java.util.List;

/**
 * Receives the displayed places after each committed change.
 * Always called on the notification executor, never while the store is locked.
 */
@FunctionalInterface
public interface PlacesProviderListener {

    void onPlacesUpdated(List<Place> displayedPlaces);
}
