package com.example.place_service.model;

import java.util.List;

/**
 * Both place sequences as committed together.
 */
public record PlacesSnapshot(List<Place> allPlaces, List<Place> displayedPlaces) {}
