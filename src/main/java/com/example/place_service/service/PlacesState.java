package com.example.place_service.service;

import com.example.place_service.model.FilterSet;
import com.example.place_service.model.Place;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the store commits as one unit. The index map is always built from
 * {@code displayedPlaces}, never set on its own.
 */
record PlacesState(
        List<Place> allPlaces,
        List<Place> displayedPlaces,
        Map<String, Integer> indexByKey,
        FilterSet filters
) {

    static PlacesState empty(FilterSet filters) {
        return of(List.of(), List.of(), filters);
    }

    static PlacesState of(List<Place> allPlaces, List<Place> displayedPlaces, FilterSet filters) {
        List<Place> displayed = List.copyOf(displayedPlaces);
        Map<String, Integer> indexByKey = new HashMap<>();
        for (int i = 0; i < displayed.size(); i++) {
            indexByKey.put(displayed.get(i).id(), i);
        }
        return new PlacesState(List.copyOf(allPlaces), displayed, Map.copyOf(indexByKey), filters);
    }

    PlacesState withDisplayedPlaces(List<Place> displayed) {
        return of(allPlaces, displayed, filters);
    }
}
