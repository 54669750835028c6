package com.example.place_service.model;

/**
 * Coarse buckets a place is classified into for filtering.
 */
public enum PlaceFilter {
    DISCOVER,
    EAT_AND_DRINK,
    SHOP,
    SERVICES,
    LOCAL_EVENTS
}
