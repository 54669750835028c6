package com.example.place_service.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The caller's filter configuration: enabled buckets plus the "top-rated only" toggle.
 */
public record FilterSet(Set<PlaceFilter> enabledFilters, boolean topRatedOnly) {

    public static final FilterSet DEFAULT = new FilterSet(EnumSet.of(PlaceFilter.DISCOVER, PlaceFilter.LOCAL_EVENTS), false);

    public FilterSet {
        enabledFilters = enabledFilters == null || enabledFilters.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledFilters));
    }

    public boolean isEnabled(PlaceFilter filter) {
        return enabledFilters.contains(filter);
    }
}
