package com.example.place_service.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A point of interest. Identity and equality are defined by {@code id} alone.
 */
public record Place(
        String id,
        String name,
        Coordinate coordinate,
        List<String> categories,          // ordered tag ids
        OpeningHours hours,               // nullable: no schedule known
        List<ProviderRating> ratingProviders
) {

    private static final int MAX_LABEL_CATEGORIES = 3;

    public Place {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(coordinate, "coordinate");
        categories = categories == null ? List.of() : List.copyOf(categories);
        ratingProviders = ratingProviders == null ? List.of() : List.copyOf(ratingProviders);
    }

    /**
     * Up to three category names for a list row, e.g. "Coffee • Bakeries • Cafes".
     * Null when the place has no categories.
     */
    @JsonProperty("categoryLabel")
    public String categoryLabel() {
        if (categories.isEmpty()) {
            return null;
        }
        return String.join(" • ", categories.subList(0, Math.min(MAX_LABEL_CATEGORIES, categories.size())));
    }

    public Optional<ProviderRating> provider(String name) {
        return ratingProviders.stream()
                .filter(p -> p.provider().equals(name))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
