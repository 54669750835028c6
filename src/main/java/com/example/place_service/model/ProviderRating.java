package com.example.place_service.model;

/**
 * Review data from one third-party rating provider.
 * A missing {@code rating} means the provider has no average for the place.
 */
public record ProviderRating(
        String provider,
        Double rating,        // 0-5, nullable
        int totalReviewCount
) {

    public static final String YELP = "yelp";
    public static final String TRIP_ADVISOR = "tripadvisor";

    public ProviderRating {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        if (rating != null && (rating < 0 || rating > 5)) {
            throw new IllegalArgumentException("Rating must be between 0 and 5: " + rating);
        }
        if (totalReviewCount < 0) {
            throw new IllegalArgumentException("Review count must not be negative: " + totalReviewCount);
        }
    }

    public double ratingOrZero() {
        return rating == null ? 0 : rating;
    }
}
