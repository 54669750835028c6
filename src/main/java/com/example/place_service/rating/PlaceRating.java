package com.example.place_service.rating;

import com.example.place_service.model.Place;
import com.example.place_service.model.ProviderRating;

import java.util.Collection;

/**
 * Composite quality score of a place, from 0 to 1.
 * Review volume is weighted twice as heavily as the average rating.
 */
public final class PlaceRating {

    static final double RATING_WEIGHT = 1;
    static final double REVIEW_WEIGHT = 2;

    private PlaceRating() {
    }

    public static int maxReviewCount(Collection<Place> places) {
        return places.stream().mapToInt(PlaceRating::reviewCount).max().orElse(0);
    }

    /**
     * Reviews counted towards the score: Yelp plus TripAdvisor. Other providers are ignored.
     */
    public static int reviewCount(Place place) {
        return countOf(place, ProviderRating.YELP) + countOf(place, ProviderRating.TRIP_ADVISOR);
    }

    /**
     * @param maxReviewCount largest review count across the candidate set being ranked
     */
    public static double score(Place place, int maxReviewCount) {
        ProviderRating yelp = place.provider(ProviderRating.YELP).orElse(null);
        ProviderRating tripAdvisor = place.provider(ProviderRating.TRIP_ADVISOR).orElse(null);

        double yelpCount = yelp == null ? 0 : yelp.totalReviewCount();
        double taCount = tripAdvisor == null ? 0 : tripAdvisor.totalReviewCount();
        double yelpRating = yelp == null ? 0 : yelp.ratingOrZero();
        double taRating = tripAdvisor == null ? 0 : tripAdvisor.ratingOrZero();

        double totalCount = reviewCount(place);
        double ratingScore = totalCount == 0
                ? 0
                : (yelpRating * yelpCount + taRating * taCount) / totalCount / 5;

        double reviewScore = reviewScore(totalCount, maxReviewCount);

        double composite = (ratingScore * RATING_WEIGHT + reviewScore * REVIEW_WEIGHT) / (RATING_WEIGHT + REVIEW_WEIGHT);
        return Math.max(0, Math.min(1, composite));
    }

    private static int countOf(Place place, String provider) {
        return place.provider(provider).map(ProviderRating::totalReviewCount).orElse(0);
    }

    private static double reviewScore(double reviewCount, int maxReviewCount) {
        double logMax = maxReviewCount > 0 ? Math.log10(maxReviewCount) : 0;
        if (logMax <= 0 || reviewCount <= 0) {
            return 0;
        }
        return Math.max(0, Math.log10(reviewCount) / logMax);
    }
}
