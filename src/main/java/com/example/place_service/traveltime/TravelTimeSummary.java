package com.example.place_service.traveltime;

import com.example.place_service.model.TravelTimes;

/**
 * How a place's travel time should be presented.
 */
public record TravelTimeSummary(Kind kind, Integer durationInMinutes) {

    public enum Kind {
        USER_HERE,
        WALKING,
        DRIVING,
        NO_DATA
    }

    static final int MAX_WALKING_MINUTES = 30;
    static final int USER_HERE_WALKING_MINUTES = 1;

    public static TravelTimeSummary noData() {
        return new TravelTimeSummary(Kind.NO_DATA, null);
    }

    public static TravelTimeSummary of(TravelTimes travelTimes) {
        if (travelTimes == null) {
            return noData();
        }

        if (travelTimes.walkingTime() != null) {
            int walkingMinutes = (int) Math.round(travelTimes.walkingTime() / 60.0);
            if (walkingMinutes <= MAX_WALKING_MINUTES) {
                if (walkingMinutes < USER_HERE_WALKING_MINUTES) {
                    return new TravelTimeSummary(Kind.USER_HERE, null);
                }
                return new TravelTimeSummary(Kind.WALKING, walkingMinutes);
            }
        }

        if (travelTimes.drivingTime() != null) {
            return new TravelTimeSummary(Kind.DRIVING, (int) Math.round(travelTimes.drivingTime() / 60.0));
        }

        return noData();
    }
}
