package com.example.place_service.traveltime;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A reusable display slot showing the travel time of one place at a time.
 * <p>
 * The slot records which place it expects when a fetch starts. A result that arrives after the
 * slot has been rebound to another place is discarded.
 */
public class TravelTimeSlot {

    private static final Logger log = LoggerFactory.getLogger(TravelTimeSlot.class);

    private final TravelTimesCache travelTimesCache;
    private final Executor uiExecutor;
    private final AtomicReference<String> expectedPlaceId = new AtomicReference<>();

    public TravelTimeSlot(TravelTimesCache travelTimesCache, Executor uiExecutor) {
        this.travelTimesCache = travelTimesCache;
        this.uiExecutor = uiExecutor;
    }

    /**
     * Requests travel times for {@code place} and hands the summary to {@code onResult} on the UI
     * executor, unless the slot was rebound in the meantime.
     *
     * @return completes with {@code true} if the result was applied, {@code false} if it was stale
     */
    public CompletableFuture<Boolean> bind(Place place, Coordinate location, Consumer<TravelTimeSummary> onResult) {
        String idAtCallTime = place.id();
        expectedPlaceId.set(idAtCallTime);

        CompletableFuture<TravelTimes> travelTimes =
                travelTimesCache.travelTimes(place, location, EnumSet.of(TransitMode.WALKING, TransitMode.DRIVING));

        return travelTimes.handleAsync((times, ex) -> {
            if (!Objects.equals(idAtCallTime, expectedPlaceId.get())) {
                log.debug("Discarding travel times for {}: slot now shows {}", idAtCallTime, expectedPlaceId.get());
                return false;
            }
            if (ex != null) {
                log.warn("Travel time lookup failed for {}", idAtCallTime, ex);
            }
            onResult.accept(ex == null ? TravelTimeSummary.of(times) : TravelTimeSummary.noData());
            return true;
        }, uiExecutor);
    }

    public void clear() {
        expectedPlaceId.set(null);
    }

    public String expectedPlaceId() {
        return expectedPlaceId.get();
    }
}
