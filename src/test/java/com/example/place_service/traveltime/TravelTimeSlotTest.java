package com.example.place_service.traveltime;

import com.example.place_service.model.Place;
import com.example.place_service.model.TravelTimes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.place_service.TestPlaces.ORIGIN;
import static com.example.place_service.TestPlaces.place;
import static org.assertj.core.api.Assertions.assertThat;

class TravelTimeSlotTest {

    private final Map<String, CompletableFuture<TravelTimes>> fetches = new ConcurrentHashMap<>();
    private final List<TravelTimeSummary> shown = new CopyOnWriteArrayList<>();
    private TravelTimeSlot slot;

    @BeforeEach
    void setUp() {
        TravelTimesCache cache = new TravelTimesCache(
                (place, from, modes) -> fetches.computeIfAbsent(place.id(), id -> new CompletableFuture<>()),
                Duration.ofSeconds(1));
        slot = new TravelTimeSlot(cache, Runnable::run);
    }

    @Test
    @DisplayName("Result should be applied when the slot still shows the requested place")
    void testApplied() {
        Place museum = place("museum", 500, "arts");

        CompletableFuture<Boolean> applied = slot.bind(museum, ORIGIN, shown::add);
        fetches.get("museum").complete(new TravelTimes(600.0, 120.0));

        assertThat(applied.join()).isTrue();
        assertThat(shown).containsExactly(new TravelTimeSummary(TravelTimeSummary.Kind.WALKING, 10));
    }

    @Test
    @DisplayName("Result should be discarded when the slot was reused for another place")
    void testStaleResultDiscarded() {
        Place museum = place("museum", 500, "arts");
        Place diner = place("diner", 200, "food");

        CompletableFuture<Boolean> first = slot.bind(museum, ORIGIN, shown::add);
        CompletableFuture<Boolean> second = slot.bind(diner, ORIGIN, shown::add);

        fetches.get("museum").complete(new TravelTimes(600.0, null));
        assertThat(first.join()).isFalse();
        assertThat(shown).isEmpty();

        fetches.get("diner").complete(new TravelTimes(10.0, null));
        assertThat(second.join()).isTrue();
        assertThat(shown).containsExactly(new TravelTimeSummary(TravelTimeSummary.Kind.USER_HERE, null));
        assertThat(slot.expectedPlaceId()).isEqualTo("diner");
    }

    @Test
    @DisplayName("Cleared slot should discard late results; failures should show no data")
    void testClearedAndFailed() {
        Place museum = place("museum", 500, "arts");
        CompletableFuture<Boolean> cleared = slot.bind(museum, ORIGIN, shown::add);
        slot.clear();
        fetches.get("museum").completeExceptionally(new IllegalStateException("routing unavailable"));
        assertThat(cleared.join()).isFalse();

        Place diner = place("diner", 200, "food");
        CompletableFuture<Boolean> failed = slot.bind(diner, ORIGIN, shown::add);
        fetches.get("diner").completeExceptionally(new IllegalStateException("routing unavailable"));

        assertThat(failed.join()).isTrue();
        assertThat(shown).containsExactly(TravelTimeSummary.noData());
    }

    @Test
    @DisplayName("Summary should prefer walking within half an hour, then driving")
    void testSummary() {
        assertThat(TravelTimeSummary.of(new TravelTimes(20.0, null)).kind()).isEqualTo(TravelTimeSummary.Kind.USER_HERE);
        assertThat(TravelTimeSummary.of(new TravelTimes(1800.0, 300.0)))
                .isEqualTo(new TravelTimeSummary(TravelTimeSummary.Kind.WALKING, 30));
        assertThat(TravelTimeSummary.of(new TravelTimes(3600.0, 900.0)))
                .isEqualTo(new TravelTimeSummary(TravelTimeSummary.Kind.DRIVING, 15));
        assertThat(TravelTimeSummary.of(new TravelTimes(null, 90.0)))
                .isEqualTo(new TravelTimeSummary(TravelTimeSummary.Kind.DRIVING, 2));
        assertThat(TravelTimeSummary.of(new TravelTimes(3600.0, null))).isEqualTo(TravelTimeSummary.noData());
        assertThat(TravelTimeSummary.of(null)).isEqualTo(TravelTimeSummary.noData());
    }
}
