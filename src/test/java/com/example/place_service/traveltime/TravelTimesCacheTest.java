package com.example.place_service.traveltime;

import com.example.place_service.datasource.TravelTimesProvider;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.place_service.TestPlaces.ORIGIN;
import static com.example.place_service.TestPlaces.metersNorth;
import static com.example.place_service.TestPlaces.place;
import static org.assertj.core.api.Assertions.assertThat;

class TravelTimesCacheTest {

    private static final Set<TransitMode> WALKING = Set.of(TransitMode.WALKING);

    private final AtomicInteger fetches = new AtomicInteger();
    private final List<CompletableFuture<TravelTimes>> pending = new ArrayList<>();
    private TravelTimesCache cache;

    @BeforeEach
    void setUp() {
        TravelTimesProvider provider = (place, from, modes) -> {
            fetches.incrementAndGet();
            CompletableFuture<TravelTimes> future = new CompletableFuture<>();
            synchronized (pending) {
                pending.add(future);
            }
            return future;
        };
        cache = new TravelTimesCache(provider, Duration.ofMillis(100));
    }

    @Test
    @DisplayName("Concurrent requests for the same place should share one in-flight fetch")
    void testConcurrentRequestsShareFetch() throws Exception {
        Place park = place("park", 100, "parks");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<CompletableFuture<TravelTimes>>> requests = new ArrayList<>();
        try {
            for (int i = 0; i < 32; i++) {
                requests.add(pool.submit(() -> cache.travelTimes(park, ORIGIN, WALKING)));
            }
            List<CompletableFuture<TravelTimes>> futures = new ArrayList<>();
            for (Future<CompletableFuture<TravelTimes>> request : requests) {
                futures.add(request.get(5, TimeUnit.SECONDS));
            }

            assertThat(fetches).hasValue(1);
            pending.get(0).complete(new TravelTimes(120.0, null));
            for (CompletableFuture<TravelTimes> future : futures) {
                assertThat(future.get(1, TimeUnit.SECONDS).walkingTime()).isEqualTo(120.0);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Nearby reference locations should reuse the entry; distant ones should fetch again")
    void testLocationBuckets() {
        Place park = place("park", 100, "parks");

        cache.travelTimes(park, ORIGIN, WALKING);
        cache.travelTimes(park, metersNorth(10), WALKING);
        assertThat(fetches).hasValue(1);

        cache.travelTimes(park, metersNorth(2000), WALKING);
        assertThat(fetches).hasValue(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("lastTravelTimes should be empty until the fetch completes")
    void testLastTravelTimes() {
        Place park = place("park", 100, "parks");
        assertThat(cache.lastTravelTimes(park, ORIGIN)).isEmpty();

        cache.travelTimes(park, ORIGIN, WALKING);
        assertThat(cache.lastTravelTimes(park, ORIGIN)).isEmpty();

        pending.get(0).complete(new TravelTimes(60.0, 20.0));
        assertThat(cache.lastTravelTimes(park, ORIGIN)).contains(new TravelTimes(60.0, 20.0));
    }

    @Test
    @DisplayName("A failed fetch should be retried on the next request")
    void testFailedFetchIsRetried() {
        Place park = place("park", 100, "parks");

        cache.travelTimes(park, ORIGIN, WALKING);
        pending.get(0).completeExceptionally(new IllegalStateException("routing unavailable"));
        assertThat(cache.lastTravelTimes(park, ORIGIN)).isEmpty();

        cache.travelTimes(park, ORIGIN, WALKING);
        assertThat(fetches).hasValue(2);
    }

    @Test
    @DisplayName("A provider that throws should yield a failed future rather than an exception")
    void testProviderThrows() {
        TravelTimesCache throwing = new TravelTimesCache((place, from, modes) -> {
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(100));

        CompletableFuture<TravelTimes> future = throwing.travelTimes(place("park", 100, "parks"), ORIGIN, WALKING);

        assertThat(future).isCompletedExceptionally();
    }

    @Test
    @DisplayName("awaitAll should resolve after the timeout when fetches hang")
    void testAwaitAll_Timeout() {
        CompletableFuture<TravelTimes> hanging = cache.travelTimes(place("a", 100, "parks"), ORIGIN, WALKING);
        CompletableFuture<TravelTimes> done = CompletableFuture.completedFuture(new TravelTimes(1.0, null));

        CompletableFuture<Void> all = cache.awaitAll(List.of(hanging, done));

        assertThat(all).succeedsWithin(Duration.ofSeconds(2));
        assertThat(hanging).isNotDone();
    }

    @Test
    @DisplayName("awaitAll should resolve normally when fetches fail")
    void testAwaitAll_Failures() {
        CompletableFuture<TravelTimes> failed = CompletableFuture.failedFuture(new IllegalStateException("down"));
        CompletableFuture<TravelTimes> done = CompletableFuture.completedFuture(new TravelTimes(1.0, null));

        assertThat(cache.awaitAll(List.of(failed, done))).isCompleted();
        assertThat(cache.awaitAll(List.of())).isCompleted();
    }
}
