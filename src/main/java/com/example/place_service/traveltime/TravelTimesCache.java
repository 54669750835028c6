package com.example.place_service.traveltime;

import com.example.place_service.datasource.TravelTimesProvider;
import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Place;
import com.example.place_service.model.TransitMode;
import com.example.place_service.model.TravelTimes;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Memoizes travel-time computations per place and reference location.
 * <p>
 * Concurrent requests for the same key share one in-flight future. Entries are never evicted,
 * including computations that never complete; a computation that fails is dropped by the cache
 * so the next request retries it.
 */
public class TravelTimesCache {

    private static final Logger log = LoggerFactory.getLogger(TravelTimesCache.class);

    /**
     * Reference locations are bucketed to three decimal places (about 100 m) so that small
     * movements of the user reuse earlier results.
     */
    record TravelTimeKey(String placeId, long latitudeBucket, long longitudeBucket) {

        static TravelTimeKey of(Place place, Coordinate location) {
            return new TravelTimeKey(place.id(),
                    Math.round(location.latitude() * 1000),
                    Math.round(location.longitude() * 1000));
        }
    }

    private final TravelTimesProvider provider;
    private final Duration timeout;
    // TODO: bound with maximumSize once rapid re-querying shows up in heap profiles
    private final AsyncCache<TravelTimeKey, TravelTimes> cache = Caffeine.newBuilder().buildAsync();

    public TravelTimesCache(TravelTimesProvider provider, Duration timeout) {
        this.provider = provider;
        this.timeout = timeout;
    }

    public CompletableFuture<TravelTimes> travelTimes(Place place, Coordinate location, Set<TransitMode> transitModes) {
        return cache.get(TravelTimeKey.of(place, location), (key, executor) -> {
            log.debug("Fetching travel times for place={} modes={}", place.id(), transitModes);
            try {
                return provider.computeTravelTimes(place, location, transitModes);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    /**
     * The travel times already resolved for the place, without waiting.
     */
    public Optional<TravelTimes> lastTravelTimes(Place place, Coordinate location) {
        CompletableFuture<TravelTimes> future = cache.getIfPresent(TravelTimeKey.of(place, location));
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.join());
    }

    /**
     * Completes once every future has settled, successfully or not, or once the timeout elapses.
     * Never completes exceptionally.
     */
    public CompletableFuture<Void> awaitAll(Collection<CompletableFuture<TravelTimes>> futures) {
        CompletableFuture<?>[] settled = futures.stream()
                .map(f -> f.handle((times, ex) -> null))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(settled)
                .completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenRun(() -> {
                    long pending = futures.stream().filter(f -> !f.isDone()).count();
                    if (pending > 0) {
                        log.warn("Travel time batch timed out after {} with {} of {} fetches pending",
                                timeout, pending, futures.size());
                    }
                });
    }

    long size() {
        return cache.synchronous().estimatedSize();
    }
}
