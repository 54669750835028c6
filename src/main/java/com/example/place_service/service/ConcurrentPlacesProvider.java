package com.example.place_service.service;

import com.example.place_service.config.PlacesProperties;
import com.example.place_service.datasource.EventsProvider;
import com.example.place_service.datasource.PlacesDatabase;
import com.example.place_service.filter.PlaceFilterEngine;
import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Event;
import com.example.place_service.model.FilterSet;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlacesSnapshot;
import com.example.place_service.ranking.PlaceRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

@Service
public class ConcurrentPlacesProvider implements PlacesProvider {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentPlacesProvider.class);

    private static final WeakReference<PlacesProviderListener> NO_LISTENER = new WeakReference<>(null);

    private final PlacesDatabase database;
    private final EventsProvider eventsProvider;
    private final PlaceFilterEngine filterEngine;
    private final PlaceRanking ranking;
    private final PlacesProperties properties;
    private final Executor notificationExecutor;

    // All places, displayed places, index map and filters, replaced as one unit.
    // Guarded by lock: readers share, commits are exclusive.
    private PlacesState state;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Displayed lists in commit order, waiting to be delivered to the listener.
    private final Queue<List<Place>> pendingNotifications = new ConcurrentLinkedQueue<>();
    private final Object deliveryMonitor = new Object();

    private final AtomicReference<WeakReference<PlacesProviderListener>> listener = new AtomicReference<>(NO_LISTENER);

    public ConcurrentPlacesProvider(PlacesDatabase database,
                                    EventsProvider eventsProvider,
                                    PlaceFilterEngine filterEngine,
                                    PlaceRanking ranking,
                                    PlacesProperties properties,
                                    @Qualifier("placesNotificationExecutor") Executor notificationExecutor) {
        this.database = database;
        this.eventsProvider = eventsProvider;
        this.filterEngine = filterEngine;
        this.ranking = ranking;
        this.properties = properties;
        this.notificationExecutor = notificationExecutor;
        this.state = PlacesState.empty(properties.defaultFilterSet());
    }

    @Override
    public Place place(int index) {
        lock.readLock().lock();
        try {
            List<Place> displayed = state.displayedPlaces();
            if (index < 0 || index >= displayed.size()) {
                throw new PlaceNotFoundException(index);
            }
            return displayed.get(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CompletableFuture<Optional<Place>> place(String key) {
        Optional<Place> local = read(s -> {
            Integer index = s.indexByKey().get(key);
            if (index != null) {
                return Optional.of(s.displayedPlaces().get(index));
            }
            return s.allPlaces().stream().filter(p -> p.id().equals(key)).findFirst();
        });
        if (local.isPresent()) {
            return CompletableFuture.completedFuture(local);
        }

        // The remote lookup runs without the lock.
        return upstream(() -> database.getPlace(key))
                .thenApply(Optional::ofNullable)
                .exceptionally(ex -> {
                    log.warn("Lookup of place {} failed: {}", key, ex.getMessage());
                    return Optional.empty();
                });
    }

    @Override
    public Optional<Place> next(String placeId) {
        return read(s -> {
            List<Place> displayed = s.displayedPlaces();
            Integer index = s.indexByKey().get(placeId);
            // A place that is no longer displayed continues at the start of the list.
            if (index == null) {
                return displayed.isEmpty() ? Optional.empty() : Optional.of(displayed.get(0));
            }
            if (index + 1 >= displayed.size()) {
                return Optional.empty();
            }
            return Optional.of(displayed.get(index + 1));
        });
    }

    @Override
    public Optional<Place> previous(String placeId) {
        return read(s -> {
            Integer index = s.indexByKey().get(placeId);
            if (index == null || index == 0) {
                return Optional.empty();
            }
            return Optional.of(s.displayedPlaces().get(index - 1));
        });
    }

    @Override
    public int count() {
        return read(s -> s.displayedPlaces().size());
    }

    @Override
    public Optional<Integer> index(Place place) {
        return read(s -> Optional.ofNullable(s.indexByKey().get(place.id())));
    }

    @Override
    public PlacesSnapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return new PlacesSnapshot(state.allPlaces(), state.displayedPlaces());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public FilterSet currentFilters() {
        return read(PlacesState::filters);
    }

    @Override
    public CompletableFuture<List<Place>> updateFromLocation(Coordinate location) {
        CompletableFuture<List<Place>> places = upstream(() -> database.getPlaces(location, properties.searchRadiusKm()))
                .exceptionally(ex -> {
                    log.warn("Fetching places near {} failed: {}", location, ex.getMessage());
                    return List.of();
                });

        CompletableFuture<List<Place>> events = upstream(() -> eventsProvider.searchEvents(location))
                .thenApply(found -> found.stream()
                        .map(Event::toPlace)
                        .flatMap(Optional::stream)
                        .toList())
                .exceptionally(ex -> {
                    log.warn("Fetching events near {} failed, continuing without them: {}", location, ex.getMessage());
                    return List.of();
                })
                .completeOnTimeout(List.of(), properties.eventsTimeout().toMillis(), TimeUnit.MILLISECONDS);

        return places.thenCombine(events, (fetchedPlaces, eventPlaces) -> {
            List<Place> merged = new ArrayList<>(fetchedPlaces);
            merged.addAll(eventPlaces);
            return merged;
        }).thenCompose(merged -> displayPlaces(merged, location));
    }

    private CompletableFuture<List<Place>> displayPlaces(List<Place> places, Coordinate location) {
        // Load travel times for the places the user will see first; the results land in the
        // cache and are reused by the full sort below.
        List<Place> placesUserWillSee = filterEngine.filter(places, currentFilters());
        ranking.sortByTravelTime(placesUserWillSee, location);

        return ranking.sortByTravelTime(places, location).thenApply(sortedPlaces -> {
            List<Place> displayed = commit(current ->
                    PlacesState.of(sortedPlaces, displayedPlacesFor(sortedPlaces, current.filters()), current.filters()));
            log.info("Committed {} places near {}, {} displayed", sortedPlaces.size(), location, displayed.size());
            return displayed;
        });
    }

    @Override
    public List<Place> refresh(FilterSet filters) {
        List<Place> displayed = commit(current ->
                PlacesState.of(current.allPlaces(), displayedPlacesFor(current.allPlaces(), filters), filters));
        log.debug("Refreshed with filters={} topRatedOnly={}, {} displayed",
                filters.enabledFilters(), filters.topRatedOnly(), displayed.size());
        return displayed;
    }

    @Override
    public List<Place> sortByDistance(Coordinate location) {
        return commit(current -> {
            if (current.filters().topRatedOnly()) {
                return current;
            }
            return current.withDisplayedPlaces(ranking.sortByDistance(current.displayedPlaces(), location));
        });
    }

    @Override
    public ListenerRegistration register(PlacesProviderListener newListener) {
        WeakReference<PlacesProviderListener> reference = new WeakReference<>(newListener);
        listener.set(reference);
        return () -> listener.compareAndSet(reference, NO_LISTENER);
    }

    /**
     * Filters and ranks {@code allPlaces}; {@code allPlaces} is already in travel-time order.
     */
    private List<Place> displayedPlacesFor(List<Place> allPlaces, FilterSet filters) {
        List<Place> filtered = filterEngine.filter(allPlaces, filters);
        return filters.topRatedOnly() ? ranking.sortByTopRated(filtered) : filtered;
    }

    // Clients may fail by throwing instead of returning a failed future.
    private static <T> CompletableFuture<T> upstream(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T read(Function<PlacesState, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies {@code mutation} under the write lock and queues one notification if the state
     * changed. The listener runs later on the notification executor.
     */
    private List<Place> commit(UnaryOperator<PlacesState> mutation) {
        List<Place> displayed;
        boolean changed;
        lock.writeLock().lock(); // Block readers and other writers
        try {
            PlacesState next = mutation.apply(state);
            changed = next != state;
            state = next;
            displayed = next.displayedPlaces();
            if (changed) {
                pendingNotifications.add(displayed);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (changed) {
            notificationExecutor.execute(this::deliverNotifications);
        }
        return displayed;
    }

    private void deliverNotifications() {
        synchronized (deliveryMonitor) {
            List<Place> displayed;
            while ((displayed = pendingNotifications.poll()) != null) {
                PlacesProviderListener current = listener.get().get();
                if (current == null) {
                    continue;
                }
                try {
                    current.onPlacesUpdated(displayed);
                } catch (RuntimeException e) {
                    log.error("Places listener failed on update of {} places", displayed.size(), e);
                }
            }
        }
    }
}
