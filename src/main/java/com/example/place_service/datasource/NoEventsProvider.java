package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Event;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Used when no events backend is configured.
 */
@Component
public class NoEventsProvider implements EventsProvider {

    @Override
    public CompletableFuture<List<Event>> searchEvents(Coordinate near) {
        return CompletableFuture.completedFuture(List.of());
    }
}
