package com.example.place_service.datasource;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.Event;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface EventsProvider {

    CompletableFuture<List<Event>> searchEvents(Coordinate near);
}
