package com.example.place_service.controller;

import com.example.place_service.model.Coordinate;
import com.example.place_service.model.FilterSet;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlacesSnapshot;
import com.example.place_service.service.PlaceNotFoundException;
import com.example.place_service.service.PlacesProvider;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
@Tag(name = "Places API", description = "Read the displayed places and push location or filter changes")
public class PlacesController {

    private final PlacesProvider placesProvider;

    public PlacesController(PlacesProvider placesProvider) {
        this.placesProvider = placesProvider;
    }

    // --- Read Endpoints ---

    @Operation(summary = "Get Displayed Places", description = "The filtered, ranked places currently shown to the user.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Displayed places",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = Place.class, type = "array")) }),
            @ApiResponse(responseCode = "204", description = "Nothing is displayed", content = @Content)
    })
    @GetMapping("/places")
    public ResponseEntity<?> getDisplayedPlaces() {
        List<Place> displayed = placesProvider.getSnapshot().displayedPlaces();

        if (displayed.isEmpty()) {
            return ResponseEntity.noContent().build();
        }

        return ResponseEntity.ok(displayed);
    }

    @Operation(summary = "Get Snapshot", description = "All fetched places and the displayed places, from the same commit.")
    @GetMapping("/places/snapshot")
    public PlacesSnapshot getSnapshot() {
        return placesProvider.getSnapshot();
    }

    @Operation(summary = "Count Displayed Places")
    @GetMapping("/places/count")
    public Map<String, Integer> count() {
        return Map.of("count", placesProvider.count());
    }

    @Operation(summary = "Get Place At Index", description = "The displayed place at a position in the list.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Place found",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = Place.class)) }),
            @ApiResponse(responseCode = "404", description = "Index outside the displayed list", content = @Content)
    })
    @GetMapping("/places/index/{index}")
    public Place getPlaceAtIndex(
            @Parameter(description = "Zero-based position in the displayed list", required = true)
            @PathVariable int index) {
        return placesProvider.place(index);
    }

    @Operation(summary = "Get Place By Key", description = "Looks a place up locally, then in the places database.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Place found",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = Place.class)) }),
            @ApiResponse(responseCode = "404", description = "Unknown place", content = @Content)
    })
    @GetMapping("/places/{id}")
    public CompletableFuture<ResponseEntity<Place>> getPlace(@PathVariable String id) {
        return placesProvider.place(id)
                .thenApply(place -> place
                        .map(ResponseEntity::ok)
                        .orElse(ResponseEntity.notFound().build()));
    }

    @Operation(summary = "Next Place", description = "The displayed place after the given one. Unknown places continue at the first displayed place.")
    @GetMapping("/places/{id}/next")
    public ResponseEntity<Place> next(@PathVariable String id) {
        return placesProvider.next(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @Operation(summary = "Previous Place", description = "The displayed place before the given one.")
    @GetMapping("/places/{id}/previous")
    public ResponseEntity<Place> previous(@PathVariable String id) {
        return placesProvider.previous(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @Operation(summary = "Get Filters")
    @GetMapping("/filters")
    public FilterSet getFilters() {
        return placesProvider.currentFilters();
    }

    // --- Mutation Endpoints ---

    @Operation(summary = "Update Location", description = "Fetches and ranks places around a new location. Listeners are notified once the ranking commits.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Update started"),
            @ApiResponse(responseCode = "400", description = "Invalid coordinate")
    })
    @PostMapping("/location")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void updateLocation(@RequestBody Coordinate location) {
        placesProvider.updateFromLocation(location);
    }

    @Operation(summary = "Apply Filters", description = "Re-filters and re-ranks the fetched places without fetching again.")
    @PutMapping("/filters")
    public List<Place> applyFilters(@RequestBody FilterSet filters) {
        return placesProvider.refresh(filters);
    }

    @Operation(summary = "Sort By Distance", description = "Re-sorts the displayed places by distance from a location. Ignored in top-rated mode.")
    @PostMapping("/places/sort-by-distance")
    public List<Place> sortByDistance(@RequestBody Coordinate location) {
        return placesProvider.sortByDistance(location);
    }

    @ExceptionHandler(PlaceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    @Hidden
    public Map<String, Object> handleNotFound(PlaceNotFoundException ex) {
        return Map.of("error", ex.getMessage(), "index", ex.getIndex());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @Hidden
    public Map<String, String> handleBadRequest(IllegalArgumentException ex) {
        return Map.of("error", ex.getMessage());
    }
}
