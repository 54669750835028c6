package com.example.place_service.filter;

import com.example.place_service.model.Event;
import com.example.place_service.model.FilterSet;
import com.example.place_service.model.OpeningHours;
import com.example.place_service.model.Place;
import com.example.place_service.model.PlaceFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.example.place_service.TestPlaces.NOON;
import static com.example.place_service.TestPlaces.ids;
import static com.example.place_service.TestPlaces.metersNorth;
import static com.example.place_service.TestPlaces.place;
import static com.example.place_service.TestPlaces.rated;
import static com.example.place_service.TestPlaces.withHours;
import static org.assertj.core.api.Assertions.assertThat;

class PlaceFilterEngineTest {

    private static final FilterSet ALL = new FilterSet(EnumSet.allOf(PlaceFilter.class), false);

    private final PlaceFilterEngine filterEngine = new PlaceFilterEngine(NOON);

    private static FilterSet enabled(PlaceFilter... filters) {
        return new FilterSet(Set.of(filters), false);
    }

    @Test
    @DisplayName("Filtering A(shopping) and B(restaurants) to eat-and-drink should keep only B")
    void testFilterExample() {
        Place a = place("A", 100, "shopping");
        Place b = rated("B", 50, "restaurants", 4.5, 20);

        assertThat(filterEngine.filter(List.of(a, b), enabled(PlaceFilter.EAT_AND_DRINK))).containsExactly(b);
    }

    @Test
    @DisplayName("Only places in enabled buckets should pass, in input order")
    void testEnabledBuckets() {
        List<Place> places = List.of(
                place("park", 10, "parks"),
                place("mall", 20, "shopping"),
                place("diner", 30, "food"),
                place("mystery", 40, "unknown-tag"));

        assertThat(ids(filterEngine.filter(places, enabled(PlaceFilter.DISCOVER, PlaceFilter.SHOP))))
                .containsExactly("park", "mall");
        assertThat(ids(filterEngine.filter(places, ALL))).containsExactly("park", "mall", "diner");
        assertThat(filterEngine.filter(places, enabled())).isEmpty();
    }

    @Test
    @DisplayName("Closed places with no later opening today should be dropped whatever the filters")
    void testHoursGate() {
        OpeningHours morningOnly = OpeningHours.builder().everyDay(LocalTime.of(8, 0), LocalTime.of(11, 0)).build();
        OpeningHours eveningOnly = OpeningHours.builder().everyDay(LocalTime.of(17, 0), LocalTime.of(23, 0)).build();
        OpeningHours allDay = OpeningHours.builder().everyDay(LocalTime.of(6, 0), LocalTime.of(22, 0)).build();
        OpeningHours noPeriods = OpeningHours.builder().build();

        List<Place> places = List.of(
                withHours("closed-for-today", "parks", morningOnly),
                withHours("opens-later", "parks", eveningOnly),
                withHours("open-now", "parks", allDay),
                withHours("never-open", "parks", noPeriods),
                place("no-schedule", 10, "parks"));

        assertThat(ids(filterEngine.filter(places, ALL))).containsExactly("opens-later", "open-now", "no-schedule");
    }

    @Test
    @DisplayName("Adapted events should be classified as local events")
    void testEvents() {
        Place concert = new Event("1", "Concert", metersNorth(100), ZonedDateTime.now(NOON), List.of("music"))
                .toPlace()
                .orElseThrow();

        assertThat(filterEngine.filter(List.of(concert), enabled(PlaceFilter.LOCAL_EVENTS))).containsExactly(concert);
        assertThat(filterEngine.filter(List.of(concert), enabled(PlaceFilter.DISCOVER))).isEmpty();
    }
}
