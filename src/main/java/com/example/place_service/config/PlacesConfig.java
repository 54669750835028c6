package com.example.place_service.config;

import com.example.place_service.datasource.TravelTimesProvider;
import com.example.place_service.filter.PlaceFilterEngine;
import com.example.place_service.ranking.PlaceRanking;
import com.example.place_service.traveltime.TravelTimesCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(PlacesProperties.class)
public class PlacesConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * The single thread that owns listener callbacks, in the role of a UI main thread.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService placesNotificationExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "places-notifications");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public TravelTimesCache travelTimesCache(TravelTimesProvider travelTimesProvider, PlacesProperties properties) {
        return new TravelTimesCache(travelTimesProvider, properties.travelTimeTimeout());
    }

    @Bean
    public PlaceRanking placeRanking(TravelTimesCache travelTimesCache) {
        return new PlaceRanking(travelTimesCache);
    }

    @Bean
    public PlaceFilterEngine placeFilterEngine(Clock clock) {
        return new PlaceFilterEngine(clock);
    }
}
