package com.example.place_service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI placeServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Nearby Places API")
                        .description("Ranked, filterable places around the user's location, with navigation through the displayed list.")
                        .version("1.0"));
    }
}
