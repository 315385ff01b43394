package com.fintech.intervalpool.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI intervalPoolOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Interval Pool Service API")
                        .description("""
                                Gap-aware cache for time-stamped price intervals.

                                **Features:**
                                - Fetches only the missing sub-ranges of a request
                                - Hourly prices before 2025-10-01, quarter-hourly from then on
                                - Protected window (day-before-yesterday to end of tomorrow) never evicted
                                - Bounded pool size with oldest-first eviction
                                - Debounced persistence to Chronicle Map
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
