package com.fintech.bars.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI realtimeBarOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Realtime Bar Service API")
                        .description("""
                                Streaming quote subscription and real-time OHLCV bar aggregation.

                                **Features:**
                                - Subscribe/unsubscribe instruments on the quote feed
                                - Latest quote and in-progress bar lookups (cache backed)
                                - Intervals 1m, 3m, 5m, 15m, 30m, 45m, 1h, 2h, 3h, 4h, 1d, 1w, 1M
                                - Completed bar history from TimescaleDB
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
