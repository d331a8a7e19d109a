package com.fintech.bars.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the bar service.
 * Maps to 'bars.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "bars")
public class BarProperties {

    private Stream stream = new Stream();
    private Aggregation aggregation = new Aggregation();
    private Cache cache = new Cache();

    @Data
    public static class Stream {
        private String url = "wss://data.tradingview.com/socket.io/websocket";
        private String origin = "https://www.tradingview.com";
        private String userAgent = "Mozilla/5.0";
        private long connectTimeoutMs = 10_000L;
        private int connectionLostTimeoutSeconds = 30;
        private long backoffFloorMs = 1_000L;
        private long backoffCeilingMs = 60_000L;
        private boolean autoStart = false;
        private List<String> symbols = new ArrayList<>();  // EXCHANGE:SYMBOL
    }

    @Data
    public static class Aggregation {
        private List<String> intervals = new ArrayList<>(List.of("1m", "5m", "1h", "1d"));
        private int partitions = 16;
    }

    @Data
    public static class Cache {
        private String type = "redis";  // redis | memory
        private long quoteTtlSeconds = 60L;
        private long barTtlSeconds = 300L;
    }
}
