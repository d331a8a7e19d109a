package com.fintech.bars.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration: common tags and percentile histograms for timers.
 *
 * Timer SLO buckets cover in-memory tick processing (microseconds) and
 * storage writes (milliseconds). Timer SLOs are expressed in nanoseconds.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "realtime-bar-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            nanos(Duration.ofNanos(10_000)),
                            nanos(Duration.ofNanos(100_000)),
                            nanos(Duration.ofMillis(1)),
                            nanos(Duration.ofMillis(5)),
                            nanos(Duration.ofMillis(25)),
                            nanos(Duration.ofMillis(100)),
                            nanos(Duration.ofMillis(500))
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private static double nanos(Duration duration) {
        return duration.toNanos();
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
