package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rolling failure statistics used as a health signal.
 *
 * @param interval         window length; counters reset at the end of every window
 * @param failureThreshold failure ratio above which the tracker trips
 * @param queueCapacity    bound of the outcome queue
 */
@ConfigurationProperties(prefix = "pdp.statistics")
public record StatisticsProperties(
        Duration interval,
        Double failureThreshold,
        Integer queueCapacity
) {
    public StatisticsProperties {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            interval = Duration.ofSeconds(60);
        }
        if (failureThreshold == null) {
            failureThreshold = 0.1;
        }
        if (queueCapacity == null || queueCapacity <= 0) {
            queueCapacity = 1024;
        }
    }

    public static StatisticsProperties defaults() {
        return new StatisticsProperties(null, null, null);
    }
}
