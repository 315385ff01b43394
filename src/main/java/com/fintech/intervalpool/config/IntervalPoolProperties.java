package com.fintech.intervalpool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized configuration for the interval pool service.
 * Maps to 'interval-pool.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "interval-pool")
public class IntervalPoolProperties {

    private Cache cache = new Cache();
    private Persistence persistence = new Persistence();
    private Storage storage = new Storage();
    private ClockConfig clock = new ClockConfig();
    private Simulation simulation = new Simulation();

    /** Zone used when a request does not name one. */
    private String defaultTimeZone = "Europe/Berlin";

    @Data
    public static class Cache {
        private int maxIntervals = 960;
        private int protectedDaysBefore = 2;
        private int protectedDaysAfter = 2;  // exclusive: today + 2 days, 00:00
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
        private long debounceMs = 3000L;
    }

    @Data
    public static class Storage {
        private String type = "chronicle-map";
        private ChronicleMapConfig chronicleMap = new ChronicleMapConfig();

        @Data
        public static class ChronicleMapConfig {
            private String path = "./data/interval-pool.dat";
            private long entries = 10_000L;
            private double averageKeySize = 32.0;
            private double averageValueSize = 131_072.0;  // ~960 intervals as JSON
        }
    }

    @Data
    public static class ClockConfig {
        /** Shift applied to the pool clock only; upstream routing always uses real time. */
        private Duration offset = Duration.ZERO;
    }

    @Data
    public static class Simulation {
        private boolean enabled = true;
        private double basePrice = 0.25;
        private double volatility = 0.02;
        private int recentDaysAfter = 2;
    }
}
