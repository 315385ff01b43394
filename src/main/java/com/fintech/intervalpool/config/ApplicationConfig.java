package com.fintech.intervalpool.config;

import com.fintech.intervalpool.pool.PoolSettings;
import com.fintech.intervalpool.source.PriceRouter;
import com.fintech.intervalpool.source.PriceSource;
import com.fintech.intervalpool.util.ResolutionTimeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    /** Real time. Upstream routing and fetch timestamps always use this clock. */
    @Bean
    @Primary
    public Clock wallClock() {
        return Clock.systemDefaultZone();
    }

    /** Pool time, optionally shifted for simulation. Decides "today" for the protected range. */
    @Bean
    public Clock poolClock(@Qualifier("wallClock") Clock wallClock, IntervalPoolProperties properties) {
        Duration offset = properties.getClock().getOffset();
        return offset == null || offset.isZero() ? wallClock : Clock.offset(wallClock, offset);
    }

    @Bean
    public ResolutionTimeline resolutionTimeline() {
        return new ResolutionTimeline();
    }

    @Bean
    public PoolSettings poolSettings(IntervalPoolProperties properties) {
        IntervalPoolProperties.Cache cache = properties.getCache();
        return new PoolSettings(
            cache.getMaxIntervals(),
            cache.getProtectedDaysBefore(),
            cache.getProtectedDaysAfter(),
            Duration.ofMillis(properties.getPersistence().getDebounceMs())
        );
    }

    @Bean
    public PriceRouter priceRouter(PriceSource priceSource, @Qualifier("wallClock") Clock wallClock) {
        return new PriceRouter(priceSource, wallClock);
    }

    /** Runs debounced saves for all pools. */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService poolSaveScheduler() {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pool-save-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
