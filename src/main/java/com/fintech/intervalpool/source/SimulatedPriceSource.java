package com.fintech.intervalpool.source;

import com.fintech.intervalpool.config.IntervalPoolProperties;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.PriceLevel;
import com.fintech.intervalpool.util.ResolutionTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulates the remote price source for local runs and demos.
 *
 * Prices follow a daily load curve plus seeded noise. The seed is derived from the subject
 * and the interval start, so the same interval always gets the same price no matter which
 * endpoint or request produced it.
 *
 * Recent endpoint: day-before-yesterday 00:00 up to the configured number of days after today.
 * Historical endpoint: the requested range, hourly before the resolution cutover.
 */
@Component
@ConditionalOnProperty(name = "interval-pool.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPriceSource.class);

    private static final double TAX_RATE = 0.19;
    private static final double FIXED_TAX = 0.08;

    private final IntervalPoolProperties.Simulation config;
    private final ResolutionTimeline timeline;
    private final Clock wallClock;
    private final AtomicLong requestsServed = new AtomicLong();

    public SimulatedPriceSource(IntervalPoolProperties properties,
                                ResolutionTimeline timeline,
                                @Qualifier("wallClock") Clock wallClock) {
        this.config = properties.getSimulation();
        this.timeline = timeline;
        this.wallClock = wallClock;
        log.info("Simulated price source enabled (base price {}, volatility {})",
                config.getBasePrice(), config.getVolatility());
    }

    @Override
    public List<PriceInterval> fetchRecent(String subjectId, ZoneId zone) {
        LocalDate today = LocalDate.now(wallClock.withZone(zone));
        ZonedDateTime start = today.minusDays(2).atStartOfDay(zone);
        ZonedDateTime end = today.plusDays(config.getRecentDaysAfter()).atStartOfDay(zone);
        requestsServed.incrementAndGet();
        return generate(subjectId, start, end);
    }

    @Override
    public List<PriceInterval> fetchRange(String subjectId, ZonedDateTime start, ZonedDateTime end) {
        if (!start.isBefore(end)) {
            throw new UpstreamException(400, "Invalid range: " + start + " to " + end, null);
        }
        requestsServed.incrementAndGet();
        return generate(subjectId, start, end);
    }

    private List<PriceInterval> generate(String subjectId, ZonedDateTime start, ZonedDateTime end) {
        List<PriceInterval> intervals = new ArrayList<>();
        ZonedDateTime current = timeline.firstIntervalStartAtOrAfter(start);
        while (current.isBefore(end)) {
            intervals.add(priceAt(subjectId, current));
            current = timeline.nextIntervalStart(current);
        }
        log.debug("Simulated {} intervals for subject {}: {} to {}", intervals.size(), subjectId, start, end);
        return intervals;
    }

    private PriceInterval priceAt(String subjectId, ZonedDateTime start) {
        long seed = 31L * subjectId.hashCode() + start.toEpochSecond();
        SplittableRandom random = new SplittableRandom(seed);

        // Morning and evening peaks
        double hour = start.getHour() + start.getMinute() / 60.0;
        double curve = 0.15 * Math.sin((hour - 6.0) / 24.0 * 2 * Math.PI)
                + 0.10 * Math.sin((hour - 3.0) / 12.0 * 2 * Math.PI);

        double volatility = config.getVolatility();
        double noise = volatility > 0 ? random.nextDouble(-volatility, volatility) : 0.0;
        double energy = Math.max(0.0, config.getBasePrice() * (1.0 + curve) + noise);
        double tax = round(energy * TAX_RATE + FIXED_TAX);
        energy = round(energy);
        double total = round(energy + tax);

        return new PriceInterval(start.toOffsetDateTime(), total, energy, tax, classify(energy),
                Map.of("currency", "EUR"));
    }

    private PriceLevel classify(double energy) {
        double ratio = energy / config.getBasePrice();
        if (ratio < 0.8) {
            return PriceLevel.VERY_CHEAP;
        } else if (ratio < 0.95) {
            return PriceLevel.CHEAP;
        } else if (ratio <= 1.05) {
            return PriceLevel.NORMAL;
        } else if (ratio <= 1.2) {
            return PriceLevel.EXPENSIVE;
        }
        return PriceLevel.VERY_EXPENSIVE;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    public long getRequestsServed() {
        return requestsServed.get();
    }
}
