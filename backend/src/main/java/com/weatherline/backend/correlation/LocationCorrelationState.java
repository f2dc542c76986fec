package com.weatherline.backend.correlation;

import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.CorrelationSnapshot;
import com.weatherline.backend.model.FactorMetricPair;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling window of aligned pairs for one location and the findings last computed from it.
 * <p>
 * Appends and recomputations are serialized by a lock. Readers never take the lock: they
 * see the most recent complete snapshot through a volatile reference.
 */
public class LocationCorrelationState {

    private final String locationId;
    private final Duration windowDuration;
    private final int maxPairs;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<AlignedPair> window = new ArrayDeque<>();
    private Instant newestEventTime;

    private volatile CorrelationSnapshot snapshot;

    public LocationCorrelationState(String locationId, Duration windowDuration, int maxPairs, Clock clock) {
        this.locationId = locationId;
        this.windowDuration = windowDuration;
        this.maxPairs = maxPairs;
        this.clock = clock;
    }

    public String getLocationId() {
        return locationId;
    }

    /**
     * Adds a pair and evicts everything older than the window duration (relative to the newest
     * event seen) or beyond the pair limit.
     */
    public void append(AlignedPair pair) {
        lock.lock();
        try {
            if (newestEventTime == null || pair.eventTimestamp().isAfter(newestEventTime)) {
                newestEventTime = pair.eventTimestamp();
            }
            window.addLast(pair);

            evictOlderThan(newestEventTime.minus(windowDuration));
            while (window.size() > maxPairs) {
                window.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the published findings with a fresh computation over the whole window.
     * Pairs that fell out of the last hour by the wall clock are dropped first, so a location
     * that has gone quiet ends up with an empty window and no findings.
     */
    public CorrelationSnapshot recompute(CorrelationEngine engine) {
        lock.lock();
        try {
            Instant now = clock.instant();
            evictOlderThan(now.minus(windowDuration));

            List<AlignedPair> pairs = new ArrayList<>(window);
            Map<FactorMetricPair, CorrelationFinding> findings = engine.computeCorrelations(pairs);
            CorrelationSnapshot computed = CorrelationSnapshot.builder()
                    .locationId(locationId)
                    .computedAt(now)
                    .windowSize(pairs.size())
                    .findings(new ArrayList<>(findings.values()))
                    .build();
            snapshot = computed;
            return computed;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void evictOlderThan(Instant cutoff) {
        window.removeIf(p -> p.eventTimestamp().isBefore(cutoff));
    }

    public Optional<CorrelationSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * Seeds the published findings from a persisted snapshot. Ignored once findings exist.
     */
    public void restore(CorrelationSnapshot persisted) {
        lock.lock();
        try {
            if (snapshot == null) {
                snapshot = persisted;
            }
        } finally {
            lock.unlock();
        }
    }

    public List<AlignedPair> pairs() {
        lock.lock();
        try {
            return List.copyOf(window);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return window.size();
        } finally {
            lock.unlock();
        }
    }
}
