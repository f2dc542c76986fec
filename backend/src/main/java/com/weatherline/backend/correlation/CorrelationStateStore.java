package com.weatherline.backend.correlation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.CorrelationSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Location id to rolling correlation state. States are created on first use.
 */
@Component
public class CorrelationStateStore {

    private final ConcurrentMap<String, LocationCorrelationState> states = new ConcurrentHashMap<>();
    private final CorrelationEngine engine;
    private final WeatherlineProperties.Correlation settings;
    private final Clock clock;

    public CorrelationStateStore(CorrelationEngine engine, WeatherlineProperties properties, Clock clock) {
        this.engine = engine;
        this.settings = properties.getCorrelation();
        this.clock = clock;
    }

    public LocationCorrelationState stateFor(String locationId) {
        return states.computeIfAbsent(locationId, id ->
                new LocationCorrelationState(id, settings.getWindowDuration(), settings.getWindowMaxEvents(), clock));
    }

    public void append(AlignedPair pair) {
        stateFor(pair.locationId()).append(pair);
    }

    public CorrelationSnapshot recompute(String locationId) {
        return stateFor(locationId).recompute(engine);
    }

    public List<CorrelationSnapshot> recomputeAll() {
        List<CorrelationSnapshot> computed = new ArrayList<>();
        for (LocationCorrelationState state : states.values()) {
            computed.add(state.recompute(engine));
        }
        return computed;
    }

    public Optional<CorrelationSnapshot> snapshot(String locationId) {
        LocationCorrelationState state = states.get(locationId);
        return state != null ? state.snapshot() : Optional.empty();
    }

    /**
     * Significant findings of the last snapshot for a location, empty when none was computed.
     */
    public List<CorrelationFinding> significantFindings(String locationId) {
        return snapshot(locationId)
                .map(s -> s.getFindings().stream().filter(CorrelationFinding::isSignificant).toList())
                .orElse(List.of());
    }

    public void restore(CorrelationSnapshot persisted) {
        stateFor(persisted.getLocationId()).restore(persisted);
    }

    public Set<String> locations() {
        return Set.copyOf(states.keySet());
    }
}
