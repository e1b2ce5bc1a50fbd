package org.jstats.pitchlens_api.modules.state;

import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.modules.state.builders.FormationStateBuilder;
import org.jstats.pitchlens_api.modules.state.builders.LineupStateBuilder;
import org.jstats.pitchlens_api.modules.state.builders.ScoreStateBuilder;
import org.jstats.pitchlens_api.modules.state.builders.SequenceStateBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of state builders by key.
 */
public final class StateBuilderRegistry {

    private final Map<String, StateBuilder<?>> builders;

    public StateBuilderRegistry(List<? extends StateBuilder<?>> builders) {
        var byKey = new LinkedHashMap<String, StateBuilder<?>>();
        for (StateBuilder<?> builder : builders) {
            if (byKey.putIfAbsent(builder.key(), builder) != null) {
                throw new ConfigurationException("State builder key '%s' is registered twice".formatted(builder.key()));
            }
        }
        this.builders = Collections.unmodifiableMap(byKey);
    }

    /**
     * The built-in builders: {@code score}, {@code sequence}, {@code lineup} and {@code formation}.
     */
    public static StateBuilderRegistry defaults() {
        return new StateBuilderRegistry(List.of(
                new ScoreStateBuilder(),
                new SequenceStateBuilder(),
                new LineupStateBuilder(),
                new FormationStateBuilder()));
    }

    public StateBuilderRegistry with(StateBuilder<?> builder) {
        var all = new ArrayList<StateBuilder<?>>(builders.values());
        all.add(builder);
        return new StateBuilderRegistry(all);
    }

    public Set<String> keys() {
        return builders.keySet();
    }

    /**
     * Looks up every key, in order.
     *
     * @throws ConfigurationException when no key is given, a key is unknown, or a key is repeated
     */
    public List<StateBuilder<?>> resolve(String... keys) {
        if (keys.length == 0) {
            throw new ConfigurationException("At least one state builder key is required. Known: " + keys());
        }
        var seen = new HashSet<String>();
        var resolved = new ArrayList<StateBuilder<?>>(keys.length);
        for (String key : keys) {
            var builder = builders.get(key);
            if (builder == null) {
                throw new ConfigurationException("Unknown state builder '%s'. Known: %s".formatted(key, keys()));
            }
            if (!seen.add(key)) {
                throw new ConfigurationException("State builder '%s' requested twice".formatted(key));
            }
            resolved.add(builder);
        }
        return resolved;
    }
}
