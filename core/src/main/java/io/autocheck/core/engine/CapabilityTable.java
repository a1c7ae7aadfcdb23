package io.autocheck.core.engine;

import io.autocheck.core.spi.Capability;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table of capabilities by {@code (name, arity)}, built once when a provider is
 * registered. Names keep declaration order, which is the tie-break order for suggestions.
 */
public final class CapabilityTable {

    private final Map<String, List<Capability>> byName;

    private CapabilityTable(Map<String, List<Capability>> byName) {
        this.byName = byName;
    }

    /**
     * Builds a table.
     *
     * @throws IllegalArgumentException if two capabilities share both name and arity
     */
    public static CapabilityTable of(List<Capability> capabilities) {
        Map<String, List<Capability>> byName = new LinkedHashMap<>();
        for (Capability capability : capabilities) {
            List<Capability> overloads = byName.computeIfAbsent(capability.name(), name -> new ArrayList<>());
            for (Capability existing : overloads) {
                if (existing.arity() == capability.arity()) {
                    throw new IllegalArgumentException(
                            "Duplicate capability: " + capability.name() + "/" + capability.arity());
                }
            }
            overloads.add(capability);
        }
        Map<String, List<Capability>> frozen = new LinkedHashMap<>();
        byName.forEach((name, overloads) -> frozen.put(name, List.copyOf(overloads)));
        return new CapabilityTable(Collections.unmodifiableMap(frozen));
    }

    /** Returns the capability with exactly this name and arity. */
    public Optional<Capability> find(String name, int arity) {
        return named(name).stream().filter(c -> c.arity() == arity).findFirst();
    }

    /** Returns every capability with this name, in declaration order. */
    public List<Capability> named(String name) {
        return byName.getOrDefault(name, List.of());
    }

    /** Capability names in declaration order. */
    public Set<String> names() {
        return byName.keySet();
    }
}
