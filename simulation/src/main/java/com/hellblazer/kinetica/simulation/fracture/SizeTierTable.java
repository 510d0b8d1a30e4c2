package com.hellblazer.kinetica.simulation.fracture;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;

/**
 * Immutable map from tier id to {@link SizeTier}.
 * <p>
 * A table is well formed when it has at least one terminal tier, every child tier it names exists, and following
 * child tiers from any row reaches a terminal tier. Malformed tables are rejected at construction.
 *
 * @author hal.hildebrand
 */
public final class SizeTierTable {

    private final NavigableMap<Integer, SizeTier> tiers;

    public SizeTierTable(Collection<SizeTier> rows) {
        require(rows != null && !rows.isEmpty(), "size-tier table cannot be empty");
        var map = new TreeMap<Integer, SizeTier>();
        for (var row : rows) {
            require(map.put(row.tier(), row) == null, "duplicate tier " + row.tier());
        }
        require(map.values().stream().anyMatch(SizeTier::isTerminal), "size-tier table has no terminal tier");
        for (var row : map.values()) {
            if (!row.isTerminal()) {
                require(map.containsKey(row.childTier()),
                        "tier " + row.tier() + " fractures into unknown tier " + row.childTier());
            }
        }
        for (var row : map.values()) {
            var current = row;
            int steps = 0;
            while (!current.isTerminal()) {
                require(++steps <= map.size(), "tier " + row.tier() + " never reaches a terminal tier");
                current = map.get(current.childTier());
            }
        }
        this.tiers = Collections.unmodifiableNavigableMap(map);
    }

    /**
     * Three tiers, each halving in radius: large (r 8) splits into two medium (r 4), which split into two small (r 2).
     */
    public static SizeTierTable defaults() {
        return new SizeTierTable(List.of(new SizeTier(3, 8.0f, 3, 20, 2, 2), new SizeTier(2, 4.0f, 2, 50, 2, 1),
                                         SizeTier.terminal(1, 2.0f, 1, 100)));
    }

    /**
     * @throws IllegalArgumentException if the tier is not in the table
     */
    public SizeTier get(int tier) {
        var row = tiers.get(tier);
        if (row == null) {
            throw new IllegalArgumentException("Unknown size tier: " + tier);
        }
        return row;
    }

    public boolean contains(int tier) {
        return tiers.containsKey(tier);
    }

    public SizeTier largest() {
        return tiers.lastEntry().getValue();
    }

    /**
     * Number of terminal fragments one body of {@code tier} eventually breaks into.
     */
    public int terminalDescendants(int tier) {
        var row = get(tier);
        return row.isTerminal() ? 1 : row.childCount() * terminalDescendants(row.childTier());
    }

    @Override
    public String toString() {
        return "SizeTierTable" + tiers.values();
    }
}
