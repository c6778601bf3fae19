package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable natural key to surrogate key maps, one per dimension. A new instance is
 * built after the dimension loads so facts resolve against what the store now holds.
 */
public final class DimensionLookups {

    private static final DimensionLookups EMPTY = new DimensionLookups(new EnumMap<>(EntityType.class));

    private final Map<EntityType, Map<String, Long>> keys;

    private DimensionLookups(Map<EntityType, Map<String, Long>> keys) {
        this.keys = keys;
    }

    public static DimensionLookups empty() {
        return EMPTY;
    }

    public static DimensionLookups of(Map<EntityType, Map<String, Long>> keys) {
        Map<EntityType, Map<String, Long>> copy = new EnumMap<>(EntityType.class);
        keys.forEach((entity, map) -> copy.put(entity, Collections.unmodifiableMap(new HashMap<>(map))));
        return new DimensionLookups(copy);
    }

    /**
     * @return The surrogate key held for the natural key, or null when the dimension has no such row.
     */
    public Long surrogateKey(EntityType dimension, String naturalKey) {
        if (naturalKey == null) {
            return null;
        }
        return keys.getOrDefault(dimension, Map.of()).get(naturalKey);
    }

    public boolean contains(EntityType dimension, String naturalKey) {
        return surrogateKey(dimension, naturalKey) != null;
    }

    public Map<String, Long> keysFor(EntityType dimension) {
        return keys.getOrDefault(dimension, Map.of());
    }

    public DimensionLookups with(EntityType dimension, Map<String, Long> dimensionKeys) {
        Map<EntityType, Map<String, Long>> copy = new EnumMap<>(EntityType.class);
        copy.putAll(keys);
        copy.put(dimension, Collections.unmodifiableMap(new HashMap<>(dimensionKeys)));
        return new DimensionLookups(copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DimensionLookups{");
        keys.forEach((entity, map) -> sb.append(entity).append('=').append(map.size()).append(' '));
        return sb.append('}').toString();
    }
}
