package com.example.conservation.etl.anomaly;

import java.util.Map;

/**
 * Reference data rules may consult beyond the batch itself.
 */
public class AnomalyContext {

    private static final AnomalyContext EMPTY = new AnomalyContext(Map.of());

    private final Map<String, String> habitatStatuses;

    /**
     * @param habitatStatuses habitat_id to conservation_status, as currently stored.
     */
    public AnomalyContext(Map<String, String> habitatStatuses) {
        this.habitatStatuses = Map.copyOf(habitatStatuses);
    }

    public static AnomalyContext empty() {
        return EMPTY;
    }

    public String habitatStatus(String habitatId) {
        return habitatId == null ? null : habitatStatuses.get(habitatId);
    }
}
