package com.reelforge.jobs;

/**
 * Queue priority tiers. Weights are spaced so intermediate tiers can be
 * introduced later without rewriting stored rows.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(5),
    HIGH(10),
    URGENT(20);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Maps a stored weight back to its tier. Weights between tiers round down
     * to the nearest defined tier.
     */
    public static JobPriority fromWeight(int weight) {
        JobPriority resolved = LOW;
        for (JobPriority priority : values()) {
            if (weight >= priority.weight) {
                resolved = priority;
            }
        }
        return resolved;
    }
}
