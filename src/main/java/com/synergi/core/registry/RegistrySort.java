package com.synergi.core.registry;

import com.synergi.core.model.WorkerEntry;

import java.util.Comparator;
import java.util.Locale;

public enum RegistrySort {
    EFFICIENCY(WorkerRanking.BY_EFFICIENCY),
    PRICE(WorkerRanking.BY_PRICE),
    REPUTATION(WorkerRanking.BY_REPUTATION),
    JOBS(WorkerRanking.BY_JOBS);

    private final Comparator<WorkerEntry> comparator;

    RegistrySort(Comparator<WorkerEntry> comparator) {
        this.comparator = comparator;
    }

    public Comparator<WorkerEntry> comparator() {
        return comparator;
    }

    /**
     * Parses a sort name case-insensitively; null or blank means {@link #EFFICIENCY}.
     *
     * @throws IllegalArgumentException for an unrecognised name
     */
    public static RegistrySort parse(String value) {
        if (value == null || value.isBlank()) {
            return EFFICIENCY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
