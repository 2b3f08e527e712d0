package com.synergi.core.registry;

import com.synergi.core.model.WorkerEntry;

import java.util.Comparator;

/**
 * Orderings over worker snapshots.
 */
public final class WorkerRanking {

    private WorkerRanking() {}

    /** Highest efficiency first, then cheaper, then earlier registration. */
    public static final Comparator<WorkerEntry> BY_EFFICIENCY =
            Comparator.comparingDouble(WorkerEntry::efficiency).reversed()
                    .thenComparing(WorkerEntry::price)
                    .thenComparingInt(WorkerEntry::registrationOrder);

    public static final Comparator<WorkerEntry> BY_PRICE =
            Comparator.comparing(WorkerEntry::price)
                    .thenComparingInt(WorkerEntry::registrationOrder);

    public static final Comparator<WorkerEntry> BY_REPUTATION =
            Comparator.comparingInt(WorkerEntry::reputation).reversed()
                    .thenComparingInt(WorkerEntry::registrationOrder);

    public static final Comparator<WorkerEntry> BY_JOBS =
            Comparator.comparingInt(WorkerEntry::jobsCompleted).reversed()
                    .thenComparingInt(WorkerEntry::registrationOrder);
}
