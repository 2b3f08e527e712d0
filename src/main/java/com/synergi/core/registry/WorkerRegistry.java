package com.synergi.core.registry;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.model.WorkerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Catalog of hireable workers, shared by all running tasks.
 * <p>
 * Readers get immutable {@link WorkerEntry} snapshots whose efficiency is computed from the
 * price and reputation current at read time. All mutation is serialized behind a write lock;
 * workers are never removed, only deactivated.
 */
@Service
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    static final int REPUTATION_GAIN = 1;
    static final int REPUTATION_LOSS = 2;

    private final EfficiencyScorer scorer;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Insertion order is registration order. */
    private final Map<String, WorkerState> workers = new LinkedHashMap<>();

    @Autowired
    public WorkerRegistry(EfficiencyScorer scorer, SynergiProperties properties) {
        this(scorer);
        for (SynergiProperties.WorkerSeed seed : properties.getRegistry().getWorkers()) {
            register(new WorkerRegistration(seed.getId(), seed.getName(), seed.getCategory(),
                    seed.getEndpoint(), seed.getAddress(), seed.getPrice(), seed.getReputation(),
                    seed.isActive()));
        }
        log.info("Worker registry loaded with {} workers across {} categories", size(), categories().size());
    }

    public WorkerRegistry(EfficiencyScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Adds a worker.
     *
     * @throws IllegalArgumentException if the id is taken or the entry is invalid
     */
    public WorkerEntry register(WorkerRegistration registration) {
        validate(registration);
        lock.writeLock().lock();
        try {
            if (workers.containsKey(registration.id())) {
                throw new IllegalArgumentException("Worker id already registered: " + registration.id());
            }
            var state = new WorkerState(registration, workers.size());
            workers.put(registration.id(), state);
            log.debug("Registered worker {} ({}) price={} reputation={}",
                    registration.id(), registration.category(), registration.price(), registration.reputation());
            return snapshot(state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Active workers in {@code category}, in registration order.
     */
    public List<WorkerEntry> listActive(String category) {
        lock.readLock().lock();
        try {
            List<WorkerEntry> result = new ArrayList<>();
            for (WorkerState state : workers.values()) {
                if (state.active && state.category.equals(category)) {
                    result.add(snapshot(state));
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All workers, active or not, optionally filtered by category, in the requested order.
     */
    public List<WorkerEntry> listAll(String category, RegistrySort sort) {
        lock.readLock().lock();
        List<WorkerEntry> result = new ArrayList<>();
        try {
            for (WorkerState state : workers.values()) {
                if (category == null || category.isBlank() || state.category.equals(category)) {
                    result.add(snapshot(state));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        result.sort(sort.comparator());
        return result;
    }

    public Optional<WorkerEntry> find(String workerId) {
        lock.readLock().lock();
        try {
            WorkerState state = workers.get(workerId);
            return state != null ? Optional.of(snapshot(state)) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True if any worker, active or not, serves {@code category}.
     */
    public boolean knowsCategory(String category) {
        lock.readLock().lock();
        try {
            return workers.values().stream().anyMatch(w -> w.category.equals(category));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> categories() {
        lock.readLock().lock();
        try {
            Set<String> result = new LinkedHashSet<>();
            workers.values().forEach(w -> result.add(w.category));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return workers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Updates job counters, earnings and reputation after a call. Unknown ids are logged and ignored.
     */
    public void recordOutcome(String workerId, boolean success, BigDecimal amountEarned) {
        lock.writeLock().lock();
        try {
            WorkerState state = workers.get(workerId);
            if (state == null) {
                log.warn("recordOutcome for unknown worker {} ignored", workerId);
                return;
            }
            if (success) {
                state.jobsCompleted++;
                if (amountEarned != null) {
                    state.totalEarned = state.totalEarned.add(amountEarned);
                }
                state.reputation = Math.min(100, state.reputation + REPUTATION_GAIN);
            } else {
                state.jobsFailed++;
                state.reputation = Math.max(0, state.reputation - REPUTATION_LOSS);
            }
            log.debug("Worker {} outcome success={} -> reputation={} completed={} failed={}",
                    workerId, success, state.reputation, state.jobsCompleted, state.jobsFailed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean deactivate(String workerId) {
        return setActive(workerId, false);
    }

    public boolean activate(String workerId) {
        return setActive(workerId, true);
    }

    private boolean setActive(String workerId, boolean active) {
        lock.writeLock().lock();
        try {
            WorkerState state = workers.get(workerId);
            if (state == null) {
                return false;
            }
            state.active = active;
            log.info("Worker {} {}", workerId, active ? "activated" : "deactivated");
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private WorkerEntry snapshot(WorkerState s) {
        return new WorkerEntry(s.id, s.name, s.category, s.endpoint, s.address, s.price, s.reputation,
                s.jobsCompleted, s.jobsFailed, s.totalEarned, s.active, s.registrationOrder,
                scorer.score(s.reputation, s.price));
    }

    private static void validate(WorkerRegistration r) {
        if (r.id() == null || r.id().isBlank()) {
            throw new IllegalArgumentException("Worker id is required");
        }
        if (r.category() == null || r.category().isBlank()) {
            throw new IllegalArgumentException("Worker " + r.id() + " has no category");
        }
        if (r.price() == null || r.price().signum() < 0) {
            throw new IllegalArgumentException("Worker " + r.id() + " has an invalid price: " + r.price());
        }
        if (r.reputation() < 0 || r.reputation() > 100) {
            throw new IllegalArgumentException("Worker " + r.id() + " reputation out of range: " + r.reputation());
        }
    }

    /** Mutable registry-owned state; guarded by {@link #lock}. */
    private static final class WorkerState {
        final String id;
        final String name;
        final String category;
        final String endpoint;
        final String address;
        final BigDecimal price;
        final int registrationOrder;
        int reputation;
        int jobsCompleted;
        int jobsFailed;
        BigDecimal totalEarned = BigDecimal.ZERO;
        boolean active;

        WorkerState(WorkerRegistration r, int registrationOrder) {
            this.id = r.id();
            this.name = r.name() != null ? r.name() : r.id();
            this.category = r.category();
            this.endpoint = r.endpoint();
            this.address = r.address() != null && !r.address().isBlank() ? r.address() : r.id();
            this.price = r.price();
            this.reputation = r.reputation();
            this.active = r.active();
            this.registrationOrder = registrationOrder;
        }
    }
}
