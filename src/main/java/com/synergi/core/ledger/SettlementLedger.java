package com.synergi.core.ledger;

import com.synergi.core.events.EventBus;
import com.synergi.core.model.SettlementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only, in-process log of every settlement.
 * <p>
 * Id allocation, the append itself and listener notification happen under one lock, so ids
 * are strictly increasing and listeners observe records in id order. A delegated record must
 * point at an already-appended parent and sit exactly one level below it.
 */
@Service
public class SettlementLedger {

    private static final Logger log = LoggerFactory.getLogger(SettlementLedger.class);

    private final Object appendLock = new Object();
    private final Clock clock;

    private final List<SettlementRecord> records = new ArrayList<>();
    private final Map<Long, SettlementRecord> byId = new HashMap<>();
    private final CopyOnWriteArrayList<Consumer<SettlementRecord>> listeners = new CopyOnWriteArrayList<>();
    private long nextId = 1;

    @Autowired
    public SettlementLedger() {
        this(Clock.systemUTC());
    }

    public SettlementLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates and appends {@code draft}, assigning its id and timestamp.
     *
     * @return the appended record
     * @throws LedgerIntegrityException if the parent is missing or the depth is not parent depth + 1
     */
    public SettlementRecord append(SettlementRecord draft) {
        synchronized (appendLock) {
            checkLinkage(draft);
            SettlementRecord record = draft.withIdentity(nextId++, Instant.now(clock));
            records.add(record);
            byId.put(record.id(), record);
            log.debug("Ledger #{} {} -> {} {} (depth {})",
                    record.id(), record.payerId(), record.workerId(), record.amount(), record.depth());
            for (Consumer<SettlementRecord> listener : listeners) {
                try {
                    listener.accept(record);
                } catch (Exception e) {
                    log.warn("Ledger listener failed on record {}: {}", record.id(), e.getMessage(), e);
                }
            }
            return record;
        }
    }

    /**
     * Newest records first.
     */
    public List<SettlementRecord> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        synchronized (appendLock) {
            int from = Math.max(0, records.size() - limit);
            List<SettlementRecord> slice = new ArrayList<>(records.subList(from, records.size()));
            Collections.reverse(slice);
            return slice;
        }
    }

    /**
     * All records in append order.
     */
    public List<SettlementRecord> all() {
        synchronized (appendLock) {
            return List.copyOf(records);
        }
    }

    public Optional<SettlementRecord> findById(long id) {
        synchronized (appendLock) {
            return Optional.ofNullable(byId.get(id));
        }
    }

    public int size() {
        synchronized (appendLock) {
            return records.size();
        }
    }

    public LedgerStats stats() {
        synchronized (appendLock) {
            int delegated = 0;
            int maxDepth = 0;
            BigDecimal volume = BigDecimal.ZERO;
            BigDecimal delegatedVolume = BigDecimal.ZERO;
            for (SettlementRecord r : records) {
                volume = volume.add(r.amount());
                if (r.delegated()) {
                    delegated++;
                    delegatedVolume = delegatedVolume.add(r.amount());
                }
                maxDepth = Math.max(maxDepth, r.depth());
            }
            return new LedgerStats(records.size(), delegated, volume, delegatedVolume, maxDepth);
        }
    }

    /**
     * Registers a listener called synchronously for every appended record, in id order.
     */
    public EventBus.Subscription subscribe(Consumer<SettlementRecord> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void checkLinkage(SettlementRecord draft) {
        if (draft.amount() == null || draft.amount().signum() < 0) {
            throw new LedgerIntegrityException("Settlement amount must be non-negative: " + draft.amount());
        }
        if (draft.parentRecordId() == null) {
            if (draft.depth() != 0 || draft.delegated()) {
                throw new LedgerIntegrityException("Record at depth " + draft.depth()
                        + " for worker " + draft.workerId() + " has no parent");
            }
            return;
        }
        SettlementRecord parent = byId.get(draft.parentRecordId());
        if (parent == null) {
            throw new LedgerIntegrityException("Parent record " + draft.parentRecordId() + " does not exist");
        }
        if (draft.depth() != parent.depth() + 1) {
            throw new LedgerIntegrityException("Record depth " + draft.depth()
                    + " must be parent depth + 1 (parent " + parent.id() + " is at depth " + parent.depth() + ")");
        }
        if (!draft.delegated()) {
            throw new LedgerIntegrityException("Child of record " + parent.id() + " must be marked delegated");
        }
    }
}
