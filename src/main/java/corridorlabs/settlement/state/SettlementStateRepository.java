package corridorlabs.settlement.state;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns all mutable engine state: the intent table, the owner index, per-corridor fee params,
 * per-corridor flow and the set of corridors registered for netting.
 *
 * <p>Components run their public operations through {@link #inLock(Supplier)} so that each
 * operation observes and commits state as one unit. The lock is reentrant, which lets the
 * netting engine call into the ledger while holding it.</p>
 */
@Component
@Slf4j
public class SettlementStateRepository {

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong version = new AtomicLong();

    private final Map<Long, IntentRecord> intents = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> intentsByOwner = new ConcurrentHashMap<>();
    private final Map<String, FeeParams> feeParams = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> flows = new ConcurrentHashMap<>();
    private final Set<String> nettableCorridors = ConcurrentHashMap.newKeySet();

    // guarded by lock
    private long lastIntentId;

    public <T> T inLock(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void runInLock(Runnable work) {
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- intents

    public long nextIntentId() {
        return inLock(() -> ++lastIntentId);
    }

    public void insertIntent(IntentRecord record) {
        runInLock(() -> {
            if (intents.putIfAbsent(record.getId(), record) != null) {
                throw new IllegalStateException("Intent id " + record.getId() + " already allocated");
            }
            intentsByOwner.computeIfAbsent(record.getOwner(), k -> new ArrayList<>()).add(record.getId());
            version.incrementAndGet();
        });
    }

    public Optional<IntentRecord> findIntent(long id) {
        return Optional.ofNullable(intents.get(id));
    }

    public void markSettled(IntentRecord record, BigInteger output, long now) {
        runInLock(() -> {
            record.markSettled(output, now);
            version.incrementAndGet();
        });
    }

    public List<Long> intentIdsOf(String owner, int maxResults) {
        return inLock(() -> {
            List<Long> ids = intentsByOwner.get(owner);
            if (ids == null || maxResults <= 0) {
                return List.of();
            }
            return List.copyOf(ids.subList(0, Math.min(maxResults, ids.size())));
        });
    }

    // ---------------------------------------------------------------- corridors

    public Optional<FeeParams> findFeeParams(String corridorId) {
        return Optional.ofNullable(feeParams.get(corridorId));
    }

    public void putFeeParams(String corridorId, FeeParams params) {
        runInLock(() -> {
            feeParams.put(corridorId, params);
            version.incrementAndGet();
        });
    }

    public BigInteger flowOf(String corridorId) {
        return flows.getOrDefault(corridorId, BigInteger.ZERO);
    }

    public void putFlow(String corridorId, BigInteger flow) {
        runInLock(() -> {
            flows.put(corridorId, flow);
            version.incrementAndGet();
        });
    }

    public boolean isNettable(String corridorId) {
        return nettableCorridors.contains(corridorId);
    }

    /**
     * @return true if the flag changed
     */
    public boolean setNettable(String corridorId, boolean nettable) {
        return inLock(() -> {
            boolean changed = nettable ? nettableCorridors.add(corridorId) : nettableCorridors.remove(corridorId);
            if (changed) {
                version.incrementAndGet();
            }
            return changed;
        });
    }

    public Set<String> nettableCorridors() {
        return Set.copyOf(new TreeSet<>(nettableCorridors));
    }

    // ---------------------------------------------------------------- snapshots

    /** Monotonic counter bumped on every mutation; used to detect unsaved changes. */
    public long version() {
        return version.get();
    }

    public StateSnapshot snapshot() {
        return inLock(() -> {
            List<IntentRecord.Snapshot> intentSnapshots = intents.values().stream()
                .sorted(Comparator.comparingLong(IntentRecord::getId))
                .map(IntentRecord::toSnapshot)
                .toList();
            Map<String, List<Long>> ownerIndex = new LinkedHashMap<>();
            intentsByOwner.forEach((owner, ids) -> ownerIndex.put(owner, List.copyOf(ids)));
            return new StateSnapshot(
                lastIntentId,
                intentSnapshots,
                ownerIndex,
                Map.copyOf(feeParams),
                Map.copyOf(flows),
                Set.copyOf(nettableCorridors)
            );
        });
    }

    public void restore(StateSnapshot snapshot) {
        runInLock(() -> {
            intents.clear();
            intentsByOwner.clear();
            feeParams.clear();
            flows.clear();
            nettableCorridors.clear();

            long highestId = 0;
            if (snapshot.intents() != null) {
                for (IntentRecord.Snapshot s : snapshot.intents()) {
                    intents.put(s.id(), IntentRecord.fromSnapshot(s));
                    highestId = Math.max(highestId, s.id());
                }
            }
            if (snapshot.intentsByOwner() != null) {
                snapshot.intentsByOwner().forEach((owner, ids) -> intentsByOwner.put(owner, new ArrayList<>(ids)));
            } else {
                intents.values().stream()
                    .sorted(Comparator.comparingLong(IntentRecord::getId))
                    .forEach(r -> intentsByOwner.computeIfAbsent(r.getOwner(), k -> new ArrayList<>()).add(r.getId()));
            }
            if (snapshot.feeParams() != null) {
                feeParams.putAll(snapshot.feeParams());
            }
            if (snapshot.flows() != null) {
                flows.putAll(snapshot.flows());
            }
            if (snapshot.nettableCorridors() != null) {
                nettableCorridors.addAll(snapshot.nettableCorridors());
            }
            // never hand out an id that is already in the table
            lastIntentId = Math.max(snapshot.lastIntentId(), highestId);
            log.info("Restored settlement state: {} intents, {} corridors with fee params, last id {}",
                intents.size(), feeParams.size(), lastIntentId);
        });
    }
}
