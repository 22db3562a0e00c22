package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory registry of live sync runs, at most one per provider.
 *
 * <p>The provider slot is claimed with {@link ConcurrentHashMap#compute}, so
 * two concurrent start requests for the same provider cannot both win.
 */
@Component
public class SyncRunRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SyncRunRegistry.class);

    // latest run per provider, active or finished
    private final Map<String, SyncRun> byProvider = new ConcurrentHashMap<>();
    private final Map<String, SyncRun> byRunId = new ConcurrentHashMap<>();

    /**
     * Claim the provider slot for {@code candidate}.
     *
     * @return empty when registered, otherwise the run that already holds the slot
     */
    public Optional<SyncRun> register(SyncRun candidate) {
        SyncRun[] conflicting = new SyncRun[1];
        byProvider.compute(candidate.getProviderId(), (providerId, existing) -> {
            if (existing != null && existing.snapshot().isActive()) {
                conflicting[0] = existing;
                return existing;
            }
            if (existing != null) {
                byRunId.remove(existing.getRunId());
            }
            byRunId.put(candidate.getRunId(), candidate);
            return candidate;
        });
        if (conflicting[0] != null) {
            logger.debug("Provider {} already has active run {}", candidate.getProviderId(), conflicting[0].getRunId());
        }
        return Optional.ofNullable(conflicting[0]);
    }

    /**
     * Give up the provider slot held by {@code run}. A slot already taken
     * over by a later run is left alone.
     */
    public void release(SyncRun run) {
        byProvider.computeIfPresent(run.getProviderId(), (providerId, holder) -> {
            if (holder != run) {
                return holder;
            }
            byRunId.remove(run.getRunId());
            return null;
        });
    }

    public Optional<SyncRun> findActive(String providerId) {
        return Optional.ofNullable(byProvider.get(providerId))
                .filter(run -> run.snapshot().isActive());
    }

    public Optional<SyncRun> findByRunId(String runId) {
        return Optional.ofNullable(byRunId.get(runId));
    }

    public Optional<SyncRunSnapshot> latest(String providerId) {
        return Optional.ofNullable(byProvider.get(providerId)).map(SyncRun::snapshot);
    }

    public boolean hasActiveRun(String providerId) {
        return findActive(providerId).isPresent();
    }

    public List<SyncRunSnapshot> activeRuns() {
        return snapshots(byProvider.values()).stream()
                .filter(SyncRunSnapshot::isActive)
                .collect(Collectors.toList());
    }

    /**
     * Drop terminal runs that ended before {@code cutoff}.
     *
     * @return number of runs evicted
     */
    public int evictFinishedBefore(LocalDateTime cutoff) {
        int[] evicted = new int[1];
        for (String providerId : byProvider.keySet()) {
            byProvider.computeIfPresent(providerId, (key, run) -> {
                SyncRunSnapshot snapshot = run.snapshot();
                if (snapshot.status().isTerminal() && snapshot.endedAt() != null && snapshot.endedAt().isBefore(cutoff)) {
                    byRunId.remove(run.getRunId());
                    evicted[0]++;
                    return null;
                }
                return run;
            });
        }
        if (evicted[0] > 0) {
            logger.debug("Evicted {} finished sync runs from registry", evicted[0]);
        }
        return evicted[0];
    }

    private static List<SyncRunSnapshot> snapshots(Collection<SyncRun> runs) {
        return runs.stream().map(SyncRun::snapshot).collect(Collectors.toList());
    }
}
