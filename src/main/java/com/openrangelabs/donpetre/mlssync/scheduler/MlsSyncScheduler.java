package com.openrangelabs.donpetre.mlssync.scheduler;

import com.openrangelabs.donpetre.mlssync.entity.MlsProviderConfig;
import com.openrangelabs.donpetre.mlssync.model.SchedulerStatus;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import com.openrangelabs.donpetre.mlssync.service.ProviderConfigService;
import com.openrangelabs.donpetre.mlssync.service.SyncOrchestrationService;
import com.openrangelabs.donpetre.mlssync.service.SyncRunRegistry;
import com.openrangelabs.donpetre.mlssync.service.SyncRunService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Scheduler for periodic MLS syncs.
 *
 * <p>Each started provider gets its own fixed-rate timer at the provider's
 * sync interval. A tick that finds a run still active for the provider is
 * skipped, never queued.
 */
@Component
public class MlsSyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MlsSyncScheduler.class);

    private final SyncOrchestrationService orchestrationService;
    private final ProviderConfigService configService;
    private final SyncRunService runService;
    private final SyncRunRegistry runRegistry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, ScheduledProvider> scheduled = new ConcurrentHashMap<>();

    @Value("${mls.scheduling.enabled:true}")
    private boolean schedulingEnabled = true;

    @Value("${mls.scheduling.auto-start:true}")
    private boolean autoStart = true;

    @Value("${mls.jobs.cleanup.enabled:true}")
    private boolean cleanupEnabled = true;

    @Value("${mls.jobs.cleanup.retention-days:30}")
    private int retentionDays = 30;

    @Value("${mls.sync.run-retention-hours:24}")
    private int runRetentionHours = 24;

    @Autowired
    public MlsSyncScheduler(SyncOrchestrationService orchestrationService,
                            ProviderConfigService configService,
                            SyncRunService runService,
                            SyncRunRegistry runRegistry,
                            TaskScheduler taskScheduler,
                            Clock clock) {
        this.orchestrationService = orchestrationService;
        this.configService = configService;
        this.runService = runService;
        this.runRegistry = runRegistry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Start periodic syncs for the provider; the first tick fires immediately.
     * Starting an already scheduled provider is a no-op.
     */
    public Mono<SchedulerStatus> start(String providerId) {
        return configService.getProvider(providerId)
                .map(config -> {
                    ScheduledProvider entry = new ScheduledProvider(
                            Duration.ofMinutes(config.getEffectiveSyncIntervalMinutes()));
                    entry.nextRunAt = LocalDateTime.now(clock);
                    ScheduledProvider existing = scheduled.putIfAbsent(providerId, entry);
                    if (existing != null) {
                        return existing.status(providerId);
                    }
                    // the first tick may run before schedule() returns
                    SchedulerStatus status = entry.status(providerId);
                    try {
                        schedule(providerId, entry);
                    } catch (RuntimeException e) {
                        scheduled.remove(providerId, entry);
                        throw e;
                    }
                    return status;
                });
    }

    /**
     * Cancel the provider's timer. A run already in progress is not interrupted.
     */
    public Mono<SchedulerStatus> stop(String providerId) {
        return configService.getProvider(providerId)
                .map(config -> {
                    ScheduledProvider entry = scheduled.remove(providerId);
                    if (entry != null) {
                        entry.cancel();
                        logger.info("Stopped scheduled sync for provider {}", providerId);
                    }
                    return stoppedStatus(config, entry);
                });
    }

    public Mono<SchedulerStatus> getStatus(String providerId) {
        return configService.getProvider(providerId)
                .map(this::statusOf);
    }

    public Flux<SchedulerStatus> getAllStatuses() {
        return configService.getAllProviders()
                .map(this::statusOf);
    }

    public boolean isScheduled(String providerId) {
        return scheduled.containsKey(providerId);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startEnabledProviders() {
        if (!schedulingEnabled || !autoStart) {
            logger.debug("Automatic start of scheduled syncs is disabled");
            return;
        }
        configService.getEnabledProviders()
                .flatMap(config -> start(config.getProviderId()))
                .collectList()
                .subscribe(
                        statuses -> logger.info("Scheduled syncs started for {} providers", statuses.size()),
                        error -> logger.error("Error starting scheduled syncs: {}", error.getMessage()));
    }

    /**
     * One timer tick for a provider
     */
    private void runScheduledSync(String providerId, ScheduledProvider entry) {
        entry.nextRunAt = LocalDateTime.now(clock).plus(entry.interval);
        if (!schedulingEnabled) {
            logger.debug("Scheduled sync is disabled");
            return;
        }
        if (orchestrationService.hasActiveRun(providerId)) {
            logger.warn("Skipping scheduled sync for provider {}: a run is still active", providerId);
            return;
        }

        orchestrationService.start(providerId, SyncOptions.defaults())
                .flatMap(result -> {
                    if (!result.isStarted()) {
                        logger.warn("Skipping scheduled sync for provider {}: run {} is active", providerId, result.activeRunId());
                        return Mono.empty();
                    }
                    entry.lastRunId = result.run().runId();
                    logger.info("Scheduled sync started for provider {}: {}", providerId, result.run().runId());
                    return orchestrationService.awaitRun(result.run().runId());
                })
                .subscribe(
                        snapshot -> logger.info("Scheduled sync {} for provider {} finished as {}: processed={}, failed={}",
                                snapshot.runId(), providerId, snapshot.status(), snapshot.processed(), snapshot.failed()),
                        error -> logger.error("Failed to run scheduled sync for provider {}: {}", providerId, error.getMessage()));
    }

    /**
     * Clean up old sync runs and errors
     * Runs daily at 2 AM
     */
    @Scheduled(cron = "0 0 2 * * ?")
    public void cleanupOldRuns() {
        if (!cleanupEnabled) {
            logger.debug("Sync run cleanup is disabled");
            return;
        }

        logger.info("Starting cleanup of sync runs older than {} days", retentionDays);

        runService.cleanupOldRuns(retentionDays)
                .subscribe(
                        deletedCount -> logger.info("Cleaned up {} old sync runs and errors", deletedCount),
                        error -> logger.error("Error during sync run cleanup: {}", error.getMessage()));
    }

    /**
     * Drop finished runs from memory; their checkpoints stay queryable
     * Runs hourly
     */
    @Scheduled(fixedRate = 3600000)
    public void evictFinishedRuns() {
        int evicted = runRegistry.evictFinishedBefore(LocalDateTime.now(clock).minusHours(runRetentionHours));
        if (evicted > 0) {
            logger.info("Evicted {} finished sync runs from memory", evicted);
        }
    }

    @PreDestroy
    public void stopAll() {
        scheduled.forEach((providerId, entry) -> entry.cancel());
        if (!scheduled.isEmpty()) {
            logger.info("Stopped scheduled syncs for {} providers", scheduled.size());
        }
        scheduled.clear();
    }

    private void schedule(String providerId, ScheduledProvider entry) {
        entry.attach(taskScheduler.scheduleAtFixedRate(
                () -> runScheduledSync(providerId, entry), Instant.now(clock), entry.interval));
        logger.info("Scheduled sync for provider {} every {} minutes", providerId, entry.interval.toMinutes());
    }

    private SchedulerStatus statusOf(MlsProviderConfig config) {
        ScheduledProvider entry = scheduled.get(config.getProviderId());
        return entry != null ? entry.status(config.getProviderId()) : stoppedStatus(config, null);
    }

    private static SchedulerStatus stoppedStatus(MlsProviderConfig config, ScheduledProvider previous) {
        return new SchedulerStatus(config.getProviderId(), false,
                Duration.ofMinutes(config.getEffectiveSyncIntervalMinutes()).getSeconds(),
                previous != null ? previous.lastRunId : null, null);
    }

    private static final class ScheduledProvider {
        private final Duration interval;
        private ScheduledFuture<?> future;
        private boolean cancelled;
        private volatile LocalDateTime nextRunAt;
        private volatile String lastRunId;

        private ScheduledProvider(Duration interval) {
            this.interval = interval;
        }

        private synchronized void attach(ScheduledFuture<?> scheduledFuture) {
            future = scheduledFuture;
            if (cancelled) {
                future.cancel(false);
            }
        }

        private synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }

        private SchedulerStatus status(String providerId) {
            return new SchedulerStatus(providerId, true, interval.getSeconds(), lastRunId, nextRunAt);
        }
    }
}
