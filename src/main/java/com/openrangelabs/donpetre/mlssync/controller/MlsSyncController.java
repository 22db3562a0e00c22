package com.openrangelabs.donpetre.mlssync.controller;

import com.openrangelabs.donpetre.mlssync.dto.StartSyncRequest;
import com.openrangelabs.donpetre.mlssync.entity.SyncError;
import com.openrangelabs.donpetre.mlssync.entity.SyncRunRecord;
import com.openrangelabs.donpetre.mlssync.model.SyncRunSnapshot;
import com.openrangelabs.donpetre.mlssync.service.SyncOrchestrationService;
import com.openrangelabs.donpetre.mlssync.service.SyncRunService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for sync runs: starting, controlling and monitoring them,
 * and working through the errors they record.
 */
@RestController
@RequestMapping("/api/mls/sync")
@CrossOrigin(origins = "${mls.security.cors.allowed-origins:*}")
public class MlsSyncController {

    private final SyncOrchestrationService orchestrationService;
    private final SyncRunService runService;

    @Autowired
    public MlsSyncController(SyncOrchestrationService orchestrationService, SyncRunService runService) {
        this.orchestrationService = orchestrationService;
        this.runService = runService;
    }

    /**
     * Get the latest run of a provider
     *
     * Returns the live snapshot while the run is in memory, otherwise the last
     * persisted checkpoint. A provider that never synced reports {@code idle}.
     *
     * @param providerId The provider to inspect
     * @return Latest run snapshot or an idle marker
     */
    @GetMapping("/status")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getSyncStatus(@RequestParam String providerId) {
        return orchestrationService.getStatus(providerId)
                .map(snapshot -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", providerId);
                    response.put("status", snapshot.status());
                    response.put("run", snapshot);
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", providerId);
                    response.put("status", "idle");
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                }));
    }

    /**
     * Get all runs that are currently in memory and not finished
     */
    @GetMapping("/active")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getActiveRuns() {
        return Mono.fromSupplier(() -> {
            List<SyncRunSnapshot> active = orchestrationService.getActiveRuns();

            Map<String, Object> response = new HashMap<>();
            response.put("runs", active);
            response.put("count", active.size());
            response.put("timestamp", LocalDateTime.now());
            return ResponseEntity.ok(response);
        });
    }

    /**
     * Start a sync run
     *
     * Answers 202 with the started run, or 409 with the id of the run that is
     * already active for the provider.
     *
     * @param request Provider id and optional sync options
     * @return Started run or conflict details
     */
    @PostMapping("/start")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> startSync(@Valid @RequestBody StartSyncRequest request) {
        return orchestrationService.start(request.getProviderId(), request.resolvedOptions())
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", request.getProviderId());
                    response.put("timestamp", LocalDateTime.now());
                    if (result.isStarted()) {
                        response.put("status", "started");
                        response.put("runId", result.run().runId());
                        response.put("run", result.run());
                        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
                    }
                    response.put("status", "conflict");
                    response.put("activeRunId", result.activeRunId());
                    response.put("message", "A sync is already in progress for this provider");
                    return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
                });
    }

    @GetMapping("/progress/{runId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<SyncRunSnapshot>> getProgress(@PathVariable String runId) {
        return orchestrationService.getProgress(runId).map(ResponseEntity::ok);
    }

    /**
     * Request cooperative cancellation of a running sync
     */
    @PostMapping("/{runId}/stop")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> stopSync(@PathVariable String runId) {
        return orchestrationService.stop(runId)
                .map(snapshot -> runResponse(snapshot, "stop_requested"));
    }

    @PostMapping("/{runId}/resume")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> resumeSync(@PathVariable String runId) {
        return orchestrationService.resume(runId)
                .map(snapshot -> runResponse(snapshot, "resumed"));
    }

    @PostMapping("/{runId}/abandon")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> abandonSync(@PathVariable String runId) {
        return orchestrationService.abandon(runId)
                .map(snapshot -> runResponse(snapshot, "abandoned"));
    }

    /**
     * Get the most recent persisted runs of a provider, newest first
     *
     * @param providerId The provider to inspect
     * @param limit Maximum number of runs (default 20)
     * @return Run history
     */
    @GetMapping("/history")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getSyncHistory(
            @RequestParam String providerId,
            @RequestParam(defaultValue = "20") int limit) {

        return runService.getRunHistory(providerId, limit)
                .collectList()
                .map(runs -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", providerId);
                    response.put("runs", runs);
                    response.put("count", runs.size());
                    response.put("successfulRuns", runs.stream().filter(SyncRunRecord::isCompleted).count());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    /**
     * Get unresolved errors of the last 24 hours, optionally for one provider
     */
    @GetMapping("/errors")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getRecentErrors(
            @RequestParam(required = false) String providerId,
            @RequestParam(defaultValue = "10") int limit) {

        return runService.getRecentErrors(providerId, limit)
                .collectList()
                .map(errors -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providerId", providerId);
                    response.put("errors", errors);
                    response.put("count", errors.size());
                    response.put("retryable", errors.stream().filter(SyncError::isRetryable).count());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @PostMapping("/errors/{errorId}/resolve")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<SyncError>> resolveError(@PathVariable UUID errorId) {
        return orchestrationService.resolveError(errorId).map(ResponseEntity::ok);
    }

    /**
     * Re-fetch the listing an error refers to and resolve the error on success
     */
    @PostMapping("/errors/{errorId}/retry")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<SyncError>> retryError(@PathVariable UUID errorId) {
        return orchestrationService.retryError(errorId).map(ResponseEntity::ok);
    }

    private ResponseEntity<Map<String, Object>> runResponse(SyncRunSnapshot snapshot, String action) {
        Map<String, Object> response = new HashMap<>();
        response.put("runId", snapshot.runId());
        response.put("providerId", snapshot.providerId());
        response.put("action", action);
        response.put("status", snapshot.status());
        response.put("run", snapshot);
        response.put("timestamp", LocalDateTime.now());
        return ResponseEntity.ok(response);
    }
}
