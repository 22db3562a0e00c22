package com.openrangelabs.donpetre.mlssync.controller;

import com.openrangelabs.donpetre.mlssync.model.SchedulerStatus;
import com.openrangelabs.donpetre.mlssync.scheduler.MlsSyncScheduler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * REST controller for the periodic per-provider sync timers
 */
@RestController
@RequestMapping("/api/mls/scheduler")
@CrossOrigin(origins = "${mls.security.cors.allowed-origins:*}")
public class SchedulerController {

    private final MlsSyncScheduler scheduler;

    @Autowired
    public SchedulerController(MlsSyncScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Get the timer status of every configured provider
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getAllStatuses() {
        return scheduler.getAllStatuses()
                .collectList()
                .map(statuses -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("providers", statuses);
                    response.put("count", statuses.size());
                    response.put("scheduled", statuses.stream().filter(SchedulerStatus::enabled).count());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @GetMapping("/{providerId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<SchedulerStatus>> getStatus(@PathVariable String providerId) {
        return scheduler.getStatus(providerId).map(ResponseEntity::ok);
    }

    /**
     * Start the provider's timer. Starting an already scheduled provider is a no-op.
     */
    @PostMapping("/{providerId}/start")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<SchedulerStatus>> startScheduler(@PathVariable String providerId) {
        return scheduler.start(providerId).map(ResponseEntity::ok);
    }

    /**
     * Stop the provider's timer. A run already in flight is not interrupted.
     */
    @PostMapping("/{providerId}/stop")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<SchedulerStatus>> stopScheduler(@PathVariable String providerId) {
        return scheduler.stop(providerId).map(ResponseEntity::ok);
    }
}
