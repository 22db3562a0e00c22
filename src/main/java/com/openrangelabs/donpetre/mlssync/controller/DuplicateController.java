package com.openrangelabs.donpetre.mlssync.controller;

import com.openrangelabs.donpetre.mlssync.dto.BatchResolveRequest;
import com.openrangelabs.donpetre.mlssync.dto.ResolveDuplicateRequest;
import com.openrangelabs.donpetre.mlssync.entity.DuplicateCandidateRecord;
import com.openrangelabs.donpetre.mlssync.model.ResolutionOutcome;
import com.openrangelabs.donpetre.mlssync.service.DuplicateResolutionService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for reviewing and resolving duplicate listing candidates
 */
@RestController
@RequestMapping("/api/mls/duplicates")
@CrossOrigin(origins = "${mls.security.cors.allowed-origins:*}")
public class DuplicateController {

    private final DuplicateResolutionService duplicateService;

    @Autowired
    public DuplicateController(DuplicateResolutionService duplicateService) {
        this.duplicateService = duplicateService;
    }

    /**
     * Get unresolved candidates, newest first
     *
     * @param limit Maximum number of candidates (default 50)
     * @return Pending candidates
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> getPendingDuplicates(
            @RequestParam(defaultValue = "50") int limit) {

        return duplicateService.getPendingDuplicates(limit)
                .collectList()
                .map(candidates -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("candidates", candidates);
                    response.put("count", candidates.size());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    /**
     * Resolve one candidate
     *
     * Applies the requested action, or the candidate's suggested action when
     * no body is sent. Resolving an already resolved candidate returns it
     * unchanged.
     *
     * @param candidateId The candidate to resolve
     * @param request Optional action override
     * @return The resolved candidate
     */
    @PostMapping("/{candidateId}/resolve")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<DuplicateCandidateRecord>> resolveDuplicate(
            @PathVariable UUID candidateId,
            @RequestBody(required = false) ResolveDuplicateRequest request) {

        return duplicateService.resolveDuplicate(candidateId, request != null ? request.getAction() : null)
                .map(ResponseEntity::ok);
    }

    /**
     * Resolve several candidates with their suggested actions. Each candidate
     * succeeds or fails on its own.
     */
    @PostMapping("/resolve")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> resolveBatch(@Valid @RequestBody BatchResolveRequest request) {
        return duplicateService.resolveAll(request.getCandidateIds())
                .collectList()
                .map(outcomes -> {
                    long succeeded = outcomes.stream().filter(ResolutionOutcome::success).count();

                    Map<String, Object> response = new HashMap<>();
                    response.put("results", outcomes);
                    response.put("requested", request.getCandidateIds().size());
                    response.put("succeeded", succeeded);
                    response.put("failed", outcomes.size() - succeeded);
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }
}
