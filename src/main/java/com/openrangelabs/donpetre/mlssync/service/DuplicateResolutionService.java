package com.openrangelabs.donpetre.mlssync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.duplicate.DuplicateDetector;
import com.openrangelabs.donpetre.mlssync.entity.DuplicateCandidateRecord;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.DuplicateCandidate;
import com.openrangelabs.donpetre.mlssync.model.ResolutionOutcome;
import com.openrangelabs.donpetre.mlssync.model.SuggestedAction;
import com.openrangelabs.donpetre.mlssync.repository.DuplicateCandidateRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Stores duplicate candidates found during sync and applies their resolutions.
 *
 * <p>Resolution is idempotent: a candidate that is already resolved is
 * returned unchanged and nothing is written.
 */
@Service
public class DuplicateResolutionService {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateResolutionService.class);

    static final int DEFAULT_PENDING_LIMIT = 50;

    private final DuplicateCandidateRecordRepository repository;
    private final PropertyCatalogService catalogService;
    private final DuplicateDetector detector;
    private final ObjectMapper objectMapper;

    @Autowired
    public DuplicateResolutionService(DuplicateCandidateRecordRepository repository,
                                      PropertyCatalogService catalogService,
                                      DuplicateDetector detector,
                                      ObjectMapper objectMapper) {
        this.repository = repository;
        this.catalogService = catalogService;
        this.detector = detector;
        this.objectMapper = objectMapper;
    }

    /**
     * Store candidates that are not already pending for the same pair
     *
     * @return number of candidates stored
     */
    public Mono<Integer> recordCandidates(String providerId, List<DuplicateCandidate> candidates) {
        return Flux.fromIterable(candidates)
                .concatMap(candidate -> repository.existsPendingPair(providerId,
                                candidate.getSource().getMlsId(), candidate.getTarget().getMlsId())
                        .filter(exists -> !exists)
                        .flatMap(absent -> repository.save(toRecord(providerId, candidate))))
                .count()
                .map(Long::intValue)
                .doOnSuccess(stored -> {
                    if (stored > 0) {
                        logger.info("Recorded {} new duplicate candidates for provider {}", stored, providerId);
                    }
                });
    }

    /**
     * Unresolved candidates, newest first
     */
    public Flux<DuplicateCandidateRecord> getPendingDuplicates(int limit) {
        return repository.findPending(limit > 0 ? limit : DEFAULT_PENDING_LIMIT);
    }

    public Mono<DuplicateCandidateRecord> resolveDuplicate(UUID candidateId) {
        return resolveDuplicate(candidateId, null);
    }

    /**
     * Apply the suggested action, or {@code override} when given, and mark
     * the candidate resolved. A failed application is recorded on the
     * candidate, which stays pending so it can be retried.
     */
    public Mono<DuplicateCandidateRecord> resolveDuplicate(UUID candidateId, SuggestedAction override) {
        return repository.findById(candidateId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Duplicate candidate", candidateId)))
                .flatMap(candidate -> {
                    if (candidate.isResolved()) {
                        logger.debug("Duplicate candidate {} already resolved as {}", candidateId, candidate.getResolvedAction());
                        return Mono.just(candidate);
                    }
                    SuggestedAction action = override != null
                            ? override
                            : SuggestedAction.fromValue(candidate.getSuggestedAction());
                    return applyAction(candidate, action)
                            .onErrorResume(error -> {
                                logger.warn("Failed to apply {} to duplicate candidate {}: {}",
                                        action.getValue(), candidateId, error.getMessage());
                                candidate.setLastError(error.getMessage());
                                return repository.save(candidate).then(Mono.<Void>error(error));
                            })
                            .then(Mono.defer(() -> {
                                candidate.markResolved(action.getResolvedValue());
                                return repository.save(candidate);
                            }))
                            .doOnSuccess(saved -> logger.info("Resolved duplicate candidate {} ({} / {}) as {}",
                                    candidateId, saved.getSourceMlsId(), saved.getTargetMlsId(), saved.getResolvedAction()));
                });
    }

    /**
     * Resolve each candidate independently; one failure never blocks the others
     */
    public Flux<ResolutionOutcome> resolveAll(List<UUID> candidateIds) {
        return Flux.fromIterable(candidateIds)
                .concatMap(candidateId -> resolveDuplicate(candidateId)
                        .map(resolved -> ResolutionOutcome.resolved(candidateId, resolved.getResolvedAction()))
                        .onErrorResume(error -> Mono.just(ResolutionOutcome.failed(candidateId, error.getMessage()))));
    }

    private Mono<Void> applyAction(DuplicateCandidateRecord candidate, SuggestedAction action) {
        if (action != SuggestedAction.MERGE) {
            return Mono.empty();
        }
        return mergePayloadOf(candidate)
                .flatMap(merged -> {
                    String absorbed = merged.getMlsId().equals(candidate.getSourceMlsId())
                            ? candidate.getTargetMlsId()
                            : candidate.getSourceMlsId();
                    return catalogService.applyMerge(merged, absorbed);
                });
    }

    // Candidates suggested as keep_both carry no payload; build one from the catalog
    private Mono<CanonicalPropertyRecord> mergePayloadOf(DuplicateCandidateRecord candidate) {
        if (candidate.getMergePayload() != null && !candidate.getMergePayload().isBlank()) {
            return Mono.fromCallable(() -> objectMapper.readValue(candidate.getMergePayload(), CanonicalPropertyRecord.class));
        }
        String providerId = candidate.getProviderId();
        return Mono.zip(
                        catalogService.findRecord(providerId, candidate.getSourceMlsId())
                                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Listing", candidate.getSourceMlsId()))),
                        catalogService.findRecord(providerId, candidate.getTargetMlsId())
                                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Listing", candidate.getTargetMlsId()))))
                .map(pair -> detector.buildMergePayload(pair.getT1(), pair.getT2()));
    }

    private DuplicateCandidateRecord toRecord(String providerId, DuplicateCandidate candidate) {
        DuplicateCandidateRecord record = new DuplicateCandidateRecord();
        record.setProviderId(providerId);
        record.setSourceMlsId(candidate.getSource().getMlsId());
        record.setTargetMlsId(candidate.getTarget().getMlsId());
        record.setConfidence(candidate.getConfidence());
        record.setMatchReasons(String.join("\n", candidate.getMatchReasons()));
        record.setSuggestedAction(candidate.getSuggestedAction().getValue());
        if (candidate.getMergePayload() != null) {
            try {
                record.setMergePayload(objectMapper.writeValueAsString(candidate.getMergePayload()));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize merge payload for " + candidate.getId(), e);
            }
        }
        return record;
    }
}
