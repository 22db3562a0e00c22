package com.openrangelabs.donpetre.mlssync.service;

import com.openrangelabs.donpetre.mlssync.entity.PropertyListing;
import com.openrangelabs.donpetre.mlssync.exception.ResourceNotFoundException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.QualityScore;
import com.openrangelabs.donpetre.mlssync.model.UpsertOutcome;
import com.openrangelabs.donpetre.mlssync.repository.PropertyListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * The local property catalog: upsert by (providerId, mlsId) and merge application
 */
@Service
public class PropertyCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(PropertyCatalogService.class);

    private final PropertyListingRepository repository;
    private final PropertyListingMapper mapper;
    private final Clock clock;

    @Autowired
    public PropertyCatalogService(PropertyListingRepository repository,
                                  PropertyListingMapper mapper,
                                  Clock clock) {
        this.repository = repository;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Insert the record or overwrite the existing row with the same mlsId
     */
    public Mono<UpsertOutcome> upsert(CanonicalPropertyRecord record, QualityScore score) {
        return repository.findByProviderIdAndMlsId(record.getProviderId(), record.getMlsId())
                .map(existing -> new Upsert(existing, UpsertOutcome.UPDATED))
                .defaultIfEmpty(new Upsert(new PropertyListing(), UpsertOutcome.CREATED))
                .flatMap(upsert -> {
                    PropertyListing listing = mapper.apply(record, upsert.listing());
                    listing.setLastSyncedAt(LocalDateTime.now(clock));
                    if (score != null) {
                        listing.setQualityScore(score.getOverall());
                    }
                    return repository.save(listing).thenReturn(upsert.outcome());
                })
                .doOnSuccess(outcome -> logger.debug("{} listing {}/{}", outcome, record.getProviderId(), record.getMlsId()));
    }

    /**
     * Most recently synced catalog records that have not been merged away
     */
    public Flux<CanonicalPropertyRecord> findRecentRecords(String providerId, int limit) {
        return repository.findRecentActive(providerId, limit)
                .map(mapper::toRecord);
    }

    public Mono<CanonicalPropertyRecord> findRecord(String providerId, String mlsId) {
        return repository.findByProviderIdAndMlsId(providerId, mlsId)
                .map(mapper::toRecord);
    }

    /**
     * Write the merged payload onto its base row and mark the absorbed row as
     * merged into it
     */
    public Mono<Void> applyMerge(CanonicalPropertyRecord merged, String absorbedMlsId) {
        String providerId = merged.getProviderId();
        Mono<PropertyListing> base = repository.findByProviderIdAndMlsId(providerId, merged.getMlsId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Listing", providerId + "/" + merged.getMlsId())));
        Mono<PropertyListing> absorbed = repository.findByProviderIdAndMlsId(providerId, absorbedMlsId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Listing", providerId + "/" + absorbedMlsId)));

        // both rows must exist before either is written
        return Mono.zip(base, absorbed)
                .flatMap(rows -> {
                    PropertyListing target = mapper.apply(merged, rows.getT1());
                    PropertyListing source = rows.getT2();
                    source.setMergedIntoMlsId(merged.getMlsId());
                    return repository.save(target).then(repository.save(source));
                })
                .doOnSuccess(listing -> logger.info("Merged listing {} into {}", absorbedMlsId, merged.getMlsId()))
                .then();
    }

    private record Upsert(PropertyListing listing, UpsertOutcome outcome) {
    }
}
