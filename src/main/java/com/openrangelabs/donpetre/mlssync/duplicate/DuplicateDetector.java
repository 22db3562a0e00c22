package com.openrangelabs.donpetre.mlssync.duplicate;

import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.DuplicateCandidate;
import com.openrangelabs.donpetre.mlssync.model.SuggestedAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static com.openrangelabs.donpetre.mlssync.duplicate.FuzzyAddressMatcher.normalize;
import static com.openrangelabs.donpetre.mlssync.duplicate.FuzzyAddressMatcher.normalizeStreet;
import static com.openrangelabs.donpetre.mlssync.duplicate.FuzzyAddressMatcher.similarity;

/**
 * Finds pairs of canonical records that likely describe the same listing.
 *
 * <p>Each pair is scored as {@code 0.4 * address + 0.3 * price + 0.3 * details}
 * and reported when the score reaches the confidence threshold. Rows of the
 * comparison matrix are evaluated on parallel rails; the result is sorted by
 * confidence, then by the input position of the pair, so it does not depend
 * on scheduling.
 */
@Slf4j
@Component
public class DuplicateDetector {

    static final double ADDRESS_WEIGHT = 0.4;
    static final double PRICE_WEIGHT = 0.3;
    static final double DETAILS_WEIGHT = 0.3;

    private static final double STRONG_MATCH = 0.95;
    private static final double LIKELY_MATCH = 0.85;

    @Value("${mls.duplicates.confidence-threshold:0.85}")
    private double confidenceThreshold = 0.85;

    @Value("${mls.duplicates.bucketing-threshold:2000}")
    private int bucketingThreshold = 2000;

    @Value("${mls.duplicates.parallelism:4}")
    private int parallelism = 4;

    public Mono<List<DuplicateCandidate>> findDuplicates(List<CanonicalPropertyRecord> records) {
        return findDuplicates(records, () -> false);
    }

    /**
     * Compare every eligible pair. {@code cancelled} is polled before each row
     * of comparisons; once it reports true the remaining rows are skipped.
     */
    public Mono<List<DuplicateCandidate>> findDuplicates(List<CanonicalPropertyRecord> records,
                                                         BooleanSupplier cancelled) {
        if (records == null || records.size() < 2) {
            return Mono.just(List.of());
        }
        List<CanonicalPropertyRecord> input = List.copyOf(records);
        PartnerIndex partners = new PartnerIndex(input, input.size() > bucketingThreshold);

        return Flux.range(0, input.size() - 1)
                .parallel(Math.max(1, parallelism))
                .runOn(Schedulers.parallel())
                .map(row -> cancelled.getAsBoolean() ? List.<ScoredPair>of() : compareRow(input, partners, row))
                .sequential()
                .flatMapIterable(pairs -> pairs)
                .collectList()
                .map(pairs -> {
                    pairs.sort(Comparator.comparingDouble((ScoredPair pair) -> pair.candidate().getConfidence())
                            .reversed()
                            .thenComparingInt(ScoredPair::first)
                            .thenComparingInt(ScoredPair::second));
                    List<DuplicateCandidate> candidates = new ArrayList<>(pairs.size());
                    pairs.forEach(pair -> candidates.add(pair.candidate()));
                    log.debug("Compared {} records, found {} duplicate candidates", input.size(), candidates.size());
                    return candidates;
                });
    }

    /**
     * Score a single pair; empty when the records share an mlsId or the score
     * falls below the confidence threshold.
     */
    public Optional<DuplicateCandidate> compare(CanonicalPropertyRecord source, CanonicalPropertyRecord target) {
        if (source.getMlsId() != null && source.getMlsId().equals(target.getMlsId())) {
            return Optional.empty();
        }
        double price = priceSimilarity(source, target);
        // a zero price score caps the total at 0.7
        if (price == 0.0 && confidenceThreshold > ADDRESS_WEIGHT + DETAILS_WEIGHT) {
            return Optional.empty();
        }
        double address = addressSimilarity(source, target);
        double details = detailsSimilarity(source, target);
        double confidence = clamp(ADDRESS_WEIGHT * address + PRICE_WEIGHT * price + DETAILS_WEIGHT * details);
        if (confidence < confidenceThreshold) {
            return Optional.empty();
        }

        List<String> reasons = matchReasons(address, price, details);
        SuggestedAction action = suggestAction(confidence, reasons.size());
        return Optional.of(DuplicateCandidate.builder()
                .id(candidateId(source, target))
                .confidence(confidence)
                .source(source)
                .target(target)
                .addressSimilarity(address)
                .priceSimilarity(price)
                .detailsSimilarity(details)
                .matchReasons(reasons)
                .suggestedAction(action)
                .mergePayload(action == SuggestedAction.MERGE ? buildMergePayload(source, target) : null)
                .build());
    }

    /**
     * Mean of street, city, state and ZIP similarity over the components
     * both records carry. Street and city are fuzzy; state and ZIP are exact.
     */
    public double addressSimilarity(CanonicalPropertyRecord first, CanonicalPropertyRecord second) {
        CanonicalPropertyRecord.Address a = first.getAddress();
        CanonicalPropertyRecord.Address b = second.getAddress();
        double score = 0;
        int factors = 0;

        String streetA = normalizeStreet(a.getStreetLine());
        String streetB = normalizeStreet(b.getStreetLine());
        if (!streetA.isEmpty() && !streetB.isEmpty()) {
            score += similarity(streetA, streetB);
            factors++;
        }
        String cityA = normalize(a.getCity());
        String cityB = normalize(b.getCity());
        if (!cityA.isEmpty() && !cityB.isEmpty()) {
            score += similarity(cityA, cityB);
            factors++;
        }
        String stateA = normalize(a.getState());
        String stateB = normalize(b.getState());
        if (!stateA.isEmpty() && !stateB.isEmpty()) {
            score += stateA.equals(stateB) ? 1 : 0;
            factors++;
        }
        String zipA = zip5(a.getZipCode());
        String zipB = zip5(b.getZipCode());
        if (!zipA.isEmpty() && !zipB.isEmpty()) {
            score += zipA.equals(zipB) ? 1 : 0;
            factors++;
        }
        return factors == 0 ? 0.0 : score / factors;
    }

    /**
     * {@code 1 - 2 * (1 - min/max)}: a 50% difference or more scores zero.
     */
    public double priceSimilarity(CanonicalPropertyRecord first, CanonicalPropertyRecord second) {
        if (!first.hasPrice() || !second.hasPrice()) {
            return 0.0;
        }
        BigDecimal min = first.getPrice().min(second.getPrice());
        BigDecimal max = first.getPrice().max(second.getPrice());
        double ratio = min.divide(max, 6, RoundingMode.HALF_UP).doubleValue();
        return Math.max(0.0, 1.0 - (1.0 - ratio) * 2);
    }

    public double detailsSimilarity(CanonicalPropertyRecord first, CanonicalPropertyRecord second) {
        CanonicalPropertyRecord.Details a = first.getDetails();
        CanonicalPropertyRecord.Details b = second.getDetails();
        int factors = 0;
        int matches = 0;

        if (a.getBedrooms() > 0 && b.getBedrooms() > 0) {
            factors++;
            if (a.getBedrooms() == b.getBedrooms()) matches++;
        }
        if (a.getBathrooms() > 0 && b.getBathrooms() > 0) {
            factors++;
            if (Math.abs(a.getBathrooms() - b.getBathrooms()) <= 0.5) matches++;
        }
        if (a.getSquareFeet() > 0 && b.getSquareFeet() > 0) {
            factors++;
            double ratio = (double) Math.min(a.getSquareFeet(), b.getSquareFeet())
                    / Math.max(a.getSquareFeet(), b.getSquareFeet());
            if (ratio >= 0.9) matches++;
        }
        if (a.getYearBuilt() > 0 && b.getYearBuilt() > 0) {
            factors++;
            if (Math.abs(a.getYearBuilt() - b.getYearBuilt()) <= 2) matches++;
        }
        return factors == 0 ? 0.0 : (double) matches / factors;
    }

    static List<String> matchReasons(double address, double price, double details) {
        List<String> reasons = new ArrayList<>();
        if (address >= 0.9) {
            reasons.add("Very similar addresses");
        } else if (address >= 0.7) {
            reasons.add("Similar addresses");
        }
        if (price >= 0.9) {
            reasons.add("Identical or very similar prices");
        } else if (price >= 0.7) {
            reasons.add("Similar price ranges");
        }
        if (details >= 0.8) {
            reasons.add("Matching property details (bedrooms, bathrooms, square footage)");
        } else if (details >= 0.6) {
            reasons.add("Similar property specifications");
        }
        return List.copyOf(reasons);
    }

    static SuggestedAction suggestAction(double confidence, int reasonCount) {
        if (confidence >= STRONG_MATCH && reasonCount >= 2) {
            return SuggestedAction.MERGE;
        }
        return confidence >= LIKELY_MATCH ? SuggestedAction.MERGE : SuggestedAction.KEEP_BOTH;
    }

    /**
     * The more recently updated record wins; equal or missing update dates
     * fall back to the completeness checklist, then to {@code first}.
     */
    public CanonicalPropertyRecord selectBaseRecord(CanonicalPropertyRecord first, CanonicalPropertyRecord second) {
        LocalDateTime updatedFirst = first.getDates().getUpdated();
        LocalDateTime updatedSecond = second.getDates().getUpdated();
        if (updatedFirst != null && (updatedSecond == null || updatedFirst.isAfter(updatedSecond))) {
            return first;
        }
        if (updatedSecond != null && (updatedFirst == null || updatedSecond.isAfter(updatedFirst))) {
            return second;
        }
        return completenessPoints(second) > completenessPoints(first) ? second : first;
    }

    /**
     * Ten-point checklist: price, street, city, state, ZIP, bedrooms,
     * bathrooms, square feet, agent name, media.
     */
    public int completenessPoints(CanonicalPropertyRecord record) {
        CanonicalPropertyRecord.Address address = record.getAddress();
        CanonicalPropertyRecord.Details details = record.getDetails();
        int points = 0;
        if (record.hasPrice()) points++;
        if (!isBlank(address.getStreetName())) points++;
        if (!isBlank(address.getCity())) points++;
        if (!isBlank(address.getState())) points++;
        if (!isBlank(address.getZipCode())) points++;
        if (details.getBedrooms() > 0) points++;
        if (details.getBathrooms() > 0) points++;
        if (details.getSquareFeet() > 0) points++;
        if (!isBlank(record.getAgent().getName())) points++;
        if (!record.getMedia().isEmpty()) points++;
        return points;
    }

    /**
     * Merge two records onto the selected base: blank or zero base values are
     * filled from the other record, media is unioned by URL with a single
     * primary, and the lifecycle dates span both records.
     */
    public CanonicalPropertyRecord buildMergePayload(CanonicalPropertyRecord first, CanonicalPropertyRecord second) {
        CanonicalPropertyRecord base = selectBaseRecord(first, second);
        CanonicalPropertyRecord other = base == first ? second : first;

        CanonicalPropertyRecord.Address a = base.getAddress();
        CanonicalPropertyRecord.Address b = other.getAddress();
        CanonicalPropertyRecord.Details d = base.getDetails();
        CanonicalPropertyRecord.Details e = other.getDetails();

        return base.toBuilder()
                .listingId(firstNonBlank(base.getListingId(), other.getListingId()))
                .propertyType(firstNonBlank(base.getPropertyType(), other.getPropertyType()))
                .price(base.hasPrice() ? base.getPrice() : other.getPrice())
                .description(firstNonBlank(base.getDescription(), other.getDescription()))
                .address(a.toBuilder()
                        .streetNumber(firstNonBlank(a.getStreetNumber(), b.getStreetNumber()))
                        .streetName(firstNonBlank(a.getStreetName(), b.getStreetName()))
                        .unitNumber(firstNonBlank(a.getUnitNumber(), b.getUnitNumber()))
                        .city(firstNonBlank(a.getCity(), b.getCity()))
                        .state(firstNonBlank(a.getState(), b.getState()))
                        .zipCode(firstNonBlank(a.getZipCode(), b.getZipCode()))
                        .latitude(a.getLatitude() != null ? a.getLatitude() : b.getLatitude())
                        .longitude(a.getLongitude() != null ? a.getLongitude() : b.getLongitude())
                        .build())
                .details(d.toBuilder()
                        .bedrooms(d.getBedrooms() > 0 ? d.getBedrooms() : e.getBedrooms())
                        .bathrooms(d.getBathrooms() > 0 ? d.getBathrooms() : e.getBathrooms())
                        .squareFeet(d.getSquareFeet() > 0 ? d.getSquareFeet() : e.getSquareFeet())
                        .lotSize(d.getLotSize() > 0 ? d.getLotSize() : e.getLotSize())
                        .yearBuilt(d.getYearBuilt() > 0 ? d.getYearBuilt() : e.getYearBuilt())
                        .stories(d.getStories() > 0 ? d.getStories() : e.getStories())
                        .garageSpaces(d.getGarageSpaces() > 0 ? d.getGarageSpaces() : e.getGarageSpaces())
                        .build())
                .agent(isBlank(base.getAgent().getName()) ? other.getAgent() : base.getAgent())
                .office(isBlank(base.getOffice().getName()) ? other.getOffice() : base.getOffice())
                .media(mergeMedia(base.getMedia(), other.getMedia()))
                .dates(base.getDates().toBuilder()
                        .listed(earliest(base.getDates().getListed(), other.getDates().getListed()))
                        .updated(latest(base.getDates().getUpdated(), other.getDates().getUpdated()))
                        .sold(base.getDates().getSold() != null ? base.getDates().getSold() : other.getDates().getSold())
                        .expires(base.getDates().getExpires() != null ? base.getDates().getExpires() : other.getDates().getExpires())
                        .build())
                .build();
    }

    private static List<CanonicalPropertyRecord.Media> mergeMedia(List<CanonicalPropertyRecord.Media> base,
                                                                  List<CanonicalPropertyRecord.Media> other) {
        Map<String, CanonicalPropertyRecord.Media> byUrl = new LinkedHashMap<>();
        for (CanonicalPropertyRecord.Media media : base) {
            byUrl.putIfAbsent(media.getUrl(), media);
        }
        for (CanonicalPropertyRecord.Media media : other) {
            byUrl.putIfAbsent(media.getUrl(), media);
        }
        List<CanonicalPropertyRecord.Media> merged = new ArrayList<>(byUrl.size());
        boolean primarySeen = false;
        for (CanonicalPropertyRecord.Media media : byUrl.values()) {
            if (media.isPrimary() && primarySeen) {
                merged.add(media.toBuilder().primary(false).build());
            } else {
                primarySeen |= media.isPrimary();
                merged.add(media);
            }
        }
        return List.copyOf(merged);
    }

    private List<ScoredPair> compareRow(List<CanonicalPropertyRecord> input, PartnerIndex partners, int row) {
        List<ScoredPair> found = new ArrayList<>();
        CanonicalPropertyRecord source = input.get(row);
        for (int column : partners.partnersOf(row)) {
            int first = row;
            int second = column;
            compare(source, input.get(column))
                    .ifPresent(candidate -> found.add(new ScoredPair(first, second, candidate)));
        }
        return found;
    }

    private static String candidateId(CanonicalPropertyRecord source, CanonicalPropertyRecord target) {
        String key = source.getProviderId() + ":" + source.getMlsId() + "|" + target.getProviderId() + ":" + target.getMlsId();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static String zip5(String zipCode) {
        if (zipCode == null) return "";
        String digits = zipCode.replaceAll("\\D", "");
        return digits.length() >= 5 ? digits.substring(0, 5) : digits;
    }

    private static String bucketKey(CanonicalPropertyRecord record) {
        String state = normalize(record.getAddress().getState());
        String zip = zip5(record.getAddress().getZipCode());
        return state.isEmpty() || zip.isEmpty() ? null : state + "|" + zip;
    }

    private static LocalDateTime earliest(LocalDateTime a, LocalDateTime b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static LocalDateTime latest(LocalDateTime a, LocalDateTime b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return isBlank(preferred) ? (fallback == null ? "" : fallback) : preferred;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    void setBucketingThreshold(int bucketingThreshold) {
        this.bucketingThreshold = bucketingThreshold;
    }

    private record ScoredPair(int first, int second, DuplicateCandidate candidate) {
    }

    /**
     * Column indices to compare for each row. Without bucketing a row is
     * compared with every later record; with bucketing only with later records
     * in the same state/ZIP bucket, plus records lacking a bucket key, which
     * are compared with everything.
     */
    private static final class PartnerIndex {

        private final int size;
        private final boolean bucketed;
        private final String[] keys;
        private final Map<String, List<Integer>> buckets = new HashMap<>();
        private final List<Integer> unkeyed = new ArrayList<>();

        PartnerIndex(List<CanonicalPropertyRecord> records, boolean bucketed) {
            this.size = records.size();
            this.bucketed = bucketed;
            this.keys = new String[size];
            if (bucketed) {
                for (int i = 0; i < size; i++) {
                    keys[i] = bucketKey(records.get(i));
                    if (keys[i] == null) {
                        unkeyed.add(i);
                    } else {
                        buckets.computeIfAbsent(keys[i], key -> new ArrayList<>()).add(i);
                    }
                }
            }
        }

        List<Integer> partnersOf(int row) {
            List<Integer> columns = new ArrayList<>();
            if (!bucketed || keys[row] == null) {
                for (int column = row + 1; column < size; column++) {
                    columns.add(column);
                }
                return columns;
            }
            for (int column : buckets.get(keys[row])) {
                if (column > row) columns.add(column);
            }
            for (int column : unkeyed) {
                if (column > row) columns.add(column);
            }
            columns.sort(Integer::compare);
            return columns;
        }
    }
}
