package com.openrangelabs.donpetre.mlssync.quality;

import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.QualityScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores canonical records for completeness, accuracy and consistency.
 *
 * <p>Each dimension starts at 100 and loses fixed points per defect, floored
 * at 0. Issues describe defects; recommendations are advisory only.
 */
@Slf4j
@Component
public class DataQualityValidator {

    private static final Pattern ZIP_PATTERN = Pattern.compile("^\\d{5}(-\\d{4})?$");

    private static final Range DEFAULT_PRICE_RANGE = new Range(10_000, 100_000_000);
    private static final Map<String, Range> PRICE_RANGES = Map.of(
            "single_family", new Range(50_000, 10_000_000),
            "condo", new Range(30_000, 5_000_000),
            "townhouse", new Range(40_000, 3_000_000),
            "multi_family", new Range(100_000, 20_000_000),
            "land", new Range(10_000, 5_000_000),
            "commercial", new Range(50_000, 50_000_000));

    private static final Range DEFAULT_SQFT_RANGE = new Range(100, 1_000_000);
    private static final Map<String, Range> SQFT_RANGES = Map.of(
            "single_family", new Range(500, 15_000),
            "condo", new Range(300, 5_000),
            "townhouse", new Range(800, 8_000),
            "multi_family", new Range(1_000, 50_000),
            "land", new Range(1_000, 1_000_000),
            "commercial", new Range(500, 100_000));

    private static final Range DEFAULT_PRICE_PER_SQFT = new Range(50, 1_000);
    private static final Map<String, Range> PRICE_PER_SQFT_BY_STATE = Map.of(
            "CA", new Range(200, 2_000),
            "NY", new Range(150, 1_500),
            "TX", new Range(80, 400),
            "FL", new Range(100, 600));

    private final Clock clock;

    public DataQualityValidator(Clock clock) {
        this.clock = clock;
    }

    public QualityScore validateRecord(CanonicalPropertyRecord record) {
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        int completeness = scoreCompleteness(record, issues, recommendations);
        int accuracy = scoreAccuracy(record, issues);
        int consistency = scoreConsistency(record, issues, recommendations);
        int overall = clamp((int) Math.round(completeness * 0.4 + accuracy * 0.4 + consistency * 0.2));

        return QualityScore.builder()
                .mlsId(record.getMlsId())
                .overall(overall)
                .completeness(completeness)
                .accuracy(accuracy)
                .consistency(consistency)
                .issues(List.copyOf(issues))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    public List<QualityScore> validateBatch(List<CanonicalPropertyRecord> records) {
        List<QualityScore> scores = records.stream()
                .map(this::validateRecord)
                .collect(Collectors.toList());
        if (log.isDebugEnabled() && !scores.isEmpty()) {
            double average = scores.stream().mapToInt(QualityScore::getOverall).average().orElse(0);
            log.debug("Validated {} records, average quality {}", scores.size(), Math.round(average));
        }
        return scores;
    }

    private int scoreCompleteness(CanonicalPropertyRecord record, List<String> issues, List<String> recommendations) {
        CanonicalPropertyRecord.Address address = record.getAddress();
        CanonicalPropertyRecord.Details details = record.getDetails();
        int score = 100;

        if (isBlank(address.getStreetName())) {
            score -= 15;
            issues.add("Missing street address");
        }
        if (isBlank(address.getCity())) {
            score -= 10;
            issues.add("Missing city");
        }
        if (isBlank(address.getState())) {
            score -= 10;
            issues.add("Missing state");
        }
        if (isBlank(address.getZipCode())) {
            score -= 5;
            issues.add("Missing ZIP code");
        }
        if (!record.hasPrice()) {
            score -= 20;
            issues.add("Missing or invalid price");
        }
        if (details.getBedrooms() <= 0) {
            score -= 8;
            issues.add("Missing bedroom count");
        }
        if (details.getBathrooms() <= 0) {
            score -= 8;
            issues.add("Missing bathroom count");
        }
        if (details.getSquareFeet() <= 0) {
            score -= 10;
            issues.add("Missing square footage");
        }

        if (isBlank(record.getAgent().getName())) {
            score -= 3;
            recommendations.add("Add listing agent information");
        }
        if (record.getMedia().isEmpty()) {
            score -= 5;
            recommendations.add("Add property photos");
        }
        if (isBlank(record.getDescription())) {
            score -= 2;
            recommendations.add("Add a property description");
        }
        return clamp(score);
    }

    private int scoreAccuracy(CanonicalPropertyRecord record, List<String> issues) {
        CanonicalPropertyRecord.Details details = record.getDetails();
        String type = record.getPropertyType();
        int score = 100;

        if (record.hasPrice()) {
            Range range = PRICE_RANGES.getOrDefault(type, DEFAULT_PRICE_RANGE);
            if (!range.contains(record.getPrice().doubleValue())) {
                score -= 15;
                issues.add("Price " + record.getPrice().toPlainString() + " outside expected range for " + describe(type));
            }
        }
        if (details.getSquareFeet() > 0) {
            Range range = SQFT_RANGES.getOrDefault(type, DEFAULT_SQFT_RANGE);
            if (!range.contains(details.getSquareFeet())) {
                score -= 10;
                issues.add("Square footage " + details.getSquareFeet() + " outside expected range for " + describe(type));
            }
        }
        if (details.getBedrooms() > 0 && details.getBathrooms() / details.getBedrooms() > 3) {
            score -= 5;
            issues.add("Unusual bathroom to bedroom ratio");
        }
        if (details.getYearBuilt() > 0) {
            int maxYear = Year.now(clock).getValue() + 1;
            if (details.getYearBuilt() < 1800 || details.getYearBuilt() > maxYear) {
                score -= 10;
                issues.add("Implausible year built: " + details.getYearBuilt());
            }
        }
        String zip = record.getAddress().getZipCode();
        if (!isBlank(zip) && !ZIP_PATTERN.matcher(zip.trim()).matches()) {
            score -= 8;
            issues.add("Malformed ZIP code: " + zip);
        }
        return clamp(score);
    }

    private int scoreConsistency(CanonicalPropertyRecord record, List<String> issues, List<String> recommendations) {
        CanonicalPropertyRecord.Details details = record.getDetails();
        int score = 100;

        if (record.hasPrice() && details.getSquareFeet() > 0) {
            BigDecimal perSqft = record.getPrice().divide(BigDecimal.valueOf(details.getSquareFeet()), 2, RoundingMode.HALF_UP);
            String state = stateCode(record.getAddress().getState());
            Range band = PRICE_PER_SQFT_BY_STATE.getOrDefault(state, DEFAULT_PRICE_PER_SQFT);
            if (!band.contains(perSqft.doubleValue())) {
                score -= 10;
                issues.add("Price per square foot " + perSqft.toPlainString() + " outside expected band"
                        + (state.isEmpty() ? "" : " for " + state));
            }
        }

        LocalDateTime listed = record.getDates().getListed();
        LocalDateTime updated = record.getDates().getUpdated();
        if (listed != null && updated != null && listed.isAfter(updated)) {
            score -= 5;
            issues.add("Listed date is after last update");
        }

        long primaryCount = record.getMedia().stream().filter(CanonicalPropertyRecord.Media::isPrimary).count();
        if (primaryCount > 1) {
            score -= 5;
            issues.add("Multiple primary photos");
        } else if (primaryCount == 0 && !record.getMedia().isEmpty()) {
            score -= 3;
            recommendations.add("Mark one photo as primary");
        }

        if ("single_family".equals(record.getPropertyType()) && details.getStories() > 3) {
            score -= 5;
            issues.add("Unusual number of stories for a single family home");
        }
        return clamp(score);
    }

    private static String describe(String type) {
        return isBlank(type) ? "unknown property type" : type;
    }

    private static String stateCode(String state) {
        return isBlank(state) ? "" : state.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private record Range(double min, double max) {
        boolean contains(double value) {
            return value >= min && value <= max;
        }
    }
}
