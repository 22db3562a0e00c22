package com.openrangelabs.donpetre.mlssync.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Null-safe readers and normalizers shared by the provider transforms.
 */
public final class ProviderPayloads {

    private static final Map<String, String> STATUS_ALIASES = Map.ofEntries(
            Map.entry("ACTIVE", "active"),
            Map.entry("ACT", "active"),
            Map.entry("PENDING", "pending"),
            Map.entry("PND", "pending"),
            Map.entry("SOLD", "sold"),
            Map.entry("SLD", "sold"),
            Map.entry("CLOSED", "sold"),
            Map.entry("WITHDRAWN", "withdrawn"),
            Map.entry("WTH", "withdrawn"),
            Map.entry("CANCELLED", "withdrawn"),
            Map.entry("CANCELED", "withdrawn"),
            Map.entry("CAN", "withdrawn"),
            Map.entry("EXPIRED", "expired"),
            Map.entry("EXP", "expired"));

    private static final Map<String, String> PROPERTY_TYPE_ALIASES = Map.ofEntries(
            Map.entry("residential", "single_family"),
            Map.entry("single_family", "single_family"),
            Map.entry("singlefamily", "single_family"),
            Map.entry("singlefamilyresidence", "single_family"),
            Map.entry("single_family_residence", "single_family"),
            Map.entry("sfr", "single_family"),
            Map.entry("condo", "condo"),
            Map.entry("condominium", "condo"),
            Map.entry("townhouse", "townhouse"),
            Map.entry("townhome", "townhouse"),
            Map.entry("multi_family", "multi_family"),
            Map.entry("multifamily", "multi_family"),
            Map.entry("residential_income", "multi_family"),
            Map.entry("land", "land"),
            Map.entry("lot", "land"),
            Map.entry("lots_and_land", "land"),
            Map.entry("commercial", "commercial"),
            Map.entry("commercial_sale", "commercial"));

    private static final List<Function<String, LocalDateTime>> DATE_PARSERS = List.of(
            raw -> OffsetDateTime.parse(raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(),
            LocalDateTime::parse,
            raw -> LocalDate.parse(raw).atStartOfDay());

    private ProviderPayloads() {
    }

    public static JsonNode at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String field : path) {
            if (current == null || current.isMissingNode() || current.isNull()) {
                return null;
            }
            current = current.get(field);
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    public static String text(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        return value == null ? "" : value.asText("").trim();
    }

    public static int integer(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null) return 0;
        if (value.isNumber()) return value.intValue();
        try {
            return (int) Double.parseDouble(value.asText().replace(",", "").trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static double decimal(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null) return 0.0;
        if (value.isNumber()) return value.doubleValue();
        try {
            return Double.parseDouble(value.asText().replace(",", "").trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public static Double optionalDecimal(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        return value == null ? null : decimal(node, path);
    }

    /**
     * Reads a price, tolerating currency symbols and thousands separators.
     */
    public static BigDecimal price(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null) return BigDecimal.ZERO;
        if (value.isNumber()) return value.decimalValue();
        String cleaned = value.asText().replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unparseable price: " + value.asText());
        }
    }

    /**
     * Reads ISO-8601 timestamps with or without offset, or plain dates.
     * Offsets are converted to UTC.
     */
    public static LocalDateTime dateTime(JsonNode node, String... path) {
        String raw = text(node, path);
        if (raw.isEmpty()) return null;
        DateTimeParseException lastFailure = null;
        for (Function<String, LocalDateTime> parser : DATE_PARSERS) {
            try {
                return parser.apply(raw);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new IllegalArgumentException("Unparseable date: " + raw, lastFailure);
    }

    /**
     * Reads a media array. Items without a URL are dropped.
     */
    public static List<CanonicalPropertyRecord.Media> media(JsonNode items, String urlField, String captionField,
                                                            String orderField, String primaryField) {
        if (items == null || !items.isArray()) return List.of();
        List<CanonicalPropertyRecord.Media> media = new ArrayList<>();
        int position = 0;
        for (JsonNode item : items) {
            String url = text(item, urlField);
            if (url.isEmpty()) continue;
            JsonNode order = at(item, orderField);
            JsonNode primary = at(item, primaryField);
            media.add(CanonicalPropertyRecord.Media.builder()
                    .url(url)
                    .caption(text(item, captionField))
                    .order(order != null ? order.asInt(position) : position)
                    .primary(flag(primary))
                    .build());
            position++;
        }
        return media;
    }

    public static boolean flag(JsonNode value) {
        if (value == null) return false;
        if (value.isBoolean()) return value.booleanValue();
        String raw = value.asText("").trim();
        return raw.equalsIgnoreCase("y") || raw.equalsIgnoreCase("yes") || raw.equalsIgnoreCase("true");
    }

    public static String normalizeStatus(String status) {
        if (status == null || status.isBlank()) return "active";
        String key = status.trim().toUpperCase(Locale.ROOT);
        return STATUS_ALIASES.getOrDefault(key, status.trim().toLowerCase(Locale.ROOT));
    }

    public static String normalizePropertyType(String propertyType) {
        if (propertyType == null || propertyType.isBlank()) return "";
        String key = propertyType.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        key = key.replaceAll("^_|_$", "");
        return PROPERTY_TYPE_ALIASES.getOrDefault(key, key);
    }
}
