package com.openrangelabs.donpetre.mlssync.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderPayloadsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void normalizeStatus_MapsProviderCodes() {
        assertThat(ProviderPayloads.normalizeStatus("ACT")).isEqualTo("active");
        assertThat(ProviderPayloads.normalizeStatus("pnd")).isEqualTo("pending");
        assertThat(ProviderPayloads.normalizeStatus("Closed")).isEqualTo("sold");
        assertThat(ProviderPayloads.normalizeStatus("CAN")).isEqualTo("withdrawn");
        assertThat(ProviderPayloads.normalizeStatus("EXP")).isEqualTo("expired");
    }

    @Test
    void normalizeStatus_UnknownOrBlank() {
        assertThat(ProviderPayloads.normalizeStatus("Coming Soon")).isEqualTo("coming soon");
        assertThat(ProviderPayloads.normalizeStatus("  ")).isEqualTo("active");
        assertThat(ProviderPayloads.normalizeStatus(null)).isEqualTo("active");
    }

    @Test
    void normalizePropertyType_CollapsesSpellings() {
        assertThat(ProviderPayloads.normalizePropertyType("Single Family Residence")).isEqualTo("single_family");
        assertThat(ProviderPayloads.normalizePropertyType("Condominium")).isEqualTo("condo");
        assertThat(ProviderPayloads.normalizePropertyType("Multi-Family")).isEqualTo("multi_family");
        assertThat(ProviderPayloads.normalizePropertyType("Farm")).isEqualTo("farm");
    }

    @Test
    void price_ToleratesCurrencyFormatting() throws Exception {
        JsonNode node = objectMapper.readTree("{\"a\": \"$1,250,000.50\", \"b\": 99000, \"c\": \"\"}");

        assertThat(ProviderPayloads.price(node, "a")).isEqualByComparingTo(new BigDecimal("1250000.50"));
        assertThat(ProviderPayloads.price(node, "b")).isEqualByComparingTo(new BigDecimal("99000"));
        assertThat(ProviderPayloads.price(node, "c")).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(ProviderPayloads.price(node, "missing")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void price_Unparseable_Throws() throws Exception {
        JsonNode node = objectMapper.readTree("{\"price\": \"call agent\"}");

        assertThatThrownBy(() -> ProviderPayloads.price(node, "price"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("call agent");
    }

    @Test
    void dateTime_AcceptsOffsetLocalAndDateOnly() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {"offset": "2025-05-30T10:15:00-05:00", "local": "2025-05-30T10:15:00", "date": "2025-05-30"}
                """);

        assertThat(ProviderPayloads.dateTime(node, "offset")).isEqualTo(LocalDateTime.of(2025, 5, 30, 15, 15));
        assertThat(ProviderPayloads.dateTime(node, "local")).isEqualTo(LocalDateTime.of(2025, 5, 30, 10, 15));
        assertThat(ProviderPayloads.dateTime(node, "date")).isEqualTo(LocalDateTime.of(2025, 5, 30, 0, 0));
        assertThat(ProviderPayloads.dateTime(node, "missing")).isNull();
    }

    @Test
    void text_WalksNestedPathsAndDefaultsToEmpty() throws Exception {
        JsonNode node = objectMapper.readTree("{\"address\": {\"city\": \" Austin \", \"zip\": null}}");

        assertThat(ProviderPayloads.text(node, "address", "city")).isEqualTo("Austin");
        assertThat(ProviderPayloads.text(node, "address", "zip")).isEmpty();
        assertThat(ProviderPayloads.text(node, "office", "name")).isEmpty();
        assertThat(ProviderPayloads.integer(node, "address", "beds")).isZero();
    }
}
