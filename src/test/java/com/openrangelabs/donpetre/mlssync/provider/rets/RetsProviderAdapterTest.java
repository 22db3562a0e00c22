package com.openrangelabs.donpetre.mlssync.provider.rets;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.mlssync.MutableClock;
import com.openrangelabs.donpetre.mlssync.TestRecords;
import com.openrangelabs.donpetre.mlssync.exception.MlsProviderException;
import com.openrangelabs.donpetre.mlssync.model.CanonicalPropertyRecord;
import com.openrangelabs.donpetre.mlssync.model.ProviderFamily;
import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;
import com.openrangelabs.donpetre.mlssync.model.SyncOptions;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RetsProviderAdapterTest {

    private static final String PAGE_ONE = """
            {
              "totalCount": 3,
              "properties": [
                {
                  "ListingID": "R-100",
                  "PropertyType": "Residential",
                  "StandardStatus": "ACT",
                  "ListPrice": "$525,000",
                  "StreetNumber": "123",
                  "StreetName": "Main Street",
                  "City": "Austin",
                  "StateOrProvince": "TX",
                  "PostalCode": "78701",
                  "BedroomsTotal": 3,
                  "BathroomsTotal": 2.5,
                  "LivingArea": 2100,
                  "YearBuilt": 2004,
                  "ListAgentFullName": "Jordan Agent",
                  "ModificationTimestamp": "2025-05-30T10:15:00Z",
                  "Media": [
                    {"MediaURL": "https://photos.example.com/r100/1.jpg", "Order": 0, "PreferredPhotoYN": "Y"}
                  ]
                },
                {
                  "ListingID": "R-101",
                  "StandardStatus": "SLD",
                  "ListPrice": 310000
                }
              ]
            }
            """;

    private MockWebServer server;
    private MutableClock clock;
    private RetsProviderAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));

        String endpoint = server.url("/rets").toString();
        WebClient webClient = WebClient.builder().baseUrl(endpoint).build();
        adapter = new RetsProviderAdapter(TestRecords.provider("rets-mls", ProviderFamily.RETS, endpoint),
                webClient, new ObjectMapper(), clock, 2);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void authenticate_PostsFormLoginAndReadsSessionCookie() throws InterruptedException {
        // Arrange
        server.enqueue(loginResponse("abc123"));

        // Act & Assert
        StepVerifier.create(adapter.authenticate())
                .expectNext(true)
                .verifyComplete();

        RecordedRequest login = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(login.getMethod()).isEqualTo("POST");
        assertThat(login.getPath()).isEqualTo("/rets/login");
        assertThat(login.getHeader("RETS-Version")).isEqualTo("RETS/1.8");
        assertThat(login.getBody().readUtf8()).contains("username=sync-user").contains("password=sync-pass");
    }

    @Test
    void authenticate_LoginRejected_ReturnsFalse() {
        // Arrange
        server.enqueue(new MockResponse().setResponseCode(401));

        // Act & Assert
        StepVerifier.create(adapter.authenticate())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void fetchPage_SendsSessionCookieAndMapsRecords() throws InterruptedException {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(json(PAGE_ONE));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .assertNext(page -> {
                    assertThat(page.pageNumber()).isEqualTo(1);
                    assertThat(page.hasMore()).isTrue();
                    assertThat(page.totalRecords()).isEqualTo(3);
                    assertThat(page.records()).hasSize(2);

                    CanonicalPropertyRecord first = page.records().get(0);
                    assertThat(first.getMlsId()).isEqualTo("R-100");
                    assertThat(first.getProviderId()).isEqualTo("rets-mls");
                    assertThat(first.getPropertyType()).isEqualTo("single_family");
                    assertThat(first.getStatus()).isEqualTo("active");
                    assertThat(first.getPrice()).isEqualByComparingTo(new BigDecimal("525000"));
                    assertThat(first.getAddress().getStreetLine()).isEqualTo("123 Main Street");
                    assertThat(first.getAddress().getCountry()).isEqualTo("US");
                    assertThat(first.getDetails().getBathrooms()).isEqualTo(2.5);
                    assertThat(first.getDates().getUpdated()).isEqualTo(LocalDateTime.of(2025, 5, 30, 10, 15));
                    assertThat(first.getMedia()).singleElement()
                            .satisfies(media -> assertThat(media.isPrimary()).isTrue());

                    CanonicalPropertyRecord second = page.records().get(1);
                    assertThat(second.getStatus()).isEqualTo("sold");
                    assertThat(second.getAddress().getCity()).isEmpty();
                    assertThat(second.getDetails().getBedrooms()).isZero();
                })
                .verifyComplete();

        server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest search = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(search.getHeader("Cookie")).isEqualTo("RETS-Session=abc123");
        assertThat(search.getHeader("RETS-Version")).isEqualTo("RETS/1.8");
        assertThat(search.getRequestUrl().queryParameter("limit")).isEqualTo("2");
        assertThat(search.getRequestUrl().queryParameter("offset")).isEqualTo("0");
    }

    @Test
    void fetchPage_PassesFiltersAndOffset() throws InterruptedException {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(json("{\"totalCount\": 2, \"properties\": []}"));
        SyncOptions options = SyncOptions.builder()
                .dateRange(SyncOptions.DateRange.builder()
                        .start(LocalDateTime.of(2025, 5, 1, 0, 0))
                        .build())
                .propertyTypes(List.of("condo", "townhouse"))
                .statusFilter(List.of("active"))
                .build();

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(options, 2))
                .assertNext(page -> assertThat(page.hasMore()).isFalse())
                .verifyComplete();

        server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest search = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(search.getRequestUrl().queryParameter("offset")).isEqualTo("2");
        assertThat(search.getRequestUrl().queryParameter("modifiedAfter")).isEqualTo("2025-05-01T00:00:00");
        assertThat(search.getRequestUrl().queryParameter("propertyType")).isEqualTo("condo,townhouse");
        assertThat(search.getRequestUrl().queryParameter("status")).isEqualTo("active");
    }

    @Test
    void fetchPage_ReusesSessionUntilItExpires() {
        // Arrange
        server.enqueue(loginResponse("first"));
        server.enqueue(json(PAGE_ONE));
        server.enqueue(json(PAGE_ONE));
        server.enqueue(loginResponse("second"));
        server.enqueue(json(PAGE_ONE));

        // Act
        adapter.fetchPage(SyncOptions.defaults(), 1).block(Duration.ofSeconds(5));
        adapter.fetchPage(SyncOptions.defaults(), 1).block(Duration.ofSeconds(5));
        assertThat(server.getRequestCount()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(31));
        adapter.fetchPage(SyncOptions.defaults(), 1).block(Duration.ofSeconds(5));

        // Assert
        assertThat(server.getRequestCount()).isEqualTo(5);
    }

    @Test
    void fetchPage_RateLimited_RaisesRetryableApiErrorWithRetryAfter() {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "30"));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(MlsProviderException.class);
                    MlsProviderException failure = (MlsProviderException) error;
                    assertThat(failure.getType()).isEqualTo(SyncErrorType.API);
                    assertThat(failure.isRetryable()).isTrue();
                    assertThat(failure.getRetryAfter()).isEqualTo(LocalDateTime.of(2025, 6, 1, 12, 0, 30));
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void fetchPage_ServerError_IsRetryable() {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(new MockResponse().setResponseCode(503));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .expectErrorSatisfies(error -> {
                    MlsProviderException failure = (MlsProviderException) error;
                    assertThat(failure.getType()).isEqualTo(SyncErrorType.API);
                    assertThat(failure.isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void fetchPage_ClientError_IsNotRetryable() {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(new MockResponse().setResponseCode(400));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .expectErrorSatisfies(error -> {
                    MlsProviderException failure = (MlsProviderException) error;
                    assertThat(failure.getType()).isEqualTo(SyncErrorType.API);
                    assertThat(failure.isRetryable()).isFalse();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void fetchPage_MalformedBody_RaisesDataError() {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(json("{\"totalCount\": 1}"));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .expectErrorSatisfies(error -> {
                    MlsProviderException failure = (MlsProviderException) error;
                    assertThat(failure.getType()).isEqualTo(SyncErrorType.DATA);
                    assertThat(failure.isRetryable()).isFalse();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void fetchPage_LoginRejected_RaisesAuthError() {
        // Arrange
        server.enqueue(new MockResponse().setResponseCode(403));

        // Act & Assert
        StepVerifier.create(adapter.fetchPage(SyncOptions.defaults(), 1))
                .expectErrorSatisfies(error -> {
                    MlsProviderException failure = (MlsProviderException) error;
                    assertThat(failure.getType()).isEqualTo(SyncErrorType.AUTH);
                    assertThat(failure.isRetryable()).isFalse();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void getPropertyById_NotFound_CompletesEmpty() throws InterruptedException {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(new MockResponse().setResponseCode(404));

        // Act & Assert
        StepVerifier.create(adapter.getPropertyById("R-404"))
                .verifyComplete();

        server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/rets/properties/R-404");
    }

    @Test
    void getRateLimitStatus_TracksResponseHeaders() {
        // Arrange
        server.enqueue(loginResponse("abc123"));
        server.enqueue(json(PAGE_ONE)
                .setHeader("X-RateLimit-Limit", "100")
                .setHeader("X-RateLimit-Remaining", "42")
                .setHeader("X-RateLimit-Reset", String.valueOf(Instant.parse("2025-06-01T12:05:00Z").getEpochSecond())));

        // Act
        adapter.fetchPage(SyncOptions.defaults(), 1).block(Duration.ofSeconds(5));

        // Assert
        StepVerifier.create(adapter.getRateLimitStatus())
                .assertNext(status -> {
                    assertThat(status.getLimit()).isEqualTo(100);
                    assertThat(status.getRemaining()).isEqualTo(42);
                    assertThat(status.getResetTime()).isEqualTo(LocalDateTime.of(2025, 6, 1, 12, 5));
                })
                .verifyComplete();
    }

    @Test
    void sessionToken_ReadsFirstCookieSegment() {
        assertThat(RetsProviderAdapter.sessionToken("RETS-Session=abc; Path=/; HttpOnly")).isEqualTo("abc");
        assertThat(RetsProviderAdapter.sessionToken("")).isEmpty();
        assertThat(RetsProviderAdapter.sessionToken(null)).isEmpty();
    }

    private static MockResponse loginResponse(String session) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Set-Cookie", "RETS-Session=" + session + "; Path=/");
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
