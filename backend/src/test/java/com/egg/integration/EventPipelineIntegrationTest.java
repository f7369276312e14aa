package com.egg.integration;

import com.egg.dto.request.DeviceRequest;
import com.egg.dto.request.EventCreateRequest;
import com.egg.dto.response.AuthResponse;
import com.egg.dto.response.EventResponse;
import com.egg.dto.response.EventStatusResponse;
import com.egg.exception.ExtractionException;
import com.egg.pipeline.ExtractedEntry;
import com.egg.pipeline.ExtractionAdapter;
import com.egg.pipeline.InferenceMode;
import com.egg.pipeline.TranscriptInput;
import com.egg.pipeline.TranscriptionAdapter;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end test of the event pipeline against real PostgreSQL, Redis and RabbitMQ.
 *
 * Flow:
 * 1. Anonymous sign-in (JWT)
 * 2. Device registration
 * 3. Event ingestion with a screen recording
 * 4. Dispatch over RabbitMQ, the Redis cooldown gate, transcription and extraction
 *    (model adapters mocked)
 * 5. Event reaches "processed" and the eggbook holds the extracted todo
 *
 * Skipped when Docker is not available.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "app.pipeline.user-cooldown-sec=0",
                "app.pipeline.cooldown-store=redis",
                "app.pipeline.sweep-interval-ms=600000"
        }
)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Event Pipeline Integration Tests")
class EventPipelineIntegrationTest {

    private static final long PIPELINE_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(30);

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("egg_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    @SuppressWarnings("rawtypes")
    static GenericContainer redisContainer = new GenericContainer("redis:7-alpine")
            .withExposedPorts(6379);

    @Container
    static RabbitMQContainer rabbitMQContainer = new RabbitMQContainer(
            DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("spring.datasource.username", postgresContainer::getUsername);
        registry.add("spring.datasource.password", postgresContainer::getPassword);
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
        registry.add("spring.rabbitmq.host", rabbitMQContainer::getHost);
        registry.add("spring.rabbitmq.port", rabbitMQContainer::getAmqpPort);
        registry.add("spring.rabbitmq.username", rabbitMQContainer::getAdminUsername);
        registry.add("spring.rabbitmq.password", rabbitMQContainer::getAdminPassword);
    }

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @MockitoBean
    private TranscriptionAdapter transcriptionAdapter;

    @MockitoBean
    private ExtractionAdapter extractionAdapter;

    private String baseUrl;
    private String jwtToken;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port;
        jwtToken = signInAnonymously();
    }

    @Test
    @DisplayName("Screen recording event is transcribed, extracted and written to the eggbook")
    void screenRecordingEvent_processedEndToEnd() throws Exception {
        // Arrange
        when(transcriptionAdapter.transcribe("https://cdn.example.com/rec-1.mp4"))
                .thenReturn("remind me to call Alex tomorrow");
        when(extractionAdapter.extract(anyList(), eq(InferenceMode.SINGLE))).thenAnswer(invocation -> {
            List<TranscriptInput> inputs = invocation.getArgument(0);
            UUID eventId = inputs.get(0).eventId();
            return List.of(new ExtractedEntry(ExtractedEntry.Kind.TODO, "Call Alex", null, List.of(eventId)));
        });

        registerDevice(jwtToken, "device-1");

        EventCreateRequest request = new EventCreateRequest();
        request.setDeviceId("device-1");
        request.setScreenRecordingUrl("https://cdn.example.com/rec-1.mp4");
        request.setDurationSec(42.0);
        request.setEventAt(LocalDateTime.now(ZoneOffset.UTC).minusMinutes(1));

        // Act
        ResponseEntity<EventResponse> created = restTemplate.exchange(
                baseUrl + "/v1/events",
                HttpMethod.POST,
                new HttpEntity<>(request, authHeaders(jwtToken)),
                EventResponse.class
        );

        // Assert
        assertEquals(HttpStatus.OK, created.getStatusCode());
        assertNotNull(created.getBody());
        UUID eventId = created.getBody().getEventId();
        assertEquals(42L, created.getBody().getDurationSec());

        assertEquals("processed", awaitTerminalStatus(eventId));

        ResponseEntity<EventResponse> event = restTemplate.exchange(
                baseUrl + "/v1/events/" + eventId,
                HttpMethod.GET,
                new HttpEntity<>(authHeaders(jwtToken)),
                EventResponse.class
        );
        assertEquals("remind me to call Alex tomorrow", event.getBody().getTranscript());

        ResponseEntity<JsonNode> todos = restTemplate.exchange(
                baseUrl + "/v1/eggbook/todos",
                HttpMethod.GET,
                new HttpEntity<>(authHeaders(jwtToken)),
                JsonNode.class
        );
        assertEquals(HttpStatus.OK, todos.getStatusCode());
        JsonNode items = todos.getBody().get("items");
        assertEquals(1, items.size());
        assertEquals("Call Alex", items.get(0).get("title").asText());
        assertEquals(eventId.toString(), items.get(0).get("sourceEventId").asText());
        assertFalse(items.get(0).get("isAccepted").asBoolean());
    }

    @Test
    @DisplayName("Extraction failure marks the event failed and keeps the transcript")
    void extractionFailure_marksEventFailed() throws Exception {
        // Arrange
        when(transcriptionAdapter.transcribe(anyString())).thenReturn("buy milk");
        when(extractionAdapter.extract(anyList(), any()))
                .thenThrow(ExtractionException.invalidResponse("not json", null));

        registerDevice(jwtToken, "device-2");

        EventCreateRequest request = new EventCreateRequest();
        request.setDeviceId("device-2");
        request.setScreenRecordingUrl("https://cdn.example.com/rec-2.mp4");

        // Act
        ResponseEntity<EventResponse> created = restTemplate.exchange(
                baseUrl + "/v1/events",
                HttpMethod.POST,
                new HttpEntity<>(request, authHeaders(jwtToken)),
                EventResponse.class
        );

        // Assert
        UUID eventId = created.getBody().getEventId();
        assertEquals("failed", awaitTerminalStatus(eventId));

        ResponseEntity<EventResponse> event = restTemplate.exchange(
                baseUrl + "/v1/events/" + eventId,
                HttpMethod.GET,
                new HttpEntity<>(authHeaders(jwtToken)),
                EventResponse.class
        );
        assertEquals("buy milk", event.getBody().getTranscript());
    }

    @Test
    @DisplayName("Another user's event is reported as not found")
    void foreignEvent_returnsNotFound() {
        // Arrange
        registerDevice(jwtToken, "device-3");

        EventCreateRequest request = new EventCreateRequest();
        request.setDeviceId("device-3");
        request.setAudioUrl("https://cdn.example.com/audio-3.m4a");
        when(transcriptionAdapter.transcribe(anyString())).thenReturn("short note");

        ResponseEntity<EventResponse> created = restTemplate.exchange(
                baseUrl + "/v1/events",
                HttpMethod.POST,
                new HttpEntity<>(request, authHeaders(jwtToken)),
                EventResponse.class
        );
        UUID eventId = created.getBody().getEventId();

        String otherToken = signInAnonymously();

        // Act
        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/v1/events/" + eventId + "/status",
                HttpMethod.GET,
                new HttpEntity<>(authHeaders(otherToken)),
                String.class
        );

        // Assert
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    @DisplayName("Device linked to another user is rejected with 409")
    void deviceOwnedByAnotherUser_returnsConflict() {
        // Arrange
        registerDevice(jwtToken, "shared-device");
        String otherToken = signInAnonymously();

        // Act
        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/v1/devices",
                HttpMethod.POST,
                new HttpEntity<>(new DeviceRequest("shared-device", "Pixel", "android", "en", "UTC"),
                        authHeaders(otherToken)),
                String.class
        );

        // Assert
        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    }

    @Test
    @DisplayName("Requests without a token are rejected")
    void missingToken_isRejected() {
        // Act
        ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/v1/eggbook/todos", String.class);

        // Assert
        assertTrue(response.getStatusCode().is4xxClientError());
    }

    private String signInAnonymously() {
        ResponseEntity<AuthResponse> response = restTemplate.postForEntity(
                baseUrl + "/v1/auth/anonymous", null, AuthResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody().getToken());
        return response.getBody().getToken();
    }

    private void registerDevice(String token, String deviceId) {
        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/v1/devices",
                HttpMethod.POST,
                new HttpEntity<>(new DeviceRequest(deviceId, "Pixel", "android", "en", "UTC"), authHeaders(token)),
                String.class
        );
        assertEquals(HttpStatus.OK, response.getStatusCode());
    }

    private String awaitTerminalStatus(UUID eventId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + PIPELINE_TIMEOUT_MS;
        String status = null;
        while (System.currentTimeMillis() < deadline) {
            ResponseEntity<EventStatusResponse> response = restTemplate.exchange(
                    baseUrl + "/v1/events/" + eventId + "/status",
                    HttpMethod.GET,
                    new HttpEntity<>(authHeaders(jwtToken)),
                    EventStatusResponse.class
            );
            status = response.getBody().getStatus();
            if ("processed".equals(status) || "failed".equals(status)) {
                return status;
            }
            Thread.sleep(250);
        }
        fail("Event " + eventId + " did not finish in time, last status: " + status);
        return status;
    }

    private HttpHeaders authHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(token);
        return headers;
    }
}
