package com.egg.service;

import com.egg.exception.ExtractionException;
import com.egg.pipeline.ExtractedEntry;
import com.egg.pipeline.ExtractedEntry.Kind;
import com.egg.pipeline.InferenceMode;
import com.egg.pipeline.TranscriptInput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GeminiExtractionService.
 *
 * Tests the model output handling including:
 * - Parsing of the items schema into eggbook entries
 * - Markdown code fence tolerance
 * - Provider error classification (transient vs permanent)
 */
@DisplayName("GeminiExtractionService Unit Tests")
class GeminiExtractionServiceTest {

    private ChatClient geminiClient;
    private GeminiExtractionService extractionService;

    @BeforeEach
    void setUp() {
        geminiClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        extractionService = new GeminiExtractionService(geminiClient, new ObjectMapper());
    }

    @Test
    @DisplayName("parseEntries should map every non-empty field to an entry")
    void testParseEntries_AllKinds() {
        // Arrange
        UUID eventId = UUID.randomUUID();
        String json = """
                {"items": [{
                  "source_event_ids": ["%s", "not-a-uuid"],
                  "scrolling_idea_title": "Garden planner",
                  "scrolling_idea_detail": "An app that tracks watering",
                  "todo_item": "Call Alex tomorrow",
                  "alert": "Rent due Friday",
                  "comment": "Good energy today"
                }]}
                """.formatted(eventId);

        // Act
        List<ExtractedEntry> entries = extractionService.parseEntries(json);

        // Assert
        assertEquals(4, entries.size());
        assertEquals(new ExtractedEntry(Kind.IDEA, "Garden planner", "An app that tracks watering", List.of(eventId)),
                entries.get(0));
        assertEquals(new ExtractedEntry(Kind.TODO, "Call Alex tomorrow", null, List.of(eventId)), entries.get(1));
        assertEquals(Kind.NOTIFICATION, entries.get(2).kind());
        assertEquals("Rent due Friday", entries.get(2).title());
        assertEquals(Kind.COMMENT, entries.get(3).kind());
        assertEquals("Good energy today", entries.get(3).content());
    }

    @Test
    @DisplayName("parseEntries should skip empty fields and accept a root array")
    void testParseEntries_RootArrayAndEmptyFields() {
        // Arrange
        String json = """
                [{"scrolling_idea_title": "", "scrolling_idea_detail": "", "todo_item": "Buy milk",
                  "alert": "", "comment": null}]
                """;

        // Act
        List<ExtractedEntry> entries = extractionService.parseEntries(json);

        // Assert
        assertEquals(1, entries.size());
        assertEquals(Kind.TODO, entries.get(0).kind());
        assertTrue(entries.get(0).sourceEventIds().isEmpty());
    }

    @Test
    @DisplayName("idea with only a title should use the title as content")
    void testParseEntries_IdeaTitleOnly() {
        // Act
        List<ExtractedEntry> entries = extractionService.parseEntries(
                "{\"items\": [{\"scrolling_idea_title\": \"Podcast about tools\"}]}");

        // Assert
        assertEquals("Podcast about tools", entries.get(0).content());
    }

    @Test
    @DisplayName("parseEntries should reject malformed JSON as a permanent failure")
    void testParseEntries_MalformedJson() {
        // Act
        ExtractionException exception = assertThrows(ExtractionException.class,
                () -> extractionService.parseEntries("Sure! Here are your items:"));

        // Assert
        assertEquals("INVALID_JSON", exception.getErrorCode());
        assertFalse(exception.isTransient());
    }

    @Test
    @DisplayName("parseEntries should reject an object without items")
    void testParseEntries_MissingItems() {
        // Act & Assert
        assertThrows(ExtractionException.class, () -> extractionService.parseEntries("{\"result\": []}"));
    }

    @Test
    @DisplayName("stripCodeFences should remove markdown fences and the json label")
    void testStripCodeFences() {
        // Act & Assert
        assertEquals("{\"items\": []}", GeminiExtractionService.stripCodeFences("```json\n{\"items\": []}\n```"));
        assertEquals("[]", GeminiExtractionService.stripCodeFences("```\n[]\n```"));
        assertEquals("{\"a\": 1}", GeminiExtractionService.stripCodeFences("json {\"a\": 1}"));
        assertEquals("{\"items\": []}", GeminiExtractionService.stripCodeFences("  {\"items\": []}  "));
    }

    @Test
    @DisplayName("classify should map 429 to a transient rate limit")
    void testClassify_RateLimited() {
        // Act
        ExtractionException exception = GeminiExtractionService.classify(
                new NonTransientAiException("429 - Resource has been exhausted"));

        // Assert
        assertEquals("RATE_LIMITED", exception.getErrorCode());
        assertTrue(exception.isTransient());
    }

    @Test
    @DisplayName("classify should treat 5xx and I/O errors as transient")
    void testClassify_Transient() {
        // Act & Assert
        assertTrue(GeminiExtractionService.classify(new TransientAiException("503 - overloaded")).isTransient());
        assertTrue(GeminiExtractionService.classify(new ResourceAccessException("connection reset")).isTransient());
    }

    @Test
    @DisplayName("classify should treat 400 and unknown errors as permanent")
    void testClassify_Permanent() {
        // Act
        ExtractionException badRequest = GeminiExtractionService.classify(
                new NonTransientAiException("400 - API key not valid"));
        ExtractionException unknown = GeminiExtractionService.classify(new IllegalStateException("boom"));

        // Assert
        assertEquals("MODEL_REJECTED", badRequest.getErrorCode());
        assertFalse(badRequest.isTransient());
        assertFalse(unknown.isTransient());
    }

    @Test
    @DisplayName("extract should call the model once and parse its fenced output")
    void testExtract_CallsModel() {
        // Arrange
        UUID eventId = UUID.randomUUID();
        when(geminiClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenReturn("```json\n{\"items\": [{\"todo_item\": \"Call Alex tomorrow\", \"source_event_ids\": [\""
                        + eventId + "\"]}]}\n```");

        // Act
        List<ExtractedEntry> entries = extractionService.extract(
                List.of(new TranscriptInput(eventId, LocalDateTime.now(), "call Alex tomorrow")),
                InferenceMode.SINGLE);

        // Assert
        assertEquals(1, entries.size());
        assertEquals(List.of(eventId), entries.get(0).sourceEventIds());
    }

    @Test
    @DisplayName("extract should reject an empty model response")
    void testExtract_EmptyResponse() {
        // Arrange
        when(geminiClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn("  ");

        // Act & Assert
        assertThrows(ExtractionException.class, () -> extractionService.extract(
                List.of(new TranscriptInput(UUID.randomUUID(), LocalDateTime.now(), "text")),
                InferenceMode.BATCH));
    }
}
