package com.egg.service;

import com.egg.exception.ExtractionException;
import com.egg.pipeline.ExtractedEntry;
import com.egg.pipeline.ExtractedEntry.Kind;
import com.egg.pipeline.ExtractionAdapter;
import com.egg.pipeline.InferenceMode;
import com.egg.pipeline.TranscriptInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Extraction adapter backed by Gemini (OpenAI-compatible chat completions).
 *
 * The model receives the ordered transcripts and returns strict JSON:
 * <pre>
 * {"items": [{"source_event_ids": ["..."], "scrolling_idea_title": "...",
 *             "scrolling_idea_detail": "...", "todo_item": "...", "alert": "...", "comment": "..."}]}
 * </pre>
 * One item can yield up to four entries: an IDEA (title and/or detail), a TODO, a NOTIFICATION
 * (alert) and a COMMENT. Empty fields yield nothing.
 *
 * Error Handling:
 * - HTTP 429: transient RATE_LIMITED
 * - HTTP 408/500/502/503/504, I/O errors, timeouts: transient MODEL_UNAVAILABLE
 * - other provider errors: permanent MODEL_REJECTED
 * - empty or malformed output: permanent INVALID_JSON
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GeminiExtractionService implements ExtractionAdapter {

    private final ChatClient geminiClient;
    private final ObjectMapper objectMapper;

    private static final String OUTPUT_SCHEMA = """
            Output JSON schema:
            {
              "items": [
                {
                  "source_event_ids": ["event_id of every input event this item is based on"],
                  "scrolling_idea_title": "string",
                  "scrolling_idea_detail": "string",
                  "todo_item": "string",
                  "alert": "string",
                  "comment": "string"
                }
              ]
            }
            """;

    private static final String SINGLE_PROMPT = """
            You are an assistant that extracts actionable productivity signals from ONE user event.
            Task:
            1) Read the event content.
            2) Decide what should become idea/todo/alert/comment outputs.
            3) Return strict JSON only, no markdown.
            """ + OUTPUT_SCHEMA + """
            Field meanings and rules:
            - source_event_ids: the event_id of the input event.
            - scrolling_idea_title: short headline for a potentially valuable idea from this event.
            - scrolling_idea_detail: concise explanation of that idea; include context and intent.
            - todo_item: one concrete, executable next action; keep imperative and specific.
            - alert: important risk/reminder/deadline to surface prominently.
            - comment: a short personal reflection on the event, only if it carries one.
            - If a field has no meaningful content, use empty string.
            - You may output multiple items if the event contains multiple independent thoughts.
            - Preserve original language tone when possible.
            """;

    private static final String BATCH_PROMPT = """
            You are an assistant that extracts actionable productivity signals from MULTIPLE user events.
            Task:
            1) Read all events as one context window, in the given order.
            2) Merge duplicates and cluster related points.
            3) Return strict JSON only, no markdown.
            """ + OUTPUT_SCHEMA + """
            Field meanings and rules:
            - source_event_ids: event_id values of the input events the item is based on, most relevant first.
            - scrolling_idea_title: short headline for a synthesized idea across events.
            - scrolling_idea_detail: compact detail that combines relevant evidence from the event set.
            - todo_item: concrete next action derived from the strongest actionable signal.
            - alert: urgent caution, conflict, or time-sensitive reminder detected in the batch.
            - comment: a short personal reflection, only if the events carry one.
            - If a field has no meaningful content, use empty string.
            - Prefer fewer, higher-quality items instead of repeating similar items.
            - Do not invent facts that are not grounded in the input events.
            """;

    @Override
    public List<ExtractedEntry> extract(List<TranscriptInput> inputs, InferenceMode mode) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("Extraction needs at least one transcript");
        }

        log.info("Starting extraction: mode={}, events={}", mode, inputs.size());

        String content;
        try {
            content = geminiClient.prompt()
                    .system(mode == InferenceMode.SINGLE ? SINGLE_PROMPT : BATCH_PROMPT)
                    .user(buildUserPrompt(inputs, mode))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw classify(e);
        }

        if (content == null || content.trim().isEmpty()) {
            log.warn("Gemini returned empty extraction response: mode={}", mode);
            throw ExtractionException.invalidResponse("empty response", null);
        }
        log.debug("Raw extraction response: {}", content);

        List<ExtractedEntry> entries = parseEntries(content);
        log.info("Extraction completed: mode={}, events={}, entries={}", mode, inputs.size(), entries.size());
        return entries;
    }

    /**
     * Parse model output into entries. Markdown code fences are tolerated.
     *
     * @throws ExtractionException permanent INVALID_JSON if the output is not the expected shape
     */
    List<ExtractedEntry> parseEntries(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(content));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse extraction response: {}", e.getOriginalMessage());
            throw ExtractionException.invalidResponse("malformed JSON", e);
        }

        JsonNode items = root != null && root.isArray() ? root : (root == null ? null : root.get("items"));
        if (items == null || !items.isArray()) {
            throw ExtractionException.invalidResponse("missing 'items' array", null);
        }

        List<ExtractedEntry> entries = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            List<UUID> sources = sourceEventIds(item);
            String ideaTitle = text(item, "scrolling_idea_title");
            String ideaDetail = text(item, "scrolling_idea_detail");
            String todo = text(item, "todo_item");
            String alert = text(item, "alert");
            String comment = text(item, "comment");

            if (!ideaTitle.isEmpty() || !ideaDetail.isEmpty()) {
                entries.add(new ExtractedEntry(Kind.IDEA,
                        ideaTitle.isEmpty() ? null : ideaTitle,
                        ideaDetail.isEmpty() ? ideaTitle : ideaDetail,
                        sources));
            }
            if (!todo.isEmpty()) {
                entries.add(new ExtractedEntry(Kind.TODO, todo, null, sources));
            }
            if (!alert.isEmpty()) {
                entries.add(new ExtractedEntry(Kind.NOTIFICATION, alert, null, sources));
            }
            if (!comment.isEmpty()) {
                entries.add(new ExtractedEntry(Kind.COMMENT, null, comment, sources));
            }
        }
        return entries;
    }

    static String stripCodeFences(String content) {
        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline >= 0 ? cleaned.substring(firstNewline + 1) : cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        if (cleaned.regionMatches(true, 0, "json", 0, 4)) {
            String rest = cleaned.substring(4).trim();
            if (rest.startsWith("{") || rest.startsWith("[")) {
                cleaned = rest;
            }
        }
        return cleaned;
    }

    static ExtractionException classify(RuntimeException error) {
        Integer status = AiFailureClassifier.httpStatus(error);
        if (status != null && status == 429) {
            log.warn("Gemini rate limit hit: {}", error.getMessage());
            return ExtractionException.rateLimited(error);
        }
        if (AiFailureClassifier.isTransient(error)) {
            log.warn("Gemini call failed transiently: {}", error.getMessage());
            return ExtractionException.unavailable(String.valueOf(error.getMessage()), error);
        }
        log.error("Gemini call rejected: {}", error.getMessage());
        return ExtractionException.rejected(String.valueOf(error.getMessage()), error);
    }

    private String buildUserPrompt(List<TranscriptInput> inputs, InferenceMode mode) {
        ArrayNode events = objectMapper.createArrayNode();
        for (TranscriptInput input : inputs) {
            ObjectNode event = events.addObject();
            event.put("event_id", input.eventId().toString());
            event.put("event_at", input.eventAt() != null ? input.eventAt().toString() : null);
            event.put("transcript", input.transcript());
        }
        String label = mode == InferenceMode.SINGLE ? "Input event JSON:" : "Input events JSON:";
        return label + "\n" + events;
    }

    private List<UUID> sourceEventIds(JsonNode item) {
        List<UUID> ids = new ArrayList<>();
        JsonNode sources = item.get("source_event_ids");
        if (sources != null && sources.isArray()) {
            sources.forEach(node -> addId(ids, node.asText()));
        }
        JsonNode single = item.get("source_event_id");
        if (single != null && single.isTextual()) {
            addId(ids, single.asText());
        }
        return ids;
    }

    private void addId(List<UUID> ids, String raw) {
        try {
            UUID id = UUID.fromString(raw.trim());
            if (!ids.contains(id)) {
                ids.add(id);
            }
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown source event id: {}", raw);
        }
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        return value == null || value.isNull() ? "" : value.asText("").trim();
    }
}
