package com.egg.service;

import com.egg.entity.EggbookIdea;
import com.egg.entity.EggbookNotification;
import com.egg.entity.EggbookTodo;
import com.egg.exception.ExtractionException;
import com.egg.pipeline.CommentGenerationAdapter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily comment generation with Gemini.
 *
 * Sends the day's ideas, todos and alerts and expects:
 * <pre>
 * {"my_egg_comment": "...", "egg_community_comment": [{"egg_name": "...", "egg_comment": "..."}]}
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GeminiCommentService implements CommentGenerationAdapter {

    private final ChatClient geminiClient;
    private final ObjectMapper objectMapper;

    private static final String SYSTEM_PROMPT = """
            You summarize a user's day for two channels based on generated ideas/todos/alerts.
            Task:
            1) Write one personal reflection comment.
            2) Write community-style comments with egg personas.
            3) Return strict JSON only, no markdown.
            Schema:
            {
              "my_egg_comment": "string",
              "egg_community_comment": [
                {
                  "egg_name": "string",
                  "egg_comment": "string"
                }
              ]
            }
            Field meanings and rules:
            - my_egg_comment: one direct summary for the user, supportive and specific, based on today's signals.
            - egg_community_comment: list of community voices.
            - egg_name: name of the persona speaking (e.g., Focus Egg, Health Egg).
            - egg_comment: what that persona says; must be relevant, concise, and actionable.
            - Keep each comment short (1-2 sentences).
            - Do not include harmful, medical, legal, or financial claims.
            - If there is little signal, still provide gentle, neutral comments without fabricating details.
            """;

    @Override
    public DailyComments generate(List<EggbookIdea> ideas, List<EggbookTodo> todos, List<EggbookNotification> alerts) {
        log.info("Generating daily comments: ideas={}, todos={}, alerts={}", ideas.size(), todos.size(), alerts.size());

        String content;
        try {
            content = geminiClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user("Input JSON:\n" + buildPayload(ideas, todos, alerts))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw GeminiExtractionService.classify(e);
        }

        if (content == null || content.isBlank()) {
            throw ExtractionException.invalidResponse("empty comments response", null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(GeminiExtractionService.stripCodeFences(content));
        } catch (JsonProcessingException e) {
            throw ExtractionException.invalidResponse("malformed comments JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw ExtractionException.invalidResponse("comments response is not an object", null);
        }

        List<CommunityComment> community = new ArrayList<>();
        JsonNode voices = root.path("egg_community_comment");
        if (voices.isArray()) {
            for (JsonNode voice : voices) {
                community.add(new CommunityComment(
                        voice.path("egg_name").asText("").trim(),
                        voice.path("egg_comment").asText("").trim()));
            }
        }

        return new DailyComments(root.path("my_egg_comment").asText(""), community);
    }

    private String buildPayload(List<EggbookIdea> ideas, List<EggbookTodo> todos, List<EggbookNotification> alerts) {
        ObjectNode payload = objectMapper.createObjectNode();

        ArrayNode ideaNodes = payload.putArray("ideas");
        ideas.forEach(idea -> ideaNodes.addObject()
                .put("title", idea.getTitle())
                .put("detail", idea.getContent())
                .put("created_at", iso(idea.getCreatedAt())));

        ArrayNode todoNodes = payload.putArray("todos");
        todos.forEach(todo -> todoNodes.addObject()
                .put("title", todo.getTitle())
                .put("isAccepted", todo.isAccepted())
                .put("updated_at", iso(todo.getUpdatedAt())));

        ArrayNode alertNodes = payload.putArray("alerts");
        alerts.forEach(alert -> alertNodes.addObject()
                .put("alert", alert.getTitle())
                .put("notify_at", iso(alert.getNotifyAt())));

        return payload.toString();
    }

    private static String iso(LocalDateTime value) {
        return value != null ? value.toString() : null;
    }
}
