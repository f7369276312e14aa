package com.egg.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Diagnostic view of the idea linked to an event. {@code idea} is null when none exists.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkedIdeaResponse {

    private UUID eventId;

    private LinkedIdea idea;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LinkedIdea {
        private UUID id;

        /** True while the pipeline has not filled in a title or content. */
        @JsonProperty("isPlaceholder")
        private boolean placeholder;

        private String title;
        private String content;
        private String screenRecordingUrl;
        private String recordingUrl;
        private String audioUrl;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
    }
}
