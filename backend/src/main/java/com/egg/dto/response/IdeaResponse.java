package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdeaResponse {

    private UUID id;

    private UUID sourceEventId;

    private String title;

    private String content;

    private String screenRecordingUrl;

    private String recordingUrl;

    private String audioUrl;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
