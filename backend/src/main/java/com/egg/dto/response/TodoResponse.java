package com.egg.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class TodoResponse {

    private UUID id;

    private UUID sourceEventId;

    private String title;

    @JsonProperty("isAccepted")
    private boolean accepted;

    @JsonProperty("isPinned")
    private boolean pinned;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
