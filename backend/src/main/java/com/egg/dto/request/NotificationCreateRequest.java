package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationCreateRequest {

    @NotBlank(message = "title is required")
    private String title;

    @NotNull(message = "notify_at is required")
    @JsonProperty("notify_at")
    private LocalDateTime notifyAt;

    @JsonProperty("todo_id")
    private UUID todoId;
}
