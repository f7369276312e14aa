package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Notification time for a todo, also used to reschedule a notification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotNull(message = "notify_at is required")
    @JsonProperty("notify_at")
    private LocalDateTime notifyAt;
}
