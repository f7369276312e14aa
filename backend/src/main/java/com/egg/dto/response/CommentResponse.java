package com.egg.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

    private UUID id;

    private UUID sourceEventId;

    private String content;

    private String eggName;

    private String eggComment;

    private LocalDate date;

    @JsonProperty("isCommunity")
    private boolean community;

    private LocalDateTime createdAt;
}
