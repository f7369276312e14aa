package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Manual comment. A community comment takes its text from {@code egg_comment}
 * when present, otherwise from {@code content}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentCreateRequest {

    private String content;

    @JsonProperty("egg_name")
    private String eggName;

    @JsonProperty("egg_comment")
    private String eggComment;

    private LocalDate date;

    @JsonProperty("isCommunity")
    private Boolean community;
}
