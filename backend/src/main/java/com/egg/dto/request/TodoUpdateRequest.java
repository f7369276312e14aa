package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TodoUpdateRequest {

    private String title;

    @JsonProperty("isAccepted")
    private Boolean accepted;

    @JsonProperty("isPinned")
    private Boolean pinned;
}
