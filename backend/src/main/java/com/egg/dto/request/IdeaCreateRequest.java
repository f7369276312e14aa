package com.egg.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdeaCreateRequest {

    private String title;

    @NotBlank(message = "content is required")
    private String content;
}
