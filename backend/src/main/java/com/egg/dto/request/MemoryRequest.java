package com.egg.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRequest {

    @NotBlank(message = "type is required")
    @Size(max = 64, message = "type must be at most 64 characters")
    private String type;

    @NotBlank(message = "content is required")
    private String content;

    @NotNull(message = "importance is required")
    private Double importance;
}
