package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Daily comment generation state for one day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentGenerationResponse {

    private String date;

    private String status;

    private boolean hasInput;

    private long activeDurationSec;

    private boolean canManualTrigger;

    private String errorMessage;
}
