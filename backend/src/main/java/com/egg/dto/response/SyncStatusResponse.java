package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Polling endpoint payload: whether the pipeline still has work for the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatusResponse {

    private String status;

    private LocalDateTime lastSyncAt;

    private boolean processing;

    private boolean hasUpdates;

    private long pendingEvents;
}
