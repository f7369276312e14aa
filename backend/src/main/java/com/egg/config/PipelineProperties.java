package com.egg.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the event aggregation and AI inference pipeline.
 *
 * Every key is bound from an environment-style variable in application.yml
 * (AI_USER_COOLDOWN_SEC, AUDIO_BATCH_TRIGGER_COUNT, ...). Defaults match the
 * values used when the variable is absent.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /** Minimum seconds between AI run attempts for one user. */
    @Min(0)
    private long userCooldownSec = 8;

    /** Batch window flush size threshold. */
    @Min(1)
    private int batchTriggerCount = 5;

    /** Batch window flush age threshold, in hours (fractions allowed). */
    @DecimalMin("0.0")
    private double batchMaxWaitHours = 12.0;

    /** Maximum number of events drained into a single pipeline run. */
    @Min(1)
    private int maxEventsPerRun = 20;

    /** Per-attempt extraction timeout. */
    @Min(1)
    private long requestTimeoutSec = 60;

    /** Maximum extraction attempts, first call included. */
    @Min(1)
    private int retryMaxAttempts = 4;

    /** Initial backoff delay, doubled after every failed attempt. */
    @DecimalMin("0.0")
    private double retryBaseDelaySec = 1.0;

    /** Age after which an event stuck in transcribing is requeued as pending. */
    @Min(1)
    private long transcribingGraceMinutes = 15;

    @Min(1000)
    private long sweepIntervalMs = 60_000;

    /** Cooldown gate backend: "memory" or "redis". */
    @NotBlank
    private String cooldownStore = "memory";

    /** Active seconds of input needed before daily comments are generated automatically. */
    @Min(0)
    private long commentAutoMinActiveSec = 3600;

    @Min(1)
    private int commentKeepDays = 7;

    private boolean debugEnabled = false;

    public Duration userCooldown() {
        return Duration.ofSeconds(userCooldownSec);
    }

    public Duration batchMaxWait() {
        return Duration.ofMillis(Math.round(batchMaxWaitHours * 3_600_000d));
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSec);
    }

    public Duration retryBaseDelay() {
        return Duration.ofMillis(Math.round(retryBaseDelaySec * 1000d));
    }

    public Duration transcribingGrace() {
        return Duration.ofMinutes(transcribingGraceMinutes);
    }
}
