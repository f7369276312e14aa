package com.egg.config;

import com.egg.pipeline.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the aggregation and inference pipeline.
 *
 * Provides the collaborators that the pipeline components take as explicit
 * dependencies instead of reaching for globals:
 * - Clock: UTC system clock (tests inject a fixed or mutable clock)
 * - Sleeper: backoff pause between extraction and transcription attempts
 * - extractionExecutor: runs each extraction attempt so it can be bounded by
 *   GEMINI_REQUEST_TIMEOUT_SEC
 *
 * Scheduling is enabled here for the recovery sweep.
 *
 * @see com.egg.pipeline.PipelineSweeper
 * @see com.egg.pipeline.ExtractionRetryExecutor
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
@Slf4j
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "extraction-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Configuring extraction executor (cached, daemon threads)");
        return Executors.newCachedThreadPool(threadFactory);
    }
}
