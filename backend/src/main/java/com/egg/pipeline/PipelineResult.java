package com.egg.pipeline;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one scheduler invocation or orchestrator run.
 *
 * @param processed events that reached PROCESSED in this run
 * @param failed events that reached FAILED in this run
 * @param skipped events that were not claimed or were changed concurrently
 * @param entriesCreated eggbook rows inserted
 * @param deferred true when the cooldown gate denied the run (work stays pending)
 */
public record PipelineResult(List<UUID> processed,
                             List<UUID> failed,
                             List<UUID> skipped,
                             int entriesCreated,
                             boolean deferred) {

    public PipelineResult {
        processed = List.copyOf(processed);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }

    public static PipelineResult empty() {
        return new PipelineResult(List.of(), List.of(), List.of(), 0, false);
    }

    public static PipelineResult deferredRun() {
        return new PipelineResult(List.of(), List.of(), List.of(), 0, true);
    }

    public boolean hasProcessed() {
        return !processed.isEmpty();
    }
}
