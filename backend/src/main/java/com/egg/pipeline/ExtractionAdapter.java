package com.egg.pipeline;

import com.egg.exception.ExtractionException;

import java.util.List;

/**
 * Turns event transcripts into eggbook entries with a generative model.
 *
 * Implementations perform exactly one model call per invocation; retries, backoff and the
 * per-attempt timeout are applied by {@link ExtractionRetryExecutor}.
 */
public interface ExtractionAdapter {

    /**
     * @param inputs one transcript per event, ordered by event time
     * @param mode SINGLE for one event, BATCH for a drained batch window
     * @return extracted entries, possibly empty
     * @throws ExtractionException transient or permanent model failure
     */
    List<ExtractedEntry> extract(List<TranscriptInput> inputs, InferenceMode mode) throws ExtractionException;
}
