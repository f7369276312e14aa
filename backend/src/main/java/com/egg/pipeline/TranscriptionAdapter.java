package com.egg.pipeline;

import com.egg.exception.TranscriptionException;

/**
 * Speech-to-text over a media reference (a URL the client uploaded to).
 */
public interface TranscriptionAdapter {

    /**
     * @param mediaRef audio or video URL
     * @return the non-blank transcript
     * @throws TranscriptionException if the media cannot be read or transcribed
     */
    String transcribe(String mediaRef) throws TranscriptionException;
}
