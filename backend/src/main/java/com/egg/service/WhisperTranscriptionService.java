package com.egg.service;

import com.egg.exception.TranscriptionException;
import com.egg.pipeline.TranscriptionAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.audio.transcription.AudioTranscriptionPrompt;
import org.springframework.ai.openai.OpenAiAudioTranscriptionModel;
import org.springframework.ai.openai.OpenAiAudioTranscriptionOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Speech-to-text through the OpenAI audio transcription API (Whisper).
 *
 * Media references are http or https URLs the client uploaded to; any other scheme is
 * rejected, so a reference can never point the server at its own files. Media of known
 * length is streamed straight into the multipart request; nothing is stored locally.
 *
 * Error Handling:
 * - malformed or non-http reference, missing media: permanent INVALID_MEDIA
 * - media above app.ai.transcription.max-audio-bytes: permanent MEDIA_TOO_LARGE
 * - empty model output: permanent EMPTY_TRANSCRIPTION
 * - provider errors: STT_UNAVAILABLE (transient) or STT_REJECTED (permanent),
 *   see {@link AiFailureClassifier}
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WhisperTranscriptionService implements TranscriptionAdapter {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final OpenAiAudioTranscriptionModel transcriptionModel;

    @Value("${app.ai.transcription.language:}")
    private String defaultLanguage;

    @Value("${app.ai.transcription.prompt:}")
    private String transcriptionPrompt;

    @Value("${app.ai.transcription.max-audio-bytes:10485760}")
    private long maxAudioBytes;

    @Override
    public String transcribe(String mediaRef) {
        if (mediaRef == null || mediaRef.isBlank()) {
            throw TranscriptionException.invalidMedia(String.valueOf(mediaRef), null);
        }

        log.info("Starting transcription: mediaRef={}", mediaRef);
        Resource media = openMedia(mediaRef);

        OpenAiAudioTranscriptionOptions.Builder optionsBuilder = OpenAiAudioTranscriptionOptions.builder();
        if (defaultLanguage != null && !defaultLanguage.isBlank()) {
            optionsBuilder.language(defaultLanguage);
        }
        if (transcriptionPrompt != null && !transcriptionPrompt.isBlank()) {
            optionsBuilder.prompt(transcriptionPrompt);
        }

        String transcription;
        try {
            transcription = transcriptionModel
                    .call(new AudioTranscriptionPrompt(media, optionsBuilder.build()))
                    .getResult()
                    .getOutput();
        } catch (RuntimeException e) {
            boolean transientFailure = AiFailureClassifier.isTransient(e);
            log.error("Transcription call failed: mediaRef={}, transient={}, error={}",
                    mediaRef, transientFailure, e.getMessage());
            throw TranscriptionException.providerFailed(mediaRef, transientFailure, e);
        }

        if (transcription == null || transcription.trim().isEmpty()) {
            log.warn("Whisper returned empty transcription: mediaRef={}", mediaRef);
            throw TranscriptionException.emptyTranscription(mediaRef);
        }

        log.info("Transcription completed: mediaRef={}, length={}", mediaRef, transcription.length());
        return transcription.trim();
    }

    /**
     * Resolve the reference and enforce the size limit.
     *
     * Only http and https references are fetched. When the server declares a length the
     * media is streamed to the provider; otherwise at most max-audio-bytes + 1 bytes are
     * read into memory to decide.
     */
    Resource openMedia(String mediaRef) {
        URI uri;
        try {
            uri = new URI(mediaRef.trim());
        } catch (URISyntaxException e) {
            throw TranscriptionException.invalidMedia(mediaRef, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme) || uri.getHost() == null) {
            log.warn("Rejected media reference: mediaRef={}, scheme={}", mediaRef, scheme);
            throw TranscriptionException.invalidMedia(mediaRef, null);
        }

        Resource resource = resolve(uri);
        long size;
        try {
            size = resource.contentLength();
        } catch (FileNotFoundException e) {
            throw TranscriptionException.invalidMedia(mediaRef, e);
        } catch (IOException e) {
            throw TranscriptionException.providerFailed(mediaRef, true, e);
        }

        if (size > maxAudioBytes) {
            throw TranscriptionException.mediaTooLarge(mediaRef, size, maxAudioBytes);
        }
        if (size >= 0) {
            log.debug("Media resolved: mediaRef={}, sizeBytes={}", mediaRef, size);
            return resource;
        }
        return readBounded(mediaRef, resource);
    }

    /**
     * @param uri an http or https URI
     * @return the resource behind it, not yet opened
     */
    Resource resolve(URI uri) {
        try {
            return new UrlResource(uri);
        } catch (MalformedURLException e) {
            throw TranscriptionException.invalidMedia(uri.toString(), e);
        }
    }

    private Resource readBounded(String mediaRef, Resource resource) {
        int limit = (int) Math.min(maxAudioBytes + 1, Integer.MAX_VALUE - 8);
        byte[] bytes;
        try (InputStream in = resource.getInputStream()) {
            bytes = in.readNBytes(limit);
        } catch (FileNotFoundException e) {
            throw TranscriptionException.invalidMedia(mediaRef, e);
        } catch (IOException e) {
            throw TranscriptionException.providerFailed(mediaRef, true, e);
        }

        if (bytes.length > maxAudioBytes) {
            throw TranscriptionException.mediaTooLarge(mediaRef, bytes.length, maxAudioBytes);
        }
        log.debug("Media of undeclared length buffered: mediaRef={}, sizeBytes={}", mediaRef, bytes.length);

        String filename = resource.getFilename();
        return new ByteArrayResource(bytes) {
            // the multipart upload needs a filename with the media extension
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }
}
