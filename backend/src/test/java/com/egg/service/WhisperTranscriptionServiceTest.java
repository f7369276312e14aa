package com.egg.service;

import com.egg.exception.TranscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.audio.transcription.AudioTranscriptionPrompt;
import org.springframework.ai.openai.OpenAiAudioTranscriptionModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.core.io.Resource;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WhisperTranscriptionService.
 *
 * Remote media is replaced by mocked resources; the transcription model is mocked.
 */
@DisplayName("WhisperTranscriptionService Unit Tests")
class WhisperTranscriptionServiceTest {

    private static final String MEDIA_URL = "https://cdn.example.com/note.m4a";

    private OpenAiAudioTranscriptionModel transcriptionModel;
    private WhisperTranscriptionService transcriptionService;

    @BeforeEach
    void setUp() {
        transcriptionModel = mock(OpenAiAudioTranscriptionModel.class, RETURNS_DEEP_STUBS);
        transcriptionService = spy(new WhisperTranscriptionService(transcriptionModel));
        ReflectionTestUtils.setField(transcriptionService, "defaultLanguage", "");
        ReflectionTestUtils.setField(transcriptionService, "transcriptionPrompt", "");
        ReflectionTestUtils.setField(transcriptionService, "maxAudioBytes", 1024L);
    }

    private Resource remoteMedia(long declaredLength) throws IOException {
        Resource resource = mock(Resource.class);
        when(resource.contentLength()).thenReturn(declaredLength);
        when(resource.getFilename()).thenReturn("note.m4a");
        doReturn(resource).when(transcriptionService).resolve(URI.create(MEDIA_URL));
        return resource;
    }

    private Resource chunkedMedia(int actualBytes) throws IOException {
        Resource resource = remoteMedia(-1);
        when(resource.getInputStream()).thenReturn(new ByteArrayInputStream(new byte[actualBytes]));
        return resource;
    }

    @Test
    @DisplayName("transcribe should return the trimmed model output")
    void testTranscribe_Success() throws IOException {
        // Arrange
        remoteMedia(100);
        when(transcriptionModel.call(any(AudioTranscriptionPrompt.class)).getResult().getOutput())
                .thenReturn("  Call Alex tomorrow.\n");

        // Act
        String transcript = transcriptionService.transcribe(MEDIA_URL);

        // Assert
        assertEquals("Call Alex tomorrow.", transcript);
    }

    @Test
    @DisplayName("transcribe should reject blank and malformed references")
    void testTranscribe_InvalidReference() {
        // Act
        TranscriptionException blank = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe("  "));
        TranscriptionException malformed = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe("not a url"));

        // Assert
        assertEquals("INVALID_MEDIA", blank.getErrorCode());
        assertEquals("INVALID_MEDIA", malformed.getErrorCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"file:///etc/passwd", "jar:file:/app.jar!/application.yml", "ftp://cdn.example.com/a.m4a",
            "classpath:application.yml", "/etc/passwd"})
    @DisplayName("openMedia should refuse anything but http and https without touching it")
    void testOpenMedia_RejectsNonHttpSchemes(String mediaRef) {
        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.openMedia(mediaRef));

        // Assert
        assertEquals("INVALID_MEDIA", exception.getErrorCode());
        assertFalse(exception.isTransient());
        verify(transcriptionService, never()).resolve(any());
        verifyNoInteractions(transcriptionModel);
    }

    @Test
    @DisplayName("transcribe should reject missing media")
    void testTranscribe_MissingMedia() throws IOException {
        // Arrange
        Resource resource = mock(Resource.class);
        when(resource.contentLength()).thenThrow(new FileNotFoundException(MEDIA_URL));
        doReturn(resource).when(transcriptionService).resolve(URI.create(MEDIA_URL));

        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertEquals("INVALID_MEDIA", exception.getErrorCode());
        assertFalse(exception.isTransient());
    }

    @Test
    @DisplayName("network errors while sizing media should be transient")
    void testTranscribe_MediaHostUnreachable() throws IOException {
        // Arrange
        Resource resource = mock(Resource.class);
        when(resource.contentLength()).thenThrow(new IOException("Connection reset"));
        doReturn(resource).when(transcriptionService).resolve(URI.create(MEDIA_URL));

        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertTrue(exception.isTransient());
    }

    @Test
    @DisplayName("transcribe should reject media above the size limit before calling the model")
    void testTranscribe_TooLarge() throws IOException {
        // Arrange
        remoteMedia(2048);

        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertEquals("MEDIA_TOO_LARGE", exception.getErrorCode());
        verify(transcriptionModel, never()).call(any(AudioTranscriptionPrompt.class));
    }

    @Test
    @DisplayName("media of undeclared length above the limit should be rejected after a bounded read")
    void testTranscribe_UndeclaredLengthTooLarge() throws IOException {
        // Arrange
        chunkedMedia(4096);

        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertEquals("MEDIA_TOO_LARGE", exception.getErrorCode());
        verify(transcriptionModel, never()).call(any(AudioTranscriptionPrompt.class));
    }

    @Test
    @DisplayName("media of undeclared length within the limit should be buffered under its filename")
    void testOpenMedia_UndeclaredLengthBuffered() throws IOException {
        // Arrange
        chunkedMedia(512);

        // Act
        Resource media = transcriptionService.openMedia(MEDIA_URL);

        // Assert
        assertEquals(512, media.contentLength());
        assertEquals("note.m4a", media.getFilename());
    }

    @Test
    @DisplayName("media of known length should be handed to the model as is")
    void testTranscribe_StreamsKnownLength() throws IOException {
        // Arrange
        Resource resource = remoteMedia(100);
        when(transcriptionModel.call(any(AudioTranscriptionPrompt.class)).getResult().getOutput())
                .thenReturn("hello");

        // Act
        transcriptionService.transcribe(MEDIA_URL);

        // Assert
        ArgumentCaptor<AudioTranscriptionPrompt> prompt = ArgumentCaptor.forClass(AudioTranscriptionPrompt.class);
        verify(transcriptionModel, atLeastOnce()).call(prompt.capture());
        assertSame(resource, prompt.getValue().getInstructions());
        verify(resource, never()).getInputStream();
    }

    @Test
    @DisplayName("empty model output should be an EMPTY_TRANSCRIPTION failure")
    void testTranscribe_EmptyOutput() throws IOException {
        // Arrange
        remoteMedia(100);
        when(transcriptionModel.call(any(AudioTranscriptionPrompt.class)).getResult().getOutput())
                .thenReturn("   ");

        // Act
        TranscriptionException exception = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertEquals("EMPTY_TRANSCRIPTION", exception.getErrorCode());
    }

    @Test
    @DisplayName("provider errors should keep their transient or permanent nature")
    void testTranscribe_ProviderErrors() throws IOException {
        // Arrange
        remoteMedia(100);
        when(transcriptionModel.call(any(AudioTranscriptionPrompt.class)))
                .thenThrow(new TransientAiException("503 - Service Unavailable"))
                .thenThrow(new NonTransientAiException("401 - Incorrect API key provided"));

        // Act
        TranscriptionException unavailable = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));
        TranscriptionException rejected = assertThrows(TranscriptionException.class,
                () -> transcriptionService.transcribe(MEDIA_URL));

        // Assert
        assertEquals("STT_UNAVAILABLE", unavailable.getErrorCode());
        assertTrue(unavailable.isTransient());
        assertEquals("STT_REJECTED", rejected.getErrorCode());
        assertFalse(rejected.isTransient());
    }
}
