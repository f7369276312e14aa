package com.egg.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiAudioTranscriptionModel;
import org.springframework.ai.openai.OpenAiAudioTranscriptionOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.OpenAiAudioApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Spring AI configuration for the two model clients of the pipeline.
 *
 * 1. Gemini (chat): structured extraction of ideas, todos, alerts and comments, reached
 *    through Google's OpenAI-compatible endpoint with the OpenAI chat client
 * 2. Whisper (audio): speech-to-text over event media
 *
 * Spring AI's built-in retry is reduced to a single attempt on both clients. Extraction
 * retries are owned by {@link com.egg.pipeline.ExtractionRetryExecutor} (bounded attempts,
 * exponential backoff, per-attempt timeout); a failed transcription fails only its event.
 *
 * With maxAttempts(1), HTTP errors surface unchanged:
 * - 5xx as {@code TransientAiException}
 * - 4xx as {@code NonTransientAiException} with message "{status} - {body}"
 * - I/O errors as {@code ResourceAccessException}
 *
 * @see org.springframework.ai.chat.client.ChatClient
 * @see org.springframework.ai.openai.OpenAiAudioTranscriptionModel
 */
@Configuration
@Slf4j
public class SpringAIConfig {

    private static final String MISSING_KEY = "missing-api-key";

    @Value("${app.ai.gemini.api-key:}")
    private String geminiApiKey;

    @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com/v1beta/openai}")
    private String geminiBaseUrl;

    @Value("${app.ai.gemini.model:gemini-2.5-flash}")
    private String geminiModel;

    @Value("${app.ai.gemini.temperature:0.2}")
    private double geminiTemperature;

    @Value("${app.ai.transcription.api-key:}")
    private String transcriptionApiKey;

    @Value("${app.ai.transcription.base-url:https://api.openai.com}")
    private String transcriptionBaseUrl;

    @Value("${app.ai.transcription.model:whisper-1}")
    private String transcriptionModel;

    /**
     * Gemini chat model through the OpenAI-compatible API.
     *
     * @return configured OpenAiChatModel
     */
    @Bean
    public OpenAiChatModel geminiChatModel() {
        log.info("Configuring Gemini ChatModel: model={}, baseUrl={}", geminiModel, geminiBaseUrl);

        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(geminiBaseUrl)
                .apiKey(keyOrPlaceholder(geminiApiKey, "GEMINI_API_KEY"))
                .completionsPath("/chat/completions")
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(geminiModel)
                .temperature(geminiTemperature)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .retryTemplate(singleAttempt())
                .build();
    }

    /**
     * ChatClient used by the extraction and daily comment adapters.
     *
     * @param geminiChatModel the configured Gemini chat model
     * @return ChatClient for Gemini
     */
    @Bean
    public ChatClient geminiClient(OpenAiChatModel geminiChatModel) {
        log.debug("Creating Gemini ChatClient bean");
        return ChatClient.create(geminiChatModel);
    }

    /**
     * Whisper transcription model.
     *
     * Per-call options (language, prompt) are set by WhisperTranscriptionService.
     *
     * @return configured OpenAiAudioTranscriptionModel
     * @see com.egg.service.WhisperTranscriptionService
     */
    @Bean
    public OpenAiAudioTranscriptionModel whisperTranscriptionModel() {
        log.info("Configuring Whisper Audio Transcription Model: model={}, baseUrl={}",
                transcriptionModel, transcriptionBaseUrl);

        OpenAiAudioApi openAiAudioApi = OpenAiAudioApi.builder()
                .baseUrl(transcriptionBaseUrl)
                .apiKey(keyOrPlaceholder(transcriptionApiKey, "STT_API_KEY"))
                .build();

        OpenAiAudioTranscriptionOptions defaultOptions = OpenAiAudioTranscriptionOptions.builder()
                .model(transcriptionModel)
                .build();

        return new OpenAiAudioTranscriptionModel(openAiAudioApi, defaultOptions, singleAttempt());
    }

    private RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }

    /**
     * The clients refuse an empty key at construction time. Without a key the
     * provider answers 401, which the pipeline records as a permanent failure.
     */
    private String keyOrPlaceholder(String apiKey, String variable) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("{} is not set; calls to this provider will be rejected", variable);
            return MISSING_KEY;
        }
        return apiKey;
    }
}
