package com.egg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Egg Backend.
 *
 * This Spring Boot application provides the REST API behind the Egg mobile app,
 * featuring:
 * - Anonymous device authentication with JWT
 * - Event ingestion (audio, screen recordings, transcripts)
 * - Asynchronous AI pipeline via RabbitMQ (speech-to-text, then eggbook extraction with Gemini)
 * - Eggbook CRUD for ideas, todos, notifications and daily comments
 * - PostgreSQL for events and eggbook entries, Redis for the optional shared cooldown gate
 */
@SpringBootApplication
public class EggBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(EggBackendApplication.class, args);
    }
}
