package com.example.safespace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.base-url=...
 * langchain4j.openai.chat-model=...
 * langchain4j.openai.report-model=...
 * langchain4j.openai.temperature=0.7
 * langchain4j.openai.report-temperature=0.3
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * API key. When blank the generation client reports itself as not configured.
     */
    private String apiKey;

    /**
     * OpenAI-compatible endpoint; blank means the library default.
     */
    private String baseUrl;

    /**
     * Model used for conversational replies, e.g. "gpt-4o-mini"
     */
    private String chatModel = "gpt-4o-mini";

    /**
     * Model used for report narratives
     */
    private String reportModel = "gpt-4o-mini";

    private double temperature = 0.7;

    /**
     * Kept low so narratives come out in a stable shape.
     */
    private double reportTemperature = 0.3;

    private Integer maxOutputTokens = 2048;

    private Duration timeout = Duration.ofSeconds(60);

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
