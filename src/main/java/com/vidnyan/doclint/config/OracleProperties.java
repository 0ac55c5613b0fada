package com.vidnyan.doclint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the OpenAI-compatible oracle endpoint.
 * Configured via application.properties or application.yml under {@code doclint.oracle}.
 */
@Data
@ConfigurationProperties(prefix = "doclint.oracle")
public class OracleProperties {

    /**
     * Base URL of the chat-completions API, without the {@code /chat/completions} suffix.
     */
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "gpt-5";

    private double temperature = 1.0;

    private Duration connectTimeout = Duration.ofSeconds(30);

    private Duration requestTimeout = Duration.ofSeconds(120);

    private String systemPrompt =
            "You are a strict, deterministic doc linter. Return ONLY valid JSON that matches the requested schema.";
}
