package com.vidnyan.doclint.config;

import com.vidnyan.doclint.application.port.in.EvaluateDocumentsUseCase.EngineConfig;
import com.vidnyan.doclint.domain.oracle.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for evaluation runs, under {@code doclint.engine}.
 * Only read by the host; the engine itself receives the resulting {@link EngineConfig}.
 */
@Data
@ConfigurationProperties(prefix = "doclint.engine")
public class EngineProperties {

    /**
     * Documents evaluated at the same time.
     */
    private int documentConcurrency = EngineConfig.DEFAULT_DOCUMENT_CONCURRENCY;

    /**
     * Rules evaluated at the same time within one document.
     */
    private int ruleConcurrency = EngineConfig.DEFAULT_RULE_CONCURRENCY;

    /**
     * Log rationale and fixes for passing rules too.
     */
    private boolean showPassDetails = false;

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
        private Duration maxJitter = RetryPolicy.DEFAULT_MAX_JITTER;
    }

    public EngineConfig toEngineConfig() {
        RetryPolicy policy = new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxJitter());
        return new EngineConfig(documentConcurrency, ruleConcurrency, policy, showPassDetails);
    }
}
