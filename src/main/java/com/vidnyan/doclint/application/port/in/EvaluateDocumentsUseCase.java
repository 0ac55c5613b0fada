package com.vidnyan.doclint.application.port.in;

import com.vidnyan.doclint.application.port.out.DocumentSource;
import com.vidnyan.doclint.application.port.out.RuleSource;
import com.vidnyan.doclint.domain.model.Document;
import com.vidnyan.doclint.domain.model.Rule;
import com.vidnyan.doclint.domain.model.Summary;
import com.vidnyan.doclint.domain.oracle.RetryPolicy;

import java.util.List;
import java.util.Objects;

/**
 * Primary use case: judge every document against every rule.
 * This is the engine's only entry point.
 */
public interface EvaluateDocumentsUseCase {

    /**
     * Evaluate all (document, rule) pairs and summarize them.
     * Task-level failures are reported inside the summary, never thrown.
     * @param request documents, rules and the run configuration
     * @return summary whose document results follow the request's document order
     */
    Summary evaluate(EvaluationRequest request);

    /**
     * Load documents and rules through the given collaborators, then evaluate.
     */
    default Summary evaluate(DocumentSource documents, RuleSource rules, EngineConfig config) {
        return evaluate(new EvaluationRequest(documents.load(), rules.load(), config));
    }

    /**
     * Evaluation request parameters.
     */
    record EvaluationRequest(
        List<Document> documents,
        List<Rule> rules,
        EngineConfig config
    ) {
        public EvaluationRequest {
            documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
            rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
            config = config != null ? config : EngineConfig.defaults();
        }

        public int taskCount() {
            return documents.size() * rules.size();
        }
    }

    /**
     * Explicit run configuration; the engine reads nothing else.
     */
    record EngineConfig(
        int documentConcurrency,
        int ruleConcurrency,
        RetryPolicy retryPolicy,
        boolean showPassDetails
    ) {
        public static final int DEFAULT_DOCUMENT_CONCURRENCY = 100;
        public static final int DEFAULT_RULE_CONCURRENCY = 50;

        public EngineConfig {
            if (documentConcurrency < 1) {
                throw new IllegalArgumentException("documentConcurrency must be >= 1 but was " + documentConcurrency);
            }
            if (ruleConcurrency < 1) {
                throw new IllegalArgumentException("ruleConcurrency must be >= 1 but was " + ruleConcurrency);
            }
            retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
        }

        public static EngineConfig defaults() {
            return new EngineConfig(DEFAULT_DOCUMENT_CONCURRENCY, DEFAULT_RULE_CONCURRENCY,
                    RetryPolicy.defaults(), false);
        }

        public static EngineConfig of(int documentConcurrency, int ruleConcurrency) {
            return new EngineConfig(documentConcurrency, ruleConcurrency, RetryPolicy.defaults(), false);
        }
    }
}
