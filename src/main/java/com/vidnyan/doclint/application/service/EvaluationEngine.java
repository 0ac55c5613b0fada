package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.application.port.in.EvaluateDocumentsUseCase;
import com.vidnyan.doclint.application.port.out.OracleTransport;
import com.vidnyan.doclint.application.port.out.PromptComposer;
import com.vidnyan.doclint.domain.location.LineLocator;
import com.vidnyan.doclint.domain.model.DocumentResult;
import com.vidnyan.doclint.domain.model.FailureCause;
import com.vidnyan.doclint.domain.model.Summary;
import com.vidnyan.doclint.domain.report.ResultAggregator;
import com.vidnyan.doclint.support.MdcAwareExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main application service: wires one run's oracle client and scheduler from the
 * request's configuration, runs every task and aggregates the summary.
 */
@Slf4j
@RequiredArgsConstructor
public class EvaluationEngine implements EvaluateDocumentsUseCase {

    private final OracleTransport oracleTransport;
    private final PromptComposer promptComposer;
    private final JudgmentParser judgmentParser;
    private final LineLocator lineLocator;
    private final ResultAggregator resultAggregator;
    private final Sleeper sleeper;

    @Override
    public Summary evaluate(EvaluationRequest request) {
        Instant startTime = Instant.now();
        EngineConfig config = request.config();

        log.info("Starting evaluation with {}: {} documents x {} rules = {} tasks (document concurrency {}, rule concurrency {})",
                oracleTransport.model(), request.documents().size(), request.rules().size(), request.taskCount(),
                config.documentConcurrency(), config.ruleConcurrency());
        if (request.rules().isEmpty()) {
            log.warn("No rules supplied; every document passes with zero outcomes");
        }

        ExecutorService threads = Executors.newCachedThreadPool(workerThreadFactory());
        try {
            OracleClient oracleClient = new OracleClient(
                    oracleTransport, promptComposer, judgmentParser,
                    OracleRetry.template(config.retryPolicy(), sleeper));
            TaskScheduler scheduler = new TaskScheduler(
                    oracleClient, lineLocator,
                    new WorkerPool(new MdcAwareExecutor(threads)),
                    new RuleRunLogger(config.showPassDetails()));

            List<DocumentResult> results = scheduler.run(request.documents(), request.rules(),
                    config.documentConcurrency(), config.ruleConcurrency());
            Summary summary = resultAggregator.aggregate(oracleTransport.model(), results);

            Duration duration = Duration.between(startTime, Instant.now());
            log.info("Evaluation complete: {} checked, {} passed, {} failed in {}ms",
                    summary.checked(), summary.passed(), summary.failed(), duration.toMillis());
            if (summary.failureCount(FailureCause.ORACLE_QUOTA) > 0) {
                log.error("{} evaluations failed because the oracle quota is exhausted",
                        summary.failureCount(FailureCause.ORACLE_QUOTA));
            }
            return summary;
        } finally {
            threads.shutdown();
        }
    }

    private static CustomizableThreadFactory workerThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("doclint-worker-");
        factory.setDaemon(true);
        return factory;
    }
}
