package com.vidnyan.doclint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclint.adapter.out.oracle.HttpOracleTransport;
import com.vidnyan.doclint.application.port.in.EvaluateDocumentsUseCase;
import com.vidnyan.doclint.application.port.out.OracleTransport;
import com.vidnyan.doclint.application.port.out.PromptComposer;
import com.vidnyan.doclint.application.service.EvaluationEngine;
import com.vidnyan.doclint.application.service.JudgmentParser;
import com.vidnyan.doclint.domain.location.LineLocator;
import com.vidnyan.doclint.domain.report.ResultAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Spring wiring for the evaluation engine.
 * The host application provides a {@link PromptComposer}; everything else has a default.
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties({EngineProperties.class, OracleProperties.class})
public class DocLintConfiguration {

    /**
     * ObjectMapper for oracle requests and responses.
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    @ConditionalOnMissingBean(OracleTransport.class)
    public OracleTransport oracleTransport(ObjectMapper objectMapper, OracleProperties properties) {
        log.info("Oracle transport: {} (model {})", properties.getBaseUrl(), properties.getModel());
        return new HttpOracleTransport(objectMapper, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public JudgmentParser judgmentParser(ObjectMapper objectMapper) {
        return new JudgmentParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public LineLocator lineLocator() {
        return new LineLocator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultAggregator resultAggregator() {
        return new ResultAggregator();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    @ConditionalOnBean(PromptComposer.class)
    @ConditionalOnMissingBean(EvaluateDocumentsUseCase.class)
    public EvaluateDocumentsUseCase evaluateDocumentsUseCase(OracleTransport oracleTransport,
                                                             PromptComposer promptComposer,
                                                             JudgmentParser judgmentParser,
                                                             LineLocator lineLocator,
                                                             ResultAggregator resultAggregator,
                                                             Sleeper sleeper) {
        return new EvaluationEngine(oracleTransport, promptComposer, judgmentParser,
                lineLocator, resultAggregator, sleeper);
    }
}
