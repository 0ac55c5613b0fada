package com.vidnyan.doclint.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclint.application.port.in.EvaluateDocumentsUseCase.EngineConfig;
import com.vidnyan.doclint.application.port.in.EvaluateDocumentsUseCase.EvaluationRequest;
import com.vidnyan.doclint.application.port.out.PromptComposer;
import com.vidnyan.doclint.domain.location.LineLocator;
import com.vidnyan.doclint.domain.model.Document;
import com.vidnyan.doclint.domain.model.DocumentResult;
import com.vidnyan.doclint.domain.model.FailureCause;
import com.vidnyan.doclint.domain.model.Rule;
import com.vidnyan.doclint.domain.model.RuleOutcome;
import com.vidnyan.doclint.domain.model.Summary;
import com.vidnyan.doclint.domain.oracle.OracleTransportException;
import com.vidnyan.doclint.domain.report.ResultAggregator;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationEngineTest {

    private static final PromptComposer COMPOSER = (rule, doc) -> doc.path() + "|" + rule.id();

    private static EvaluationEngine engine(ScriptedTransport transport) {
        return new EvaluationEngine(transport, COMPOSER, new JudgmentParser(new ObjectMapper()),
                new LineLocator(), new ResultAggregator(), millis -> { });
    }

    private static List<Document> documents(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Document("docs/doc-" + i + ".md", "# Doc " + i + "\nBody line\n"))
                .toList();
    }

    private static List<Rule> rules(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Rule("R" + i, i % 2 == 0 ? Rule.Severity.ERROR : Rule.Severity.WARN, "criteria " + i))
                .toList();
    }

    @Test
    void evaluate_AllPassing_ShouldRunEveryPairOnceAndKeepOrder() {
        // Arrange
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> ScriptedTransport.verdict(true, "ok"));
        List<Document> docs = documents(3);
        List<Rule> rules = rules(5);

        // Act
        Summary summary = engine(transport).evaluate(new EvaluationRequest(docs, rules, EngineConfig.of(2, 3)));

        // Assert
        assertEquals(ScriptedTransport.MODEL, summary.model());
        assertEquals(3, summary.checked());
        assertEquals(3, summary.passed());
        assertEquals(0, summary.failed());
        assertFalse(summary.hasFailures());

        assertEquals(15, transport.calls());
        Set<String> expectedPairs = new HashSet<>();
        docs.forEach(d -> rules.forEach(r -> expectedPairs.add(d.path() + "|" + r.id())));
        assertEquals(expectedPairs, new HashSet<>(transport.prompts()));

        assertEquals(docs, summary.documentResults().stream().map(DocumentResult::document).toList());
        for (DocumentResult result : summary.documentResults()) {
            assertEquals(List.of("R0", "R1", "R2", "R3", "R4"),
                    result.outcomes().stream().map(RuleOutcome::ruleId).toList());
            assertTrue(result.outcomes().stream().allMatch(o -> o.line() == null));
        }
    }

    @Test
    void evaluate_Violation_ShouldLocateLineFromFixes() {
        // Arrange
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> prompt.endsWith("|R1")
                ? "{\"pass\": false, \"rationale\": \"passive voice\", \"suggested_fixes\": [{\"line\": 7}]}"
                : "{\"pass\": false, \"rationale\": \"vague\", \"suggested_fixes\": [{\"before\": \"Body line\"}]}");
        Document doc = new Document("docs/a.md", "# Title\nBody line\n");

        // Act
        Summary summary = engine(transport).evaluate(
                new EvaluationRequest(List.of(doc), rules(2), EngineConfig.of(1, 2)));

        // Assert
        List<RuleOutcome> outcomes = summary.documentResults().get(0).outcomes();
        assertEquals(2, outcomes.get(0).line());
        assertEquals(7, outcomes.get(1).line());
        assertEquals(Rule.Severity.WARN, outcomes.get(1).severity());
        assertEquals(1, summary.failed());
        assertEquals(2, summary.failureCount(FailureCause.VIOLATION));
        assertEquals(1, summary.failureCount(Rule.Severity.ERROR));
        assertEquals(1, summary.failureCount(Rule.Severity.WARN));
    }

    @Test
    void evaluate_UnreadableDocument_ShouldBecomeEngineErrorWithoutStoppingOthers() {
        // Arrange
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> ScriptedTransport.verdict(true, "ok"));
        List<Document> docs = List.of(
                new Document("docs/ok-1.md", "fine"),
                Document.unreadable("docs/locked.md"),
                new Document("docs/ok-2.md", "fine"));

        // Act
        Summary summary = engine(transport).evaluate(new EvaluationRequest(docs, rules(2), EngineConfig.of(3, 2)));

        // Assert
        assertEquals(3, summary.checked());
        assertEquals(2, summary.passed());
        assertEquals(1, summary.failed());
        assertEquals(4, transport.calls());

        DocumentResult broken = summary.documentResults().get(1);
        assertEquals("docs/locked.md", broken.document().path());
        RuleOutcome outcome = broken.outcomes().get(0);
        assertEquals("engine_error", outcome.ruleId());
        assertEquals("Engine error: cannot read document docs/locked.md", outcome.rationale());
        assertEquals(1, outcome.line());
        assertEquals(1, summary.failureCount(FailureCause.ENGINE_ERROR));
    }

    @Test
    void evaluate_QuotaExhausted_ShouldFailEveryTaskAtLineOne() {
        // Arrange
        ScriptedTransport transport = ScriptedTransport.scripted(
                new OracleTransportException(429, "insufficient_quota", "429 quota"));

        // Act
        Summary summary = engine(transport).evaluate(
                new EvaluationRequest(documents(2), rules(2), EngineConfig.of(2, 2)));

        // Assert
        assertEquals(4, transport.calls());
        assertEquals(2, summary.failed());
        assertEquals(4, summary.failureCount(FailureCause.ORACLE_QUOTA));
        summary.documentResults().forEach(result -> result.outcomes().forEach(outcome -> {
            assertEquals(1, outcome.line());
            assertEquals("LLM call failed: insufficient quota.", outcome.rationale());
        }));
    }

    @Test
    void evaluate_NoRules_ShouldPassEveryDocumentWithoutCalls() {
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> ScriptedTransport.verdict(false, "x"));

        Summary summary = engine(transport).evaluate(
                new EvaluationRequest(documents(2), List.of(), EngineConfig.defaults()));

        assertEquals(0, transport.calls());
        assertEquals(2, summary.passed());
        assertTrue(summary.documentResults().stream().allMatch(r -> r.outcomes().isEmpty()));
    }

    @Test
    void evaluate_NoDocuments_ShouldReturnEmptySummary() {
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> ScriptedTransport.verdict(true, "ok"));

        Summary summary = engine(transport).evaluate(new EvaluationRequest(List.of(), rules(3), null));

        assertEquals(0, summary.checked());
        assertEquals(0, transport.calls());
    }

    @Test
    void evaluate_FromSources_ShouldLoadThenEvaluate() {
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> ScriptedTransport.verdict(true, "ok"));

        Summary summary = engine(transport).evaluate(() -> documents(2), () -> rules(3), EngineConfig.of(1, 1));

        assertEquals(2, summary.checked());
        assertEquals(6, transport.calls());
    }

    @Test
    void evaluate_ShouldTagOracleCallsWithDocumentInMdc() {
        // Arrange
        Map<String, String> seen = new ConcurrentHashMap<>();
        ScriptedTransport transport = ScriptedTransport.answering(prompt -> {
            seen.put(prompt, String.valueOf(MDC.get(TaskScheduler.MDC_DOCUMENT)));
            return ScriptedTransport.verdict(true, "ok");
        });

        // Act
        engine(transport).evaluate(new EvaluationRequest(documents(4), rules(3), EngineConfig.of(4, 3)));

        // Assert
        assertEquals(12, seen.size());
        Map<String, String> mismatched = seen.entrySet().stream()
                .filter(e -> !e.getKey().startsWith(e.getValue() + "|"))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        assertTrue(mismatched.isEmpty(), "calls tagged with the wrong document: " + mismatched);
    }
}
