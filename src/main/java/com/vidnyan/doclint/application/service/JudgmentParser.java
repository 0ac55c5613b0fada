package com.vidnyan.doclint.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclint.domain.model.Judgment;
import com.vidnyan.doclint.domain.model.Rule;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the oracle's JSON verdict:
 * {@code {"id": string, "pass": boolean, "rationale": string, "suggested_fixes": any[]}}.
 * The echoed id is ignored; the verdict is always attributed to the rule that was asked.
 */
@RequiredArgsConstructor
public class JudgmentParser {

    private final ObjectMapper objectMapper;

    public Judgment parse(String response, Rule rule) {
        if (response == null || response.isBlank()) {
            throw new MalformedJudgmentException("empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new MalformedJudgmentException(e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedJudgmentException("expected a JSON object");
        }

        JsonNode pass = root.get("pass");
        if (pass == null || !pass.isBoolean()) {
            throw new MalformedJudgmentException("missing boolean 'pass'");
        }

        JsonNode rationale = root.get("rationale");
        String rationaleText = rationale == null || rationale.isNull()
                ? ""
                : rationale.isTextual() ? rationale.asText() : rationale.toString();

        return Judgment.judged(rule.id(), pass.booleanValue(), rationaleText, fixes(root));
    }

    private List<JsonNode> fixes(JsonNode root) {
        JsonNode fixes = root.has("suggested_fixes") ? root.get("suggested_fixes") : root.get("suggestedFixes");
        if (fixes == null || !fixes.isArray()) {
            return List.of();
        }
        List<JsonNode> result = new ArrayList<>(fixes.size());
        fixes.forEach(fix -> {
            if (!fix.isNull()) result.add(fix);
        });
        return result;
    }
}
