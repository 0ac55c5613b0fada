package com.vidnyan.doclint.domain.model;

/**
 * One (document, rule) evaluation unit.
 * The index pair is the task's identity and the only way its result finds its output slot.
 */
public record EvaluationTask(
    int documentIndex,
    int ruleIndex,
    Document document,
    Rule rule
) {

    public String describe() {
        return document.path() + " :: " + rule.id();
    }
}
