package com.vidnyan.doclint.application.port.out;

import com.vidnyan.doclint.domain.model.Document;
import com.vidnyan.doclint.domain.model.Rule;

/**
 * Port for building the prompt text of one (document, rule) evaluation.
 * Supplied by the host application; the engine only passes the result to the oracle.
 */
@FunctionalInterface
public interface PromptComposer {

    String compose(Rule rule, Document document);
}
