package com.vidnyan.doclint.application.port.out;

import com.vidnyan.doclint.domain.model.Rule;

import java.util.List;

/**
 * Port for loading rule definitions.
 * Implemented by adapters that parse rule documents from files, databases, etc.
 */
@FunctionalInterface
public interface RuleSource {

    List<Rule> load();
}
