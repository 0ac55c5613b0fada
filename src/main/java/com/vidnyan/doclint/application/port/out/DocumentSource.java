package com.vidnyan.doclint.application.port.out;

import com.vidnyan.doclint.domain.model.Document;

import java.util.List;

/**
 * Port for the documents to lint, already filtered to the target set and read into memory.
 */
@FunctionalInterface
public interface DocumentSource {

    List<Document> load();
}
