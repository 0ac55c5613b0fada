package com.vidnyan.doclint.domain.model;

public class DocumentUnreadableException extends RuntimeException {

    public DocumentUnreadableException(String path) {
        super("cannot read document " + path);
    }
}
