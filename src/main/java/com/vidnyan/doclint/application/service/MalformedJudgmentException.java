package com.vidnyan.doclint.application.service;

public class MalformedJudgmentException extends RuntimeException {

    public MalformedJudgmentException(String message) {
        super(message);
    }

    public MalformedJudgmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
