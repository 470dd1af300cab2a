package com.analystpilot.orchestrator.service;

/**
 * The request did not include a non-empty {@code question.txt}.
 * Raised before any provider is contacted; never retried.
 */
public class QuestionMissingException extends RuntimeException {

    public QuestionMissingException() {
        super("question.txt is required but missing");
    }
}
