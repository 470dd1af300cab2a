package com.analystpilot.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of answering one question, and of each provider attempt on the way.
 *
 * Serialized as-is by the HTTP layer:
 * {@code {"success", "final_answer", "api_used", "iterations", "error"}}.
 */
public record AnalysisResult(
        @JsonProperty("success")      boolean success,
        @JsonProperty("final_answer") Object  finalAnswer,
        @JsonProperty("api_used")     @JsonInclude(JsonInclude.Include.NON_NULL) String  apiUsed,
        @JsonProperty("iterations")   @JsonInclude(JsonInclude.Include.NON_NULL) Integer iterations,
        @JsonProperty("error")        String  error
) {
    public static AnalysisResult succeeded(Object finalAnswer, String provider, int iterations) {
        return new AnalysisResult(true, finalAnswer, provider, iterations, null);
    }

    public static AnalysisResult failed(String error) {
        return new AnalysisResult(false, null, null, null, error);
    }

    public static AnalysisResult failed(String provider, int iterations, String error) {
        return new AnalysisResult(false, null, provider, iterations, error);
    }
}
