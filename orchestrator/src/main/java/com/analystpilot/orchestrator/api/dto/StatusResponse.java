package com.analystpilot.orchestrator.api.dto;

/**
 * Response body for GET /.
 */
public record StatusResponse(String status, String message) {

    public static StatusResponse running() {
        return new StatusResponse("running", "Data Analyst Agent API is up");
    }
}
