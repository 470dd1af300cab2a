package com.analystpilot.orchestrator.service;

/**
 * One file of an analysis request, detached from the web layer.
 */
public record UploadedFile(String filename, byte[] content) {

    public UploadedFile {
        content = content == null ? new byte[0] : content;
    }
}
