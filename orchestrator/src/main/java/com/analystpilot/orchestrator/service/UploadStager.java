package com.analystpilot.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an upload into the question and the file manifest, writing the
 * auxiliary files to a fresh temporary directory.
 *
 * Exactly one file named {@code question.txt} (case-insensitive) supplies the
 * question; every other file joins the manifest under its sanitized name.
 * When two names sanitize to the same value the later one gets a numeric
 * suffix ({@code data_1.csv}). Oversized files are logged, never rejected.
 */
public class UploadStager {

    private static final Logger log = LoggerFactory.getLogger(UploadStager.class);

    static final String QUESTION_FILE = "question.txt";

    private final Path stagingRoot;
    private final long maxFileSizeBytes;

    public UploadStager(Path stagingRoot, long maxFileSizeBytes) {
        this.stagingRoot      = stagingRoot;
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    /**
     * @throws QuestionMissingException if there is no question.txt or it is blank
     */
    public StagedRequest stage(List<UploadedFile> files) {
        String question = null;
        for (UploadedFile file : files) {
            if (QUESTION_FILE.equalsIgnoreCase(FileNames.sanitize(file.filename()))) {
                question = new String(file.content(), StandardCharsets.UTF_8).strip();
                log.info("Detected question.txt with {} chars", question.length());
            }
        }
        if (question == null || question.isEmpty()) {
            log.warn("Request missing question.txt");
            throw new QuestionMissingException();
        }

        Path directory;
        try {
            Files.createDirectories(stagingRoot);
            directory = Files.createTempDirectory(stagingRoot, "data_agent_");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create staging directory", e);
        }

        Map<String, Path> manifest = new LinkedHashMap<>();
        StagedRequest staged = new StagedRequest(question, manifest, directory);
        try {
            for (UploadedFile file : files) {
                String sanitized = FileNames.sanitize(file.filename());
                if (QUESTION_FILE.equalsIgnoreCase(sanitized)) {
                    continue;
                }
                String name = uniqueName(sanitized, manifest);
                if (!name.equals(sanitized)) {
                    log.warn("Upload {} collides with an earlier file; staged as {}", file.filename(), name);
                }
                if (file.content().length > maxFileSizeBytes) {
                    log.warn("File {} is very large ({} bytes). May affect processing.",
                            name, file.content().length);
                }
                Path target = directory.resolve(name);
                Files.write(target, file.content());
                manifest.put(name, target);
            }
        } catch (IOException e) {
            staged.close();
            throw new UncheckedIOException("Could not stage uploaded files", e);
        }
        log.info("Staged {} file(s) in {}", manifest.size(), directory);
        return new StagedRequest(question, Collections.unmodifiableMap(manifest), directory);
    }

    /** {@code name}, or {@code base_N.ext} with the smallest N not yet taken. */
    static String uniqueName(String name, Map<String, Path> taken) {
        if (!taken.containsKey(name)) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext  = dot > 0 ? name.substring(dot) : "";
        for (int n = 1; ; n++) {
            String candidate = base + "_" + n + ext;
            if (!taken.containsKey(candidate)) {
                return candidate;
            }
        }
    }
}
