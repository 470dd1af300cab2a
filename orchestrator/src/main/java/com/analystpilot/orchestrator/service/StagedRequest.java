package com.analystpilot.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;

/**
 * The question and the auxiliary files of one request, written to a private
 * temporary directory. Closing it deletes the directory.
 *
 * @param question  text of question.txt
 * @param manifest  file name → staged path, in upload order
 * @param directory the staging directory
 */
public record StagedRequest(String question, Map<String, Path> manifest, Path directory)
        implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagedRequest.class);

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        // walkFileTree reports every failure as IOException, unlike Files.walk's stream.
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Could not delete staging directory {}: {}", directory, e.getMessage());
        }
    }
}
