package com.analystpilot.orchestrator.api;

import com.analystpilot.orchestrator.agent.AnalysisResult;
import com.analystpilot.orchestrator.api.dto.StatusResponse;
import com.analystpilot.orchestrator.service.AnalysisService;
import com.analystpilot.orchestrator.service.QuestionMissingException;
import com.analystpilot.orchestrator.service.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API.
 *
 * POST /analyze   multipart upload ("files"); must include question.txt
 * GET  /          liveness message
 *
 * Example:
 *   curl -F "files=@question.txt" -F "files=@sales.csv" http://localhost:8080/analyze
 */
@RestController
public class AnalyzeController {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeController.class);

    private final AnalysisService analysisService;

    public AnalyzeController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping(path = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalysisResult analyze(@RequestParam(name = "files", required = false) List<MultipartFile> files)
            throws IOException {
        List<UploadedFile> uploads = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                uploads.add(new UploadedFile(file.getOriginalFilename(), file.getBytes()));
            }
        }
        return analysisService.analyze(uploads);
    }

    @GetMapping("/")
    public StatusResponse status() {
        return StatusResponse.running();
    }

    // ------------------------------------------------------------------
    // Error mapping: failures keep the same JSON shape as results
    // ------------------------------------------------------------------

    @ExceptionHandler(QuestionMissingException.class)
    public ResponseEntity<AnalysisResult> questionMissing(QuestionMissingException e) {
        return ResponseEntity.badRequest().body(AnalysisResult.failed(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<AnalysisResult> unexpected(Exception e) {
        // Spring's own client errors (bad media type, missing part, ResponseStatusException) keep their status.
        if (e instanceof ErrorResponse errorResponse) {
            log.warn("Rejected /analyze request: {}", e.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(AnalysisResult.failed(String.valueOf(e.getMessage())));
        }
        log.error("Error in /analyze: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(AnalysisResult.failed(String.valueOf(e.getMessage())));
    }
}
