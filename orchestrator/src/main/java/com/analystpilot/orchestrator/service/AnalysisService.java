package com.analystpilot.orchestrator.service;

import com.analystpilot.orchestrator.agent.AnalysisResult;
import com.analystpilot.orchestrator.agent.FeedbackOrchestrator;
import com.analystpilot.orchestrator.agent.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Handles one analysis request end to end: stage the upload, build the
 * first prompt, run the feedback loop, clean up.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final UploadStager         stager;
    private final PromptBuilder        prompts;
    private final FeedbackOrchestrator orchestrator;

    public AnalysisService(UploadStager stager, PromptBuilder prompts, FeedbackOrchestrator orchestrator) {
        this.stager       = stager;
        this.prompts      = prompts;
        this.orchestrator = orchestrator;
    }

    /**
     * @throws QuestionMissingException before any provider is contacted, if
     *         the upload has no usable question.txt
     */
    public AnalysisResult analyze(List<UploadedFile> files) {
        // Tags every log line of this request, including those from the loop and sandbox.
        MDC.put("requestId", UUID.randomUUID().toString().substring(0, 8));
        try (StagedRequest staged = stager.stage(files)) {
            log.info("Received question with {} auxiliary file(s): {}",
                    staged.manifest().size(), staged.manifest().keySet());
            String prompt = prompts.initialPrompt(staged.question(), staged.manifest().keySet());
            AnalysisResult result = orchestrator.run(prompt, staged.manifest());
            log.info("Analysis finished: success={} provider={} iterations={}",
                    result.success(), result.apiUsed(), result.iterations());
            return result;
        } finally {
            MDC.remove("requestId");
        }
    }
}
