package com.analystpilot.orchestrator.service;

import com.analystpilot.orchestrator.agent.AnalysisResult;
import com.analystpilot.orchestrator.agent.FeedbackOrchestrator;
import com.analystpilot.orchestrator.agent.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AnalysisService.
 *
 * Staging runs for real in a temp dir; the feedback loop is a Mockito mock.
 */
@ExtendWith(MockitoExtension.class)
class AnalysisServiceTest {

    @TempDir Path root;

    @Mock FeedbackOrchestrator orchestrator;

    AnalysisService service;

    @BeforeEach
    void setUp() {
        service = new AnalysisService(new UploadStager(root, 1024 * 1024), new PromptBuilder(), orchestrator);
    }

    @Test
    void analyze_buildsPromptFromQuestionAndFileNames() {
        when(orchestrator.run(anyString(), anyMap())).thenReturn(AnalysisResult.succeeded("4", "nvidia", 1));

        AnalysisResult result = service.analyze(List.of(
                file("question.txt", "What is 2+2?"),
                file("b.csv", "1"),
                file("a.csv", "2")));

        assertThat(result.finalAnswer()).isEqualTo("4");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Path>> manifest = ArgumentCaptor.forClass(Map.class);
        verify(orchestrator).run(prompt.capture(), manifest.capture());

        assertThat(prompt.getValue())
                .contains("\n\nQuestion: What is 2+2?")
                .endsWith("Files available for context:\n[a.csv, b.csv]");
        assertThat(manifest.getValue()).containsOnlyKeys("a.csv", "b.csv");
    }

    @Test
    void analyze_deletesStagedFilesAfterwards() throws Exception {
        when(orchestrator.run(anyString(), anyMap())).thenReturn(AnalysisResult.failed("All APIs () failed"));

        service.analyze(List.of(file("question.txt", "q"), file("data.csv", "1")));

        try (var entries = Files.list(root)) {
            assertThat(entries).isEmpty();
        }
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void analyze_missingQuestion_neverReachesOrchestrator() {
        assertThatThrownBy(() -> service.analyze(List.of(file("data.csv", "1"))))
                .isInstanceOf(QuestionMissingException.class);

        verify(orchestrator, never()).run(any(), any());
        assertThat(MDC.get("requestId")).isNull();
    }

    private static UploadedFile file(String name, String content) {
        return new UploadedFile(name, content.getBytes(StandardCharsets.UTF_8));
    }
}
