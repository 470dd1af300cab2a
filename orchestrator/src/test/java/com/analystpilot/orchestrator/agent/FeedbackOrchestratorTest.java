package com.analystpilot.orchestrator.agent;

import com.analystpilot.orchestrator.MutableClock;
import com.analystpilot.orchestrator.executor.ContainerRuntime;
import com.analystpilot.orchestrator.executor.FakeContainerRuntime;
import com.analystpilot.orchestrator.executor.ImportScanner;
import com.analystpilot.orchestrator.executor.SandboxExecutor;
import com.analystpilot.orchestrator.provider.ProviderClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FeedbackOrchestrator.
 *
 * Providers are scripted fakes and the sandbox is a real SandboxExecutor over
 * an in-memory container runtime, so the whole loop runs without network or Docker.
 */
class FeedbackOrchestratorTest {

    static final String PROMPT = "Question: What is 2+2?";

    @TempDir Path root;

    MutableClock         clock;
    FakeContainerRuntime runtime;
    SandboxExecutor      sandbox;
    SimpleMeterRegistry  meterRegistry;

    @BeforeEach
    void setUp() {
        clock         = MutableClock.atEpoch();
        runtime       = new FakeContainerRuntime();
        meterRegistry = new SimpleMeterRegistry();
        sandbox       = new SandboxExecutor(runtime, ImportScanner.withBundledStdlib(), root,
                "python:3.11-slim", Duration.ofSeconds(60), Duration.ofSeconds(60), meterRegistry);
    }

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void immediateFinalAnswer_succeedsInOneIteration() {
        ScriptedProvider a = new ScriptedProvider("nvidia", "{\"final answer\": \"4\"}");
        ScriptedProvider b = new ScriptedProvider("gemini", "{\"final answer\": \"5\"}");

        AnalysisResult result = orchestrator(9, a, b).run(PROMPT, Map.of());

        assertThat(result.success()).isTrue();
        assertThat(result.finalAnswer()).isEqualTo("4");
        assertThat(result.apiUsed()).isEqualTo("nvidia");
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(b.prompts).isEmpty();
        assertThat(runtime.started).isEmpty();
        assertThat(meterRegistry.counter("analyst.attempts", "provider", "nvidia", "outcome", "succeeded").count())
                .isEqualTo(1.0);
    }

    @Test
    void codeThenAnswer_feedsExecutionOutputBack() {
        runtime.onScript = ws -> new ContainerRuntime.ExecOutput(0, "2\n", "", false);
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "{\"code\": \"print(2)\", \"analysis\": \"printing\"}",
                "{\"final answer\": \"2\"}");

        AnalysisResult result = orchestrator(9, a).run(PROMPT, Map.of());

        assertThat(result.success()).isTrue();
        assertThat(result.finalAnswer()).isEqualTo("2");
        assertThat(result.iterations()).isEqualTo(2);

        String feedback = a.prompts.get(1);
        assertThat(feedback).startsWith("Original Question:\n" + PROMPT);
        assertThat(feedback).contains("Iteration 1\nModel output:\n{\"code\": \"print(2)\"");
        assertThat(feedback).contains("Execution Results:\nsuccess: true\nstdout:\n2\nexit_code: 0");
        assertThat(runtime.removed).containsExactly("container-1");
        assertThat(sandbox.openSessionCount()).isZero();
    }

    @Test
    void structuredAnswer_isReturnedAsStructure() {
        ScriptedProvider a = new ScriptedProvider("nvidia", "{\"final answer\": {\"mean\": 2.5, \"n\": 4}}");

        AnalysisResult result = orchestrator(9, a).run(PROMPT, Map.of());

        assertThat(result.finalAnswer()).isEqualTo(Map.of("mean", 2.5, "n", 4));
    }

    @Test
    void codeIterations_shareOneSandboxSession() {
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "{\"code\": \"import pandas\"}",
                "{\"code\": \"import pandas\\nprint(1)\"}",
                "{\"final answer\": \"done\"}");

        AnalysisResult result = orchestrator(9, a).run(PROMPT, Map.of());

        assertThat(result.iterations()).isEqualTo(3);
        assertThat(runtime.started).containsExactly("container-1");
        assertThat(runtime.commandsOf("pip")).hasSize(1);
        assertThat(runtime.commandsOf("python")).hasSize(2);
        assertThat(a.prompts.get(2)).contains("Iteration 1").contains("---").contains("Iteration 2");
    }

    @Test
    void continuation_repromptsWithPreviousOutput() {
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "Let me think about the data first.",
                "{\"final answer\": \"4\"}");

        AnalysisResult result = orchestrator(9, a).run(PROMPT, Map.of());

        assertThat(result.success()).isTrue();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(a.prompts.get(1)).isEqualTo(PROMPT
                + "\n\nPrevious response:\nLet me think about the data first."
                + "\n\nPlease provide the final answer or executable code.");
        assertThat(runtime.started).isEmpty();
    }

    // ------------------------------------------------------------------
    // Failure and fallback
    // ------------------------------------------------------------------

    @Test
    void allProvidersSilent_failsNamingEveryProvider() {
        ScriptedProvider a = new ScriptedProvider("nvidia", (String) null);
        ScriptedProvider b = new ScriptedProvider("gemini", (String) null);
        ScriptedProvider c = new ScriptedProvider("openai", (String) null);

        AnalysisResult result = orchestrator(9, a, b, c).run(PROMPT, Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("All APIs (nvidia, gemini, openai) failed to provide a response");
        assertThat(result.apiUsed()).isNull();
        assertThat(List.of(a, b, c)).allSatisfy(p -> assertThat(p.prompts).hasSize(1));
    }

    @Test
    void firstProviderFails_fallsBackToNext() {
        ScriptedProvider a = new ScriptedProvider("nvidia", (String) null);
        ScriptedProvider b = new ScriptedProvider("gemini", "{\"final answer\": \"4\"}");

        AnalysisResult result = orchestrator(9, a, b).run(PROMPT, Map.of());

        assertThat(result.success()).isTrue();
        assertThat(result.apiUsed()).isEqualTo("gemini");
        assertThat(b.prompts).containsExactly(PROMPT);
    }

    @Test
    void iterationCap_endsAttemptAndFallsBack() {
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "{\"code\": \"print(1)\"}", "{\"code\": \"print(2)\"}", "{\"code\": \"print(3)\"}",
                "{\"final answer\": \"never reached\"}");
        ScriptedProvider b = new ScriptedProvider("gemini", "{\"final answer\": \"4\"}");
        FeedbackOrchestrator orchestrator = orchestrator(3, a, b);

        AnalysisResult attempt = orchestrator.runAttempt(a, PROMPT, Map.of());
        assertThat(attempt.success()).isFalse();
        assertThat(attempt.error()).isEqualTo("Maximum iterations (3) reached for nvidia");
        assertThat(attempt.iterations()).isEqualTo(3);
        assertThat(a.prompts).hasSize(3);
        assertThat(sandbox.openSessionCount()).isZero();

        assertThat(orchestrator.runAttempt(b, PROMPT, Map.of()).apiUsed()).isEqualTo("gemini");
    }

    @Test
    void attemptDeadline_stopsBeforeNextProviderCall() {
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "{\"code\": \"print(1)\"}", "{\"code\": \"print(2)\"}", "{\"final answer\": \"late\"}");
        a.eachCallTakes = Duration.ofSeconds(200);

        AnalysisResult result = orchestrator(9, a).runAttempt(a, PROMPT, Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Global deadline exceeded for nvidia");
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(a.prompts).hasSize(2);
        assertThat(runtime.removed).containsExactly("container-1");
    }

    @Test
    void noProviders_failsImmediately() {
        AnalysisResult result = orchestrator(9).run(PROMPT, Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("No LLM providers are configured");
    }

    @Test
    void failedScript_isReportedToModelNotToCaller() {
        runtime.onScript = ws -> new ContainerRuntime.ExecOutput(1, "", "NameError: name 'x' is not defined", false);
        ScriptedProvider a = new ScriptedProvider("nvidia",
                "{\"code\": \"print(x)\"}",
                "{\"final answer\": \"recovered\"}");

        AnalysisResult result = orchestrator(9, a).run(PROMPT, Map.of());

        assertThat(result.success()).isTrue();
        assertThat(a.prompts.get(1)).contains("success: false").contains("NameError").contains("exit_code: 1");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private FeedbackOrchestrator orchestrator(int maxIterations, ProviderClient... providers) {
        return new FeedbackOrchestrator(
                Arrays.asList(providers),
                new ResponseParser(new ObjectMapper()),
                sandbox,
                new PromptBuilder(),
                new FeedbackOrchestrator.Settings(maxIterations, Duration.ofSeconds(300), true),
                clock,
                meterRegistry);
    }

    /** Provider that returns scripted replies in order, then null. */
    class ScriptedProvider implements ProviderClient {

        final String        name;
        final Deque<String> replies = new ArrayDeque<>();
        final List<String>  prompts = new ArrayList<>();
        Duration            eachCallTakes = Duration.ZERO;

        ScriptedProvider(String name, String... replies) {
            this.name = name;
            for (String r : replies) {
                // ArrayDeque rejects null; an empty string stands for "no response".
                this.replies.add(r == null ? "" : r);
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String invoke(String prompt) {
            prompts.add(prompt);
            clock.advance(eachCallTakes);
            String reply = replies.poll();
            return reply == null || reply.isEmpty() ? null : reply;
        }
    }
}
