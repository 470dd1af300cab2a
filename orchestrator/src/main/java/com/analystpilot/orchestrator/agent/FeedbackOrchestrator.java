package com.analystpilot.orchestrator.agent;

import com.analystpilot.orchestrator.executor.ExecutionResult;
import com.analystpilot.orchestrator.executor.SandboxExecutor;
import com.analystpilot.orchestrator.executor.SandboxSession;
import com.analystpilot.orchestrator.provider.ProviderClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The feedback loop that turns a question into an answer.
 *
 * Providers are tried one after another in configured order. Against each
 * provider this class runs an <em>attempt</em>:
 *   → send the prompt
 *   → classify the reply
 *   → final answer? done
 *   → code? run it in the attempt's sandbox session, append the result to
 *     the history, re-prompt with the full history
 *   → anything else? re-prompt asking for an answer or code
 * until an answer arrives, the provider fails, the attempt deadline passes,
 * or the iteration cap is hit. The first attempt to produce a final answer
 * wins; if none does, the result names every provider that was tried.
 *
 * Iterations within an attempt are strictly sequential: each prompt depends
 * on the complete history before it.
 */
public class FeedbackOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FeedbackOrchestrator.class);

    private static final int PREVIEW_CHARS = 200;

    /**
     * @param maxIterations    hard cap on provider calls per attempt
     * @param attemptBudget    wall-clock budget of one attempt
     * @param keepSessionOpen  reuse one sandbox environment across the
     *                         iterations of an attempt (closed when the attempt ends)
     */
    public record Settings(int maxIterations, Duration attemptBudget, boolean keepSessionOpen) {
        public Settings {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
            }
        }
    }

    private final List<ProviderClient> providers;
    private final ResponseParser       parser;
    private final SandboxExecutor      sandbox;
    private final PromptBuilder        prompts;
    private final Settings             settings;
    private final Clock                clock;
    private final MeterRegistry        meterRegistry;

    public FeedbackOrchestrator(List<ProviderClient> providers,
                                ResponseParser parser,
                                SandboxExecutor sandbox,
                                PromptBuilder prompts,
                                Settings settings,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.providers     = List.copyOf(providers);
        this.parser        = parser;
        this.sandbox       = sandbox;
        this.prompts       = prompts;
        this.settings      = settings;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Answer the prompt, falling back across providers.
     *
     * @param initialPrompt full first prompt (system instructions + question)
     * @param manifest      file name → host path, copied into every sandbox
     */
    public AnalysisResult run(String initialPrompt, Map<String, Path> manifest) {
        if (providers.isEmpty()) {
            log.error("No LLM providers configured");
            return AnalysisResult.failed("No LLM providers are configured");
        }

        List<String> attempted = new ArrayList<>();
        for (ProviderClient provider : providers) {
            log.info("Trying provider '{}'", provider.name());
            MDC.put("provider", provider.name());
            try {
                AnalysisResult result = runAttempt(provider, initialPrompt, manifest);
                if (result.success()) {
                    return result;
                }
                log.warn("Provider '{}' attempt failed: {}", provider.name(), result.error());
            } finally {
                MDC.remove("provider");
            }
            attempted.add(provider.name());
        }

        log.error("All providers failed: {}", attempted);
        return AnalysisResult.failed(
                "All APIs (" + String.join(", ", attempted) + ") failed to provide a response");
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    AnalysisResult runAttempt(ProviderClient provider, String initialPrompt, Map<String, Path> manifest) {
        String  name     = provider.name();
        Instant deadline = clock.instant().plus(settings.attemptBudget());
        String  attemptId = name + "-" + UUID.randomUUID().toString().substring(0, 8);

        List<IterationRecord> history = new ArrayList<>();
        String currentPrompt = initialPrompt;
        SandboxSession session = null;
        AttemptState state = AttemptState.SELECT_PROVIDER;

        try {
            for (int iteration = 1; iteration <= settings.maxIterations(); iteration++) {
                MDC.put("iteration", String.valueOf(iteration));

                if (!clock.instant().isBefore(deadline)) {
                    return fail(name, iteration - 1, state, "Global deadline exceeded for " + name);
                }

                state = transition(state, AttemptState.AWAIT_RESPONSE);
                log.info("Provider '{}' iteration {}/{}", name, iteration, settings.maxIterations());
                log.debug("Prompt preview: {}", preview(currentPrompt));

                String output = provider.invoke(currentPrompt);
                if (output == null || output.isBlank()) {
                    return fail(name, iteration, state, name + " returned no response");
                }
                log.debug("Raw output preview: {}", preview(output));

                state = transition(state, AttemptState.DISPATCH);
                ParsedResponse parsed = parser.parse(output);
                log.info("Provider '{}' replied with {}", name, parsed.kind());

                switch (parsed.kind()) {
                    case FINAL_ANSWER -> {
                        transition(state, AttemptState.SUCCEEDED);
                        count(name, "succeeded");
                        log.info("Provider '{}' answered after {} iteration(s)", name, iteration);
                        Object answer = parsed.answer() != null ? parsed.answer() : parsed.content();
                        return AnalysisResult.succeeded(answer, name, iteration);
                    }
                    case CODE -> {
                        state = transition(state, AttemptState.EXECUTE);
                        if (session == null) {
                            session = sandbox.openSession(attemptId, manifest);
                        }
                        log.info("Executing {} code block(s)", parsed.codeBlocks().size());
                        ExecutionResult execution =
                                sandbox.execute(session, parsed.codeBlocks(), settings.keepSessionOpen());
                        history.add(new IterationRecord(iteration, output, execution));

                        state = transition(state, AttemptState.BUILD_FEEDBACK);
                        currentPrompt = prompts.feedbackPrompt(initialPrompt, history);
                    }
                    case CONTINUATION -> {
                        state = transition(state, AttemptState.BUILD_FEEDBACK);
                        currentPrompt = prompts.continuationPrompt(initialPrompt, output);
                    }
                }
            }

            return fail(name, settings.maxIterations(), state,
                    "Maximum iterations (" + settings.maxIterations() + ") reached for " + name);
        } finally {
            if (session != null) {
                sandbox.close(session);
            }
            MDC.remove("iteration");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AnalysisResult fail(String provider, int iterations, AttemptState from, String error) {
        transition(from, AttemptState.FAILED);
        count(provider, "failed");
        return AnalysisResult.failed(provider, iterations, error);
    }

    private AttemptState transition(AttemptState from, AttemptState to) {
        log.debug("Attempt state {} -> {}", from, to);
        return to;
    }

    private void count(String provider, String outcome) {
        meterRegistry.counter("analyst.attempts", "provider", provider, "outcome", outcome).increment();
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }
}
