package com.analystpilot.orchestrator.agent;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds every prompt the feedback loop sends.
 *
 * The protocol is JSON-only: the model must answer with either
 * {@code {"final answer": ...}} or {@code {"code": ..., "analysis": ...}}.
 * {@link ResponseParser} is the other half of this contract.
 */
public class PromptBuilder {

    /**
     * First prompt of every attempt: system instructions, the question, and
     * the names of the files the scripts can open from their working directory.
     */
    public String initialPrompt(String question, Collection<String> fileNames) {
        List<String> names = fileNames.stream().sorted().toList();
        return SYSTEM_PROMPT
                + "\n\nQuestion: " + question.strip()
                + "\n\nFiles available for context:\n" + names;
    }

    /**
     * Prompt after a code iteration: the original prompt plus the complete
     * history of model outputs and execution results so far.
     */
    public String feedbackPrompt(String originalPrompt, List<IterationRecord> history) {
        String rendered = history.stream()
                .map(IterationRecord::render)
                .collect(Collectors.joining("\n\n---\n\n"));
        return """
                Original Question:
                %s

                Here is the full history of attempts so far:
                %s

                Now, based on this history, please either:
                1. Provide the **final answer** in JSON format: { "final answer": ... }
                2. OR, if more work is needed, provide only the next incremental code block in the format: {"code": <code to be executed>,
                "analysis": <brief description of further analysis made by you>}

                But try to construct efficient code at once.
                And if the received input is satisfactory, try to analyze and give the final answer at the earliest according to the format mentioned previously.
                """.formatted(originalPrompt, rendered);
    }

    /** Prompt after a reply that was neither an answer nor code. */
    public String continuationPrompt(String originalPrompt, String previousOutput) {
        return originalPrompt
                + "\n\nPrevious response:\n" + previousOutput
                + "\n\nPlease provide the final answer or executable code.";
    }

    // ------------------------------------------------------------------
    // System prompt
    // ------------------------------------------------------------------

    static final String SYSTEM_PROMPT = """
            You are a highly capable data analyst agent.

            You will receive:
            - A primary question
            - Optional additional files (data, SQL DB dumps, Parquet files, etc.) in your working directory

            Your objectives:
            1. Read and interpret the question carefully.
            2. If the question contains one or more URLs:
               - Determine the best way to retrieve and parse its content
                 (requests + BeautifulSoup for static HTML, httpx for APIs,
                 playwright for JS-heavy pages).
               - Handle pagination, nested links and subpages if needed.
               - Stay domain-agnostic; do not hardcode to a specific site.
            3. Handle any type of data source in the files: CSV, JSON, Parquet, SQL databases, Excel, etc.
            4. Break the task into subtasks. When a subtask needs code, write fully runnable Python 3.11 code.
            5. After running code and reading its results, compose the final user-facing answer.

            IMPORTANT:
            Your reply is consumed by a program, not a person. Reply with exactly ONE JSON object and nothing else.
            There are two kinds of reply:

            Final answer, in the format the question asks for:
            {"final answer": <THE ACTUAL ANSWER IN THE CORRECT FORMAT>}

            Code to execute, with your progress so far:
            {
            "code": <the Python code to run>,
            "analysis": <your analysis and progress so far>
            }

            Code runs in a sandbox; print() everything you need to see, it is returned to you on the next turn.
            Do not add explanations outside the JSON object.
            Try to answer within 30-40 seconds.
            """;
}
