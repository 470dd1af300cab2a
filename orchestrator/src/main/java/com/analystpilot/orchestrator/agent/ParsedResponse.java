package com.analystpilot.orchestrator.agent;

import java.util.List;
import java.util.Objects;

/**
 * A model reply after classification.
 *
 * <ul>
 *   <li>{@link Kind#FINAL_ANSWER}: {@code content} is the answer as text,
 *       {@code answer} keeps the original structured value (string, number,
 *       map, list).</li>
 *   <li>{@link Kind#CODE}: {@code codeBlocks} is never empty; {@code content}
 *       is the blocks joined.</li>
 *   <li>{@link Kind#CONTINUATION}: nothing usable was found; {@code content}
 *       is the raw text and {@code requiresFollowup} is set.</li>
 * </ul>
 *
 * Use the static factories; they enforce these invariants.
 */
public record ParsedResponse(
        Kind         kind,
        String       content,
        Object       answer,
        List<String> codeBlocks,
        String       analysis,
        String       raw,
        boolean      requiresFollowup
) {
    public enum Kind { FINAL_ANSWER, CODE, CONTINUATION }

    public ParsedResponse {
        Objects.requireNonNull(kind, "kind");
        codeBlocks = codeBlocks == null ? List.of() : List.copyOf(codeBlocks);
        raw        = raw == null ? "" : raw;
    }

    public static ParsedResponse finalAnswer(String content, Object answer, String raw) {
        Objects.requireNonNull(content, "final answer content");
        return new ParsedResponse(Kind.FINAL_ANSWER, content, answer, List.of(), null, raw, false);
    }

    public static ParsedResponse code(List<String> codeBlocks, String analysis, String raw) {
        if (codeBlocks == null || codeBlocks.isEmpty()) {
            throw new IllegalArgumentException("a code reply needs at least one code block");
        }
        return new ParsedResponse(Kind.CODE, String.join("\n\n", codeBlocks), null,
                codeBlocks, analysis, raw, false);
    }

    public static ParsedResponse continuation(String raw) {
        String text = raw == null ? "" : raw.strip();
        return new ParsedResponse(Kind.CONTINUATION, text, null, List.of(), null, raw, true);
    }
}
