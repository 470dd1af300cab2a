package com.analystpilot.orchestrator.agent;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort extraction for replies that embed the expected object in prose
 * or break JSON quoting elsewhere.
 *
 * Looks for a brace-delimited fragment containing {@code "final answer": "..."},
 * then for one containing {@code "code": "..."} (with an optional
 * {@code "analysis": "..."}). Captured values are used verbatim: escape
 * sequences are not decoded.
 */
public class PatternFallbackTier implements ParseTier {

    private static final Pattern FINAL_ANSWER = Pattern.compile(
            "\\{[^}]*\"final answer\"\\s*:\\s*\"([^\"]+)\"[^}]*\\}");

    private static final Pattern CODE = Pattern.compile(
            "\\{[^}]*\"code\"\\s*:\\s*\"([^\"]+)\"[^}]*\\}", Pattern.DOTALL);

    private static final Pattern ANALYSIS = Pattern.compile(
            "\\{[^}]*\"analysis\"\\s*:\\s*\"([^\"]+)\"[^}]*\\}", Pattern.DOTALL);

    @Override
    public Optional<ParsedResponse> tryParse(String raw) {
        String text = raw.strip();

        Matcher answer = FINAL_ANSWER.matcher(text);
        if (answer.find()) {
            String value = answer.group(1);
            return Optional.of(ParsedResponse.finalAnswer(value, value, raw));
        }

        Matcher code = CODE.matcher(text);
        if (code.find()) {
            Matcher analysis = ANALYSIS.matcher(text);
            String analysisText = analysis.find() ? analysis.group(1) : null;
            return Optional.of(ParsedResponse.code(List.of(code.group(1)), analysisText, raw));
        }

        return Optional.empty();
    }
}
