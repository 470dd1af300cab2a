package com.analystpilot.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the reply as a JSON object, after removing a code fence that wraps
 * the whole text ({@code ```json ... ```} or a bare {@code ``` ... ```}).
 *
 * <ul>
 *   <li>{@code {"final answer": <any>}} → FINAL_ANSWER</li>
 *   <li>{@code {"code": <string|array|scalar>, "analysis": <optional>}} → CODE</li>
 * </ul>
 *
 * Anything else (invalid JSON, trailing content after the object, not an
 * object, no known key) is no match.
 */
public class StrictJsonTier implements ParseTier {

    static final String FINAL_ANSWER_KEY = "final answer";
    static final String CODE_KEY         = "code";
    static final String ANALYSIS_KEY     = "analysis";

    private static final Pattern LEADING_FENCE  = Pattern.compile("^```[A-Za-z0-9_+-]*[ \\t]*\\R?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\R?[ \\t]*```$");

    private final ObjectMapper json;
    private final ObjectReader reader;

    public StrictJsonTier(ObjectMapper objectMapper) {
        this.json   = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public Optional<ParsedResponse> tryParse(String raw) {
        JsonNode root;
        try {
            root = reader.readTree(stripFences(raw));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode answer = root.get(FINAL_ANSWER_KEY);
        if (answer != null && !answer.isNull()) {
            String content = answer.isTextual() ? answer.asText() : answer.toString();
            return Optional.of(ParsedResponse.finalAnswer(content, toValue(answer), raw));
        }

        JsonNode code = root.get(CODE_KEY);
        if (code != null && !code.isNull()) {
            List<String> blocks = codeBlocks(code);
            if (blocks.isEmpty()) {
                return Optional.empty();
            }
            JsonNode analysis = root.get(ANALYSIS_KEY);
            String analysisText = analysis == null || analysis.isNull()
                    ? null
                    : analysis.isTextual() ? analysis.asText() : analysis.toString();
            return Optional.of(ParsedResponse.code(blocks, analysisText, raw));
        }

        return Optional.empty();
    }

    /** Remove one fence pair around the whole text, with or without a language tag. */
    static String stripFences(String text) {
        String t = text.strip();
        if (t.startsWith("```")) {
            t = LEADING_FENCE.matcher(t).replaceFirst("");
        }
        if (t.endsWith("```")) {
            t = TRAILING_FENCE.matcher(t).replaceFirst("");
        }
        return t.strip();
    }

    /** String → one block; array → one block per element; any other scalar → its text. */
    private static List<String> codeBlocks(JsonNode code) {
        List<String> blocks = new ArrayList<>();
        if (code.isArray()) {
            for (JsonNode element : code) {
                blocks.add(element.isTextual() ? element.asText() : element.toString());
            }
        } else if (code.isTextual()) {
            blocks.add(code.asText());
        } else {
            blocks.add(code.toString());
        }
        return blocks;
    }

    private Object toValue(JsonNode node) {
        try {
            return json.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }
}
