package com.analystpilot.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a raw model reply as FINAL_ANSWER, CODE or CONTINUATION.
 *
 * Tiers run in order and the first match wins:
 * <ol>
 *   <li>empty reply → CONTINUATION (follow-up required)</li>
 *   <li>{@link StrictJsonTier}: the reply is (fenced) JSON with a known key</li>
 *   <li>{@link PatternFallbackTier}: a known key is embedded in free text</li>
 *   <li>otherwise → CONTINUATION carrying the raw text</li>
 * </ol>
 *
 * Parsing never throws, and re-parsing a CONTINUATION's content yields a
 * CONTINUATION again.
 */
public class ResponseParser {

    private final List<ParseTier> tiers;

    public ResponseParser(ObjectMapper objectMapper) {
        this(List.of(new StrictJsonTier(objectMapper), new PatternFallbackTier()));
    }

    public ResponseParser(List<ParseTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public ParsedResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedResponse.continuation(raw);
        }
        for (ParseTier tier : tiers) {
            Optional<ParsedResponse> parsed = tier.tryParse(raw);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return ParsedResponse.continuation(raw);
    }
}
