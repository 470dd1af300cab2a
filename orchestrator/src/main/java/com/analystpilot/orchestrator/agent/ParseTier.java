package com.analystpilot.orchestrator.agent;

import java.util.Optional;

/**
 * One strategy in the {@link ResponseParser}'s ordered chain.
 *
 * A tier either recognises the reply or returns empty so the next tier can
 * try. Tiers never throw.
 */
public interface ParseTier {

    /**
     * @param raw the reply exactly as the provider returned it; never blank
     */
    Optional<ParsedResponse> tryParse(String raw);
}
