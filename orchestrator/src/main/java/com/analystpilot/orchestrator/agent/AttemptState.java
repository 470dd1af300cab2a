package com.analystpilot.orchestrator.agent;

/**
 * States of one provider attempt in the {@link FeedbackOrchestrator}.
 *
 * <pre>
 *   SELECT_PROVIDER → AWAIT_RESPONSE → DISPATCH ─┬→ SUCCEEDED
 *                          ↑                     ├→ EXECUTE → BUILD_FEEDBACK ─┐
 *                          │                     └→ BUILD_FEEDBACK ───────────┤
 *                          └──────────────────────────────────────────────────┘
 *   any state → FAILED (provider null, deadline passed, iteration cap)
 * </pre>
 */
public enum AttemptState {
    SELECT_PROVIDER,
    AWAIT_RESPONSE,
    DISPATCH,
    EXECUTE,
    BUILD_FEEDBACK,
    SUCCEEDED,
    FAILED
}
