package com.ryuqq.devloop.core.spi;

/**
 * Decision on an escalated review.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AdjudicationDecision {

    /** Override the reviewer and accept the deferrals as technical debt. */
    ACCEPT_DEFERRAL,

    /** Send the escalated findings back to the implementer. */
    ROUTE_BACK,

    /** Stop the session. */
    ABANDON,

    /** Stop and wait for a human; the session stays in review. */
    DEFER_TO_HUMAN
}
