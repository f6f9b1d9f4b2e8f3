/**
 * Session outcomes.
 *
 * <p>A finished session ends in exactly one
 * {@link com.ryuqq.devloop.core.outcome.SessionOutcome}. Abandoned and escalated outcomes always
 * carry an {@link com.ryuqq.devloop.core.outcome.EscalationReport}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.outcome;
