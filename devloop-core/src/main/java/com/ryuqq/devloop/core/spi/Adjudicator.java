package com.ryuqq.devloop.core.spi;

import com.ryuqq.devloop.core.finding.Finding;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.EscalationReport;

import java.util.List;

/**
 * Resolves review escalations.
 *
 * <p>Called by the orchestrator whenever at least one reviewer's effective verdict is
 * ESCALATED. Implementations may ask a human, apply a policy or delegate to another model.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Adjudicator {

    /**
     * Decides how to proceed.
     *
     * @param sessionId the session
     * @param report what is escalated and why
     * @param escalated findings in ESCALATED status
     * @return the decision
     */
    AdjudicationDecision adjudicate(SessionId sessionId, EscalationReport report, List<Finding> escalated);
}
