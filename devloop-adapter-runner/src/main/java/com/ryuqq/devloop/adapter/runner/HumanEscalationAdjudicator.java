package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.core.finding.Finding;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.spi.AdjudicationDecision;
import com.ryuqq.devloop.core.spi.Adjudicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 모든 에스컬레이션을 사람에게 넘기는 기본 Adjudicator.
 *
 * <p>자동 판정 규칙이 없는 환경의 기본값입니다. 세션은 Escalated 결과로 멈춥니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HumanEscalationAdjudicator implements Adjudicator {

    private static final Logger log = LoggerFactory.getLogger(HumanEscalationAdjudicator.class);

    @Override
    public AdjudicationDecision adjudicate(SessionId sessionId, EscalationReport report, List<Finding> escalated) {
        log.warn("Session {} needs a human decision: {} ({} escalated finding(s))",
            sessionId.getValue(), report.summary(), escalated.size());
        return AdjudicationDecision.DEFER_TO_HUMAN;
    }
}
