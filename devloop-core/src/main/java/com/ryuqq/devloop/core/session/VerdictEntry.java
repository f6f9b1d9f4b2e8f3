package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.finding.Verdict;
import com.ryuqq.devloop.core.model.ActorName;

import java.time.Instant;

/**
 * 리뷰어 판정과 판정 당시의 변경 리비전.
 *
 * <p>판정 이후 리비전이 올라가면 (수정 발생) 해당 판정은 stale이 됩니다.</p>
 *
 * @param reviewer 리뷰어
 * @param stated 리뷰어가 보낸 판정
 * @param effective 원장 판정과 비교한 더 엄격한 판정
 * @param revision 판정 당시 리비전
 * @param at 판정 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VerdictEntry(
    ActorName reviewer,
    Verdict stated,
    Verdict effective,
    int revision,
    Instant at
) {

    public VerdictEntry {
        if (reviewer == null || stated == null || effective == null || at == null) {
            throw new IllegalArgumentException("VerdictEntry fields cannot be null");
        }
    }
}
