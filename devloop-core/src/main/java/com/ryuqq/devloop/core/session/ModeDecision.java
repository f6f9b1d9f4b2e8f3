package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.check.ArtifactKind;
import com.ryuqq.devloop.core.model.Mode;

import java.util.List;
import java.util.Set;

/**
 * 모드 적격성 판정 결과.
 *
 * @param requested 요청된 모드
 * @param effective 실제 적용 모드
 * @param sensitiveKinds 발견된 민감 산출물 종류
 * @param sensitivePaths 민감 경로
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModeDecision(
    Mode requested,
    Mode effective,
    Set<ArtifactKind> sensitiveKinds,
    List<String> sensitivePaths
) {

    public ModeDecision {
        sensitiveKinds = Set.copyOf(sensitiveKinds);
        sensitivePaths = List.copyOf(sensitivePaths);
    }

    /**
     * LIGHTWEIGHT 요청이 FULL로 전환되었는지 확인.
     *
     * @return 전환되었으면 true
     */
    public boolean fellBack() {
        return requested != effective;
    }

    public String auditNote() {
        return "Lightweight mode rejected: change touches " + sensitiveKinds.stream().sorted().toList()
            + " via " + sensitivePaths + "; falling back to full mode";
    }
}
