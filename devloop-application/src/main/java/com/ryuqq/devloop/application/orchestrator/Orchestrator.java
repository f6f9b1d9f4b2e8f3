package com.ryuqq.devloop.application.orchestrator;

/**
 * 개발 루프 세션 조정자.
 *
 * <p>변경 요청 하나를 planning → implementation → validation → review → reflection 순서로
 * 진행시킵니다. 각 단계는 게이트가 충족될 때만 넘어갑니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SessionHandle handle = orchestrator.start(
 *     StartRequest.of("Add rate limiting to the global controller", Mode.FULL));
 *
 * if (handle.isCompleted()) {
 *     // COMPLETE
 * } else {
 *     EscalationReport report = handle.getEscalationOrNull();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 세션 시작 및 종료까지 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>specialist 선택 (override 또는 키워드 분류)</li>
     *   <li>모드 적격성 판정, 시작 마커 기록, 로스터 생성</li>
     *   <li>단계별 게이트 대기</li>
     *   <li>COMPLETE, ABANDONED 또는 사람 판단 대기로 종료</li>
     * </ol>
     *
     * @param request 시작 요청
     * @return 종료된 세션 핸들
     * @throws com.ryuqq.devloop.core.classify.SpecialistSelectionException specialist가 모호한 경우
     * @throws IllegalArgumentException 이어받을 세션을 찾을 수 없는 경우
     * @throws SessionInterruptedException 실행 중 인터럽트된 경우 (세션 기록은 이어받기 가능한 상태로 남음)
     */
    SessionHandle start(StartRequest request);
}
