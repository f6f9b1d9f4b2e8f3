package com.ryuqq.devloop.core.actor;

/**
 * 세션 로스터의 정의로부터 Actor를 생성.
 *
 * <p>구현자는 선택된 specialist 라벨을 받아 해당 전문 분야로 구성됩니다.
 * 리뷰어에게는 specialist가 참고 정보로만 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActorFactory {

    /**
     * Actor 생성.
     *
     * @param spec 로스터 정의
     * @param specialist 세션에 선택된 specialist 라벨
     * @return 새 Actor (spec.name()과 같은 이름)
     */
    Actor create(ActorSpec spec, String specialist);
}
