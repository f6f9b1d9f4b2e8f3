package com.ryuqq.devloop.core.actor;

import com.ryuqq.devloop.core.model.ActorName;

import java.util.Map;

/**
 * Actor가 메시지 처리 중 사용하는 런타임 컨텍스트.
 *
 * <p>Actor는 이 컨텍스트를 통해서만 다른 Actor(또는 Orchestrator)에게 메시지를 보냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ActorContext {

    /**
     * 현재 Actor 이름.
     *
     * @return 자기 자신의 주소
     */
    ActorName self();

    /**
     * 메시지 전송.
     *
     * @param recipient 수신자
     * @param kind 메시지 종류
     * @param body 본문
     * @param attributes 속성
     */
    void send(ActorName recipient, String kind, String body, Map<String, String> attributes);

    default void send(ActorName recipient, String kind, String body) {
        send(recipient, kind, body, Map.of());
    }

    /**
     * Orchestrator에게 전송.
     *
     * @param kind 메시지 종류
     * @param body 본문
     * @param attributes 속성
     */
    default void tellOrchestrator(String kind, String body, Map<String, String> attributes) {
        send(ActorName.ORCHESTRATOR, kind, body, attributes);
    }
}
