package com.ryuqq.devloop.core.actor;

import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.model.ActorName;

/**
 * 메일박스를 가진 독립 참여자.
 *
 * <p>런타임은 Actor 하나당 한 번에 하나의 메시지만 전달합니다. 따라서 구현체는 내부 상태에 대해
 * 동기화할 필요가 없습니다.</p>
 *
 * <p>{@link #onMessage}에서 발생한 예외는 처리 실패로 간주되어 메시지가 재전달됩니다.
 * 전달 한도를 넘으면 dead-letter로 이동합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Actor {

    /**
     * Actor 주소.
     *
     * @return 이름
     */
    ActorName name();

    /**
     * 메시지 처리.
     *
     * @param message 수신 메시지
     * @param context 응답 전송에 사용하는 컨텍스트
     */
    void onMessage(Message message, ActorContext context);
}
