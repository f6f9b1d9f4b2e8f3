package com.ryuqq.devloop.core.contract;

import com.ryuqq.devloop.core.model.ActorName;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Actor 사이에서 교환되는 메시지.
 *
 * <p>모든 조정은 메시지 교환으로 이루어집니다. Orchestrator도 {@link ActorName#ORCHESTRATOR}
 * 주소를 가진 하나의 수신자입니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>id: 메시지 고유 ID (중복 수신 제거에 사용)</li>
 *   <li>sender / recipient: 송수신 Actor</li>
 *   <li>kind: 메시지 종류 ({@link MessageKinds})</li>
 *   <li>body: 자유 형식 본문</li>
 *   <li>attributes: 구조화된 부가 정보 (findingId, severity 등)</li>
 * </ul>
 *
 * @param id 메시지 ID
 * @param sender 송신자
 * @param recipient 수신자
 * @param kind 메시지 종류
 * @param body 본문 (빈 문자열 허용)
 * @param attributes 속성 (불변)
 * @param sentAt 송신 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    String id,
    ActorName sender,
    ActorName recipient,
    String kind,
    String body,
    Map<String, String> attributes,
    Instant sentAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (sentAt == null) {
            throw new IllegalArgumentException("sentAt cannot be null");
        }
        body = body == null ? "" : body;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 새 ID로 메시지 생성.
     *
     * @param sender 송신자
     * @param recipient 수신자
     * @param kind 메시지 종류
     * @param body 본문
     * @param attributes 속성
     * @param sentAt 송신 시각
     * @return Message 인스턴스
     */
    public static Message of(ActorName sender, ActorName recipient, String kind, String body,
                             Map<String, String> attributes, Instant sentAt) {
        return new Message(UUID.randomUUID().toString(), sender, recipient, kind, body, attributes, sentAt);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값, 없으면 null
     */
    public String attribute(String key) {
        return attributes.get(key);
    }

    /**
     * 필수 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값
     * @throws IllegalArgumentException 속성이 없거나 비어있는 경우
     */
    public String requireAttribute(String key) {
        String value = attributes.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                String.format("Message %s (%s) is missing attribute '%s'", id, kind, key)
            );
        }
        return value;
    }

    /**
     * 속성 하나를 추가한 사본 생성.
     *
     * @param key 속성 키
     * @param value 속성 값
     * @return 새 Message (같은 id)
     */
    public Message withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new Message(id, sender, recipient, kind, body, copy, sentAt);
    }

    public boolean isKind(String candidate) {
        return kind.equals(candidate);
    }
}
