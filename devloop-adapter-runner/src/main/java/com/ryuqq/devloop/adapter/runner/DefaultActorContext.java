package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.core.actor.ActorContext;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.contract.MessageKinds;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.spi.MessageBus;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bus에 직접 송신하는 ActorContext.
 *
 * <p>처리 중인 메시지의 sessionId 속성을 기억했다가, 그 처리 중에 보내는 메시지에
 * 같은 sessionId를 붙입니다. Actor가 직접 지정한 sessionId는 덮어쓰지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DefaultActorContext implements ActorContext {

    private final ActorName self;
    private final MessageBus bus;
    private final Clock clock;
    private volatile String sessionId;

    DefaultActorContext(ActorName self, MessageBus bus, Clock clock) {
        this.self = self;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * 처리할 메시지의 세션에 컨텍스트를 묶음.
     *
     * @param trigger 처리할 메시지
     */
    void bind(Message trigger) {
        String attribute = trigger.attribute(MessageKinds.ATTR_SESSION_ID);
        if (attribute != null) {
            this.sessionId = attribute;
        }
    }

    @Override
    public ActorName self() {
        return self;
    }

    @Override
    public void send(ActorName recipient, String kind, String body, Map<String, String> attributes) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        bus.send(Message.of(self, recipient, kind, body, stamped(attributes), clock.instant()));
    }

    private Map<String, String> stamped(Map<String, String> attributes) {
        String current = sessionId;
        if (current == null || (attributes != null && attributes.containsKey(MessageKinds.ATTR_SESSION_ID))) {
            return attributes;
        }
        Map<String, String> copy = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
        copy.put(MessageKinds.ATTR_SESSION_ID, current);
        return copy;
    }
}
