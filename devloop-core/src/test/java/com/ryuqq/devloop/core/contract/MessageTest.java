package com.ryuqq.devloop.core.contract;

import com.ryuqq.devloop.core.model.ActorName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Message 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MessageTest {

    private static final ActorName REVIEWER = ActorName.of("security");

    @Test
    void of_AssignsUniqueIds() {
        Message first = Message.of(REVIEWER, ActorName.ORCHESTRATOR, MessageKinds.VERDICT, "", Map.of(), Instant.now());
        Message second = Message.of(REVIEWER, ActorName.ORCHESTRATOR, MessageKinds.VERDICT, "", Map.of(), Instant.now());

        assertNotEquals(first.id(), second.id());
    }

    @Test
    void constructor_CopiesAttributes() {
        // given
        Map<String, String> attributes = new HashMap<>();
        attributes.put(MessageKinds.ATTR_VERDICT, "CLEAR");

        // when
        Message message = Message.of(REVIEWER, ActorName.ORCHESTRATOR, MessageKinds.VERDICT, null, attributes, Instant.now());
        attributes.put(MessageKinds.ATTR_VERDICT, "ESCALATED");

        // then
        assertEquals("CLEAR", message.attribute(MessageKinds.ATTR_VERDICT));
        assertEquals("", message.body());
        assertThrows(UnsupportedOperationException.class, () -> message.attributes().put("x", "y"));
    }

    @Test
    void requireAttribute_Missing_ThrowsWithKind() {
        Message message = Message.of(REVIEWER, ActorName.ORCHESTRATOR, MessageKinds.FINDING_RAISED, "leak", Map.of(), Instant.now());

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> message.requireAttribute(MessageKinds.ATTR_SEVERITY)
        );
        assertTrue(exception.getMessage().contains(MessageKinds.FINDING_RAISED));
    }

    @Test
    void withAttribute_KeepsIdentity() {
        Message message = Message.of(REVIEWER, ActorName.ORCHESTRATOR, MessageKinds.VERDICT, "", Map.of(), Instant.now());

        Message stamped = message.withAttribute(MessageKinds.ATTR_REVISION, "3");

        assertEquals(message.id(), stamped.id());
        assertEquals("3", stamped.attribute(MessageKinds.ATTR_REVISION));
        assertNull(message.attribute(MessageKinds.ATTR_REVISION));
    }
}
