package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.adapter.inmemory.workspace.InMemoryWorkspace;
import com.ryuqq.devloop.application.recovery.RollbackMode;
import com.ryuqq.devloop.application.recovery.RollbackResult;
import com.ryuqq.devloop.core.actor.ActorSpec;
import com.ryuqq.devloop.core.actor.ReviewerDomain;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.outcome.EscalationKind;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.session.Session;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * SessionRecovery 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SessionRecoveryTest {

    private static final SessionId SESSION_ID = SessionId.of("s-1");

    @Mock
    private SessionStore store;

    private InMemoryWorkspace workspace;
    private SessionRecovery recovery;
    private StartMarker marker;

    @BeforeEach
    void setUp() {
        workspace = new InMemoryWorkspace();
        workspace.write("src/App.java", "class App {}");
        marker = workspace.mark();
        workspace.write("src/App.java", "class App { RateLimiter limiter; }");
        workspace.write("src/RateLimiter.java", "class RateLimiter {}");
        recovery = new SessionRecovery(store, workspace);
    }

    private SessionRecord record(boolean ended) {
        Session session = Session.create(SESSION_ID, "Add rate limiting", Mode.FULL, "global-controller",
            List.of(ActorSpec.implementer(ActorName.of("implementer")),
                ActorSpec.reviewer(ActorName.of("security"), ReviewerDomain.SECURITY)),
            marker, null, Clock.systemUTC());
        if (ended) {
            session.abandon("validation failed 3 times",
                new EscalationReport(EscalationKind.VALIDATION_FAILURE, "failed", null, null, null));
        }
        return session.toRecord(Map.of());
    }

    @Test
    void rollback_HARD_시작마커와_동일해짐() {
        // given
        when(store.find(SESSION_ID)).thenReturn(Optional.of(record(true)));

        // when
        RollbackResult result = recovery.rollback(SESSION_ID, RollbackMode.HARD);

        // then
        assertThat(result.before().paths()).containsExactly("src/App.java", "src/RateLimiter.java");
        assertThat(result.after().isEmpty()).isTrue();
        assertThat(workspace.files()).containsExactly("src/App.java");
        assertThat(workspace.read("src/App.java")).contains("class App {}");
    }

    @Test
    void rollback_SOFT_작업을_보존하고_되돌림() {
        // given
        when(store.find(SESSION_ID)).thenReturn(Optional.of(record(true)));

        // when
        RollbackResult result = recovery.rollback(SESSION_ID, RollbackMode.SOFT);

        // then
        assertThat(result.preservedAt()).isNotBlank();
        assertThat(result.after().isEmpty()).isTrue();

        workspace.hardRevert(new StartMarker(result.preservedAt(), marker.branch(), marker.markedAt()));
        assertThat(workspace.read("src/RateLimiter.java")).contains("class RateLimiter {}");
    }

    @Test
    void rollback_INSPECT_작업트리를_바꾸지_않음() {
        // given
        when(store.find(SESSION_ID)).thenReturn(Optional.of(record(false)));

        // when
        RollbackResult result = recovery.rollback(SESSION_ID, RollbackMode.INSPECT);

        // then
        assertThat(result.before().paths()).hasSize(2);
        assertThat(result.preservedAt()).isNull();
        assertThat(workspace.files()).containsExactly("src/App.java", "src/RateLimiter.java");
    }

    @Test
    void rollback_진행중_세션은_HARD_거부() {
        when(store.find(SESSION_ID)).thenReturn(Optional.of(record(false)));

        assertThatThrownBy(() -> recovery.rollback(SESSION_ID, RollbackMode.HARD))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("active session");
        assertThat(workspace.files()).hasSize(2);
    }

    @Test
    void rollback_알수없는_세션이면_예외() {
        when(store.find(SESSION_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> recovery.rollback(SESSION_ID, RollbackMode.INSPECT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown session");
    }
}
