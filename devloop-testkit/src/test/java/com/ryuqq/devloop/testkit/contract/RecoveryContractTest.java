package com.ryuqq.devloop.testkit.contract;

import com.ryuqq.devloop.adapter.runner.HumanEscalationAdjudicator;
import com.ryuqq.devloop.adapter.runner.SessionOrchestrator;
import com.ryuqq.devloop.adapter.runner.SessionRecovery;
import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.application.orchestrator.StartRequest;
import com.ryuqq.devloop.application.recovery.RollbackMode;
import com.ryuqq.devloop.application.recovery.RollbackResult;
import com.ryuqq.devloop.core.actor.ReviewerDomain;
import com.ryuqq.devloop.core.finding.Severity;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.EscalationKind;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.statemachine.Phase;
import com.ryuqq.devloop.testkit.scripted.ScriptedImplementer;
import com.ryuqq.devloop.testkit.scripted.ScriptedReviewer;
import com.ryuqq.devloop.testkit.scripted.StubCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for rollback and session continuation.
 *
 * <p>This test validates that every session can be taken back to its start marker, and that
 * an interrupted or escalated session can be continued from SETUP.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>INSPECT reports the change without touching the workspace</li>
 *   <li>HARD restores the start state exactly; SOFT keeps the work at a preserved snapshot</li>
 *   <li>Rollback of a session that has not ended is refused</li>
 *   <li>Continuation reuses task and start marker and archives the previous record</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RecoveryContractTest extends AbstractContractTest {

    private static final String TASK = "Rename the routing table loader";
    private static final String CHANGED = "src/main/java/routing/TableLoader.java";

    private ScriptedImplementer implementer;
    private ScriptedReviewer security;
    private SessionRecovery recovery;

    @BeforeEach
    void setUpRecovery() {
        workspace.write("README.md", "routing service");
        implementer = implementer().withRound(Map.of(CHANGED, "class TableLoader {}"));
        recovery = new SessionRecovery(store, workspace);
    }

    private SessionHandle abandonedByValidation() {
        security = reviewer("security");
        actors.register(implementer).register(security);
        return orchestrator(
            List.of(reviewerSpec(security, ReviewerDomain.SECURITY)),
            List.of(StubCheck.failing("tests"))
        ).start(StartRequest.of(TASK, Mode.LIGHTWEIGHT));
    }

    private SessionOrchestrator escalatingOrchestrator() {
        implementer.defers("user-supplied", "This is a minor issue");
        security = reviewer("security")
            .raises("Loader reads files from a user-supplied path", Severity.HIGH)
            .rejectsDeferrals();
        actors.register(implementer).register(security);
        return orchestrator(
            List.of(reviewerSpec(security, ReviewerDomain.SECURITY)),
            List.of(StubCheck.passing("compile")),
            new HumanEscalationAdjudicator(), fastConfig()
        );
    }

    @Test
    void testRollback_Inspect_DoesNotModifyWorkspace() {
        // Given
        SessionHandle handle = abandonedByValidation();
        assertRecordedPhase(handle, Phase.ABANDONED);

        // When
        RollbackResult result = recovery.rollback(handle.getSessionId(), RollbackMode.INSPECT);

        // Then
        assertEquals(List.of(CHANGED), result.before().paths());
        assertEquals(result.before(), result.after());
        assertTrue(workspace.read(CHANGED).isPresent());
    }

    @Test
    void testRollback_Hard_RestoresStartState() {
        // Given
        SessionHandle handle = abandonedByValidation();

        // When
        RollbackResult result = recovery.rollback(handle.getSessionId(), RollbackMode.HARD);

        // Then: only the file that existed before the session remains
        assertEquals(List.of(CHANGED), result.before().paths());
        assertTrue(result.after().isEmpty());
        assertEquals(List.of("README.md"), workspace.files());
        assertEquals("routing service", workspace.read("README.md").orElseThrow());
    }

    @Test
    void testRollback_Soft_PreservesWork() {
        // Given
        SessionHandle handle = abandonedByValidation();

        // When
        RollbackResult result = recovery.rollback(handle.getSessionId(), RollbackMode.SOFT);

        // Then
        assertNotNull(result.preservedAt());
        assertEquals(List.of("README.md"), workspace.files());
    }

    @Test
    void testRollback_EscalatedSession_Refused() {
        // Given: escalated sessions are not ended
        SessionHandle handle = escalatingOrchestrator().start(StartRequest.of(TASK, Mode.LIGHTWEIGHT));
        assertTrue(handle.getOutcome().isEscalated());

        // When/Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> recovery.rollback(handle.getSessionId(), RollbackMode.HARD));
        assertTrue(exception.getMessage().contains("active session"));
        assertTrue(workspace.read(CHANGED).isPresent(), "Workspace must be untouched");
    }

    @Test
    void testContinue_EscalatedSession_ResumesWithSameTaskAndMarker() {
        // Given: first session escalated to a human
        SessionOrchestrator orchestrator = escalatingOrchestrator();
        SessionHandle first = orchestrator.start(StartRequest.of(TASK, Mode.LIGHTWEIGHT));
        assertTrue(first.getOutcome().isEscalated());
        SessionRecord before = record(first);

        // When: continued; the reviewer raises nothing new this time
        SessionHandle second = orchestrator.start(StartRequest.continuing(first.getSessionId(), Mode.LIGHTWEIGHT));

        // Then
        assertTrue(second.isCompleted(), "Continued session should complete: " + second);
        SessionRecord continued = record(second);
        assertEquals(first.getSessionId().getValue(), continued.continuedFrom());
        assertEquals(TASK, continued.task());
        assertEquals(before.startReference(), continued.startReference());
        assertEquals(before.specialist(), continued.specialist());

        SessionRecord archived = record(first);
        assertEquals("ABANDONED", archived.phase());
        assertTrue(archived.abandonReason().startsWith("interrupted; continued as " + second.getSessionId().getValue()));
        assertEquals(EscalationKind.SESSION_INTERRUPTION, archived.escalation().kind());

        // The previous session is ended now and cannot be continued again
        assertThrows(IllegalStateException.class,
            () -> orchestrator.start(StartRequest.continuing(first.getSessionId(), Mode.LIGHTWEIGHT)));
    }

    @Test
    void testContinue_UnknownSession_Rejected() {
        SessionOrchestrator orchestrator = escalatingOrchestrator();

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> orchestrator.start(StartRequest.continuing(SessionId.of("missing"), Mode.LIGHTWEIGHT)));

        assertTrue(exception.getMessage().contains("Unknown session to continue"));
    }
}
