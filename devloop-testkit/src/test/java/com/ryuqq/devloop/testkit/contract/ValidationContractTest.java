package com.ryuqq.devloop.testkit.contract;

import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.application.orchestrator.StartRequest;
import com.ryuqq.devloop.core.actor.ReviewerDomain;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.outcome.Abandoned;
import com.ryuqq.devloop.core.outcome.EscalationKind;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.statemachine.Phase;
import com.ryuqq.devloop.testkit.scripted.ScriptedImplementer;
import com.ryuqq.devloop.testkit.scripted.ScriptedReviewer;
import com.ryuqq.devloop.testkit.scripted.StubCheck;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the validation pipeline.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Short-circuit: layers after the first failure are skipped, not run</li>
 *   <li>Feedback: the implementer receives the failing layer and goes around again</li>
 *   <li>Bounded retry: three consecutive failures abandon the session, no fourth run</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValidationContractTest extends AbstractContractTest {

    private static final String TASK = "Rename the routing table loader";

    @Test
    void testValidation_FailingLayer_SkipsLaterLayersAndRetries() {
        // Given: tests fail once, then pass
        ScriptedImplementer implementer = implementer()
            .withRound(Map.of("src/main/java/routing/TableLoader.java", "class TableLoader { broken }"))
            .withRound(Map.of("src/main/java/routing/TableLoader.java", "class TableLoader {}"));
        ScriptedReviewer quality = reviewer("code-quality");
        actors.register(implementer).register(quality);

        StubCheck compile = StubCheck.passing("compile");
        StubCheck tests = StubCheck.sequence("tests", false, true);
        StubCheck lint = StubCheck.passing("lint");

        // When: checks are given out of order on purpose
        SessionHandle handle = orchestrator(
            List.of(reviewerSpec(quality, ReviewerDomain.CODE_QUALITY)),
            List.of(lint, tests, compile)
        ).start(StartRequest.of(TASK, Mode.LIGHTWEIGHT));

        // Then
        assertTrue(handle.isCompleted(), "Session should complete: " + handle);
        assertEquals(2, compile.runs());
        assertEquals(2, tests.runs());
        assertEquals(1, lint.runs(), "lint must be skipped after the tests failure");
        assertEquals(2, implementer.implementations());
        assertTrue(implementer.receivedKinds().contains("validation.failed"));

        SessionRecord record = record(handle);
        assertEquals(List.of(
            "iteration 1: compile=PASS, tests=FAIL, lint=SKIPPED",
            "iteration 2: compile=PASS, tests=PASS, lint=PASS"
        ), record.validationHistory());
        assertEquals(List.of("SETUP", "IMPLEMENTATION", "VALIDATION", "IMPLEMENTATION", "VALIDATION", "REVIEW",
            "COMPLETE"), visitedPhases(handle));
    }

    @Test
    void testValidation_ThreeConsecutiveFailures_Abandons() {
        // Given: tests never pass
        ScriptedImplementer implementer = implementer()
            .withRound(Map.of("src/main/java/routing/TableLoader.java", "class TableLoader { broken }"));
        ScriptedReviewer quality = reviewer("code-quality");
        actors.register(implementer).register(quality);

        StubCheck compile = StubCheck.passing("compile");
        StubCheck tests = StubCheck.failing("tests");

        // When
        SessionHandle handle = orchestrator(
            List.of(reviewerSpec(quality, ReviewerDomain.CODE_QUALITY)),
            List.of(compile, tests)
        ).start(StartRequest.of(TASK, Mode.LIGHTWEIGHT));

        // Then: exactly three runs, then escalation
        Abandoned abandoned = assertInstanceOf(Abandoned.class, handle.getOutcome());
        assertEquals(EscalationKind.VALIDATION_FAILURE, abandoned.escalation().kind());
        assertEquals(Phase.VALIDATION, abandoned.lastKnownGoodPhase());
        assertEquals(3, tests.runs());
        assertEquals(3, implementer.implementations());
        assertEquals(3, abandoned.escalation().attemptHistory().size());
        assertTrue(abandoned.escalation().currentFailures().get(0).startsWith("Layer 'tests' failed."));

        // Reviewers never saw the change
        assertFalse(quality.receivedKinds().contains("review.requested"));
        assertRecordedPhase(handle, Phase.ABANDONED);
    }
}
