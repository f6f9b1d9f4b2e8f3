package com.ryuqq.devloop.testkit.contract;

import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.application.orchestrator.StartRequest;
import com.ryuqq.devloop.core.actor.ReviewerDomain;
import com.ryuqq.devloop.core.classify.SpecialistSelectionException;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.testkit.scripted.ScriptedImplementer;
import com.ryuqq.devloop.testkit.scripted.ScriptedReviewer;
import com.ryuqq.devloop.testkit.scripted.StubCheck;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for mode eligibility and specialist selection at SETUP.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Lightweight request with a sensitive target path runs in full mode</li>
 *   <li>Lightweight session whose change touches a dependency manifest falls back to full mode</li>
 *   <li>Ambiguous task is rejected before any session is created</li>
 *   <li>Specialist override wins and is audited; unmatched tasks use the default specialist</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModeContractTest extends AbstractContractTest {

    private ScriptedReviewer quality;

    private SessionHandle run(ScriptedImplementer implementer, StartRequest request) {
        quality = reviewer("code-quality");
        actors.register(implementer).register(quality);
        return orchestrator(
            List.of(reviewerSpec(quality, ReviewerDomain.CODE_QUALITY)),
            List.of(StubCheck.passing("compile"))
        ).start(request);
    }

    @Test
    void testMode_SensitiveTargetPath_RunsFullMode() {
        // Given
        ScriptedImplementer implementer = implementer().withRound(Map.of("pom.xml", "<project/>"));
        StartRequest request = StartRequest.of("Bump the routing library", Mode.LIGHTWEIGHT)
            .withTargetPaths(List.of("pom.xml"));

        // When
        SessionHandle handle = run(implementer, request);

        // Then: planning and reflection were part of the session
        assertTrue(handle.isCompleted(), "Session should complete: " + handle);
        assertEquals("FULL", record(handle).mode());
        assertEquals(List.of("SETUP", "PLANNING", "IMPLEMENTATION", "VALIDATION", "REVIEW", "REFLECTION", "COMPLETE"),
            visitedPhases(handle));
        assertAuditContains(handle, "Lightweight mode rejected");
    }

    @Test
    void testMode_ManifestTouchedDuringImplementation_FallsBackToFull() {
        // Given: nothing sensitive declared up front, but the change edits pom.xml
        ScriptedImplementer implementer = implementer().withRound(Map.of(
            "src/main/java/routing/TableLoader.java", "class TableLoader {}",
            "pom.xml", "<project/>"));

        // When
        SessionHandle handle = run(implementer, StartRequest.of("Rename the routing table loader", Mode.LIGHTWEIGHT));

        // Then: no planning happened, but reflection did
        assertTrue(handle.isCompleted(), "Session should complete: " + handle);
        SessionRecord record = record(handle);
        assertEquals("FULL", record.mode());
        assertEquals(List.of("SETUP", "IMPLEMENTATION", "VALIDATION", "REVIEW", "REFLECTION", "COMPLETE"),
            visitedPhases(handle));
        assertAuditContains(handle, "Lightweight mode rejected: change touches [DEPENDENCY_MANIFEST] via [pom.xml]");
    }

    @Test
    void testSpecialist_AmbiguousTask_RejectedBeforeSession() {
        // Given
        ScriptedImplementer implementer = implementer();

        // When/Then
        SpecialistSelectionException exception = assertThrows(SpecialistSelectionException.class,
            () -> run(implementer, StartRequest.of("Tune the audio index", Mode.LIGHTWEIGHT)));

        assertEquals(List.of("database", "media-handler"), exception.getCandidates());
        assertTrue(store.list().isEmpty(), "No session should be recorded");
        assertFalse(bus.isRegistered(ActorName.ORCHESTRATOR));
        assertTrue(actors.specialists().isEmpty());
    }

    @Test
    void testSpecialist_Override_WinsOverClassification() {
        // Given
        ScriptedImplementer implementer = implementer()
            .withRound(Map.of("src/main/java/routing/TableLoader.java", "class TableLoader {}"));

        // When
        SessionHandle handle = run(implementer,
            StartRequest.of("Tune the audio index", Mode.LIGHTWEIGHT).withSpecialist("database"));

        // Then
        assertTrue(handle.isCompleted());
        assertEquals("database", record(handle).specialist());
        assertEquals(List.of("database", "database"), actors.specialists());
        assertAuditContains(handle, "Specialist overridden: database");
    }

    @Test
    void testSpecialist_UnmatchedTask_UsesDefault() {
        // Given
        ScriptedImplementer implementer = implementer()
            .withRound(Map.of("src/main/java/Names.java", "class Names {}"));

        // When
        SessionHandle handle = run(implementer, StartRequest.of("Rename a variable", Mode.LIGHTWEIGHT));

        // Then
        assertTrue(handle.isCompleted());
        assertEquals("general", record(handle).specialist());
    }
}
