package com.ryuqq.devloop.testkit.contract;

import com.ryuqq.devloop.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.devloop.adapter.inmemory.store.InMemorySessionStore;
import com.ryuqq.devloop.adapter.inmemory.workspace.InMemoryWorkspace;
import com.ryuqq.devloop.adapter.runner.ActorRuntimeConfig;
import com.ryuqq.devloop.adapter.runner.BackoffCalculator;
import com.ryuqq.devloop.adapter.runner.MailboxActorRuntime;
import com.ryuqq.devloop.adapter.runner.OrchestratorConfig;
import com.ryuqq.devloop.adapter.runner.SessionOrchestrator;
import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.core.actor.ActorSpec;
import com.ryuqq.devloop.core.actor.ReviewerDomain;
import com.ryuqq.devloop.core.check.Check;
import com.ryuqq.devloop.core.classify.SpecialistClassifier;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.Adjudicator;
import com.ryuqq.devloop.core.statemachine.Phase;
import com.ryuqq.devloop.testkit.scripted.ScriptedActorFactory;
import com.ryuqq.devloop.testkit.scripted.ScriptedImplementer;
import com.ryuqq.devloop.testkit.scripted.ScriptedReviewer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Runs real sessions end to end: a {@link SessionOrchestrator} over in-memory adapters, with
 * scripted actors on a {@link MailboxActorRuntime}. Gates are shortened so that a test which
 * expects a timeout finishes in well under a second.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryMessageBus: mailboxes, redelivery, dead letters</li>
 *   <li>InMemorySessionStore: session records with full save history</li>
 *   <li>InMemoryWorkspace: file tree with start markers</li>
 *   <li>ScriptedActorFactory: hands out the scripted actors registered by the test</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         ScriptedImplementer implementer = implementer().withRound(Map.of("src/A.java", "class A {}"));
 *         ScriptedReviewer security = reviewer("security");
 *         actors.register(implementer).register(security);
 *
 *         SessionHandle handle = orchestrator(List.of(reviewerSpec(security, ReviewerDomain.SECURITY)),
 *             List.of(StubCheck.passing("compile"))).start(StartRequest.of("Add a thing", Mode.LIGHTWEIGHT));
 *
 *         assertTrue(handle.isCompleted());
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final ActorName IMPLEMENTER = ActorName.of("implementer");

    protected InMemoryMessageBus bus;
    protected InMemorySessionStore store;
    protected InMemoryWorkspace workspace;
    protected ScriptedActorFactory actors;
    protected Clock clock;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all adapters.</p>
     */
    @BeforeEach
    void setUp() {
        clock = Clock.systemUTC();
        bus = new InMemoryMessageBus();
        store = new InMemorySessionStore();
        workspace = new InMemoryWorkspace(clock);
        actors = new ScriptedActorFactory();
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.clear();
        }
        if (store != null) {
            store.clear();
        }
    }

    /**
     * Configuration with gates short enough for tests.
     *
     * <p>Gates that are expected to be satisfied get 5 seconds; tests that expect a timeout
     * override the relevant gate.</p>
     *
     * @return config
     */
    protected OrchestratorConfig fastConfig() {
        return new OrchestratorConfig()
            .withPlanningGate(Duration.ofSeconds(5), 1)
            .withImplementationGate(Duration.ofSeconds(5), 1)
            .withReviewGate(Duration.ofSeconds(5), 1)
            .withReflectionGate(Duration.ofSeconds(5), 1)
            .withPollInterval(Duration.ofMillis(20));
    }

    protected SessionOrchestrator orchestrator(List<ActorSpec> reviewers, List<Check> checks) {
        return orchestrator(reviewers, checks, (sessionId, report, escalated) -> {
            throw new AssertionError("Unexpected adjudication: " + report.summary());
        }, fastConfig());
    }

    protected SessionOrchestrator orchestrator(List<ActorSpec> reviewers, List<Check> checks,
                                               Adjudicator adjudicator, OrchestratorConfig config) {
        ActorRuntimeConfig runtimeConfig = new ActorRuntimeConfig().withPollIntervalMs(10);
        return new SessionOrchestrator(
            bus, store, workspace,
            () -> new MailboxActorRuntime(bus, runtimeConfig, clock, new BackoffCalculator(1, 10, 0.0)),
            actors, reviewers, checks, adjudicator, SpecialistClassifier.withDefaults(), config, clock
        );
    }

    protected ScriptedImplementer implementer() {
        return new ScriptedImplementer(IMPLEMENTER, workspace);
    }

    protected ScriptedReviewer reviewer(String name) {
        return new ScriptedReviewer(ActorName.of(name));
    }

    protected static ActorSpec reviewerSpec(ScriptedReviewer reviewer, ReviewerDomain domain) {
        return ActorSpec.reviewer(reviewer.name(), domain);
    }

    protected SessionRecord record(SessionHandle handle) {
        return store.find(handle.getSessionId())
            .orElseThrow(() -> new AssertionError("No record for " + handle.getSessionId()));
    }

    /**
     * Asserts that the session record is in the expected phase.
     *
     * @param handle the finished session
     * @param expected the expected phase
     */
    protected void assertRecordedPhase(SessionHandle handle, Phase expected) {
        SessionRecord record = record(handle);
        assertEquals(expected.name(), record.phase(),
            String.format("Expected phase %s but was %s for session %s", expected, record.phase(),
                record.sessionId()));
    }

    /**
     * Asserts that some audit entry of the session contains the text.
     *
     * @param handle the finished session
     * @param text expected fragment
     */
    protected void assertAuditContains(SessionHandle handle, String text) {
        SessionRecord record = record(handle);
        assertTrue(record.audit().stream().anyMatch(entry -> entry.event().contains(text)),
            String.format("Expected an audit entry containing '%s' in %s", text,
                record.audit().stream().map(SessionRecord.AuditEntry::event).toList()));
    }

    /**
     * Phases visited by the session, in order, taken from its transition audit entries.
     *
     * @param handle the finished session
     * @return visited phases starting with SETUP
     */
    protected List<String> visitedPhases(SessionHandle handle) {
        SessionRecord record = record(handle);
        List<String> transitions = record.audit().stream()
            .filter(entry -> !entry.from().equals(entry.to()))
            .map(SessionRecord.AuditEntry::to)
            .toList();
        return Stream.concat(Stream.of(Phase.SETUP.name()), transitions.stream()).toList();
    }
}
