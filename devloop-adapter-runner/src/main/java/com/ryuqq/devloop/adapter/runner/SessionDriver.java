package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.application.orchestrator.SessionInterruptedException;
import com.ryuqq.devloop.application.runtime.ActorRuntime;
import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.check.CheckInterruptedException;
import com.ryuqq.devloop.core.check.CheckRunner;
import com.ryuqq.devloop.core.check.ValidationFeedback;
import com.ryuqq.devloop.core.check.ValidationRun;
import com.ryuqq.devloop.core.contract.Delivery;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.contract.MessageKinds;
import com.ryuqq.devloop.core.finding.DeferralJustifications;
import com.ryuqq.devloop.core.finding.Finding;
import com.ryuqq.devloop.core.finding.FindingStatus;
import com.ryuqq.devloop.core.finding.Severity;
import com.ryuqq.devloop.core.finding.Verdict;
import com.ryuqq.devloop.core.gate.Gate;
import com.ryuqq.devloop.core.gate.GateController;
import com.ryuqq.devloop.core.gate.GateEscalation;
import com.ryuqq.devloop.core.gate.GateStatus;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.FindingId;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.outcome.Abandoned;
import com.ryuqq.devloop.core.outcome.Completed;
import com.ryuqq.devloop.core.outcome.CompletionSummary;
import com.ryuqq.devloop.core.outcome.Escalated;
import com.ryuqq.devloop.core.outcome.EscalationKind;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.outcome.SessionOutcome;
import com.ryuqq.devloop.core.session.ModeDecision;
import com.ryuqq.devloop.core.session.ModeEligibility;
import com.ryuqq.devloop.core.session.Session;
import com.ryuqq.devloop.core.session.VerdictEntry;
import com.ryuqq.devloop.core.spi.AdjudicationDecision;
import com.ryuqq.devloop.core.spi.Adjudicator;
import com.ryuqq.devloop.core.spi.MessageBus;
import com.ryuqq.devloop.core.spi.SessionStore;
import com.ryuqq.devloop.core.spi.Workspace;
import com.ryuqq.devloop.core.statemachine.Phase;
import com.ryuqq.devloop.core.statemachine.PhaseTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 세션 하나의 실행을 담당하는 드라이버.
 *
 * <p>오케스트레이터 스레드 하나만 이 객체를 사용합니다. 모든 단계 전이와 Session 변경은
 * 이 스레드에서만 일어나며, Actor는 메시지를 보낼 뿐입니다.</p>
 *
 * <p><strong>대기 규칙:</strong> 모든 대기는 게이트입니다. 오케스트레이터 mailbox를
 * pollInterval 간격으로 수신하면서 게이트 상태를 확인하고, 시간 초과 시 라운드를 연장하거나
 * 최대 라운드에 도달하면 에스컬레이션합니다. Actor 상태(IDLE)는 전이 조건이 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SessionDriver {

    private static final Logger log = LoggerFactory.getLogger(SessionDriver.class);

    private static final int TITLE_MAX_LENGTH = 72;

    private final Session session;
    private final ActorRuntime runtime;
    private final MessageBus bus;
    private final SessionStore store;
    private final Workspace workspace;
    private final CheckRunner checkRunner;
    private final Adjudicator adjudicator;
    private final GateController gateController;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final RecentMessageIds seenMessageIds = new RecentMessageIds();

    private SessionOutcome outcome;

    SessionDriver(Session session, ActorRuntime runtime, MessageBus bus, SessionStore store, Workspace workspace,
                  CheckRunner checkRunner, Adjudicator adjudicator, OrchestratorConfig config, Clock clock) {
        this.session = session;
        this.runtime = runtime;
        this.bus = bus;
        this.store = store;
        this.workspace = workspace;
        this.checkRunner = checkRunner;
        this.adjudicator = adjudicator;
        this.gateController = new GateController(clock);
        this.config = config;
        this.clock = clock;
    }

    /**
     * SETUP 이후 종료 조건까지 세션 실행.
     *
     * @return 종료된 세션 핸들
     * @throws SessionInterruptedException 오케스트레이터 스레드가 인터럽트된 경우
     */
    SessionHandle run() {
        try {
            assignTask();
            while (outcome == null) {
                MdcContext.setPhase(session.phase().name());
                switch (session.phase()) {
                    case PLANNING -> runPlanning();
                    case IMPLEMENTATION -> runImplementation();
                    case VALIDATION -> runValidation();
                    case REVIEW -> runReview();
                    case REFLECTION -> runReflection();
                    case SETUP, COMPLETE, ABANDONED -> throw new IllegalStateException(
                        "Unexpected phase in session loop: " + session.phase());
                }
            }
            log.info("Session {} finished in {}: {}", session.id().getValue(), session.phase(),
                outcome.getClass().getSimpleName());
            return SessionHandle.of(session.id(), session.phase(), outcome);
        } catch (InterruptedException | CheckInterruptedException e) {
            Thread.currentThread().interrupt();
            session.note("Interrupted in " + session.phase() + "; continue the session to resume from SETUP");
            log.warn("Session {} interrupted in {}", session.id().getValue(), session.phase());
            throw new SessionInterruptedException(session.id(), e);
        } catch (RuntimeException e) {
            session.note("Interrupted by failure in " + session.phase() + ": " + e.getMessage());
            log.error("Session {} failed in {}", session.id().getValue(), session.phase(), e);
            throw e;
        } finally {
            closeSession();
        }
    }

    // ============================================================
    // Phases
    // ============================================================

    private void assignTask() {
        Phase first = PhaseTransition.afterSetup(session.mode());
        session.transitionTo(first, "roster spawned; task assigned");
        Map<String, String> attributes = Map.of(
            MessageKinds.ATTR_MODE, session.mode().name(),
            MessageKinds.ATTR_SPECIALIST, session.specialist(),
            MessageKinds.ATTR_PHASE, first.name()
        );
        for (ActorName participant : session.participants()) {
            send(participant, MessageKinds.TASK_ASSIGNED, session.task(), attributes);
        }
        persist();
    }

    private void runPlanning() throws InterruptedException {
        Gate gate = gateController.open("plan-confirmed", session.reviewers(), MessageKinds.PLAN_CONFIRMED,
            config.planningTimeout(), config.planningRounds());
        GateStatus status = await(gate);
        session.recordGate(gate, status);

        if (status == GateStatus.TIMED_OUT) {
            abandonOnGate(gate, "planning gate timed out");
            return;
        }
        send(session.implementer(), MessageKinds.PLAN_APPROVED, "All reviewers confirmed the plan", Map.of());
        session.transitionTo(Phase.IMPLEMENTATION, "plan confirmed by " + joinNames(gate.confirmed()));
        persist();
    }

    private void runImplementation() throws InterruptedException {
        Gate gate = gateController.open("implementation-ready", List.of(session.implementer()),
            MessageKinds.IMPLEMENTATION_READY, config.implementationTimeout(), config.implementationRounds());
        GateStatus status = await(gate);
        session.recordGate(gate, status);

        if (status == GateStatus.TIMED_OUT) {
            abandonOnGate(gate, "implementation gate timed out");
            return;
        }
        int revision = session.bumpRevision();
        session.transitionTo(Phase.VALIDATION, "implementation ready (revision " + revision + ")");
        persist();
    }

    private void runValidation() {
        Change change = workspace.changeSince(session.startMarker());
        int iteration = session.nextValidationIteration();

        if (iteration == 1 && session.mode() == Mode.LIGHTWEIGHT) {
            ModeDecision decision = ModeEligibility.evaluate(Mode.LIGHTWEIGHT, change.paths());
            if (decision.fellBack()) {
                session.upgradeToFull(decision.auditNote());
                log.warn("Session {} upgraded to FULL: {}", session.id().getValue(), decision.sensitivePaths());
            }
        }

        ValidationRun run = checkRunner.run(change, iteration);
        int consecutiveFailures = session.recordValidationRun(run);
        log.info("Validation {}", run.summary());

        if (run.passed()) {
            session.transitionTo(Phase.REVIEW, "validation passed (iteration " + iteration + ")");
            persist();
            return;
        }

        ValidationFeedback feedback = ValidationFeedback.from(run);
        if (consecutiveFailures >= config.maxValidationAttempts()) {
            List<String> history = session.validationRuns().stream().map(ValidationRun::summary).toList();
            EscalationReport report = new EscalationReport(
                EscalationKind.VALIDATION_FAILURE,
                String.format("Validation failed %d consecutive time(s); last failing layer: %s",
                    consecutiveFailures, feedback.layer()),
                List.of(feedback.render()),
                history,
                List.of("Inspect the change with an INSPECT rollback",
                    "Fix the '" + feedback.layer() + "' layer manually and continue the session",
                    "Roll back with SOFT to keep the work for reference")
            );
            abandon("validation failed " + consecutiveFailures + " times", report);
            return;
        }

        send(session.implementer(), MessageKinds.VALIDATION_FAILED, feedback.render(), Map.of(
            MessageKinds.ATTR_LAYER, feedback.layer(),
            MessageKinds.ATTR_ITERATION, String.valueOf(iteration)
        ));
        session.transitionTo(Phase.IMPLEMENTATION,
            "validation failed at '" + feedback.layer() + "' (iteration " + iteration + ")");
        persist();
    }

    private void runReview() throws InterruptedException {
        Change change = workspace.changeSince(session.startMarker());
        Map<String, String> attributes = Map.of(
            MessageKinds.ATTR_REVISION, String.valueOf(session.revision()),
            MessageKinds.ATTR_ITERATION, String.valueOf(session.reviewCycles() + 1)
        );
        for (ActorName reviewer : session.reviewers()) {
            send(reviewer, MessageKinds.REVIEW_REQUESTED, change.diff(), attributes);
        }

        Gate gate = gateController.open("verdict", session.reviewers(), MessageKinds.VERDICT,
            config.reviewTimeout(), config.reviewRounds());
        GateStatus status = await(gate);
        session.recordGate(gate, status);
        if (status == GateStatus.TIMED_OUT) {
            abandonOnGate(gate, "verdict gate timed out");
            return;
        }
        persist();

        if (!refreshStaleVerdicts(change)) {
            return;
        }

        List<VerdictEntry> escalated = session.escalatedVerdicts();
        if (escalated.isEmpty()) {
            Phase next = PhaseTransition.afterReview(session.mode());
            if (next == Phase.COMPLETE) {
                complete("all verdicts allow advance");
            } else {
                session.transitionTo(next, "all verdicts allow advance");
                persist();
            }
            return;
        }
        adjudicate(escalated);
    }

    /**
     * 판정 이후 변경이 생긴 리뷰어에게 재판정 요청.
     *
     * @return 계속 진행할 수 있으면 true, 세션이 종료되었으면 false
     */
    private boolean refreshStaleVerdicts(Change reviewedChange) throws InterruptedException {
        int passes = 0;
        List<ActorName> stale = session.staleReviewers();
        while (!stale.isEmpty()) {
            if (passes >= config.maxReverdictPasses()) {
                EscalationReport report = new EscalationReport(
                    EscalationKind.REVIEW_ESCALATION,
                    String.format("Verdicts of %s are still stale after %d re-verdict pass(es)",
                        joinNames(stale), passes),
                    List.of(),
                    auditTrail(),
                    List.of("Ask the listed reviewers for a final verdict", "Route back to implementation")
                );
                abandon("verdicts kept going stale", report);
                return false;
            }
            passes++;
            log.warn("Verdicts of {} are stale at revision {}, requesting re-verdict", stale, session.revision());
            session.note("Re-verdict requested from " + joinNames(stale) + " at revision " + session.revision());

            Change current = workspace.changeSince(session.startMarker());
            String body = current.diff().isEmpty() ? reviewedChange.diff() : current.diff();
            for (ActorName reviewer : stale) {
                send(reviewer, MessageKinds.REVERDICT_REQUESTED, body,
                    Map.of(MessageKinds.ATTR_REVISION, String.valueOf(session.revision())));
            }

            Gate gate = gateController.open("reverdict", stale, MessageKinds.VERDICT,
                config.reviewTimeout(), config.reviewRounds());
            GateStatus status = await(gate);
            session.recordGate(gate, status);
            if (status == GateStatus.TIMED_OUT) {
                abandonOnGate(gate, "re-verdict gate timed out");
                return false;
            }
            persist();
            stale = session.staleReviewers();
        }
        return true;
    }

    private void adjudicate(List<VerdictEntry> escalated) {
        List<Finding> escalatedFindings = session.ledger().withStatus(FindingStatus.ESCALATED);
        EscalationReport report = new EscalationReport(
            EscalationKind.REVIEW_ESCALATION,
            String.format("%d reviewer verdict(s) escalated: %s", escalated.size(),
                escalated.stream().map(entry -> entry.reviewer().getValue()).collect(Collectors.joining(", "))),
            escalatedFindings.stream().map(SessionDriver::describe).toList(),
            auditTrail(),
            List.of("Accept the disputed deferrals as technical debt",
                "Route the findings back to implementation",
                "Abandon the session")
        );

        AdjudicationDecision decision = adjudicator.adjudicate(session.id(), report, escalatedFindings);
        session.note("Adjudication of " + escalatedFindings.size() + " escalated finding(s): " + decision);
        log.info("Adjudication decision for session {}: {}", session.id().getValue(), decision);

        switch (decision) {
            case ACCEPT_DEFERRAL -> {
                for (Finding finding : escalatedFindings) {
                    session.ledger().overrideAccept(finding.id(), "accepted by adjudication: "
                        + Optional.ofNullable(finding.justification()).orElse("no justification"));
                }
                Phase next = PhaseTransition.afterReview(session.mode());
                if (next == Phase.COMPLETE) {
                    complete("escalation accepted by adjudication");
                } else {
                    session.transitionTo(next, "escalation accepted by adjudication");
                    persist();
                }
            }
            case ROUTE_BACK -> routeBack(escalatedFindings, report);
            case ABANDON -> abandon("abandoned by adjudication", report);
            case DEFER_TO_HUMAN -> {
                session.escalate(report);
                persist();
                outcome = new Escalated(report);
            }
        }
    }

    private void routeBack(List<Finding> escalatedFindings, EscalationReport report) {
        if (session.reviewCycles() >= config.maxReviewCycles()) {
            EscalationReport limit = new EscalationReport(
                EscalationKind.REVIEW_CYCLE_LIMIT,
                String.format("Review cycle limit reached (%d of %d route-backs)", session.reviewCycles(),
                    config.maxReviewCycles()),
                report.currentFailures(),
                report.attemptHistory(),
                List.of("Accept the remaining findings as technical debt by hand",
                    "Split the disputed work into its own session")
            );
            abandon("review cycle limit reached", limit);
            return;
        }
        int cycles = session.incrementReviewCycles();

        String body = escalatedFindings.stream().map(SessionDriver::describe).collect(Collectors.joining("\n"));
        send(session.implementer(), MessageKinds.CHANGES_REQUESTED, body,
            Map.of(MessageKinds.ATTR_ITERATION, String.valueOf(cycles)));
        session.clearVerdicts();
        session.transitionTo(Phase.IMPLEMENTATION, "routed back by adjudication (cycle " + cycles + ")");
        persist();
    }

    private void runReflection() throws InterruptedException {
        for (ActorName participant : session.participants()) {
            send(participant, MessageKinds.REFLECTION_REQUESTED, session.task(), Map.of());
        }
        Gate gate = gateController.open("reflection-done", session.participants(), MessageKinds.REFLECTION_DONE,
            config.reflectionTimeout(), config.reflectionRounds());
        GateStatus status = await(gate);
        session.recordGate(gate, status);

        if (status == GateStatus.TIMED_OUT) {
            // soft deadline: 미응답 참여자가 있어도 완료
            session.note("Reflection deadline passed; outstanding: " + joinNames(gate.outstanding()));
        }
        complete("reflection finished");
    }

    // ============================================================
    // Gate waiting
    // ============================================================

    /**
     * 게이트가 충족되거나 최대 라운드까지 시간 초과될 때까지 대기.
     *
     * @param gate 대기할 게이트
     * @return SATISFIED 또는 TIMED_OUT
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    private GateStatus await(Gate gate) throws InterruptedException {
        log.info("Gate '{}' opened: waiting for {} from {}", gate.name(), gate.qualifyingKind(),
            joinNames(gate.outstanding()));
        long pollMs = config.pollInterval().toMillis();

        while (true) {
            GateStatus status = gateController.poll(gate);
            if (status == GateStatus.SATISFIED) {
                log.info("Gate '{}' satisfied in round {}", gate.name(), gate.round());
                return status;
            }
            if (status == GateStatus.TIMED_OUT) {
                if (!gateController.extendRound(gate)) {
                    log.warn("Gate '{}' timed out after {} round(s); outstanding: {}", gate.name(),
                        gate.round(), gate.outstanding());
                    return status;
                }
                session.note(String.format("Gate '%s' timed out; round %d of %d started (outstanding: %s)",
                    gate.name(), gate.round(), gate.maxRounds(), joinNames(gate.outstanding())));
                persist();
                continue;
            }

            Optional<Delivery> received = bus.receive(ActorName.ORCHESTRATOR, pollMs);
            if (received.isEmpty()) {
                continue;
            }
            Delivery delivery = received.get();
            bus.ack(delivery);
            Message message = delivery.message();
            if (!seenMessageIds.add(message.id())) {
                log.debug("Duplicate message {} ({}) ignored", message.id(), message.kind());
                continue;
            }
            dispatch(message, gate);
        }
    }

    private void dispatch(Message message, Gate gate) {
        if (message.isKind(gate.qualifyingKind())) {
            confirm(message, gate);
            return;
        }
        try {
            switch (message.kind()) {
                case MessageKinds.PLAN_DRAFTED -> onPlanDrafted(message);
                case MessageKinds.FINDING_RAISED -> onFindingRaised(message);
                case MessageKinds.FINDING_FIXED -> onFindingFixed(message);
                case MessageKinds.DEFERRAL_PROPOSED -> onDeferralProposed(message);
                case MessageKinds.DEFERRAL_ACCEPTED -> onDeferralDecided(message, true);
                case MessageKinds.DEFERRAL_REJECTED -> onDeferralDecided(message, false);
                case MessageKinds.DISCUSSION -> log.debug("Discussion from {}: {}", message.sender(), message.body());
                default -> log.debug("Ignoring {} from {} while waiting on gate '{}'",
                    message.kind(), message.sender(), gate.name());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            // 프로토콜 위반 메시지는 세션을 멈추지 않음
            log.warn("Rejected {} from {}: {}", message.kind(), message.sender(), e.getMessage());
            session.note("Rejected " + message.kind() + " from " + message.sender() + ": " + e.getMessage());
        }
    }

    private void confirm(Message message, Gate gate) {
        if (!gateController.isRequired(gate, message.sender())) {
            log.debug("{} from {} does not count for gate '{}'", message.kind(), message.sender(), gate.name());
            return;
        }
        if (message.isKind(MessageKinds.VERDICT)) {
            Verdict stated = Verdict.parse(message.requireAttribute(MessageKinds.ATTR_VERDICT));
            VerdictEntry entry = session.recordVerdict(message.sender(), stated);
            if (entry.effective() != entry.stated()) {
                log.warn("Verdict of {} overridden by ledger: stated {}, effective {}",
                    message.sender(), entry.stated(), entry.effective());
            }
            session.note("Verdict from " + message.sender() + ": " + entry.effective()
                + " (stated " + entry.stated() + ", revision " + entry.revision() + ")");
        }
        if (gateController.recordConfirmation(gate, message)) {
            session.note("Gate '" + gate.name() + "' confirmed by " + message.sender());
            persist();
        }
    }

    // ============================================================
    // Review protocol
    // ============================================================

    private void onPlanDrafted(Message message) {
        requireSender(message, session.implementer());
        for (ActorName reviewer : session.reviewers()) {
            send(reviewer, MessageKinds.PLAN_REVIEW_REQUESTED, message.body(), Map.of());
        }
        session.note("Plan drafted by " + message.sender() + "; forwarded to reviewers");
        persist();
    }

    private void onFindingRaised(Message message) {
        if (!session.isReviewer(message.sender())) {
            throw new IllegalArgumentException("Only reviewers can raise findings: " + message.sender());
        }
        Severity severity = Severity.parse(message.requireAttribute(MessageKinds.ATTR_SEVERITY));
        Finding finding = session.ledger().raise(message.sender(), message.body(), severity);
        if (session.verdicts().containsKey(message.sender())) {
            session.markVerdictStale(message.sender());
            log.warn("{} raised {} after its verdict; verdict marked stale", message.sender(), finding.id());
        }

        send(session.implementer(), MessageKinds.FINDING_OPENED, finding.description(), Map.of(
            MessageKinds.ATTR_FINDING_ID, finding.id().getValue(),
            MessageKinds.ATTR_SEVERITY, severity.name(),
            MessageKinds.ATTR_RAISED_BY, message.sender().getValue()
        ));
        send(message.sender(), MessageKinds.FINDING_OPENED, finding.description(), Map.of(
            MessageKinds.ATTR_FINDING_ID, finding.id().getValue(),
            MessageKinds.ATTR_SEVERITY, severity.name(),
            MessageKinds.ATTR_RAISED_BY, message.sender().getValue()
        ));
        session.note("Finding " + finding.id() + " [" + severity + "] raised by " + message.sender());
        persist();
    }

    private void onFindingFixed(Message message) {
        requireSender(message, session.implementer());
        FindingId id = FindingId.of(message.requireAttribute(MessageKinds.ATTR_FINDING_ID));
        Finding finding = session.ledger().markFixed(id);
        int revision = session.bumpRevision();

        send(finding.raisedBy(), MessageKinds.FIX_SUBMITTED, message.body(), Map.of(
            MessageKinds.ATTR_FINDING_ID, id.getValue(),
            MessageKinds.ATTR_REVISION, String.valueOf(revision)
        ));
        session.note("Finding " + id + " fixed (revision " + revision + ")");
        persist();
    }

    private void onDeferralProposed(Message message) {
        requireSender(message, session.implementer());
        FindingId id = FindingId.of(message.requireAttribute(MessageKinds.ATTR_FINDING_ID));
        Finding finding = session.ledger().proposeDeferral(id, message.body());
        String category = DeferralJustifications.classify(message.body()).name();

        send(finding.raisedBy(), MessageKinds.DEFERRAL_REVIEW_REQUESTED, message.body(), Map.of(
            MessageKinds.ATTR_FINDING_ID, id.getValue(),
            MessageKinds.ATTR_CATEGORY, category,
            MessageKinds.ATTR_SEVERITY, finding.severity().name()
        ));
        session.note("Deferral of " + id + " proposed (" + category + ")");
        persist();
    }

    private void onDeferralDecided(Message message, boolean accepted) {
        FindingId id = FindingId.of(message.requireAttribute(MessageKinds.ATTR_FINDING_ID));
        Finding current = session.ledger().get(id);
        requireSender(message, current.raisedBy());

        Finding decided = accepted
            ? session.ledger().acceptDeferral(id, session.reviewerSpec(current.raisedBy()).policy())
            : session.ledger().rejectDeferral(id);
        if (accepted && decided.status() == FindingStatus.ESCALATED) {
            log.warn("Acceptance of {} overruled: blocking finding with justification category {}", id,
                DeferralJustifications.classify(decided.justification()));
        }

        send(session.implementer(), MessageKinds.DEFERRAL_DECIDED, message.body(), Map.of(
            MessageKinds.ATTR_FINDING_ID, id.getValue(),
            MessageKinds.ATTR_DECISION, decided.status().name()
        ));
        session.note("Deferral of " + id + " " + (accepted ? "accepted" : "rejected") + " by " + message.sender()
            + " (now " + decided.status() + ")");
        persist();
    }

    private static void requireSender(Message message, ActorName expected) {
        if (!message.sender().equals(expected)) {
            throw new IllegalArgumentException(
                String.format("%s must come from %s (sender: %s)", message.kind(), expected, message.sender())
            );
        }
    }

    // ============================================================
    // Endings
    // ============================================================

    private void abandonOnGate(Gate gate, String reason) {
        GateEscalation escalation = gateController.escalation(gate);
        EscalationReport report = new EscalationReport(
            EscalationKind.GATE_TIMEOUT,
            escalation.summary(),
            escalation.outstanding().stream().map(actor -> "no " + gate.qualifyingKind() + " from " + actor).toList(),
            auditTrail(),
            List.of("Check whether the outstanding actors are stuck", "Continue the session to restart from SETUP")
        );
        abandon(reason, report);
    }

    private void abandon(String reason, EscalationReport report) {
        EscalationReport withDeadLetters = appendDeadLetters(report);
        Phase lastKnownGood = session.abandon(reason, withDeadLetters);
        persist();
        outcome = new Abandoned(reason, lastKnownGood, withDeadLetters);
        log.warn("Session {} abandoned in {}: {}", session.id().getValue(), lastKnownGood, reason);
    }

    private void complete(String trigger) {
        session.transitionTo(Phase.COMPLETE, trigger);
        CompletionSummary summary = summarize();
        store.saveSummary(session.id(), summary);
        persist();
        outcome = new Completed(summary);
    }

    private CompletionSummary summarize() {
        Map<String, String> verdicts = new LinkedHashMap<>();
        session.verdicts().forEach((reviewer, entry) -> verdicts.put(reviewer.getValue(), entry.effective().name()));
        List<String> technicalDebt = session.ledger().technicalDebt().stream()
            .map(SessionDriver::describe)
            .toList();
        return new CompletionSummary(
            title(session.task()),
            session.task(),
            session.mode().name(),
            session.specialist(),
            verdicts,
            technicalDebt,
            session.validationRuns().size(),
            session.reviewCycles()
        );
    }

    private EscalationReport appendDeadLetters(EscalationReport report) {
        String sessionId = session.id().getValue();
        List<MessageBus.DeadLetter> deadLetters = bus.deadLetters().stream()
            .filter(deadLetter -> sessionId.equals(
                deadLetter.delivery().message().attribute(MessageKinds.ATTR_SESSION_ID)))
            .toList();
        if (deadLetters.isEmpty()) {
            return report;
        }
        List<String> failures = new ArrayList<>(report.currentFailures());
        for (MessageBus.DeadLetter deadLetter : deadLetters) {
            Message message = deadLetter.delivery().message();
            failures.add(String.format("dead letter: %s %s → %s (%s)", message.kind(), message.sender(),
                message.recipient(), deadLetter.reason()));
        }
        return new EscalationReport(report.kind(), report.summary(), failures, report.attemptHistory(),
            report.suggestedActions());
    }

    private void closeSession() {
        try {
            if (outcome != null) {
                for (ActorName participant : session.participants()) {
                    send(participant, MessageKinds.SESSION_CLOSED, session.phase().name(), Map.of());
                }
            }
        } finally {
            runtime.shutdown();
            for (ActorName participant : session.participants()) {
                bus.unregister(participant);
            }
            bus.unregister(ActorName.ORCHESTRATOR);
            seenMessageIds.clear();
            persist();
            MdcContext.clear();
        }
    }

    // ============================================================
    // Helpers
    // ============================================================

    private void send(ActorName recipient, String kind, String body, Map<String, String> attributes) {
        Map<String, String> stamped = new LinkedHashMap<>(attributes);
        stamped.put(MessageKinds.ATTR_SESSION_ID, session.id().getValue());
        bus.send(Message.of(ActorName.ORCHESTRATOR, recipient, kind, body, stamped, clock.instant()));
    }

    private void persist() {
        store.save(session.toRecord(runtime.statuses()));
    }

    private List<String> auditTrail() {
        return session.audit().stream()
            .map(record -> record.at() + " " + record.event())
            .toList();
    }

    private static String joinNames(List<ActorName> names) {
        return names.isEmpty()
            ? "-"
            : names.stream().map(ActorName::getValue).collect(Collectors.joining(", "));
    }

    private static String describe(Finding finding) {
        String base = String.format("%s [%s, %s] by %s: %s", finding.id().getValue(), finding.severity(),
            finding.status(), finding.raisedBy().getValue(), finding.description());
        return finding.justification() == null ? base : base + " (" + finding.justification() + ")";
    }

    private static String title(String task) {
        String firstLine = task.strip().lines().findFirst().orElse(task);
        return firstLine.length() <= TITLE_MAX_LENGTH
            ? firstLine
            : firstLine.substring(0, TITLE_MAX_LENGTH - 3) + "...";
    }
}
