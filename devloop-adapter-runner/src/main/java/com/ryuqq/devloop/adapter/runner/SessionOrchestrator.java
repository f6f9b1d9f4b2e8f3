package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.application.orchestrator.Orchestrator;
import com.ryuqq.devloop.application.orchestrator.SessionHandle;
import com.ryuqq.devloop.application.orchestrator.StartRequest;
import com.ryuqq.devloop.application.runtime.ActorRuntime;
import com.ryuqq.devloop.core.actor.ActorFactory;
import com.ryuqq.devloop.core.actor.ActorSpec;
import com.ryuqq.devloop.core.check.Check;
import com.ryuqq.devloop.core.check.CheckRunner;
import com.ryuqq.devloop.core.classify.Classification;
import com.ryuqq.devloop.core.classify.SpecialistClassifier;
import com.ryuqq.devloop.core.classify.SpecialistSelectionException;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.outcome.EscalationKind;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.session.ModeDecision;
import com.ryuqq.devloop.core.session.ModeEligibility;
import com.ryuqq.devloop.core.session.Session;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.Adjudicator;
import com.ryuqq.devloop.core.spi.MessageBus;
import com.ryuqq.devloop.core.spi.SessionStore;
import com.ryuqq.devloop.core.spi.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Orchestrator 구현체.
 *
 * <p>세션 설정(SETUP)을 수행한 뒤 {@link SessionDriver}에 단계 진행을 위임합니다.</p>
 *
 * <p><strong>SETUP 처리 흐름:</strong></p>
 * <pre>
 * 1. 이어받기 요청이면 이전 세션 기록 조회 (task, 시작 마커 재사용)
 * 2. specialist 선택: override → 이전 세션 → 키워드 분류 (모호하면 거부, 미분류면 기본값)
 * 3. 모드 적격성 판정: LIGHTWEIGHT + 민감 경로 → FULL (감사 기록)
 * 4. 시작 마커 기록 (새 세션만)
 * 5. 이전 세션을 ABANDONED("interrupted")로 보관
 * 6. 오케스트레이터 mailbox 초기화, 로스터 spawn
 * </pre>
 *
 * <p><strong>제약:</strong> 오케스트레이터 mailbox는 Bus당 하나이므로,
 * 하나의 Bus 위에서는 한 번에 한 세션만 실행해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final MessageBus bus;
    private final SessionStore store;
    private final Workspace workspace;
    private final Supplier<ActorRuntime> runtimeFactory;
    private final ActorFactory actorFactory;
    private final List<ActorSpec> reviewers;
    private final CheckRunner checkRunner;
    private final Adjudicator adjudicator;
    private final SpecialistClassifier classifier;
    private final OrchestratorConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param bus 메시지 버스
     * @param store 세션 저장소
     * @param workspace 작업 트리
     * @param runtimeFactory 세션마다 새 ActorRuntime을 만드는 공급자
     * @param actorFactory 로스터 항목으로 Actor 생성
     * @param reviewers 리뷰어 로스터 (1명 이상)
     * @param checks 검증 계층
     * @param adjudicator 에스컬레이션 판정자
     * @param classifier specialist 분류기
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null이거나 리뷰어가 없는 경우
     */
    public SessionOrchestrator(MessageBus bus, SessionStore store, Workspace workspace,
                               Supplier<ActorRuntime> runtimeFactory, ActorFactory actorFactory,
                               List<ActorSpec> reviewers, List<Check> checks, Adjudicator adjudicator,
                               SpecialistClassifier classifier, OrchestratorConfig config, Clock clock) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        if (runtimeFactory == null) {
            throw new IllegalArgumentException("runtimeFactory cannot be null");
        }
        if (actorFactory == null) {
            throw new IllegalArgumentException("actorFactory cannot be null");
        }
        if (reviewers == null || reviewers.isEmpty()) {
            throw new IllegalArgumentException("reviewers cannot be null or empty");
        }
        if (reviewers.stream().anyMatch(spec -> !spec.isReviewer())) {
            throw new IllegalArgumentException("reviewers must only contain reviewer specs");
        }
        if (checks == null) {
            throw new IllegalArgumentException("checks cannot be null");
        }
        if (adjudicator == null) {
            throw new IllegalArgumentException("adjudicator cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bus = bus;
        this.store = store;
        this.workspace = workspace;
        this.runtimeFactory = runtimeFactory;
        this.actorFactory = actorFactory;
        this.reviewers = List.copyOf(reviewers);
        this.checkRunner = new CheckRunner(checks, config.verificationLevel(), clock);
        this.adjudicator = adjudicator;
        this.classifier = classifier;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public SessionHandle start(StartRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        SessionRecord previous = null;
        if (request.continueSession() != null) {
            previous = store.find(request.continueSession())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown session to continue: " + request.continueSession().getValue()));
            if (previous.hasEnded()) {
                throw new IllegalStateException(
                    "Session " + previous.sessionId() + " already ended in " + previous.phase());
            }
        }

        String task = previous != null ? previous.task() : request.task();
        String specialist = selectSpecialist(request, task, previous);
        ModeDecision decision = ModeEligibility.evaluate(request.mode(), request.targetPaths());
        StartMarker marker = previous != null ? previous.toStartMarker() : workspace.mark();

        SessionId id = SessionId.generate();
        SessionId continuedFrom = previous != null ? SessionId.of(previous.sessionId()) : null;
        Session session = Session.create(id, task, decision.effective(), specialist, roster(), marker,
            continuedFrom, clock);
        if (decision.fellBack()) {
            session.note(decision.auditNote());
            log.warn("Lightweight mode rejected for sensitive paths {}", decision.sensitivePaths());
        }
        if (request.specialistOverride() != null) {
            session.note("Specialist overridden: " + request.specialistOverride());
        }

        MdcContext.setSession(id.getValue(), session.phase().name());
        if (previous != null) {
            archiveInterrupted(previous, id);
        }
        log.info("Session {} created (mode={}, specialist={}, marker={})",
            id.getValue(), session.mode(), specialist, marker.reference());

        bus.unregister(ActorName.ORCHESTRATOR);
        bus.register(ActorName.ORCHESTRATOR);

        ActorRuntime runtime = runtimeFactory.get();
        try {
            for (ActorSpec spec : session.roster()) {
                runtime.spawn(actorFactory.create(spec, specialist));
            }
        } catch (RuntimeException e) {
            runtime.shutdown();
            bus.unregister(ActorName.ORCHESTRATOR);
            MdcContext.clear();
            throw e;
        }

        return new SessionDriver(session, runtime, bus, store, workspace, checkRunner, adjudicator, config, clock)
            .run();
    }

    private String selectSpecialist(StartRequest request, String task, SessionRecord previous) {
        if (request.specialistOverride() != null) {
            return request.specialistOverride();
        }
        if (previous != null) {
            return previous.specialist();
        }
        Classification classification = classifier.classify(task);
        return switch (classification.kind()) {
            case MATCHED -> classification.label();
            case AMBIGUOUS -> throw new SpecialistSelectionException(task, classification.candidates());
            case UNMATCHED -> config.defaultSpecialist();
        };
    }

    private List<ActorSpec> roster() {
        List<ActorSpec> roster = new ArrayList<>();
        roster.add(ActorSpec.implementer(ActorName.of(config.implementerName())));
        roster.addAll(reviewers);
        return roster;
    }

    private void archiveInterrupted(SessionRecord previous, SessionId successor) {
        EscalationReport report = new EscalationReport(
            EscalationKind.SESSION_INTERRUPTION,
            "Session interrupted in " + previous.phase(),
            List.of(),
            List.of("continued as " + successor.getValue()),
            List.of("Inspect the change with an INSPECT rollback")
        );
        store.save(previous.archivedAsAbandoned("interrupted; continued as " + successor.getValue(), report,
            clock.instant()));
        log.info("Session {} archived as ABANDONED; continued as {}", previous.sessionId(), successor.getValue());
    }
}
