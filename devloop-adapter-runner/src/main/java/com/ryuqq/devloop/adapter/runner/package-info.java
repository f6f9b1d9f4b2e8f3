/**
 * Runner Adapter Layer - Orchestrator 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.SessionOrchestrator} - 세션 설정 및 단계 진행</li>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.MailboxActorRuntime} - Actor별 mailbox 소비 워커</li>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.SessionRecovery} - 시작 마커 기준 롤백</li>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.SessionStatusQuery} - 세션 목록 조회</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SessionOrchestrator, MailboxActorRuntime, SessionRecovery)
 *   ↓ implements
 * application (Orchestrator, ActorRuntime, Recovery)
 *   ↓ depends on
 * core (Session, GateController, CheckRunner, FindingLedger)
 *   ↓ depends on
 * core/spi (MessageBus, SessionStore, Workspace, Adjudicator)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.devloop.adapter.runner;
