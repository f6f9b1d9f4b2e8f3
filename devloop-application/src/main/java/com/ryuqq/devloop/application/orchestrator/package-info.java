/**
 * Devloop Application Layer - 세션 실행 API.
 *
 * <p>이 패키지는 변경 요청을 받아 세션을 끝까지 진행시키는 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.application.orchestrator.Orchestrator} - 세션 실행 조정자</li>
 *   <li>{@link com.ryuqq.devloop.application.orchestrator.StartRequest} - 시작 요청</li>
 *   <li>{@link com.ryuqq.devloop.application.orchestrator.SessionHandle} - 종료 결과 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 devloop-adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> SessionHandle은 불변 객체</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.devloop.application.orchestrator;
