/**
 * 외부 프로세스 어댑터.
 *
 * <p>실제 저장소에서 실행할 때 사용하는 구현체입니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.process.ProcessCheck}: 외부 명령 기반 검증 계층</li>
 *   <li>{@link com.ryuqq.devloop.adapter.runner.process.GitWorkspace}: git CLI 기반 작업 트리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.devloop.adapter.runner.process;
