/**
 * JSON 파일 기반 세션 영속화.
 *
 * <p>Jackson으로 {@link com.ryuqq.devloop.core.session.SessionRecord}와
 * {@link com.ryuqq.devloop.core.outcome.CompletionSummary}를 직렬화합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.devloop.adapter.runner.persistence;
