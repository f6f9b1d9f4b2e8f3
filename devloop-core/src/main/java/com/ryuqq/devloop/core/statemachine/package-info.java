/**
 * Session phase state machine.
 *
 * <p>Phases only move forward along the allowed edges in
 * {@link com.ryuqq.devloop.core.statemachine.PhaseTransition}. Every move is recorded as an
 * {@link com.ryuqq.devloop.core.statemachine.AuditRecord}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.statemachine;
