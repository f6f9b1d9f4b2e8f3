/**
 * Confirmation gates.
 *
 * <p>A phase only advances when its gate is satisfied: every required participant has sent the
 * qualifying message kind. An idle actor never satisfies a gate.</p>
 *
 * <h2>Timeouts</h2>
 * <p>Each gate has a per-round timeout and a maximum number of rounds. A timed-out gate is
 * either extended by one round or escalated with a
 * {@link com.ryuqq.devloop.core.gate.GateEscalation}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.gate;
