/**
 * Actor runtime port.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.application.runtime.ActorRuntime} - Spawns actors and reports their status</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.application.runtime;
