/**
 * Message contract between actors and the orchestrator.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.core.contract.Message} - Addressed message with kind, body and attributes</li>
 *   <li>{@link com.ryuqq.devloop.core.contract.Delivery} - One delivery attempt of a message</li>
 *   <li>{@link com.ryuqq.devloop.core.contract.MessageKinds} - Well-known message kinds and attribute keys</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.contract;
