/**
 * Core value types of the development loop.
 *
 * <p>This package contains the immutable identifiers and small value objects
 * shared by every other package.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.core.model.SessionId} - Session identifier</li>
 *   <li>{@link com.ryuqq.devloop.core.model.ActorName} - Actor mailbox address</li>
 *   <li>{@link com.ryuqq.devloop.core.model.FindingId} - Review finding identifier</li>
 *   <li>{@link com.ryuqq.devloop.core.model.StartMarker} - Workspace state reference taken at session creation</li>
 *   <li>{@link com.ryuqq.devloop.core.model.Mode} - Full or lightweight pipeline</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Validation in constructor (fail-fast)</li>
 *   <li><strong>Factory Methods:</strong> Use {@code of()} for creation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.model;
