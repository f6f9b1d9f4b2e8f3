/**
 * Session aggregate and its persisted record.
 *
 * <p>{@link com.ryuqq.devloop.core.session.Session} is owned by the orchestrator thread. Its
 * {@link com.ryuqq.devloop.core.session.SessionRecord} projection is what stores persist and what
 * status queries, restarts and rollbacks read.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.session;
