/**
 * Actors and their roster definitions.
 *
 * <p>An {@link com.ryuqq.devloop.core.actor.Actor} owns a mailbox and reacts to one message at a
 * time. Reviewers carry a {@link com.ryuqq.devloop.core.actor.ReviewerDomain} whose default
 * blocking policy can be overridden per roster entry.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.actor;
