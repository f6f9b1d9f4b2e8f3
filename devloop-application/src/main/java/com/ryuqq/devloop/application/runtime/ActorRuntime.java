package com.ryuqq.devloop.application.runtime;

import com.ryuqq.devloop.core.actor.Actor;
import com.ryuqq.devloop.core.actor.ActorStatus;
import com.ryuqq.devloop.core.model.ActorName;

import java.util.Map;

/**
 * Actor mailbox runtime.
 *
 * <p>Runs each spawned actor against its mailbox on the message bus, one message at a time.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registering the actor's mailbox and starting its consumer loop</li>
 *   <li>Reporting ACTIVE while a message is handled and IDLE otherwise</li>
 *   <li>Redelivering failed messages with backoff, dead-lettering them after the delivery budget</li>
 *   <li>Deduplicating redelivered messages by message id</li>
 * </ul>
 *
 * <p><strong>Status is informational:</strong> the orchestrator never advances a phase because an
 * actor became IDLE. Only gate confirmations count.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ActorRuntime {

    /**
     * Starts consuming the actor's mailbox.
     *
     * @param actor the actor
     * @throws IllegalStateException if an actor with the same name is already running
     */
    void spawn(Actor actor);

    /**
     * Current status of an actor.
     *
     * @param name actor name
     * @return status, STOPPED for unknown actors
     */
    ActorStatus status(ActorName name);

    /**
     * Snapshot of every spawned actor's status.
     *
     * @return statuses by name
     */
    Map<ActorName, ActorStatus> statuses();

    /**
     * Stops every actor loop and releases worker threads.
     */
    void shutdown();
}
