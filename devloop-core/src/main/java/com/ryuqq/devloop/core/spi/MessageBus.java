package com.ryuqq.devloop.core.spi;

import com.ryuqq.devloop.core.contract.Delivery;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.model.ActorName;

import java.util.List;
import java.util.Optional;

/**
 * Addressed mailbox SPI used by actors and the orchestrator.
 *
 * <p>Every participant, the orchestrator included, owns one mailbox keyed by its
 * {@link ActorName}. Messages to a recipient are delivered in the order they were sent.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registering and unregistering mailboxes</li>
 *   <li>Per-recipient FIFO delivery with blocking receive</li>
 *   <li>Acknowledging processed deliveries</li>
 *   <li>Negative acknowledging failed deliveries for redelivery at the head of the mailbox</li>
 *   <li>Dead-lettering deliveries that exhausted their budget or have no recipient</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: senders and the single consumer of a mailbox run on different threads</li>
 *   <li>At-least-once Delivery: consumers must deduplicate on {@link Message#id()}</li>
 *   <li>Ordering: a nacked delivery is redelivered before any later message to the same recipient</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Optional&lt;Delivery&gt; next = bus.receive(name, 200);
 * next.ifPresent(delivery -&gt; {
 *     try {
 *         actor.onMessage(delivery.message(), context);
 *         bus.ack(delivery);
 *     } catch (RuntimeException e) {
 *         bus.nack(delivery);
 *     }
 * });
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Creates the mailbox for a recipient. Registering twice is a no-op.
     *
     * @param recipient mailbox owner
     */
    void register(ActorName recipient);

    /**
     * Removes a mailbox and discards any pending messages.
     *
     * @param recipient mailbox owner
     * @return number of discarded pending messages
     */
    int unregister(ActorName recipient);

    /**
     * Enqueues a message at the tail of the recipient's mailbox.
     *
     * <p>Messages to an unregistered recipient are dead-lettered immediately.</p>
     *
     * @param message the message to send
     * @throws IllegalArgumentException if message is null
     */
    void send(Message message);

    /**
     * Takes the next delivery for a recipient, waiting up to {@code timeoutMs}.
     *
     * @param recipient mailbox owner
     * @param timeoutMs maximum wait in milliseconds (0 for no wait)
     * @return the next delivery, or empty if none arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws IllegalArgumentException if the recipient is not registered
     */
    Optional<Delivery> receive(ActorName recipient, long timeoutMs) throws InterruptedException;

    /**
     * Acknowledges a processed delivery. Idempotent.
     *
     * @param delivery the delivery to acknowledge
     */
    void ack(Delivery delivery);

    /**
     * Returns a delivery to the head of its recipient's mailbox with an incremented attempt.
     *
     * @param delivery the failed delivery
     */
    void nack(Delivery delivery);

    /**
     * Moves a delivery to the dead-letter list.
     *
     * @param delivery the delivery that permanently failed
     * @param reason why it was dead-lettered
     */
    void deadLetter(Delivery delivery, String reason);

    /**
     * Dead-lettered deliveries, oldest first.
     *
     * @return snapshot of the dead-letter list
     */
    List<DeadLetter> deadLetters();

    /**
     * A dead-lettered delivery and the reason it was moved there.
     *
     * @param delivery the delivery
     * @param reason the reason
     */
    record DeadLetter(Delivery delivery, String reason) {
    }
}
