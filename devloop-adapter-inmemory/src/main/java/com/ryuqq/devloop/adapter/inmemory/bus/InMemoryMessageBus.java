package com.ryuqq.devloop.adapter.inmemory.bus;

import com.ryuqq.devloop.core.contract.Delivery;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.spi.MessageBus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of MessageBus for testing and single-process runs.
 *
 * <p>This implementation keeps one {@link LinkedBlockingDeque} per registered recipient.
 * New messages go to the tail; nacked deliveries go back to the head so that ordering per
 * recipient is preserved across redeliveries.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Per-recipient FIFO with blocking receive</li>
 *   <li>Visibility timeout: in-flight deliveries that are neither acked nor nacked can be
 *       returned to their mailbox with {@link #processVisibilityTimeouts()}</li>
 *   <li>Dead-letter list for exhausted deliveries and unknown recipients</li>
 *   <li>Thread-safe: all operations are safe for concurrent access</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No persistence: all data lost on restart</li>
 *   <li>Single JVM only</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    /**
     * Default visibility timeout in milliseconds (30 seconds).
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final ConcurrentHashMap<ActorName, LinkedBlockingDeque<Delivery>> mailboxes;
    private final ConcurrentHashMap<Long, InFlight> inFlight;
    private final List<DeadLetter> deadLetters;
    private final AtomicLong deliverySequence;
    private final long visibilityTimeoutMs;

    public InMemoryMessageBus() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a bus with a custom visibility timeout.
     *
     * @param visibilityTimeoutMs how long a received delivery stays invisible before it may be redelivered
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryMessageBus(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.mailboxes = new ConcurrentHashMap<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
        this.deliverySequence = new AtomicLong();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void register(ActorName recipient) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        mailboxes.computeIfAbsent(recipient, name -> new LinkedBlockingDeque<>());
    }

    @Override
    public int unregister(ActorName recipient) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        LinkedBlockingDeque<Delivery> removed = mailboxes.remove(recipient);
        inFlight.values().removeIf(entry -> entry.delivery.message().recipient().equals(recipient));
        return removed == null ? 0 : removed.size();
    }

    @Override
    public void send(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        Delivery delivery = new Delivery(deliverySequence.incrementAndGet(), message, 1);
        LinkedBlockingDeque<Delivery> mailbox = mailboxes.get(message.recipient());
        if (mailbox == null) {
            deadLetters.add(new DeadLetter(delivery, "Unknown recipient: " + message.recipient()));
            return;
        }
        mailbox.addLast(delivery);
    }

    @Override
    public Optional<Delivery> receive(ActorName recipient, long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative, but was: " + timeoutMs);
        }
        LinkedBlockingDeque<Delivery> mailbox = mailboxes.get(recipient);
        if (mailbox == null) {
            throw new IllegalArgumentException("Recipient is not registered: " + recipient);
        }
        Delivery delivery = mailbox.pollFirst(timeoutMs, TimeUnit.MILLISECONDS);
        if (delivery == null) {
            return Optional.empty();
        }
        inFlight.put(delivery.deliveryId(), new InFlight(delivery, System.currentTimeMillis() + visibilityTimeoutMs));
        return Optional.of(delivery);
    }

    @Override
    public void ack(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        inFlight.remove(delivery.deliveryId());
    }

    @Override
    public void nack(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (inFlight.remove(delivery.deliveryId()) == null) {
            return;
        }
        requeueAtHead(delivery.nextAttempt());
    }

    @Override
    public void deadLetter(Delivery delivery, String reason) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        inFlight.remove(delivery.deliveryId());
        deadLetters.add(new DeadLetter(delivery, reason));
    }

    @Override
    public List<DeadLetter> deadLetters() {
        return List.copyOf(deadLetters);
    }

    /**
     * Returns every in-flight delivery whose visibility timeout expired to the head of its mailbox.
     *
     * <p>Simulates the redelivery of a message whose consumer died before acknowledging it.</p>
     *
     * @return number of redelivered deliveries
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        List<Long> expired = new ArrayList<>();
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAgainAt <= now) {
                expired.add(entry.getKey());
            }
        }

        int count = 0;
        for (Long deliveryId : expired) {
            InFlight entry = inFlight.remove(deliveryId);
            if (entry != null) {
                requeueAtHead(entry.delivery.nextAttempt());
                count++;
            }
        }
        return count;
    }

    private void requeueAtHead(Delivery delivery) {
        LinkedBlockingDeque<Delivery> mailbox = mailboxes.get(delivery.message().recipient());
        if (mailbox == null) {
            deadLetters.add(new DeadLetter(delivery, "Recipient unregistered before redelivery"));
            return;
        }
        mailbox.addFirst(delivery);
    }

    /**
     * Clears all mailboxes, in-flight deliveries and dead letters. Registrations are kept.
     */
    public void clear() {
        mailboxes.values().forEach(LinkedBlockingDeque::clear);
        inFlight.clear();
        deadLetters.clear();
    }

    public int mailboxSize(ActorName recipient) {
        LinkedBlockingDeque<Delivery> mailbox = mailboxes.get(recipient);
        return mailbox == null ? 0 : mailbox.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int deadLetterSize() {
        return deadLetters.size();
    }

    public boolean isRegistered(ActorName recipient) {
        return mailboxes.containsKey(recipient);
    }

    private static final class InFlight {
        private final Delivery delivery;
        private final long visibleAgainAt;

        private InFlight(Delivery delivery, long visibleAgainAt) {
            this.delivery = delivery;
            this.visibleAgainAt = visibleAgainAt;
        }
    }
}
