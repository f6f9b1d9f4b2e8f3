/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement for the
 * development loop.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.devloop.core.spi.MessageBus} - Per-actor FIFO mailboxes with ack/nack and dead letters</li>
 *   <li>{@link com.ryuqq.devloop.core.spi.SessionStore} - Session record persistence</li>
 *   <li>{@link com.ryuqq.devloop.core.spi.Workspace} - Working tree marker, diff and rollback</li>
 *   <li>{@link com.ryuqq.devloop.core.spi.Adjudicator} - Resolution of review escalations</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>devloop-adapter-inmemory provides test implementations; devloop-adapter-runner provides
 * the git-backed workspace and the JSON file store.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.spi;
