/**
 * In-memory message bus adapter.
 *
 * <p>Provides {@link com.ryuqq.devloop.adapter.inmemory.bus.InMemoryMessageBus}, a per-recipient
 * FIFO mailbox implementation of the MessageBus SPI for tests and single-process runs.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.adapter.inmemory.bus;
