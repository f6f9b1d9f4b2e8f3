/**
 * In-memory session store adapter.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.adapter.inmemory.store;
