/**
 * Session recovery port.
 *
 * <p>Rollback modes: INSPECT (diff only), SOFT (restore and keep the work for inspection),
 * HARD (restore exactly).</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.application.recovery;
