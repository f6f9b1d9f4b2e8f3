/**
 * In-memory workspace adapter.
 *
 * <p>Snapshot-based stand-in for a version-controlled working tree. Used by the testkit
 * scenarios to exercise change detection and rollback without touching disk.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.adapter.inmemory.workspace;
