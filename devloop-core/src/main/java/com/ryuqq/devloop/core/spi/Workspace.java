package com.ryuqq.devloop.core.spi;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.StartMarker;

/**
 * The working tree the implementer mutates.
 *
 * <p>Only the implementer writes to the workspace; reviewers read the current change through
 * {@link #changeSince}. All operations throw {@link WorkspaceException} when the underlying
 * storage fails.</p>
 *
 * <p><strong>Rollback Modes:</strong></p>
 * <ul>
 *   <li>{@link #softRevert}: restores the marked state but keeps the discarded work for inspection</li>
 *   <li>{@link #hardRevert}: restores the marked state and discards the work; afterwards
 *       {@code changeSince(marker)} is empty</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Workspace {

    /**
     * Takes an immutable reference to the current state.
     *
     * @return the start marker
     */
    StartMarker mark();

    /**
     * Paths and diff changed since the marker.
     *
     * @param marker the reference state
     * @return the change (empty when identical)
     */
    Change changeSince(StartMarker marker);

    /**
     * Restores the marked state, preserving the discarded work somewhere inspectable.
     *
     * @param marker the reference state
     * @return where the discarded work was preserved (stash ref, snapshot id)
     */
    String softRevert(StartMarker marker);

    /**
     * Restores the marked state exactly and discards the work.
     *
     * @param marker the reference state
     */
    void hardRevert(StartMarker marker);
}
