package com.ryuqq.devloop.core.spi;

import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.CompletionSummary;
import com.ryuqq.devloop.core.session.SessionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for session records.
 *
 * <p>The orchestrator saves the record after every phase transition so that an interrupted
 * session can be inspected, rolled back or continued.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: status queries read while the orchestrator writes</li>
 *   <li>Last write wins: {@link #save} replaces the previous record of the same session</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * Saves or replaces a session record.
     *
     * @param record the record
     */
    void save(SessionRecord record);

    /**
     * Loads a session record.
     *
     * @param sessionId the session
     * @return the record, or empty if unknown
     */
    Optional<SessionRecord> find(SessionId sessionId);

    /**
     * All stored records, most recently updated first.
     *
     * @return records
     */
    List<SessionRecord> list();

    /**
     * Stores the hand-off summary of a completed session.
     *
     * @param sessionId the session
     * @param summary the summary
     */
    void saveSummary(SessionId sessionId, CompletionSummary summary);

    Optional<CompletionSummary> findSummary(SessionId sessionId);
}
