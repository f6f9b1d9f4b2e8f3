package com.ryuqq.devloop.adapter.inmemory.store;

import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.CompletionSummary;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.SessionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of SessionStore.
 *
 * <p>Keeps the latest record per session in a {@link ConcurrentHashMap}. Every saved version is
 * also appended to a history list so tests can assert on intermediate phases.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, SessionRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletionSummary> summaries = new ConcurrentHashMap<>();
    private final List<SessionRecord> history = new CopyOnWriteArrayList<>();

    @Override
    public void save(SessionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        records.put(record.sessionId(), record);
        history.add(record);
    }

    @Override
    public Optional<SessionRecord> find(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return Optional.ofNullable(records.get(sessionId.getValue()));
    }

    @Override
    public List<SessionRecord> list() {
        return records.values().stream()
            .sorted(Comparator.comparing(SessionRecord::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }

    @Override
    public void saveSummary(SessionId sessionId, CompletionSummary summary) {
        if (sessionId == null || summary == null) {
            throw new IllegalArgumentException("sessionId and summary cannot be null");
        }
        summaries.put(sessionId.getValue(), summary);
    }

    @Override
    public Optional<CompletionSummary> findSummary(SessionId sessionId) {
        return Optional.ofNullable(summaries.get(sessionId.getValue()));
    }

    /**
     * Every saved version of a session, oldest first.
     *
     * @param sessionId the session
     * @return saved versions
     */
    public List<SessionRecord> history(SessionId sessionId) {
        return history.stream()
            .filter(record -> record.sessionId().equals(sessionId.getValue()))
            .toList();
    }

    public void clear() {
        records.clear();
        summaries.clear();
        history.clear();
    }

    public int size() {
        return records.size();
    }
}
