package com.ryuqq.devloop.adapter.runner;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 최근 처리한 메시지 ID 집합 (중복 제거용).
 *
 * <p>최대 capacity개까지만 기억하고, 넘치면 가장 오래된 ID부터 잊습니다.
 * 재전달은 원본 직후에 일어나므로 오래된 ID를 잊어도 중복 제거에는 영향이 없습니다.</p>
 *
 * <p>스레드 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RecentMessageIds {

    static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Map<String, Boolean> ids;

    RecentMessageIds() {
        this(DEFAULT_CAPACITY);
    }

    RecentMessageIds(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ids = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > RecentMessageIds.this.capacity;
            }
        };
    }

    /**
     * ID 기록.
     *
     * @param id 메시지 ID
     * @return 처음 본 ID이면 true
     */
    synchronized boolean add(String id) {
        return ids.put(id, Boolean.TRUE) == null;
    }

    synchronized boolean contains(String id) {
        return ids.containsKey(id);
    }

    synchronized int size() {
        return ids.size();
    }

    synchronized void clear() {
        ids.clear();
    }
}
