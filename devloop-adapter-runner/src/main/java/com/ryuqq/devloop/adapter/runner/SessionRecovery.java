package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.application.recovery.Recovery;
import com.ryuqq.devloop.application.recovery.RollbackMode;
import com.ryuqq.devloop.application.recovery.RollbackResult;
import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.SessionStore;
import com.ryuqq.devloop.core.spi.Workspace;
import com.ryuqq.devloop.core.spi.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovery 구현체.
 *
 * <p>세션 기록의 시작 마커를 기준으로 작업 트리를 조회하거나 되돌립니다.</p>
 *
 * <p><strong>롤백 방식:</strong></p>
 * <ul>
 *   <li>INSPECT: 시작 마커 대비 변경만 반환 (작업 트리 변경 없음, 진행 중 세션도 허용)</li>
 *   <li>SOFT: 현재 상태를 보존 참조로 남긴 뒤 시작 마커 상태로 복원</li>
 *   <li>HARD: 시작 마커 상태로 복원, 복원 후 변경이 남아 있으면 실패</li>
 * </ul>
 *
 * <p>SOFT/HARD는 종료된(ABANDONED 또는 COMPLETE) 세션에만 허용됩니다.
 * 진행 중인 세션의 작업 트리는 구현 Actor만 변경합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionRecovery implements Recovery {

    private static final Logger log = LoggerFactory.getLogger(SessionRecovery.class);

    private final SessionStore store;
    private final Workspace workspace;

    public SessionRecovery(SessionStore store, Workspace workspace) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        this.store = store;
        this.workspace = workspace;
    }

    @Override
    public RollbackResult rollback(SessionId sessionId, RollbackMode mode) {
        if (sessionId == null || mode == null) {
            throw new IllegalArgumentException("sessionId and mode cannot be null");
        }
        SessionRecord record = store.find(sessionId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId.getValue()));
        StartMarker marker = record.toStartMarker();
        Change before = workspace.changeSince(marker);

        if (mode == RollbackMode.INSPECT) {
            log.info("Inspect {}: {} path(s) changed since {}", sessionId.getValue(), before.paths().size(),
                marker.reference());
            return new RollbackResult(sessionId, mode, marker, before, before, null);
        }

        if (!record.hasEnded()) {
            throw new IllegalStateException(
                String.format("Cannot %s rollback active session %s (phase: %s)", mode, record.sessionId(),
                    record.phase())
            );
        }

        String preservedAt = null;
        if (mode == RollbackMode.SOFT) {
            preservedAt = workspace.softRevert(marker);
        } else {
            workspace.hardRevert(marker);
        }

        Change after = workspace.changeSince(marker);
        if (mode == RollbackMode.HARD && !after.isEmpty()) {
            throw new WorkspaceException("Hard rollback left changes against " + marker.reference() + ": "
                + after.paths());
        }
        log.info("{} rollback of {} to {}: {} path(s) reverted{}", mode, sessionId.getValue(), marker.reference(),
            before.paths().size(), preservedAt == null ? "" : ", work preserved at " + preservedAt);
        return new RollbackResult(sessionId, mode, marker, before, after, preservedAt);
    }
}
