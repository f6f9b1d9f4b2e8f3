package com.ryuqq.devloop.application.orchestrator;

import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.model.SessionId;

import java.util.List;

/**
 * 세션 시작 요청.
 *
 * <p>{@code continueSession}이 있으면 이전 세션의 작업 설명과 시작 마커를 이어받으며,
 * 이 경우 {@code task}는 비워둘 수 있습니다.</p>
 *
 * @param task 작업 설명
 * @param mode 요청 모드
 * @param specialistOverride specialist 직접 지정 (없으면 null)
 * @param continueSession 이어받을 중단된 세션 (없으면 null)
 * @param targetPaths 변경 예정 경로 (LIGHTWEIGHT 적격성 판정에 사용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StartRequest(
    String task,
    Mode mode,
    String specialistOverride,
    SessionId continueSession,
    List<String> targetPaths
) {

    public StartRequest {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (continueSession == null && (task == null || task.isBlank())) {
            throw new IllegalArgumentException("task cannot be null or blank");
        }
        if (specialistOverride != null && specialistOverride.isBlank()) {
            throw new IllegalArgumentException("specialistOverride cannot be blank");
        }
        targetPaths = targetPaths == null ? List.of() : List.copyOf(targetPaths);
    }

    public static StartRequest of(String task, Mode mode) {
        return new StartRequest(task, mode, null, null, List.of());
    }

    public StartRequest withSpecialist(String specialist) {
        return new StartRequest(task, mode, specialist, continueSession, targetPaths);
    }

    public StartRequest withTargetPaths(List<String> paths) {
        return new StartRequest(task, mode, specialistOverride, continueSession, paths);
    }

    public static StartRequest continuing(SessionId previous, Mode mode) {
        return new StartRequest(null, mode, null, previous, List.of());
    }
}
