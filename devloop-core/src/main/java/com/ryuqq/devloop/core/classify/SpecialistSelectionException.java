package com.ryuqq.devloop.core.classify;

import java.util.List;

/**
 * 작업 설명만으로 specialist를 하나로 정할 수 없을 때 발생.
 *
 * <p>호출자는 {@code specialistOverride}로 후보 중 하나를 지정해 다시 시작해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SpecialistSelectionException extends RuntimeException {

    private final List<String> candidates;

    public SpecialistSelectionException(String task, List<String> candidates) {
        super("Ambiguous specialist for task '" + task + "': candidates " + candidates
            + ". Provide a specialist override.");
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
