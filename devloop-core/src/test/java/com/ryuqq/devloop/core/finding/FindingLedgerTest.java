package com.ryuqq.devloop.core.finding;

import com.ryuqq.devloop.core.model.ActorName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FindingLedger 테스트.
 *
 * <ul>
 *   <li>Finding 수명주기 (수정, 연기, 에스컬레이션, override)</li>
 *   <li>판정 시점 정리: 임계값 미만은 기술 부채, 이상은 에스컬레이션</li>
 *   <li>원장 기반 판정 도출</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FindingLedgerTest {

    private static final ActorName SECURITY = ActorName.of("security");
    private static final ActorName DRY = ActorName.of("dry");

    private FindingLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new FindingLedger(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Test
    void raise_AssignsSequentialIds() {
        Finding first = ledger.raise(SECURITY, "Token logged in plain text", Severity.HIGH);
        Finding second = ledger.raise(DRY, "Duplicated limiter setup", Severity.LOW);

        assertThat(first.id().getValue()).isEqualTo("F-1");
        assertThat(second.id().getValue()).isEqualTo("F-2");
        assertThat(first.status()).isEqualTo(FindingStatus.OPEN);
        assertThat(first.justification()).isNull();
    }

    @Test
    void proposeDeferral_ThenAccept_KeepsJustification() {
        Finding finding = ledger.raise(SECURITY, "Rate limit keyed by IP only", Severity.MEDIUM);

        ledger.proposeDeferral(finding.id(), "Requires cross-component coordination with the gateway team");
        Finding accepted = ledger.acceptDeferral(finding.id(), BlockingPolicy.anyFinding());

        assertThat(accepted.status()).isEqualTo(FindingStatus.DEFERRED_ACCEPTED);
        assertThat(accepted.justification()).contains("cross-component");
        assertThat(ledger.technicalDebt()).containsExactly(accepted);
    }

    @Test
    void acceptDeferral_BlockingWithMinimizingJustification_Escalates() {
        // given: 보안 리뷰어는 모든 Finding을 차단
        Finding finding = ledger.raise(SECURITY, "Session token in query string", Severity.CRITICAL);
        ledger.proposeDeferral(finding.id(), "It works fine, this is minor, do it later");

        // when: 리뷰어가 수락해도
        Finding decided = ledger.acceptDeferral(finding.id(), BlockingPolicy.anyFinding());

        // then
        assertThat(decided.status()).isEqualTo(FindingStatus.ESCALATED);
        assertThat(decided.justification()).isEqualTo("It works fine, this is minor, do it later");
        assertThat(ledger.technicalDebt()).isEmpty();

        ledger.settle(SECURITY, BlockingPolicy.anyFinding());
        assertThat(ledger.get(finding.id()).status()).isEqualTo(FindingStatus.ESCALATED);
        assertThat(ledger.verdictFor(SECURITY)).isEqualTo(Verdict.ESCALATED);
    }

    @Test
    void acceptDeferral_BelowThresholdWithMinimizingJustification_Accepted() {
        Finding finding = ledger.raise(DRY, "Two similar builders", Severity.LOW);
        ledger.proposeDeferral(finding.id(), "Minor duplication, later");

        Finding decided = ledger.acceptDeferral(finding.id(), BlockingPolicy.criticalOnly());

        assertThat(decided.status()).isEqualTo(FindingStatus.DEFERRED_ACCEPTED);
    }

    @Test
    void acceptDeferral_NoPendingDeferral_ThrowsIllegalState() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.HIGH);

        assertThatThrownBy(() -> ledger.acceptDeferral(finding.id(), BlockingPolicy.anyFinding()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no pending deferral");
    }

    @Test
    void rejectDeferral_EscalatesAndAllowsLaterFix() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.HIGH);
        ledger.proposeDeferral(finding.id(), "Minor, will fix later");

        Finding escalated = ledger.rejectDeferral(finding.id());
        Finding fixed = ledger.markFixed(finding.id());

        assertThat(escalated.status()).isEqualTo(FindingStatus.ESCALATED);
        assertThat(escalated.justification()).isEqualTo("Minor, will fix later");
        assertThat(fixed.status()).isEqualTo(FindingStatus.FIXED);
        assertThat(fixed.justification()).isNull();
    }

    @Test
    void markFixed_AlreadyFixed_ThrowsIllegalState() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.HIGH);
        ledger.markFixed(finding.id());

        assertThatThrownBy(() -> ledger.markFixed(finding.id()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("FIXED → FIXED");
    }

    @Test
    void proposeDeferral_WithoutJustification_ThrowsIllegalArgument() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.HIGH);

        assertThatThrownBy(() -> ledger.proposeDeferral(finding.id(), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overrideAccept_OnlyFromEscalated() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.HIGH);

        assertThatThrownBy(() -> ledger.overrideAccept(finding.id(), "adjudicated"))
            .isInstanceOf(IllegalStateException.class);

        ledger.settle(SECURITY, BlockingPolicy.anyFinding());
        Finding accepted = ledger.overrideAccept(finding.id(), "Accepted by adjudication");

        assertThat(accepted.status()).isEqualTo(FindingStatus.DEFERRED_ACCEPTED);
        assertThat(accepted.justification()).isEqualTo("Accepted by adjudication");
    }

    // ============================================================
    // Settle & verdict
    // ============================================================

    @Test
    void settle_BelowThreshold_RecordedAsTechnicalDebt() {
        // given: DRY 리뷰어는 CRITICAL만 차단
        ledger.raise(DRY, "Two similar builders", Severity.HIGH);

        // when
        ledger.settle(DRY, BlockingPolicy.criticalOnly());

        // then
        assertThat(ledger.technicalDebt()).hasSize(1);
        assertThat(ledger.technicalDebt().get(0).justification()).isEqualTo(FindingLedger.TECHNICAL_DEBT_REASON);
        assertThat(ledger.verdictFor(DRY)).isEqualTo(Verdict.RESOLVED);
    }

    @Test
    void settle_BlockingOpenFinding_Escalated() {
        ledger.raise(SECURITY, "Secret in config", Severity.LOW);

        ledger.settle(SECURITY, BlockingPolicy.anyFinding());

        assertThat(ledger.withStatus(FindingStatus.ESCALATED)).hasSize(1);
        assertThat(ledger.verdictFor(SECURITY)).isEqualTo(Verdict.ESCALATED);
    }

    @Test
    void settle_BlockingPendingDeferral_DecidedByJustificationCategory() {
        Finding valid = ledger.raise(SECURITY, "Key rotation not covered", Severity.HIGH);
        Finding invalid = ledger.raise(SECURITY, "Token not validated", Severity.HIGH);
        ledger.proposeDeferral(valid.id(), "Out of scope: lives in another module");
        ledger.proposeDeferral(invalid.id(), "It works fine today");

        ledger.settle(SECURITY, BlockingPolicy.anyFinding());

        assertThat(ledger.get(valid.id()).status()).isEqualTo(FindingStatus.DEFERRED_ACCEPTED);
        assertThat(ledger.get(invalid.id()).status()).isEqualTo(FindingStatus.ESCALATED);
    }

    @Test
    void verdictFor_NoFindings_Clear() {
        assertThat(ledger.verdictFor(SECURITY)).isEqualTo(Verdict.CLEAR);
    }

    @Test
    void verdictFor_AllFixed_Resolved() {
        Finding finding = ledger.raise(SECURITY, "Missing auth check", Severity.CRITICAL);
        ledger.markFixed(finding.id());

        assertThat(ledger.verdictFor(SECURITY)).isEqualTo(Verdict.RESOLVED);
        assertThat(ledger.verdictFor(DRY)).isEqualTo(Verdict.CLEAR);
    }
}
