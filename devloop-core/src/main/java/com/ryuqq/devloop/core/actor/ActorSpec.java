package com.ryuqq.devloop.core.actor;

import com.ryuqq.devloop.core.finding.BlockingPolicy;
import com.ryuqq.devloop.core.model.ActorName;

/**
 * 세션 로스터의 Actor 정의.
 *
 * <p>구현자는 domain/policy가 없고, 리뷰어는 둘 다 필수입니다.</p>
 *
 * @param name Actor 이름
 * @param role 역할
 * @param domain 리뷰 관점 (구현자는 null)
 * @param policy 차단 정책 (구현자는 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActorSpec(
    ActorName name,
    ActorRole role,
    ReviewerDomain domain,
    BlockingPolicy policy
) {

    public ActorSpec {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (name.isOrchestrator()) {
            throw new IllegalArgumentException("'" + name + "' is reserved for the orchestrator");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (role == ActorRole.REVIEWER && (domain == null || policy == null)) {
            throw new IllegalArgumentException("Reviewer " + name + " requires a domain and a blocking policy");
        }
        if (role == ActorRole.IMPLEMENTER && (domain != null || policy != null)) {
            throw new IllegalArgumentException("Implementer " + name + " cannot carry a reviewer domain or policy");
        }
    }

    public static ActorSpec implementer(ActorName name) {
        return new ActorSpec(name, ActorRole.IMPLEMENTER, null, null);
    }

    /**
     * 도메인 기본 정책으로 리뷰어 정의.
     *
     * @param name 리뷰어 이름
     * @param domain 리뷰 관점
     * @return ActorSpec
     */
    public static ActorSpec reviewer(ActorName name, ReviewerDomain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        return new ActorSpec(name, ActorRole.REVIEWER, domain, domain.defaultPolicy());
    }

    public static ActorSpec reviewer(ActorName name, ReviewerDomain domain, BlockingPolicy policy) {
        return new ActorSpec(name, ActorRole.REVIEWER, domain, policy);
    }

    public boolean isReviewer() {
        return role == ActorRole.REVIEWER;
    }
}
