package com.ryuqq.semreg.core.definition;

import com.ryuqq.semreg.core.model.ObjectType;

/**
 * 레지스트리 객체 정의 본문.
 *
 * <p>{@link ObjectType}별로 정확히 하나의 본문 타입이 대응되는 sealed interface입니다.
 * 유형별 분기를 타입 안전하게 유지하기 위해 무형식 페이로드 대신 이 타입을 사용합니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>모든 본문은 불변 record</li>
 *   <li>{@link #fqn()}은 유형 네임스페이스 내에서 객체를 식별하는 안정적인 이름</li>
 *   <li>{@link #objectType()}은 직렬화 대상이 아님</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public sealed interface Definition permits
    EntityTypeDefBody,
    AttributeDefBody,
    VerbContractBody,
    MembershipRuleBody,
    ViewDefBody,
    EvidenceRequirementBody,
    TaxonomyDefBody,
    TaxonomyNodeBody,
    PolicyRuleBody,
    DerivationSpecBody {

    /**
     * 정규화된 이름 (Fully-Qualified Name).
     *
     * @return FQN
     */
    String fqn();

    /**
     * 이 본문이 해석되는 객체 유형.
     *
     * @return ObjectType
     */
    ObjectType objectType();
}
