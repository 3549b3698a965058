package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * 정책 규칙.
 *
 * @param fqn 정규화된 이름
 * @param name 표시 이름
 * @param description 설명
 * @param domain 도메인
 * @param enforcement 적용 방식 (예: "block", "warn")
 * @param appliesTo 적용 대상 FQN 목록
 * @param predicates 판정 조건 표현식 목록
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record PolicyRuleBody(
    String fqn,
    String name,
    String description,
    String domain,
    String enforcement,
    List<String> appliesTo,
    List<String> predicates
) implements Definition {

    public PolicyRuleBody {
        appliesTo = appliesTo == null ? List.of() : List.copyOf(appliesTo);
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.POLICY_RULE;
    }
}
