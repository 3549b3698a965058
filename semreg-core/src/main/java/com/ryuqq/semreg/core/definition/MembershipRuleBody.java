package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * 택소노미 소속 규칙.
 *
 * <p>대상 객체(주로 엔티티 유형)를 택소노미의 특정 노드에 연결합니다.</p>
 *
 * @param fqn 정규화된 이름
 * @param name 표시 이름
 * @param description 설명 (null 가능)
 * @param taxonomyFqn 택소노미 FQN
 * @param nodeFqn 택소노미 노드 FQN
 * @param membershipKind 소속 종류
 * @param targetType 대상 객체 유형 wire name (예: "entity_type_def")
 * @param targetFqn 대상 객체 FQN
 * @param conditions 조건부 소속 조건
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record MembershipRuleBody(
    String fqn,
    String name,
    String description,
    String taxonomyFqn,
    String nodeFqn,
    MembershipKind membershipKind,
    String targetType,
    String targetFqn,
    List<MembershipCondition> conditions
) implements Definition {

    public MembershipRuleBody {
        membershipKind = membershipKind == null ? MembershipKind.DIRECT : membershipKind;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.MEMBERSHIP_RULE;
    }

    /**
     * 소속 종류.
     */
    public enum MembershipKind {
        DIRECT,
        INHERITED,
        CONDITIONAL
    }

    /**
     * 조건부 소속 조건.
     *
     * @param kind 조건 종류 (예: "attribute_equals")
     * @param field 대상 필드
     * @param operator 연산자
     * @param value 비교 값
     */
    public record MembershipCondition(String kind, String field, String operator, JsonNode value) {
    }
}
