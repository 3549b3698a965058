package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

/**
 * 택소노미 정의.
 *
 * @param fqn 정규화된 이름 (예: "taxonomy.risk-tier")
 * @param name 표시 이름
 * @param description 설명
 * @param domain 도메인
 * @param rootNodeFqn 루트 노드 FQN (null 가능)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record TaxonomyDefBody(
    String fqn,
    String name,
    String description,
    String domain,
    String rootNodeFqn
) implements Definition {

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.TAXONOMY_DEF;
    }
}
