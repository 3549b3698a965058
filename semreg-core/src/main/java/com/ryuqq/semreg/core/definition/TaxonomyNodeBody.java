package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

/**
 * 택소노미 노드.
 *
 * @param fqn 정규화된 이름 (예: "taxonomy.risk-tier.high")
 * @param taxonomyFqn 소속 택소노미 FQN
 * @param name 표시 이름
 * @param description 설명 (null 가능)
 * @param parentFqn 상위 노드 FQN (루트면 null)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record TaxonomyNodeBody(
    String fqn,
    String taxonomyFqn,
    String name,
    String description,
    String parentFqn
) implements Definition {

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.TAXONOMY_NODE;
    }
}
