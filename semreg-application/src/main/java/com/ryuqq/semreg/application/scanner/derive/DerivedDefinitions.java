package com.ryuqq.semreg.application.scanner.derive;

import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.VerbContractBody;

import java.util.List;

/**
 * Verb 설정에서 도출된 정의 묶음.
 *
 * @param verbContracts verb 계약 (FQN 순)
 * @param entityTypes 엔티티 유형 (FQN 순)
 * @param attributes 속성 (FQN 순)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record DerivedDefinitions(
    List<VerbContractBody> verbContracts,
    List<EntityTypeDefBody> entityTypes,
    List<AttributeDefBody> attributes
) {

    public DerivedDefinitions {
        verbContracts = verbContracts == null ? List.of() : List.copyOf(verbContracts);
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * 도출된 정의 총 개수.
     *
     * @return 정의 수
     */
    public int size() {
        return verbContracts.size() + entityTypes.size() + attributes.size();
    }
}
