package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * 증빙 요구사항.
 *
 * @param fqn 정규화된 이름
 * @param name 표시 이름
 * @param description 설명
 * @param targetEntityType 요구사항이 적용되는 엔티티 유형 FQN
 * @param documentTypes 인정되는 문서 유형
 * @param minimumDocuments 필요한 최소 문서 수
 * @param mandatory 필수 여부
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record EvidenceRequirementBody(
    String fqn,
    String name,
    String description,
    String targetEntityType,
    List<String> documentTypes,
    int minimumDocuments,
    boolean mandatory
) implements Definition {

    public EvidenceRequirementBody {
        documentTypes = documentTypes == null ? List.of() : List.copyOf(documentTypes);
        if (minimumDocuments < 0) {
            throw new IllegalArgumentException("minimumDocuments cannot be negative");
        }
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.EVIDENCE_REQUIREMENT;
    }
}
