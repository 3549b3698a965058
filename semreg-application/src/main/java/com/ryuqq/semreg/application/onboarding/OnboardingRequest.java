package com.ryuqq.semreg.application.onboarding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.DefinitionCodec;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.EvidenceRequirementBody;
import com.ryuqq.semreg.core.definition.VerbContractBody;

import java.util.ArrayList;
import java.util.List;

/**
 * 엔티티 유형 하나를 레지스트리에 온보딩하기 위한 요청.
 *
 * <p>엔티티 유형을 제외한 모든 컬렉션은 선택 사항이며, 비어 있으면
 * {@link OnboardingDefaults}가 생성한 기본값이 사용됩니다 (증빙 요구사항 제외).</p>
 *
 * <p><strong>JSON 형식 (snake_case):</strong></p>
 * <pre>
 * {
 *   "entity_type": { "fqn": "entity.test-widget", "name": "Test Widget", "domain": "test", ... },
 *   "attributes": [],
 *   "verb_contracts": [],
 *   "taxonomy_fqns": [],
 *   "view_fqns": [],
 *   "evidence_requirements": [],
 *   "dry_run": false,
 *   "created_by": "onboarding_pipeline"
 * }
 * </pre>
 *
 * <p>entityType의 null 여부와 구조 검증은 {@link OnboardingRequestValidator}가 담당합니다.</p>
 *
 * @param entityType 온보딩할 엔티티 유형
 * @param attributes 속성 정의 (비면 기본값 생성)
 * @param verbContracts verb 계약 (비면 CRUD 기본값 생성)
 * @param taxonomyFqns 배치할 분류 체계 FQN (비면 도메인 기본값)
 * @param viewFqns 컬럼을 추가할 뷰 FQN (비면 도메인 기본값)
 * @param evidenceRequirements 증빙 요구사항 (비면 생성하지 않음)
 * @param dryRun true면 쓰기 없이 예정 수만 보고
 * @param createdBy 생성 주체 (null이면 {@value #DEFAULT_CREATED_BY})
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record OnboardingRequest(
    EntityTypeDefBody entityType,
    List<AttributeDefBody> attributes,
    List<VerbContractBody> verbContracts,
    List<String> taxonomyFqns,
    List<String> viewFqns,
    List<EvidenceRequirementBody> evidenceRequirements,
    boolean dryRun,
    String createdBy
) {

    /**
     * created_by가 없을 때의 생성 주체.
     */
    public static final String DEFAULT_CREATED_BY = "onboarding_pipeline";

    private static final DefinitionCodec CODEC = new DefinitionCodec();

    public OnboardingRequest {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        verbContracts = verbContracts == null ? List.of() : List.copyOf(verbContracts);
        taxonomyFqns = taxonomyFqns == null ? List.of() : List.copyOf(taxonomyFqns);
        viewFqns = viewFqns == null ? List.of() : List.copyOf(viewFqns);
        evidenceRequirements = evidenceRequirements == null ? List.of() : List.copyOf(evidenceRequirements);
        createdBy = createdBy == null ? DEFAULT_CREATED_BY : createdBy;
    }

    /**
     * 엔티티 유형만 지정한 요청 Builder.
     *
     * @param entityType 엔티티 유형
     * @return Builder
     */
    public static Builder builder(EntityTypeDefBody entityType) {
        return new Builder(entityType);
    }

    /**
     * JSON 요청 파싱.
     *
     * @param json JSON 문자열
     * @return OnboardingRequest
     * @throws OnboardingValidationException JSON이 잘못된 경우
     */
    public static OnboardingRequest fromJson(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        try {
            return CODEC.objectMapper().readValue(json, OnboardingRequest.class);
        } catch (JsonProcessingException e) {
            throw new OnboardingValidationException(
                List.of("Malformed onboarding request: " + e.getOriginalMessage()), e
            );
        }
    }

    /**
     * JSON 직렬화.
     *
     * @return JSON 문자열
     */
    public String toJson() {
        try {
            return CODEC.objectMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize onboarding request", e);
        }
    }

    /**
     * dryRun만 바꾼 사본.
     *
     * @param dryRun dry run 여부
     * @return 새 OnboardingRequest
     */
    public OnboardingRequest withDryRun(boolean dryRun) {
        return new OnboardingRequest(
            entityType, attributes, verbContracts, taxonomyFqns, viewFqns, evidenceRequirements, dryRun, createdBy
        );
    }

    /**
     * OnboardingRequest Builder.
     */
    public static final class Builder {

        private final EntityTypeDefBody entityType;
        private final List<AttributeDefBody> attributes = new ArrayList<>();
        private final List<VerbContractBody> verbContracts = new ArrayList<>();
        private final List<String> taxonomyFqns = new ArrayList<>();
        private final List<String> viewFqns = new ArrayList<>();
        private final List<EvidenceRequirementBody> evidenceRequirements = new ArrayList<>();
        private boolean dryRun;
        private String createdBy = DEFAULT_CREATED_BY;

        private Builder(EntityTypeDefBody entityType) {
            this.entityType = entityType;
        }

        public Builder attribute(AttributeDefBody attribute) {
            attributes.add(attribute);
            return this;
        }

        public Builder attributes(List<AttributeDefBody> attributes) {
            this.attributes.addAll(attributes);
            return this;
        }

        public Builder verbContract(VerbContractBody contract) {
            verbContracts.add(contract);
            return this;
        }

        public Builder taxonomyFqn(String taxonomyFqn) {
            taxonomyFqns.add(taxonomyFqn);
            return this;
        }

        public Builder viewFqn(String viewFqn) {
            viewFqns.add(viewFqn);
            return this;
        }

        public Builder evidenceRequirement(EvidenceRequirementBody requirement) {
            evidenceRequirements.add(requirement);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public OnboardingRequest build() {
            return new OnboardingRequest(
                entityType, attributes, verbContracts, taxonomyFqns, viewFqns, evidenceRequirements, dryRun, createdBy
            );
        }
    }
}
