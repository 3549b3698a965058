package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 온보딩 요청 구조 검증기.
 *
 * <p>정의 본문의 업무적 타당성은 검사하지 않고, 게시에 필요한 식별 정보만 확인합니다.
 * 모든 위반을 모은 뒤 한 번에 {@link OnboardingValidationException}을 던집니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ul>
 *   <li>entity_type 존재, fqn/name/domain 비어 있지 않음</li>
 *   <li>모든 FQN은 점으로 구분된 두 구간 이상 (예: "entity.test-widget")</li>
 *   <li>컬렉션 안에서 FQN 중복 없음</li>
 *   <li>엔티티 유형의 필수/선택 속성 FQN은 두 목록을 합쳐 한 번씩만</li>
 *   <li>created_by 비어 있지 않음</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class OnboardingRequestValidator {

    private static final Pattern FQN = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)+");

    /**
     * 요청 검증.
     *
     * @param request 온보딩 요청
     * @throws IllegalArgumentException request가 null인 경우
     * @throws OnboardingValidationException 위반 사항이 있는 경우
     */
    public void validate(OnboardingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        List<String> violations = new ArrayList<>();

        EntityTypeDefBody entityType = request.entityType();
        if (entityType == null) {
            violations.add("entity_type is required");
        } else {
            checkFqn("entity_type.fqn", entityType.fqn(), violations);
            checkNotBlank("entity_type.name", entityType.name(), violations);
            checkNotBlank("entity_type.domain", entityType.domain(), violations);
            Set<String> attributeFqns = new HashSet<>();
            checkFqns("entity_type.required_attributes", entityType.requiredAttributes(), attributeFqns, violations);
            checkFqns("entity_type.optional_attributes", entityType.optionalAttributes(), attributeFqns, violations);
        }

        checkDefinitions("attributes", request.attributes(), violations);
        checkDefinitions("verb_contracts", request.verbContracts(), violations);
        checkDefinitions("evidence_requirements", request.evidenceRequirements(), violations);
        checkFqns("taxonomy_fqns", request.taxonomyFqns(), new HashSet<>(), violations);
        checkFqns("view_fqns", request.viewFqns(), new HashSet<>(), violations);
        checkNotBlank("created_by", request.createdBy(), violations);

        if (!violations.isEmpty()) {
            throw new OnboardingValidationException(violations);
        }
    }

    private static void checkDefinitions(String field, List<? extends Definition> definitions, List<String> violations) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            Definition definition = definitions.get(i);
            String path = field + "[" + i + "]";
            if (definition == null) {
                violations.add(path + " cannot be null");
                continue;
            }
            if (checkFqn(path + ".fqn", definition.fqn(), violations) && !seen.add(definition.fqn())) {
                violations.add(path + ".fqn duplicates '" + definition.fqn() + "'");
            }
        }
    }

    private static void checkFqns(String field, List<String> fqns, Set<String> seen, List<String> violations) {
        for (int i = 0; i < fqns.size(); i++) {
            String path = field + "[" + i + "]";
            String fqn = fqns.get(i);
            if (checkFqn(path, fqn, violations) && !seen.add(fqn)) {
                violations.add(path + " duplicates '" + fqn + "'");
            }
        }
    }

    private static boolean checkFqn(String path, String fqn, List<String> violations) {
        if (!checkNotBlank(path, fqn, violations)) {
            return false;
        }
        if (!FQN.matcher(fqn).matches()) {
            violations.add(path + " is not a valid FQN: '" + fqn + "'");
            return false;
        }
        return true;
    }

    private static boolean checkNotBlank(String path, String value, List<String> violations) {
        if (value == null || value.isBlank()) {
            violations.add(path + " is required");
            return false;
        }
        return true;
    }
}
