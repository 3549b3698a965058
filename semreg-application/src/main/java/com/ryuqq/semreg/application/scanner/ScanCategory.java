package com.ryuqq.semreg.application.scanner;

import com.ryuqq.semreg.core.model.ObjectType;

/**
 * 스캔 보고서의 집계 카테고리.
 *
 * <p>선언 순서가 보고서 출력 순서입니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum ScanCategory {

    VERB_CONTRACTS("Verb contracts", ObjectType.VERB_CONTRACT),
    ENTITY_TYPES("Entity types", ObjectType.ENTITY_TYPE_DEF),
    ATTRIBUTES("Attributes", ObjectType.ATTRIBUTE_DEF),
    TAXONOMIES("Taxonomies", ObjectType.TAXONOMY_DEF),
    TAXONOMY_NODES("Taxonomy nodes", ObjectType.TAXONOMY_NODE),
    VIEWS("Views", ObjectType.VIEW_DEF),
    POLICIES("Policies", ObjectType.POLICY_RULE),
    DERIVATION_SPECS("Derivation specs", ObjectType.DERIVATION_SPEC);

    private final String label;
    private final ObjectType objectType;

    ScanCategory(String label, ObjectType objectType) {
        this.label = label;
        this.objectType = objectType;
    }

    /**
     * 보고서 라벨.
     *
     * @return 라벨
     */
    public String label() {
        return label;
    }

    /**
     * 카테고리에 집계되는 객체 유형.
     *
     * @return ObjectType
     */
    public ObjectType objectType() {
        return objectType;
    }

    /**
     * 객체 유형에 대응하는 카테고리가 있는지 확인.
     *
     * @param objectType 객체 유형
     * @return 대응 카테고리가 있으면 true
     */
    public static boolean supports(ObjectType objectType) {
        for (ScanCategory category : values()) {
            if (category.objectType == objectType) {
                return true;
            }
        }
        return false;
    }

    /**
     * 객체 유형에 대응하는 카테고리.
     *
     * @param objectType 객체 유형
     * @return ScanCategory
     * @throws IllegalArgumentException 스캔 대상이 아닌 유형인 경우
     */
    public static ScanCategory of(ObjectType objectType) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        for (ScanCategory category : values()) {
            if (category.objectType == objectType) {
                return category;
            }
        }
        throw new IllegalArgumentException("Not a scan category: " + objectType);
    }
}
