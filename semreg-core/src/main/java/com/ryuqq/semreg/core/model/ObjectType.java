package com.ryuqq.semreg.core.model;

/**
 * 레지스트리 객체 유형.
 *
 * <p>각 유형은 고정된 wire name을 가지며, 정의(definition) 페이로드를 해석하는
 * 본문 타입을 결정합니다. wire name은 {@link ObjectId} 파생과 저장소 컬럼 값에 사용되므로
 * 한 번 배포된 후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>코어가 직접 다루는 유형:</strong></p>
 * <ul>
 *   <li>{@link #ENTITY_TYPE_DEF}, {@link #ATTRIBUTE_DEF}, {@link #VERB_CONTRACT}</li>
 *   <li>{@link #MEMBERSHIP_RULE}, {@link #VIEW_DEF}, {@link #EVIDENCE_REQUIREMENT}</li>
 * </ul>
 *
 * <p><strong>시딩 단계에서 사용하는 유형:</strong></p>
 * <ul>
 *   <li>{@link #TAXONOMY_DEF}, {@link #TAXONOMY_NODE}, {@link #POLICY_RULE}, {@link #DERIVATION_SPEC}</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum ObjectType {

    ENTITY_TYPE_DEF("entity_type_def"),
    ATTRIBUTE_DEF("attribute_def"),
    VERB_CONTRACT("verb_contract"),
    MEMBERSHIP_RULE("membership_rule"),
    VIEW_DEF("view_def"),
    EVIDENCE_REQUIREMENT("evidence_requirement"),
    TAXONOMY_DEF("taxonomy_def"),
    TAXONOMY_NODE("taxonomy_node"),
    POLICY_RULE("policy_rule"),
    DERIVATION_SPEC("derivation_spec");

    private final String wireName;

    ObjectType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장소와 식별자 파생에 사용되는 안정적인 이름.
     *
     * @return wire name (예: "entity_type_def")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire name으로 ObjectType 조회.
     *
     * @param wireName wire name
     * @return ObjectType
     * @throws IllegalArgumentException 알 수 없는 wire name인 경우
     */
    public static ObjectType fromWireName(String wireName) {
        if (wireName == null) {
            throw new IllegalArgumentException("wireName cannot be null");
        }
        for (ObjectType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
