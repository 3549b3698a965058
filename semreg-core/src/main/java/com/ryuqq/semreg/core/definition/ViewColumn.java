package com.ryuqq.semreg.core.definition;

/**
 * 뷰 컬럼.
 *
 * <p>컬럼의 동일성은 {@code attributeFqn}으로만 판단합니다.</p>
 *
 * @param attributeFqn 속성 FQN
 * @param label 표시 라벨
 * @param sourceEntityType 컬럼을 기여한 엔티티 유형 FQN (null 가능)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ViewColumn(String attributeFqn, String label, String sourceEntityType) {

    public ViewColumn {
        if (attributeFqn == null || attributeFqn.isBlank()) {
            throw new IllegalArgumentException("attributeFqn cannot be null or blank");
        }
    }
}
