package com.ryuqq.semreg.core.model;

/**
 * 정의 페이로드의 콘텐츠 해시 (SHA-256, 소문자 16진수).
 *
 * <p>드리프트 감지에 사용됩니다. 계산 규칙은
 * {@link com.ryuqq.semreg.core.definition.DefinitionCodec#hash} 참고.</p>
 *
 * @param value 64자리 16진수 문자열
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record DefinitionHash(String value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 64자리 소문자 16진수가 아닌 경우
     */
    public DefinitionHash {
        if (value == null || !value.matches("^[0-9a-f]{64}$")) {
            throw new IllegalArgumentException("DefinitionHash must be 64 lower-case hex characters");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
