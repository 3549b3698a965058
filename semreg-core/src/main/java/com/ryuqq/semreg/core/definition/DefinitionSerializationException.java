package com.ryuqq.semreg.core.definition;

/**
 * 정의 본문과 JSON 트리 간 변환 실패.
 *
 * <p>온보딩 파이프라인에서는 항목 단위로 복구 가능한 오류로 취급되어
 * 해당 단계의 오류 목록에 기록됩니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class DefinitionSerializationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public DefinitionSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
