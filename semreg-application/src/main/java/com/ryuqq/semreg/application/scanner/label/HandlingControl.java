package com.ryuqq.semreg.application.scanner.label;

/**
 * 라벨이 붙은 데이터의 취급 통제.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum HandlingControl {

    /** 조회 시 기본으로 마스킹 */
    MASK_BY_DEFAULT,

    /** 외부 반출 금지 */
    NO_EXPORT,

    /** 외부 LLM 전송 금지 */
    NO_LLM_EXTERNAL
}
