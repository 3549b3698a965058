package com.ryuqq.semreg.core.model;

/**
 * 스냅샷 변경 분류.
 *
 * <p>새 체인의 첫 스냅샷은 항상 {@link #CREATED}이며,
 * 드리프트로 인한 후속 스냅샷은 현재 {@link #NON_BREAKING}으로 고정 분류됩니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum ChangeType {

    /**
     * 새 체인의 최초 스냅샷.
     */
    CREATED,

    /**
     * 하위 호환 변경.
     */
    NON_BREAKING,

    /**
     * 하위 호환이 깨지는 변경.
     */
    BREAKING,

    /**
     * 폐기 예정 표시.
     */
    DEPRECATION,

    /**
     * 사용 종료.
     */
    RETIREMENT
}
