package com.ryuqq.semreg.application.scanner.label;

/**
 * 데이터 등급. 선언 순서가 민감도 오름차순입니다.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum Classification {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED
}
