package com.ryuqq.semreg.application.onboarding;

import java.util.List;

/**
 * 구조적으로 잘못된 온보딩 요청.
 *
 * <p>어떤 단계도 실행되기 전에 발생하며, 발견된 모든 위반 사항을 담습니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class OnboardingValidationException extends IllegalArgumentException {

    private final List<String> violations;

    /**
     * 생성자.
     *
     * @param violations 위반 사항 (비어 있으면 안 됨)
     */
    public OnboardingValidationException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * 원인 예외와 함께 생성.
     *
     * @param violations 위반 사항 (비어 있으면 안 됨)
     * @param cause 원인
     */
    public OnboardingValidationException(List<String> violations, Throwable cause) {
        super(buildMessage(violations), cause);
        this.violations = List.copyOf(violations);
    }

    /**
     * 위반 사항 목록.
     *
     * @return 불변 목록
     */
    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        return "Invalid onboarding request: " + String.join("; ", violations);
    }
}
