package com.ryuqq.semreg.application.scanner.config;

import java.util.List;

/**
 * Verb 생명주기 제약.
 *
 * @param requiresStates 실행 전 엔티티가 있어야 하는 상태
 * @param preconditionChecks 실행 전 검사 이름
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record LifecycleConfig(List<String> requiresStates, List<String> preconditionChecks) {

    public LifecycleConfig {
        requiresStates = requiresStates == null ? List.of() : List.copyOf(requiresStates);
        preconditionChecks = preconditionChecks == null ? List.of() : List.copyOf(preconditionChecks);
    }
}
