package com.ryuqq.semreg.core.step;

import java.util.ArrayList;
import java.util.List;

/**
 * 단계별 게시 집계.
 *
 * <p>published, skipped, updated 카운터와 항목 단위로 수집된 오류 메시지 목록입니다.
 * 오류 목록이 비어 있지 않아도 호출 자체가 실패한 것은 아닙니다.</p>
 *
 * @param published 새로 생성된 항목 수 (dry run에서는 처리 예정 항목 수)
 * @param skipped 변경 없어 건너뛴 항목 수
 * @param updated 후속 스냅샷이 게시된 항목 수
 * @param errors 항목 단위 오류 메시지
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record StepResult(int published, int skipped, int updated, List<String> errors) {

    private static final StepResult EMPTY = new StepResult(0, 0, 0, List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 카운터가 음수인 경우
     */
    public StepResult {
        if (published < 0 || skipped < 0 || updated < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 빈 결과.
     *
     * @return 모든 카운터가 0인 StepResult
     */
    public static StepResult empty() {
        return EMPTY;
    }

    /**
     * 두 결과를 합산.
     *
     * @param other 더할 결과
     * @return 합산 결과
     */
    public StepResult plus(StepResult other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new StepResult(
            published + other.published,
            skipped + other.skipped,
            updated + other.updated,
            merged
        );
    }

    /**
     * 오류 존재 여부.
     *
     * @return 오류가 하나 이상이면 true
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 성공적으로 처리된 항목 수 (published + skipped + updated).
     *
     * @return 처리 항목 수
     */
    public int processed() {
        return published + skipped + updated;
    }
}
