package com.ryuqq.semreg.application.scanner;

import com.ryuqq.semreg.core.publish.PublishOutcome;

/**
 * 카테고리 하나의 게시 집계.
 *
 * @param published 새로 생성된 수 (dry run에서는 예정 수)
 * @param skipped 변경 없어 건너뛴 수
 * @param updated 후속 스냅샷이 게시된 수
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ScanTally(int published, int skipped, int updated) {

    private static final ScanTally ZERO = new ScanTally(0, 0, 0);

    public ScanTally {
        if (published < 0 || skipped < 0 || updated < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
    }

    /**
     * 0 집계.
     *
     * @return ScanTally
     */
    public static ScanTally zero() {
        return ZERO;
    }

    /**
     * dry run 예정 수.
     *
     * @param count 항목 수
     * @return published만 count인 ScanTally
     */
    public static ScanTally planned(int count) {
        return new ScanTally(count, 0, 0);
    }

    /**
     * 게시 결과 하나를 반영한 집계.
     *
     * @param outcome 게시 결과
     * @return 새 ScanTally
     */
    public ScanTally plus(PublishOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome.isInserted()) {
            return new ScanTally(published + 1, skipped, updated);
        }
        if (outcome.isSkipped()) {
            return new ScanTally(published, skipped + 1, updated);
        }
        return new ScanTally(published, skipped, updated + 1);
    }

    /**
     * 두 집계를 합산.
     *
     * @param other 더할 집계
     * @return 합산 결과
     */
    public ScanTally plus(ScanTally other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return new ScanTally(published + other.published, skipped + other.skipped, updated + other.updated);
    }

    /**
     * 처리 항목 수.
     *
     * @return published + skipped + updated
     */
    public int total() {
        return published + skipped + updated;
    }
}
