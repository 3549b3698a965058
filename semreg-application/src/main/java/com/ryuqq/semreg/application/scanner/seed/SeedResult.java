package com.ryuqq.semreg.application.scanner.seed;

import com.ryuqq.semreg.application.scanner.ScanCategory;
import com.ryuqq.semreg.application.scanner.ScanTally;
import com.ryuqq.semreg.core.publish.PublishOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 시더 한 번 실행의 카테고리별 집계.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class SeedResult {

    private static final SeedResult EMPTY = new SeedResult(new EnumMap<>(ScanCategory.class));

    private final Map<ScanCategory, ScanTally> tallies;

    private SeedResult(EnumMap<ScanCategory, ScanTally> tallies) {
        this.tallies = Collections.unmodifiableMap(new EnumMap<>(tallies));
    }

    public static SeedResult empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 카테고리 집계.
     *
     * @param category 카테고리
     * @return 기록이 없으면 {@link ScanTally#zero()}
     */
    public ScanTally tally(ScanCategory category) {
        return tallies.getOrDefault(category, ScanTally.zero());
    }

    /**
     * 기록된 카테고리의 집계.
     *
     * @return 불변 Map
     */
    public Map<ScanCategory, ScanTally> tallies() {
        return tallies;
    }

    @Override
    public String toString() {
        return "SeedResult" + tallies;
    }

    /**
     * SeedResult 누적 Builder.
     */
    public static final class Builder {

        private final EnumMap<ScanCategory, ScanTally> tallies = new EnumMap<>(ScanCategory.class);

        private Builder() {
        }

        /**
         * 게시 결과 반영. 카테고리는 스냅샷의 객체 유형으로 결정됩니다.
         *
         * @param outcome 게시 결과
         * @return this
         */
        public Builder record(PublishOutcome outcome) {
            if (outcome == null) {
                throw new IllegalArgumentException("outcome cannot be null");
            }
            ScanCategory category = ScanCategory.of(outcome.snapshot().objectType());
            tallies.merge(category, ScanTally.zero().plus(outcome), ScanTally::plus);
            return this;
        }

        /**
         * dry run 예정 수 반영.
         *
         * @param category 카테고리
         * @param count 항목 수
         * @return this
         */
        public Builder plan(ScanCategory category, int count) {
            if (category == null) {
                throw new IllegalArgumentException("category cannot be null");
            }
            tallies.merge(category, ScanTally.planned(count), ScanTally::plus);
            return this;
        }

        public SeedResult build() {
            return new SeedResult(tallies);
        }
    }
}
