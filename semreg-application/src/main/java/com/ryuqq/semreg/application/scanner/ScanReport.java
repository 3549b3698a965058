package com.ryuqq.semreg.application.scanner;

import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.publish.PublishOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 스캔 실행 결과 보고서.
 *
 * <p>모든 {@link ScanCategory}에 대해 집계가 존재하며, 한 번도 기록되지 않은
 * 카테고리는 0으로 보고됩니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class ScanReport {

    private final Map<ScanCategory, ScanTally> tallies;
    private final SnapshotSetId snapshotSetId;
    private final boolean dryRun;

    private ScanReport(Builder builder) {
        EnumMap<ScanCategory, ScanTally> copy = new EnumMap<>(ScanCategory.class);
        for (ScanCategory category : ScanCategory.values()) {
            copy.put(category, builder.tallies.getOrDefault(category, ScanTally.zero()));
        }
        this.tallies = Collections.unmodifiableMap(copy);
        this.snapshotSetId = builder.snapshotSetId;
        this.dryRun = builder.dryRun;
    }

    /**
     * 새 Builder.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 카테고리별 집계.
     *
     * @param category 카테고리
     * @return ScanTally
     */
    public ScanTally tally(ScanCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return tallies.get(category);
    }

    /**
     * 전체 집계 (카테고리 순서대로).
     *
     * @return 불변 Map
     */
    public Map<ScanCategory, ScanTally> tallies() {
        return tallies;
    }

    /**
     * 모든 카테고리의 합.
     *
     * @return ScanTally
     */
    public ScanTally total() {
        ScanTally total = ScanTally.zero();
        for (ScanTally tally : tallies.values()) {
            total = total.plus(tally);
        }
        return total;
    }

    public int totalPublished() {
        return total().published();
    }

    public int totalSkipped() {
        return total().skipped();
    }

    public int totalUpdated() {
        return total().updated();
    }

    /**
     * 스캔이 생성한 스냅샷 세트 ID.
     *
     * @return SnapshotSetId (dry run이면 null)
     */
    public SnapshotSetId snapshotSetId() {
        return snapshotSetId;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * 사람이 읽을 수 있는 보고서.
     *
     * @return 여러 줄 문자열
     */
    public String toReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("Scan Report");
        if (dryRun) {
            sb.append(" (dry run)");
        }
        sb.append(":\n");
        for (Map.Entry<ScanCategory, ScanTally> entry : tallies.entrySet()) {
            appendLine(sb, entry.getKey().label(), entry.getValue());
        }
        appendLine(sb, "Total", total());
        if (snapshotSetId != null) {
            sb.append("  Snapshot set:     ").append(snapshotSetId).append('\n');
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String label, ScanTally tally) {
        sb.append(String.format("  %-17s %d published, %d skipped, %d updated\n",
            label + ":", tally.published(), tally.skipped(), tally.updated()));
    }

    @Override
    public String toString() {
        return "ScanReport{" +
            "tallies=" + tallies +
            ", snapshotSetId=" + snapshotSetId +
            ", dryRun=" + dryRun +
            '}';
    }

    /**
     * ScanReport 누적 Builder.
     *
     * <p>Thread-safe하지 않습니다.</p>
     */
    public static final class Builder {

        private final Map<ScanCategory, ScanTally> tallies = new EnumMap<>(ScanCategory.class);
        private SnapshotSetId snapshotSetId;
        private boolean dryRun;

        private Builder() {
        }

        /**
         * 게시 결과 하나 반영.
         *
         * @param category 카테고리
         * @param outcome 게시 결과
         * @return this
         */
        public Builder record(ScanCategory category, PublishOutcome outcome) {
            if (category == null) {
                throw new IllegalArgumentException("category cannot be null");
            }
            tallies.merge(category, ScanTally.zero().plus(outcome), ScanTally::plus);
            return this;
        }

        /**
         * 집계 합산.
         *
         * @param category 카테고리
         * @param tally 더할 집계
         * @return this
         */
        public Builder add(ScanCategory category, ScanTally tally) {
            if (category == null) {
                throw new IllegalArgumentException("category cannot be null");
            }
            if (tally == null) {
                throw new IllegalArgumentException("tally cannot be null");
            }
            tallies.merge(category, tally, ScanTally::plus);
            return this;
        }

        public Builder snapshotSetId(SnapshotSetId snapshotSetId) {
            this.snapshotSetId = snapshotSetId;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ScanReport build() {
            return new ScanReport(this);
        }
    }
}
