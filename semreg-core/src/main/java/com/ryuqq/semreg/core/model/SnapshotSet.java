package com.ryuqq.semreg.core.model;

import java.time.Instant;

/**
 * 한 번의 스캔 또는 온보딩 실행에서 기록된 스냅샷 묶음.
 *
 * @param snapshotSetId 세트 식별자
 * @param label 사람이 읽을 수 있는 라벨 (null 가능)
 * @param createdBy 생성 주체
 * @param createdAt 생성 시각
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SnapshotSet(
    SnapshotSetId snapshotSetId,
    String label,
    String createdBy,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public SnapshotSet {
        if (snapshotSetId == null || createdAt == null) {
            throw new IllegalArgumentException("snapshotSetId and createdAt are required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
    }
}
