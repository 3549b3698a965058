package com.ryuqq.semreg.core.model;

import java.util.UUID;

/**
 * 스냅샷 식별자.
 *
 * <p>저장소가 스냅샷을 기록할 때 발급하며, 버전 체인의 {@code predecessor_id}로 참조됩니다.</p>
 *
 * @param value UUID 값
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SnapshotId(UUID value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public SnapshotId {
        if (value == null) {
            throw new IllegalArgumentException("SnapshotId value cannot be null");
        }
    }

    /**
     * 새로운 무작위 SnapshotId 생성.
     *
     * @return SnapshotId
     */
    public static SnapshotId random() {
        return new SnapshotId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
