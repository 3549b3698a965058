package com.ryuqq.semreg.core.model;

import java.util.UUID;

/**
 * 스냅샷 세트 식별자.
 *
 * @param value UUID 값
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SnapshotSetId(UUID value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public SnapshotSetId {
        if (value == null) {
            throw new IllegalArgumentException("SnapshotSetId value cannot be null");
        }
    }

    /**
     * 새로운 무작위 SnapshotSetId 생성.
     *
     * @return SnapshotSetId
     */
    public static SnapshotSetId random() {
        return new SnapshotSetId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
