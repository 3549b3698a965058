package com.ryuqq.semreg.core.publish;

import com.ryuqq.semreg.core.model.Snapshot;

/**
 * 드리프트 갱신 결과.
 *
 * @param previous 대체된 이전 스냅샷
 * @param snapshot 새로 게시된 활성 스냅샷
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record Updated(Snapshot previous, Snapshot snapshot) implements PublishOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException previous 또는 snapshot이 null인 경우
     */
    public Updated {
        if (previous == null) {
            throw new IllegalArgumentException("previous cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }
}
