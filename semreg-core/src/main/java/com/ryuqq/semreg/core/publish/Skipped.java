package com.ryuqq.semreg.core.publish;

import com.ryuqq.semreg.core.model.Snapshot;

/**
 * 변경 없음 결과.
 *
 * @param snapshot 그대로 유지된 활성 스냅샷
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record Skipped(Snapshot snapshot) implements PublishOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public Skipped {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }
}
