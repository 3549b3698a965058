package com.ryuqq.semreg.core.publish;

import com.ryuqq.semreg.core.model.Snapshot;

/**
 * 새 체인 생성 결과 (버전 1.0, CREATED).
 *
 * @param snapshot 생성된 스냅샷
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record Inserted(Snapshot snapshot) implements PublishOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public Inserted {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }
}
