package com.ryuqq.semreg.core.publish;

import com.ryuqq.semreg.core.model.Snapshot;

/**
 * 멱등 게시 결과.
 *
 * <p>PublishOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Inserted}: 새 체인 생성 (published로 집계)</li>
 *   <li>{@link Skipped}: 해시 동일, 쓰기 없음</li>
 *   <li>{@link Updated}: 해시 변경, 후속 스냅샷 게시</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public sealed interface PublishOutcome permits Inserted, Skipped, Updated {

    /**
     * 게시 이후의 활성 스냅샷.
     *
     * @return 활성 스냅샷
     */
    Snapshot snapshot();

    /**
     * 새 체인이 생성되었는지 확인.
     *
     * @return 생성 여부
     */
    default boolean isInserted() {
        return this instanceof Inserted;
    }

    /**
     * 변경 없이 건너뛰었는지 확인.
     *
     * @return 건너뜀 여부
     */
    default boolean isSkipped() {
        return this instanceof Skipped;
    }

    /**
     * 후속 스냅샷이 게시되었는지 확인.
     *
     * @return 갱신 여부
     */
    default boolean isUpdated() {
        return this instanceof Updated;
    }
}
