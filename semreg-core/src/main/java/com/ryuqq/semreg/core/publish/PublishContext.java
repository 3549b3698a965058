package com.ryuqq.semreg.core.publish;

import com.ryuqq.semreg.core.model.SnapshotSetId;

/**
 * 게시 호출 공통 속성.
 *
 * <p>한 번의 스캔 또는 온보딩 실행 동안 모든 게시 호출에 같은 값이 전달됩니다.</p>
 *
 * @param createdBy 생성 주체
 * @param snapshotSetId 스냅샷 세트 ID (null 가능)
 * @param driftRationale 드리프트 갱신 시 기록할 변경 사유
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record PublishContext(String createdBy, SnapshotSetId snapshotSetId, String driftRationale) {

    /**
     * 호출자가 사유를 지정하지 않았을 때의 드리프트 변경 사유.
     */
    public static final String DEFAULT_DRIFT_RATIONALE = "Definition drift update";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException createdBy가 null 또는 blank인 경우
     */
    public PublishContext {
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
        if (driftRationale == null || driftRationale.isBlank()) {
            driftRationale = DEFAULT_DRIFT_RATIONALE;
        }
    }

    /**
     * 기본 드리프트 사유로 생성.
     *
     * @param createdBy 생성 주체
     * @param snapshotSetId 스냅샷 세트 ID (null 가능)
     * @return PublishContext
     */
    public static PublishContext of(String createdBy, SnapshotSetId snapshotSetId) {
        return new PublishContext(createdBy, snapshotSetId, DEFAULT_DRIFT_RATIONALE);
    }

    /**
     * 드리프트 사유를 변경한 새 인스턴스.
     *
     * @param driftRationale 변경 사유
     * @return 새 PublishContext
     */
    public PublishContext withDriftRationale(String driftRationale) {
        return new PublishContext(createdBy, snapshotSetId, driftRationale);
    }
}
