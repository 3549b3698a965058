package com.ryuqq.semreg.core.model;

/**
 * 스냅샷 기록 요청 메타데이터.
 *
 * <p>저장소에 새 스냅샷을 쓸 때 정의 페이로드와 함께 전달됩니다.
 * {@code predecessorId}가 null이면 새 체인({@code insertSnapshot}),
 * 값이 있으면 후속 스냅샷({@code publishSnapshot})입니다.</p>
 *
 * <p><strong>생성 예시:</strong></p>
 * <pre>
 * SnapshotMeta fresh = SnapshotMeta.initial(ObjectType.ATTRIBUTE_DEF, objectId, "scanner");
 * SnapshotMeta next = SnapshotMeta.successorOf(active, ChangeType.NON_BREAKING, "drift", "scanner");
 * </pre>
 *
 * @param objectType 객체 유형
 * @param objectId 객체 식별자
 * @param versionMajor 메이저 버전
 * @param versionMinor 마이너 버전
 * @param predecessorId 이전 스냅샷 ID (새 체인이면 null)
 * @param changeType 변경 분류
 * @param changeRationale 변경 사유 (null 가능)
 * @param createdBy 생성 주체
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SnapshotMeta(
    ObjectType objectType,
    ObjectId objectId,
    int versionMajor,
    int versionMinor,
    SnapshotId predecessorId,
    ChangeType changeType,
    String changeRationale,
    String createdBy
) {

    /**
     * 새 체인의 최초 버전.
     */
    public static final int INITIAL_MAJOR = 1;

    /**
     * 새 체인의 최초 마이너 버전.
     */
    public static final int INITIAL_MINOR = 0;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 버전이 음수인 경우
     */
    public SnapshotMeta {
        if (objectType == null || objectId == null || changeType == null) {
            throw new IllegalArgumentException("objectType, objectId and changeType are required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
        if (versionMajor < 0 || versionMinor < 0) {
            throw new IllegalArgumentException(
                "version cannot be negative (current: " + versionMajor + "." + versionMinor + ")"
            );
        }
    }

    /**
     * 새 체인의 첫 스냅샷 메타데이터 (1.0, CREATED).
     *
     * @param objectType 객체 유형
     * @param objectId 객체 식별자
     * @param createdBy 생성 주체
     * @return SnapshotMeta
     */
    public static SnapshotMeta initial(ObjectType objectType, ObjectId objectId, String createdBy) {
        return new SnapshotMeta(
            objectType, objectId, INITIAL_MAJOR, INITIAL_MINOR, null, ChangeType.CREATED, null, createdBy
        );
    }

    /**
     * 활성 스냅샷의 후속 메타데이터.
     *
     * <p>메이저 버전은 그대로 유지되고 마이너 버전은 정확히 1 증가합니다.</p>
     *
     * @param predecessor 현재 활성 스냅샷
     * @param changeType 변경 분류
     * @param changeRationale 변경 사유
     * @param createdBy 생성 주체
     * @return SnapshotMeta
     * @throws IllegalArgumentException predecessor가 null인 경우
     */
    public static SnapshotMeta successorOf(
        Snapshot predecessor,
        ChangeType changeType,
        String changeRationale,
        String createdBy
    ) {
        if (predecessor == null) {
            throw new IllegalArgumentException("predecessor cannot be null");
        }
        return new SnapshotMeta(
            predecessor.objectType(),
            predecessor.objectId(),
            predecessor.versionMajor(),
            predecessor.versionMinor() + 1,
            predecessor.snapshotId(),
            changeType,
            changeRationale,
            createdBy
        );
    }

    /**
     * 후속 스냅샷 요청인지 확인.
     *
     * @return predecessorId가 있으면 true
     */
    public boolean hasPredecessor() {
        return predecessorId != null;
    }
}
