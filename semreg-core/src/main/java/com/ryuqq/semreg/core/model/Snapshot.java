package com.ryuqq.semreg.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * 저장된 불변 스냅샷.
 *
 * <p>한 객체 정의의 특정 시점 버전입니다. 동일 {@link ObjectId}의 스냅샷들은
 * {@code predecessorId}로 단일 연결 체인을 이루며, 후속 스냅샷이 없는 것이 활성 스냅샷입니다.</p>
 *
 * <p><strong>소유권:</strong> 정의 트리는 저장소가 소유합니다. 저장소 구현은
 * 호출자에게 방어적 복사본을 반환해야 하며, 호출자는 반환된 트리를 수정해도
 * 저장소 상태에 영향을 주지 않습니다.</p>
 *
 * @param snapshotId 스냅샷 ID
 * @param objectType 객체 유형
 * @param objectId 객체 식별자
 * @param versionMajor 메이저 버전
 * @param versionMinor 마이너 버전
 * @param predecessorId 이전 스냅샷 ID (체인 시작이면 null)
 * @param changeType 변경 분류
 * @param changeRationale 변경 사유 (null 가능)
 * @param createdBy 생성 주체
 * @param createdAt 생성 시각
 * @param snapshotSetId 스냅샷 세트 ID (null 가능)
 * @param definition 정의 페이로드 (JSON 트리)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record Snapshot(
    SnapshotId snapshotId,
    ObjectType objectType,
    ObjectId objectId,
    int versionMajor,
    int versionMinor,
    SnapshotId predecessorId,
    ChangeType changeType,
    String changeRationale,
    String createdBy,
    Instant createdAt,
    SnapshotSetId snapshotSetId,
    JsonNode definition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Snapshot {
        if (snapshotId == null || objectType == null || objectId == null) {
            throw new IllegalArgumentException("snapshotId, objectType and objectId are required");
        }
        if (changeType == null || createdBy == null || createdAt == null || definition == null) {
            throw new IllegalArgumentException("changeType, createdBy, createdAt and definition are required");
        }
    }

    /**
     * 메타데이터와 정의로 스냅샷 조립.
     *
     * @param snapshotId 발급된 스냅샷 ID
     * @param meta 메타데이터
     * @param definition 정의 페이로드
     * @param snapshotSetId 스냅샷 세트 ID (null 가능)
     * @param createdAt 생성 시각
     * @return Snapshot
     */
    public static Snapshot of(
        SnapshotId snapshotId,
        SnapshotMeta meta,
        JsonNode definition,
        SnapshotSetId snapshotSetId,
        Instant createdAt
    ) {
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        return new Snapshot(
            snapshotId,
            meta.objectType(),
            meta.objectId(),
            meta.versionMajor(),
            meta.versionMinor(),
            meta.predecessorId(),
            meta.changeType(),
            meta.changeRationale(),
            meta.createdBy(),
            createdAt,
            snapshotSetId,
            definition
        );
    }

    /**
     * 이전 스냅샷 ID 조회.
     *
     * @return predecessorId (체인 시작이면 empty)
     */
    public Optional<SnapshotId> predecessor() {
        return Optional.ofNullable(predecessorId);
    }

    /**
     * 정의의 최상위 텍스트 필드 조회.
     *
     * @param fieldName 필드 이름 (예: "fqn")
     * @return 필드 값 (없거나 텍스트가 아니면 empty)
     */
    public Optional<String> definitionField(String fieldName) {
        JsonNode node = definition.get(fieldName);
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    /**
     * "major.minor" 형식의 버전 문자열.
     *
     * @return 버전 문자열 (예: "1.3")
     */
    public String version() {
        return versionMajor + "." + versionMinor;
    }
}
