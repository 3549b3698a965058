package com.ryuqq.semreg.core.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.definition.DefinitionCodec;
import com.ryuqq.semreg.core.model.ChangeType;
import com.ryuqq.semreg.core.model.DefinitionHash;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.model.SnapshotMeta;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 멱등 게시기.
 *
 * <p>스캐너와 온보딩 파이프라인이 공유하는 단일 게시 알고리즘입니다.
 * 변경되지 않은 입력으로 다시 실행하면 저장소에 아무것도 쓰지 않습니다.</p>
 *
 * <p><strong>게시 흐름:</strong></p>
 * <pre>
 * 1. objectId = ObjectId.of(type, fqn), newHash = hash(definition)
 * 2. active = store.findActiveByDefinitionField(type, "fqn", fqn)
 * 3. active 없음            → insertSnapshot(1.0, CREATED)           → Inserted
 * 4. hash(active) == newHash → 쓰기 없음                              → Skipped
 * 5. hash(active) != newHash → publishSnapshot(major, minor + 1,
 *                               NON_BREAKING, driftRationale)          → Updated
 * </pre>
 *
 * <p><strong>변경 분류:</strong> 드리프트 갱신은 항상 {@link ChangeType#NON_BREAKING}으로
 * 기록됩니다. 호출자가 분류를 지정하는 기능은 아직 없습니다.</p>
 *
 * <p><strong>동시성:</strong> 조회와 쓰기 사이에 잠금을 잡지 않습니다. 같은 FQN을 동시에
 * 게시하면 저장소의 충돌 검출이 {@link com.ryuqq.semreg.core.spi.SnapshotConflictException}으로
 * 한쪽을 실패시킵니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class IdempotentPublisher {

    private static final Logger log = LoggerFactory.getLogger(IdempotentPublisher.class);

    /**
     * 활성 스냅샷 조회에 사용하는 정의 필드.
     */
    public static final String FQN_FIELD = "fqn";

    private final SnapshotStore store;
    private final DefinitionCodec codec;

    /**
     * 기본 코덱으로 생성.
     *
     * @param store 스냅샷 저장소
     */
    public IdempotentPublisher(SnapshotStore store) {
        this(store, new DefinitionCodec());
    }

    /**
     * 생성자.
     *
     * @param store 스냅샷 저장소
     * @param codec 정의 코덱
     * @throws IllegalArgumentException store 또는 codec이 null인 경우
     */
    public IdempotentPublisher(SnapshotStore store, DefinitionCodec codec) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.store = store;
        this.codec = codec;
    }

    /**
     * 정의 본문을 멱등 게시.
     *
     * @param definition 정의 본문
     * @param context 게시 컨텍스트
     * @return 게시 결과
     * @throws com.ryuqq.semreg.core.definition.DefinitionSerializationException 직렬화 실패 시
     */
    public PublishOutcome publish(Definition definition, PublishContext context) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        return publish(definition.objectType(), definition.fqn(), codec.toTree(definition), context);
    }

    /**
     * JSON 정의를 멱등 게시.
     *
     * @param objectType 객체 유형
     * @param fqn 객체 FQN
     * @param definition 새로 계산된 정의 페이로드
     * @param context 게시 컨텍스트
     * @return 게시 결과
     * @throws IllegalArgumentException 인자가 null이거나 fqn이 blank인 경우
     */
    public PublishOutcome publish(ObjectType objectType, String fqn, JsonNode definition, PublishContext context) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        ObjectId objectId = ObjectId.of(objectType, fqn);
        DefinitionHash newHash = codec.hash(definition);

        Optional<Snapshot> existing = store.findActiveByDefinitionField(objectType, FQN_FIELD, fqn);
        if (existing.isEmpty()) {
            SnapshotMeta meta = SnapshotMeta.initial(objectType, objectId, context.createdBy());
            Snapshot inserted = store.insertSnapshot(meta, definition, context.snapshotSetId());
            log.debug("Inserted {} '{}' as {} (v{})", objectType, fqn, inserted.snapshotId(), inserted.version());
            return new Inserted(inserted);
        }

        Snapshot active = existing.get();
        if (codec.hash(active.definition()).equals(newHash)) {
            log.debug("Skipped {} '{}': hash {} unchanged", objectType, fqn, newHash);
            return new Skipped(active);
        }

        Snapshot successor = supersede(active, definition, context, context.driftRationale());
        return new Updated(active, successor);
    }

    /**
     * 해시 비교 없이 활성 스냅샷의 후속 스냅샷 게시.
     *
     * <p>호출자가 이미 변경 여부를 판단한 경우(예: 뷰 컬럼 병합)에 사용합니다.</p>
     *
     * @param active 현재 활성 스냅샷
     * @param definition 새 정의 페이로드
     * @param context 게시 컨텍스트
     * @param rationale 변경 사유
     * @return 새 활성 스냅샷
     */
    public Snapshot supersede(Snapshot active, JsonNode definition, PublishContext context, String rationale) {
        if (active == null) {
            throw new IllegalArgumentException("active cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        SnapshotMeta meta = SnapshotMeta.successorOf(active, ChangeType.NON_BREAKING, rationale, context.createdBy());
        Snapshot successor = store.publishSnapshot(meta, definition, context.snapshotSetId());
        log.debug("Updated {} {} v{} -> v{} ({})",
            active.objectType(), active.objectId(), active.version(), successor.version(), rationale);
        return successor;
    }

    /**
     * 게시에 사용하는 코덱.
     *
     * @return DefinitionCodec
     */
    public DefinitionCodec codec() {
        return codec;
    }
}
