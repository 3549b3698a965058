package com.ryuqq.semreg.application.onboarding;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.semreg.core.definition.AttributeDataType;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.DefinitionCodec;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.EvidenceRequirementBody;
import com.ryuqq.semreg.core.definition.ViewColumn;
import com.ryuqq.semreg.core.definition.ViewDefBody;
import com.ryuqq.semreg.core.model.ChangeType;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.model.SnapshotMeta;
import com.ryuqq.semreg.core.model.SnapshotSet;
import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.publish.IdempotentPublisher;
import com.ryuqq.semreg.core.publish.PublishContext;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import com.ryuqq.semreg.core.spi.SnapshotStoreException;
import com.ryuqq.semreg.core.spi.StoreUnavailableException;
import com.ryuqq.semreg.core.step.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OnboardingPipeline 통합 테스트.
 *
 * <p>InMemorySnapshotStore 위에서 6단계 전체 흐름, 멱등성, 부분 실패 격리,
 * 뷰 컬럼 병합, 치명적 오류 전파를 검증합니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class OnboardingPipelineTest {

    private static final String ENTITY_FQN = "entity.test-widget";

    private InMemorySnapshotStore store;
    private OnboardingPipeline pipeline;
    private final DefinitionCodec codec = new DefinitionCodec();

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
        pipeline = new OnboardingPipeline(store);
    }

    @Test
    void run_빈_저장소에_test_widget_온보딩_시_기본값으로_모든_단계_게시() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).createdBy("test").build();

        // when
        OnboardingResult result = pipeline.run(request);

        // then
        assertThat(result.snapshotSetId()).isNotNull();
        assertThat(result.dryRun()).isFalse();
        assertThat(result.entityTypeStep().published()).isEqualTo(1);
        assertThat(result.attributesStep().published()).isEqualTo(3);
        assertThat(result.verbContractsStep().published()).isEqualTo(4);
        assertThat(result.taxonomyStep().published()).isEqualTo(1);
        assertThat(result.viewsStep().published()).isZero();
        assertThat(result.viewsStep().errors())
            .containsExactly("View 'view.test' not found, skipped column merge");
        assertThat(result.evidenceStep()).isEqualTo(StepResult.empty());
        assertThat(result.totalPublished()).isEqualTo(9);

        Optional<SnapshotSet> set = store.findSnapshotSet(result.snapshotSetId());
        assertThat(set).isPresent();
        assertThat(set.get().label()).isEqualTo("onboarding:" + ENTITY_FQN);
        assertThat(set.get().createdBy()).isEqualTo("test");
        assertThat(store.countActive(ObjectType.ATTRIBUTE_DEF)).isEqualTo(3);
        assertThat(store.countActive(ObjectType.MEMBERSHIP_RULE)).isEqualTo(1);
    }

    @Test
    void run_같은_요청을_두_번_실행하면_두_번째는_모두_skipped() {
        // given
        seedView("view.test", List.of());
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();
        OnboardingResult first = pipeline.run(request);
        int snapshotsAfterFirst = store.snapshotCount();

        // when
        OnboardingResult second = pipeline.run(request);

        // then
        assertThat(first.hasErrors()).isFalse();
        assertThat(second.totalPublished()).isZero();
        assertThat(second.totalUpdated()).isZero();
        assertThat(second.totalSkipped()).isEqualTo(first.totalPublished() + first.totalUpdated());
        assertThat(second.hasErrors()).isFalse();
        assertThat(store.snapshotCount()).isEqualTo(snapshotsAfterFirst);
        assertThat(second.snapshotSetId()).isNotEqualTo(first.snapshotSetId());
    }

    @Test
    void run_dry_run이면_저장소에_접근하지_않고_예정_수만_보고() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(testWidget())
            .taxonomyFqn("taxonomy.test")
            .taxonomyFqn("taxonomy.widgets")
            .evidenceRequirement(evidence("test.widget-certificate"))
            .dryRun(true)
            .build();

        // when
        OnboardingResult result = pipeline.run(request);

        // then
        assertThat(result.dryRun()).isTrue();
        assertThat(result.snapshotSetId()).isNull();
        assertThat(result.entityTypeStep().published()).isEqualTo(1);
        assertThat(result.attributesStep().published()).isEqualTo(3);
        assertThat(result.verbContractsStep().published()).isEqualTo(4);
        assertThat(result.taxonomyStep().published()).isEqualTo(2);
        assertThat(result.viewsStep().published()).isEqualTo(1);
        assertThat(result.evidenceStep().published()).isEqualTo(1);
        assertThat(result.hasErrors()).isFalse();
        assertThat(store.snapshotCount()).isZero();
        assertThat(store.snapshotSetCount()).isZero();
    }

    @Test
    void run_속성_하나만_실패하면_나머지_속성과_다른_단계는_정상_처리() {
        // given
        SnapshotStore failing = new FailingInsertStore("test.widget-status");
        OnboardingPipeline failingPipeline = new OnboardingPipeline(failing);
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();

        // when
        OnboardingResult result = failingPipeline.run(request);

        // then
        assertThat(result.attributesStep().published()).isEqualTo(2);
        assertThat(result.attributesStep().errors()).hasSize(1);
        assertThat(result.attributesStep().errors().get(0))
            .startsWith("Attribute 'test.widget-status': ")
            .contains("simulated write failure");
        assertThat(result.entityTypeStep().published()).isEqualTo(1);
        assertThat(result.verbContractsStep().published()).isEqualTo(4);
        assertThat(result.verbContractsStep().errors()).isEmpty();
        assertThat(result.taxonomyStep().published()).isEqualTo(1);
    }

    @Test
    void run_뷰가_있으면_새_컬럼을_병합하고_minor_버전_증가() {
        // given
        Snapshot original = seedView("view.test", List.of(new ViewColumn("test.existing", "Existing", null)));
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();

        // when
        OnboardingResult result = pipeline.run(request);

        // then
        assertThat(result.viewsStep().updated()).isEqualTo(1);
        assertThat(result.viewsStep().errors()).isEmpty();

        Snapshot active = store.resolveActive(ObjectType.VIEW_DEF, original.objectId()).orElseThrow();
        assertThat(active.predecessorId()).isEqualTo(original.snapshotId());
        assertThat(active.versionMajor()).isEqualTo(1);
        assertThat(active.versionMinor()).isEqualTo(1);
        assertThat(active.changeType()).isEqualTo(ChangeType.NON_BREAKING);
        assertThat(active.changeRationale()).isEqualTo("Added columns for " + ENTITY_FQN);
        assertThat(active.snapshotSetId()).isEqualTo(result.snapshotSetId());

        ViewDefBody merged = codec.fromTree(active.definition(), ViewDefBody.class);
        assertThat(merged.columns()).extracting(ViewColumn::attributeFqn).containsExactly(
            "test.existing", "test.widget-name", "test.widget-status", "test.widget-description"
        );
    }

    @Test
    void run_뷰_병합은_두_번째_실행에서_skipped_이고_버전은_한_번만_증가() {
        // given
        Snapshot original = seedView("view.test", List.of());
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();
        pipeline.run(request);

        // when
        OnboardingResult second = pipeline.run(request);

        // then
        assertThat(second.viewsStep().skipped()).isEqualTo(1);
        assertThat(second.viewsStep().updated()).isZero();
        Snapshot active = store.resolveActive(ObjectType.VIEW_DEF, original.objectId()).orElseThrow();
        assertThat(active.version()).isEqualTo("1.1");
        assertThat(store.history(original.objectId())).hasSize(2);
    }

    @Test
    void run_정의가_바뀌면_드리프트_사유로_갱신() {
        // given
        pipeline.run(OnboardingRequest.builder(testWidget()).build());
        EntityTypeDefBody changed = new EntityTypeDefBody(
            ENTITY_FQN, "Test Widget", "A changed description", "test", null, null,
            List.of("test.widget-name", "test.widget-status"), List.of("test.widget-description"), null
        );

        // when
        OnboardingResult result = pipeline.run(OnboardingRequest.builder(changed).build());

        // then
        assertThat(result.entityTypeStep().updated()).isEqualTo(1);
        assertThat(result.attributesStep().skipped()).isEqualTo(3);
        Snapshot active = store.resolveActive(
            ObjectType.ENTITY_TYPE_DEF, ObjectId.of(ObjectType.ENTITY_TYPE_DEF, ENTITY_FQN)
        ).orElseThrow();
        assertThat(active.version()).isEqualTo("1.1");
        assertThat(active.changeRationale()).isEqualTo(OnboardingConfig.DEFAULT_DRIFT_RATIONALE);
    }

    @Test
    void run_마지막_구간이_같은_두_엔티티는_서로의_기본_계약을_덮어쓰지_않음() {
        // given
        OnboardingRequest current = OnboardingRequest.builder(
            EntityTypeDefBody.of("entity.widget", "Widget", "Current widget", "entity")
        ).build();
        OnboardingRequest legacy = OnboardingRequest.builder(
            EntityTypeDefBody.of("legacy.widget", "Widget", "Legacy widget", "legacy")
        ).build();
        pipeline.run(current);

        // when
        OnboardingResult legacyResult = pipeline.run(legacy);
        OnboardingResult currentRerun = pipeline.run(current);
        OnboardingResult legacyRerun = pipeline.run(legacy);

        // then
        assertThat(legacyResult.verbContractsStep().published()).isEqualTo(4);
        assertThat(legacyResult.verbContractsStep().updated()).isZero();
        assertThat(currentRerun.totalPublished()).isZero();
        assertThat(currentRerun.totalUpdated()).isZero();
        assertThat(currentRerun.verbContractsStep().skipped()).isEqualTo(4);
        assertThat(legacyRerun.totalPublished()).isZero();
        assertThat(legacyRerun.totalUpdated()).isZero();
        assertThat(store.countActive(ObjectType.VERB_CONTRACT)).isEqualTo(8);
        assertThat(store.findActiveByDefinitionField(ObjectType.VERB_CONTRACT, "fqn", "legacy.widget.create"))
            .isPresent();
    }

    @Test
    void run_요청에_속성이_있으면_기본값_대신_사용() {
        // given
        AttributeDefBody explicit = new AttributeDefBody(
            "test.widget-weight", "Widget Weight", "Weight in grams", "test",
            AttributeDataType.DECIMAL, null, null, false, null
        );
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).attribute(explicit).build();

        // when
        OnboardingResult result = pipeline.run(request);

        // then
        assertThat(result.attributesStep().published()).isEqualTo(1);
        assertThat(store.listActive(ObjectType.ATTRIBUTE_DEF, 10, 0))
            .extracting(snapshot -> snapshot.definitionField("fqn").orElseThrow())
            .containsExactly("test.widget-weight");
    }

    @Test
    void run_증빙_요구사항을_게시() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(testWidget())
            .evidenceRequirement(evidence("test.widget-certificate"))
            .evidenceRequirement(evidence("test.widget-invoice"))
            .build();

        // when
        OnboardingResult result = pipeline.run(request);

        // then
        assertThat(result.evidenceStep().published()).isEqualTo(2);
        assertThat(store.countActive(ObjectType.EVIDENCE_REQUIREMENT)).isEqualTo(2);
    }

    @Test
    void run_검증_실패_시_스냅샷_세트도_만들지_않음() {
        // given
        EntityTypeDefBody invalid = EntityTypeDefBody.of(ENTITY_FQN, " ", "desc", "test");
        OnboardingRequest request = OnboardingRequest.builder(invalid).build();

        // when & then
        assertThatThrownBy(() -> pipeline.run(request))
            .isInstanceOf(OnboardingValidationException.class)
            .hasMessageContaining("entity_type.name is required");
        assertThat(store.snapshotSetCount()).isZero();
        assertThat(store.snapshotCount()).isZero();
    }

    @Test
    void run_저장소_장애는_즉시_전파되고_앞_단계_게시는_남음() {
        // given
        SnapshotStore outage = new OutageOnTypeStore(ObjectType.VERB_CONTRACT);
        OnboardingPipeline outagePipeline = new OnboardingPipeline(outage);
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();

        // when & then
        assertThatThrownBy(() -> outagePipeline.run(request))
            .isInstanceOf(StoreUnavailableException.class);
        assertThat(outage.countActive(ObjectType.ENTITY_TYPE_DEF)).isEqualTo(1);
        assertThat(outage.countActive(ObjectType.ATTRIBUTE_DEF)).isEqualTo(3);
        assertThat(outage.countActive(ObjectType.VERB_CONTRACT)).isZero();
    }

    @Test
    void run_엔티티_유형_게시_실패는_전파() {
        // given
        SnapshotStore failing = new FailingInsertStore(ENTITY_FQN);
        OnboardingPipeline failingPipeline = new OnboardingPipeline(failing);
        OnboardingRequest request = OnboardingRequest.builder(testWidget()).build();

        // when & then
        assertThatThrownBy(() -> failingPipeline.run(request))
            .isInstanceOf(SnapshotStoreException.class)
            .hasMessageContaining("simulated write failure");
        assertThat(failing.countActive(ObjectType.ATTRIBUTE_DEF)).isZero();
    }

    @Test
    void 생성자_store가_null이면_예외() {
        assertThatThrownBy(() -> new OnboardingPipeline(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store cannot be null");
    }

    private Snapshot seedView(String fqn, List<ViewColumn> columns) {
        ViewDefBody view = new ViewDefBody(fqn, "Test View", "Test view", "test", null, columns, null, null);
        IdempotentPublisher publisher = new IdempotentPublisher(store, codec);
        SnapshotSetId setId = store.createSnapshotSet("seed", "test");
        return publisher.publish(view, PublishContext.of("test", setId)).snapshot();
    }

    private static EntityTypeDefBody testWidget() {
        return EntityTypeDefBody.of(ENTITY_FQN, "Test Widget", "A test entity type", "test")
            .withAttributes(
                List.of("test.widget-name", "test.widget-status"),
                List.of("test.widget-description")
            );
    }

    private static EvidenceRequirementBody evidence(String fqn) {
        return new EvidenceRequirementBody(fqn, "Evidence", "Evidence document", ENTITY_FQN, List.of("pdf"), 1, true);
    }

    /**
     * 특정 FQN의 최초 삽입만 실패시키는 저장소.
     */
    private static final class FailingInsertStore extends InMemorySnapshotStore {

        private final String failingFqn;

        FailingInsertStore(String failingFqn) {
            this.failingFqn = failingFqn;
        }

        @Override
        public synchronized Snapshot insertSnapshot(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId) {
            if (failingFqn.equals(definition.path("fqn").asText())) {
                throw new SnapshotStoreException("simulated write failure for " + failingFqn);
            }
            return super.insertSnapshot(meta, definition, snapshotSetId);
        }
    }

    /**
     * 특정 객체 유형 조회 시점부터 장애를 내는 저장소.
     */
    private static final class OutageOnTypeStore extends InMemorySnapshotStore {

        private final ObjectType unavailableType;

        OutageOnTypeStore(ObjectType unavailableType) {
            this.unavailableType = unavailableType;
        }

        @Override
        public Optional<Snapshot> findActiveByDefinitionField(ObjectType objectType, String fieldName, String fieldValue) {
            if (objectType == unavailableType) {
                throw new StoreUnavailableException("connection refused");
            }
            return super.findActiveByDefinitionField(objectType, fieldName, fieldValue);
        }
    }
}
