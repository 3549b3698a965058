package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.definition.DefinitionCodec;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.EvidenceRequirementBody;
import com.ryuqq.semreg.core.definition.MembershipRuleBody;
import com.ryuqq.semreg.core.definition.VerbContractBody;
import com.ryuqq.semreg.core.definition.ViewDefBody;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.publish.IdempotentPublisher;
import com.ryuqq.semreg.core.publish.PublishContext;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import com.ryuqq.semreg.core.spi.StoreUnavailableException;
import com.ryuqq.semreg.core.step.StepRecorder;
import com.ryuqq.semreg.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 엔티티 유형 온보딩 파이프라인.
 *
 * <p>엔티티 유형 하나와 그에 딸린 정의들을 6단계에 걸쳐 레지스트리에 게시합니다.
 * 모든 게시는 {@link IdempotentPublisher}를 거치므로 같은 요청을 다시 실행하면
 * 모든 항목이 skipped로 보고됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * run(request)
 *   ↓
 * 0. 요청 검증 (dry run 포함, 실패 시 OnboardingValidationException)
 *    dry run이 아니면 createSnapshotSet("onboarding:" + entity fqn)
 * 1. 엔티티 유형      → publish (실패 시 전파)
 * 2. 속성            → 요청 값 또는 defaultAttributes, 항목별 publish
 * 3. Verb 계약       → 요청 값 또는 CRUD 기본값, 항목별 publish
 * 4. 분류 체계 배치   → 분류 체계마다 MembershipRule 생성 후 publish
 * 5. 뷰 컬럼 병합     → 뷰가 없으면 soft error, 새 컬럼이 있으면 후속 스냅샷 게시
 * 6. 증빙 요구사항    → 요청 값만 publish
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>{@link StoreUnavailableException}: 즉시 전파. 앞 단계에서 게시된 스냅샷은 남습니다.</li>
 *   <li>1단계 실패: 전파. 엔티티 유형 없이 나머지 단계를 진행하지 않습니다.</li>
 *   <li>2~6단계 항목 실패: 해당 단계의 errors에 기록하고 다음 항목으로 진행 (WARN 로그)</li>
 * </ul>
 *
 * <p><strong>Dry run:</strong> 각 단계의 published에 처리 예정 항목 수만 기록합니다.
 * 저장소를 읽지도 쓰지도 않으며 스냅샷 세트를 만들지 않습니다.</p>
 *
 * <p>단계 사이에 트랜잭션은 없습니다. 중간에 중단되면 같은 요청으로 다시 실행해
 * 나머지를 게시합니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class OnboardingPipeline {

    private static final Logger log = LoggerFactory.getLogger(OnboardingPipeline.class);

    static final String VIEW_RATIONALE_PREFIX = "Added columns for ";

    private final SnapshotStore store;
    private final IdempotentPublisher publisher;
    private final DefinitionCodec codec;
    private final OnboardingDefaults defaults;
    private final OnboardingRequestValidator validator;
    private final OnboardingConfig config;

    /**
     * 기본 규칙과 기본 설정으로 생성.
     *
     * @param store 스냅샷 저장소
     */
    public OnboardingPipeline(SnapshotStore store) {
        this(store, new IdempotentPublisher(store), new StandardOnboardingDefaults(), new OnboardingConfig());
    }

    /**
     * 생성자.
     *
     * @param store 스냅샷 저장소 (세트 생성, 뷰 조회)
     * @param publisher 멱등 게시기
     * @param defaults 기본값 생성 전략
     * @param config 파이프라인 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OnboardingPipeline(
        SnapshotStore store,
        IdempotentPublisher publisher,
        OnboardingDefaults defaults,
        OnboardingConfig config
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.codec = publisher.codec();
        this.defaults = defaults;
        this.validator = new OnboardingRequestValidator();
        this.config = config;
    }

    /**
     * 온보딩 실행.
     *
     * @param request 온보딩 요청
     * @return 단계별 결과
     * @throws OnboardingValidationException 요청이 구조적으로 잘못된 경우
     * @throws StoreUnavailableException 저장소에 접근할 수 없는 경우
     */
    public OnboardingResult run(OnboardingRequest request) {
        validator.validate(request);

        EntityTypeDefBody entityType = request.entityType();
        boolean dryRun = request.dryRun();
        log.info("Onboarding entity type '{}'{}", entityType.fqn(), dryRun ? " (dry run)" : "");

        SnapshotSetId setId = null;
        PublishContext context = null;
        if (!dryRun) {
            setId = store.createSnapshotSet(config.setLabelFor(entityType.fqn()), request.createdBy());
            context = new PublishContext(request.createdBy(), setId, config.driftRationale());
        }

        StepResult entityTypeStep = entityTypeStep(entityType, context);
        StepResult attributesStep = publishStep("Attribute", attributes(request), context);
        StepResult verbContractsStep = publishStep("VerbContract", verbContracts(request), context);
        StepResult taxonomyStep = publishStep("MembershipRule", membershipRules(request), context);
        StepResult viewsStep = viewStep(entityType, viewFqns(request), context);
        StepResult evidenceStep = publishStep("EvidenceRequirement", request.evidenceRequirements(), context);

        OnboardingResult result = new OnboardingResult(
            entityTypeStep, attributesStep, verbContractsStep, taxonomyStep, viewsStep, evidenceStep, setId, dryRun
        );
        log.info("Onboarding '{}' completed: {} published, {} skipped, {} updated, {} errors",
            entityType.fqn(), result.totalPublished(), result.totalSkipped(), result.totalUpdated(),
            result.allErrors().size());
        return result;
    }

    private StepResult entityTypeStep(EntityTypeDefBody entityType, PublishContext context) {
        StepRecorder step = new StepRecorder();
        if (context == null) {
            step.recordPublish();
        } else {
            step.record(publisher.publish(entityType, context));
        }
        return step.toResult();
    }

    private StepResult publishStep(String label, List<? extends Definition> definitions, PublishContext context) {
        StepRecorder step = new StepRecorder();
        if (context == null) {
            step.recordPublishes(definitions.size());
            return step.toResult();
        }
        for (Definition definition : definitions) {
            try {
                step.record(publisher.publish(definition, context));
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                String message = label + " '" + definition.fqn() + "': " + e.getMessage();
                log.warn("Onboarding item failed: {}", message, e);
                step.recordError(message);
            }
        }
        return step.toResult();
    }

    private StepResult viewStep(EntityTypeDefBody entityType, List<String> viewFqns, PublishContext context) {
        StepRecorder step = new StepRecorder();
        if (context == null) {
            step.recordPublishes(viewFqns.size());
            return step.toResult();
        }
        for (String viewFqn : viewFqns) {
            try {
                mergeViewColumns(entityType, viewFqn, context, step);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                String message = "View '" + viewFqn + "': " + e.getMessage();
                log.warn("Onboarding item failed: {}", message, e);
                step.recordError(message);
            }
        }
        return step.toResult();
    }

    private void mergeViewColumns(
        EntityTypeDefBody entityType,
        String viewFqn,
        PublishContext context,
        StepRecorder step
    ) {
        Optional<Snapshot> existing =
            store.findActiveByDefinitionField(ObjectType.VIEW_DEF, IdempotentPublisher.FQN_FIELD, viewFqn);
        if (existing.isEmpty()) {
            log.info("View '{}' not found, skipped column merge for '{}'", viewFqn, entityType.fqn());
            step.recordError("View '" + viewFqn + "' not found, skipped column merge");
            return;
        }

        Snapshot active = existing.get();
        ViewDefBody view = codec.fromTree(active.definition(), ViewDefBody.class);
        ViewDefBody merged = view.mergeColumns(defaults.columnsForView(entityType, viewFqn));
        if (merged == view) {
            step.recordSkip();
            return;
        }
        publisher.supersede(active, codec.toTree(merged), context, VIEW_RATIONALE_PREFIX + entityType.fqn());
        step.recordUpdate();
    }

    private List<AttributeDefBody> attributes(OnboardingRequest request) {
        return request.attributes().isEmpty()
            ? defaults.defaultAttributes(request.entityType())
            : request.attributes();
    }

    private List<VerbContractBody> verbContracts(OnboardingRequest request) {
        return request.verbContracts().isEmpty()
            ? defaults.defaultVerbContracts(request.entityType())
            : request.verbContracts();
    }

    private List<MembershipRuleBody> membershipRules(OnboardingRequest request) {
        List<String> taxonomyFqns = request.taxonomyFqns().isEmpty()
            ? defaults.defaultTaxonomyFqns(request.entityType())
            : request.taxonomyFqns();
        return taxonomyFqns.stream()
            .map(taxonomyFqn -> defaults.membershipRule(request.entityType(), taxonomyFqn))
            .toList();
    }

    private List<String> viewFqns(OnboardingRequest request) {
        return request.viewFqns().isEmpty()
            ? defaults.defaultViewFqns(request.entityType())
            : request.viewFqns();
    }
}
