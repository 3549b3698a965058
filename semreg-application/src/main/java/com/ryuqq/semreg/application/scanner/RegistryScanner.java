package com.ryuqq.semreg.application.scanner;

import com.ryuqq.semreg.application.scanner.config.VerbConfigSource;
import com.ryuqq.semreg.application.scanner.config.VerbsConfig;
import com.ryuqq.semreg.application.scanner.derive.DefinitionDeriver;
import com.ryuqq.semreg.application.scanner.derive.DerivedDefinitions;
import com.ryuqq.semreg.application.scanner.seed.SeedContext;
import com.ryuqq.semreg.application.scanner.seed.SeedResult;
import com.ryuqq.semreg.application.scanner.seed.Seeder;
import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.publish.IdempotentPublisher;
import com.ryuqq.semreg.core.publish.PublishContext;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Verb 설정 기반 레지스트리 스캐너.
 *
 * <p>Verb 설정에서 도출한 정의와 시더 카탈로그를 한 번의 스냅샷 세트로 멱등 게시합니다.</p>
 *
 * <p><strong>스캔 흐름:</strong></p>
 * <pre>
 * scan(dryRun)
 *   ↓
 * 1. VerbConfigSource.load()
 * 2. DefinitionDeriver.derive() → contracts, entity types, attributes
 * 3. dryRun이면 예정 수만 보고하고 종료 (저장소 접근 없음)
 * 4. createSnapshotSet(setLabel, createdBy)
 * 5. contracts → entity types → attributes 순서로 publish
 * 6. 등록 순서대로 Seeder.seed()
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 설정 로드, 직렬화, 저장소 오류 등 모든 예외는 스캔을 중단하고
 * 그대로 전파됩니다. 이미 게시된 스냅샷은 남아 있으며, 같은 입력으로 다시 스캔하면
 * 남은 항목만 게시됩니다.</p>
 *
 * <p>Thread-safe하지 않습니다. 한 인스턴스에서 동시에 여러 스캔을 실행하지 마십시오.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class RegistryScanner {

    private static final Logger log = LoggerFactory.getLogger(RegistryScanner.class);

    private final VerbConfigSource configSource;
    private final DefinitionDeriver deriver;
    private final IdempotentPublisher publisher;
    private final SnapshotStore store;
    private final List<Seeder> seeders;
    private final ScannerConfig config;

    /**
     * 생성자.
     *
     * @param configSource verb 설정 소스
     * @param deriver 정의 도출기
     * @param publisher 멱등 게시기
     * @param store 스냅샷 세트 생성에 사용할 저장소
     * @param seeders 시더 목록 (실행 순서)
     * @param config 스캐너 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RegistryScanner(
        VerbConfigSource configSource,
        DefinitionDeriver deriver,
        IdempotentPublisher publisher,
        SnapshotStore store,
        List<Seeder> seeders,
        ScannerConfig config
    ) {
        if (configSource == null) {
            throw new IllegalArgumentException("configSource cannot be null");
        }
        if (deriver == null) {
            throw new IllegalArgumentException("deriver cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (seeders == null) {
            throw new IllegalArgumentException("seeders cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.configSource = configSource;
        this.deriver = deriver;
        this.publisher = publisher;
        this.store = store;
        this.seeders = List.copyOf(seeders);
        this.config = config;
    }

    /**
     * 실제 게시 스캔.
     *
     * @return ScanReport
     */
    public ScanReport scan() {
        return scan(false);
    }

    /**
     * 스캔 실행.
     *
     * @param dryRun true면 저장소에 접근하지 않고 예정 수만 보고
     * @return ScanReport
     */
    public ScanReport scan(boolean dryRun) {
        log.info("Starting registry scan{}", dryRun ? " (dry run)" : "");

        VerbsConfig verbs = configSource.load();
        DerivedDefinitions derived = deriver.derive(verbs);
        log.info("Derived {} verb contracts, {} entity types, {} attributes",
            derived.verbContracts().size(), derived.entityTypes().size(), derived.attributes().size());

        ScanReport.Builder report = ScanReport.builder().dryRun(dryRun);

        if (dryRun) {
            report.add(ScanCategory.VERB_CONTRACTS, ScanTally.planned(derived.verbContracts().size()));
            report.add(ScanCategory.ENTITY_TYPES, ScanTally.planned(derived.entityTypes().size()));
            report.add(ScanCategory.ATTRIBUTES, ScanTally.planned(derived.attributes().size()));
            for (Seeder seeder : seeders) {
                merge(report, seeder.preview());
            }
            ScanReport result = report.build();
            log.info("Registry scan dry run completed: {} would be published", result.totalPublished());
            return result;
        }

        SnapshotSetId setId = store.createSnapshotSet(config.setLabel(), config.createdBy());
        PublishContext context = new PublishContext(config.createdBy(), setId, config.driftRationale());
        report.snapshotSetId(setId);

        publishAll(ScanCategory.VERB_CONTRACTS, derived.verbContracts(), context, report);
        publishAll(ScanCategory.ENTITY_TYPES, derived.entityTypes(), context, report);
        publishAll(ScanCategory.ATTRIBUTES, derived.attributes(), context, report);

        SeedContext seedContext = new SeedContext(publisher, context);
        for (Seeder seeder : seeders) {
            log.debug("Running seeder '{}'", seeder.name());
            merge(report, seeder.seed(seedContext));
        }

        ScanReport result = report.build();
        log.info("Registry scan completed: set={}, {} published, {} skipped, {} updated",
            setId, result.totalPublished(), result.totalSkipped(), result.totalUpdated());
        return result;
    }

    private void publishAll(
        ScanCategory category,
        List<? extends Definition> definitions,
        PublishContext context,
        ScanReport.Builder report
    ) {
        for (Definition definition : definitions) {
            report.record(category, publisher.publish(definition, context));
        }
    }

    private static void merge(ScanReport.Builder report, SeedResult result) {
        for (Map.Entry<ScanCategory, ScanTally> entry : result.tallies().entrySet()) {
            report.add(entry.getKey(), entry.getValue());
        }
    }
}
