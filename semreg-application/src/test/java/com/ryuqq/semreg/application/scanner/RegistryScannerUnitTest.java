package com.ryuqq.semreg.application.scanner;

import com.ryuqq.semreg.application.scanner.config.VerbConfigException;
import com.ryuqq.semreg.application.scanner.config.VerbConfigSource;
import com.ryuqq.semreg.application.scanner.config.VerbsConfig;
import com.ryuqq.semreg.application.scanner.derive.DefinitionDeriver;
import com.ryuqq.semreg.application.scanner.derive.DerivedDefinitions;
import com.ryuqq.semreg.application.scanner.seed.SeedContext;
import com.ryuqq.semreg.application.scanner.seed.SeedResult;
import com.ryuqq.semreg.application.scanner.seed.Seeder;
import com.ryuqq.semreg.core.definition.TaxonomyDefBody;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.publish.IdempotentPublisher;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import com.ryuqq.semreg.core.spi.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RegistryScanner 유닛 테스트.
 *
 * <p>설정 소스, 도출기, 저장소를 Mock으로 대체하여 흐름 제어와 오류 전파를 검증합니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RegistryScannerUnitTest {

    @Mock
    private VerbConfigSource configSource;

    @Mock
    private DefinitionDeriver deriver;

    @Mock
    private SnapshotStore store;

    @Mock
    private Seeder seeder;

    private RegistryScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new RegistryScanner(
            configSource, deriver, new IdempotentPublisher(store), store, List.of(seeder), new ScannerConfig()
        );
    }

    @Test
    void scan_dry_run은_저장소에_접근하지_않음() {
        // given
        VerbsConfig config = new VerbsConfig("1.0", Map.of());
        when(configSource.load()).thenReturn(config);
        when(deriver.derive(config)).thenReturn(new DerivedDefinitions(List.of(), List.of(), List.of()));
        when(seeder.preview()).thenReturn(SeedResult.builder().plan(ScanCategory.POLICIES, 2).build());

        // when
        ScanReport report = scanner.scan(true);

        // then
        assertThat(report.tally(ScanCategory.POLICIES)).isEqualTo(ScanTally.planned(2));
        assertThat(report.totalPublished()).isEqualTo(2);
        verifyNoInteractions(store);
        verify(seeder, never()).seed(any());
    }

    @Test
    void scan_설정_로딩_실패시_세트를_만들지_않고_중단() {
        // given
        when(configSource.load()).thenThrow(new VerbConfigException("Verb configuration not found: verbs.yaml"));

        // when & then
        assertThatThrownBy(() -> scanner.scan())
            .isInstanceOf(VerbConfigException.class)
            .hasMessageContaining("verbs.yaml");
        verifyNoInteractions(store, deriver, seeder);
    }

    @Test
    void scan_저장소_장애는_그대로_전파() {
        // given
        VerbsConfig config = new VerbsConfig("1.0", Map.of());
        when(configSource.load()).thenReturn(config);
        when(deriver.derive(config)).thenReturn(new DerivedDefinitions(List.of(), List.of(), List.of()));
        when(store.createSnapshotSet(anyString(), anyString()))
            .thenThrow(new StoreUnavailableException("connection refused"));

        // when & then
        assertThatThrownBy(() -> scanner.scan())
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessage("connection refused");
        verifyNoInteractions(seeder);
    }

    @Test
    void scan_시더_게시_중_장애도_전파() {
        // given
        VerbsConfig config = new VerbsConfig("1.0", Map.of());
        SnapshotSetId setId = SnapshotSetId.random();
        when(configSource.load()).thenReturn(config);
        when(deriver.derive(config)).thenReturn(new DerivedDefinitions(List.of(), List.of(), List.of()));
        when(store.createSnapshotSet("onboarding-scan", "scanner")).thenReturn(setId);
        when(seeder.seed(any())).thenAnswer(invocation -> {
            TaxonomyDefBody taxonomy = new TaxonomyDefBody("taxonomy.x", "X", null, "x", null);
            return SeedResult.builder()
                .record(invocation.<SeedContext>getArgument(0).publish(taxonomy))
                .build();
        });
        when(store.findActiveByDefinitionField(eq(ObjectType.TAXONOMY_DEF), eq("fqn"), eq("taxonomy.x")))
            .thenReturn(Optional.empty());
        when(store.insertSnapshot(any(), any(), eq(setId)))
            .thenThrow(new StoreUnavailableException("lost connection"));

        // when & then
        assertThatThrownBy(() -> scanner.scan())
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessage("lost connection");
    }
}
