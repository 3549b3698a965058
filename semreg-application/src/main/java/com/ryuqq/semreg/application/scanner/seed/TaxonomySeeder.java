package com.ryuqq.semreg.application.scanner.seed;

import com.ryuqq.semreg.application.scanner.ScanCategory;
import com.ryuqq.semreg.core.definition.TaxonomyNodeBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * 분류 체계와 노드를 게시하는 시더.
 *
 * <p>체계마다 체계 정의를 먼저 게시한 뒤 노드를 선언 순서대로 게시합니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class TaxonomySeeder implements Seeder {

    private static final Logger log = LoggerFactory.getLogger(TaxonomySeeder.class);

    private final Supplier<? extends List<TaxonomyBundle>> bundles;

    /**
     * 생성자.
     *
     * @param bundles 분류 체계 목록 supplier
     */
    public TaxonomySeeder(Supplier<? extends List<TaxonomyBundle>> bundles) {
        if (bundles == null) {
            throw new IllegalArgumentException("bundles cannot be null");
        }
        this.bundles = bundles;
    }

    /**
     * 고정 목록으로 생성.
     *
     * @param bundles 분류 체계 목록
     * @return TaxonomySeeder
     */
    public static TaxonomySeeder of(List<TaxonomyBundle> bundles) {
        List<TaxonomyBundle> copy = List.copyOf(bundles);
        return new TaxonomySeeder(() -> copy);
    }

    @Override
    public String name() {
        return "taxonomies";
    }

    @Override
    public SeedResult preview() {
        SeedResult.Builder result = SeedResult.builder();
        for (TaxonomyBundle bundle : bundles.get()) {
            result.plan(ScanCategory.TAXONOMIES, 1);
            result.plan(ScanCategory.TAXONOMY_NODES, bundle.nodes().size());
        }
        return result.build();
    }

    @Override
    public SeedResult seed(SeedContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        SeedResult.Builder result = SeedResult.builder();
        for (TaxonomyBundle bundle : bundles.get()) {
            result.record(context.publish(bundle.taxonomy()));
            for (TaxonomyNodeBody node : bundle.nodes()) {
                result.record(context.publish(node));
            }
            log.debug("Seeded taxonomy '{}' with {} nodes", bundle.taxonomy().fqn(), bundle.nodes().size());
        }
        return result.build();
    }
}
