package com.ryuqq.semreg.application.scanner.seed;

import com.ryuqq.semreg.core.definition.TaxonomyDefBody;
import com.ryuqq.semreg.core.definition.TaxonomyNodeBody;

import java.util.List;

/**
 * 분류 체계 하나와 그 노드들.
 *
 * @param taxonomy 분류 체계 정의
 * @param nodes 노드 정의 (부모가 자식보다 먼저 나와야 함)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record TaxonomyBundle(TaxonomyDefBody taxonomy, List<TaxonomyNodeBody> nodes) {

    public TaxonomyBundle {
        if (taxonomy == null) {
            throw new IllegalArgumentException("taxonomy cannot be null");
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        for (TaxonomyNodeBody node : nodes) {
            if (!taxonomy.fqn().equals(node.taxonomyFqn())) {
                throw new IllegalArgumentException(
                    "node " + node.fqn() + " does not belong to taxonomy " + taxonomy.fqn()
                );
            }
        }
    }
}
