package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.MembershipRuleBody;
import com.ryuqq.semreg.core.definition.VerbContractBody;
import com.ryuqq.semreg.core.definition.ViewColumn;

import java.util.List;

/**
 * Default generation strategy for onboarding requests.
 *
 * <p>The pipeline calls these methods only for collections the request leaves empty
 * (plus {@link #membershipRule} and {@link #columnsForView}, which are always derived).
 * All methods must be pure and deterministic: the same entity type must always yield
 * equal definitions in the same order, otherwise re-running an onboarding reports
 * spurious updates.</p>
 *
 * <p>{@link StandardOnboardingDefaults} is the reference implementation.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public interface OnboardingDefaults {

    /**
     * Attribute definitions for an entity type without explicit attributes.
     *
     * @param entityType entity type being onboarded
     * @return attribute definitions (may be empty)
     */
    List<AttributeDefBody> defaultAttributes(EntityTypeDefBody entityType);

    /**
     * Verb contracts for an entity type without explicit contracts.
     *
     * @param entityType entity type being onboarded
     * @return verb contracts (may be empty)
     */
    List<VerbContractBody> defaultVerbContracts(EntityTypeDefBody entityType);

    /**
     * Taxonomies to place an entity type into when none are requested.
     *
     * @param entityType entity type being onboarded
     * @return taxonomy fqns (may be empty)
     */
    List<String> defaultTaxonomyFqns(EntityTypeDefBody entityType);

    /**
     * Views to extend when none are requested.
     *
     * @param entityType entity type being onboarded
     * @return view fqns (may be empty)
     */
    List<String> defaultViewFqns(EntityTypeDefBody entityType);

    /**
     * Membership rule linking an entity type to a taxonomy.
     *
     * @param entityType entity type being onboarded
     * @param taxonomyFqn taxonomy fqn
     * @return membership rule
     */
    MembershipRuleBody membershipRule(EntityTypeDefBody entityType, String taxonomyFqn);

    /**
     * Columns an entity type contributes to a view.
     *
     * @param entityType entity type being onboarded
     * @param viewFqn view fqn
     * @return columns, identified by attribute fqn
     */
    List<ViewColumn> columnsForView(EntityTypeDefBody entityType, String viewFqn);
}
