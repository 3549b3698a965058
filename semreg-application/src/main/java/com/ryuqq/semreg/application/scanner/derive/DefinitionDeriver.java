package com.ryuqq.semreg.application.scanner.derive;

import com.ryuqq.semreg.application.scanner.config.VerbsConfig;

/**
 * Derives registry definitions from a verb configuration.
 *
 * <p>Implementations must be pure: the same configuration always yields equal
 * definitions in the same order, and no I/O is performed. Idempotent rescans
 * depend on this.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public interface DefinitionDeriver {

    /**
     * Derive verb contracts, entity types and attributes.
     *
     * @param config verb configuration
     * @return derived definitions, each collection sorted by fqn
     */
    DerivedDefinitions derive(VerbsConfig config);
}
