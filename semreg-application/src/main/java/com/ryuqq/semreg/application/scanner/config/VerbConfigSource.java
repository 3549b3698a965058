package com.ryuqq.semreg.application.scanner.config;

/**
 * Verb configuration source.
 *
 * <p>Implementations load the full verb configuration on each call. The scanner calls
 * {@link #load()} exactly once per scan.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public interface VerbConfigSource {

    /**
     * Load the verb configuration.
     *
     * @return parsed configuration
     * @throws VerbConfigException if the configuration cannot be read or parsed
     */
    VerbsConfig load();
}
