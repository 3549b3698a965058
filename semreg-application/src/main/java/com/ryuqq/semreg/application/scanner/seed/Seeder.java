package com.ryuqq.semreg.application.scanner.seed;

/**
 * Publishes a fixed catalog of definitions after the verb-derived phases of a scan.
 *
 * <p>Seeders run in registration order through the scanner's shared publisher, so
 * re-running a scan over an unchanged catalog reports every seeded item as skipped.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>{@link #preview()} performs no store access and reports planned counts only</li>
 *   <li>{@link #seed(SeedContext)} publishes every item; any exception aborts the scan</li>
 *   <li>Item order must be deterministic</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public interface Seeder {

    /**
     * Seeder name used in logs.
     *
     * @return name
     */
    String name();

    /**
     * Planned counts for a dry run.
     *
     * @return result whose {@code published} counters hold the item counts
     */
    SeedResult preview();

    /**
     * Publish every item.
     *
     * @param context publisher and publish attributes of the current scan
     * @return per-category tallies
     */
    SeedResult seed(SeedContext context);
}
