/**
 * Idempotent publish algorithm shared by every registry producer.
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.core.publish.Inserted} - New chain started at 1.0</li>
 *   <li>{@link com.ryuqq.semreg.core.publish.Skipped} - Content hash unchanged, nothing written</li>
 *   <li>{@link com.ryuqq.semreg.core.publish.Updated} - Drift detected, successor written</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.core.publish;
