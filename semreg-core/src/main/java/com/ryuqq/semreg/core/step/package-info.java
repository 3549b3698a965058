/**
 * Per-phase publish counters.
 *
 * <p>{@link com.ryuqq.semreg.core.step.StepRecorder} accumulates one entry per item while a
 * phase runs and yields an immutable {@link com.ryuqq.semreg.core.step.StepResult}.</p>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.core.step;
