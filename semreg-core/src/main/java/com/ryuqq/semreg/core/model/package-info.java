/**
 * Registry data model: identities, snapshots and snapshot sets.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.core.model.ObjectType} - Closed set of registry object tags</li>
 *   <li>{@link com.ryuqq.semreg.core.model.ObjectId} - Deterministic identity derived from (type, fqn)</li>
 *   <li>{@link com.ryuqq.semreg.core.model.DefinitionHash} - Content hash of a definition payload</li>
 *   <li>{@link com.ryuqq.semreg.core.model.SnapshotId} - Snapshot unique identifier</li>
 *   <li>{@link com.ryuqq.semreg.core.model.SnapshotSetId} - Snapshot set unique identifier</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.core.model.Snapshot} - Immutable persisted version of an object</li>
 *   <li>{@link com.ryuqq.semreg.core.model.SnapshotMeta} - Write request metadata</li>
 *   <li>{@link com.ryuqq.semreg.core.model.SnapshotSet} - Grouping of the snapshots of one run</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.core.model;
