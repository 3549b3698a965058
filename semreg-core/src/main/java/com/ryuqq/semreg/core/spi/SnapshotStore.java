package com.ryuqq.semreg.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.model.SnapshotId;
import com.ryuqq.semreg.core.model.SnapshotMeta;
import com.ryuqq.semreg.core.model.SnapshotSet;
import com.ryuqq.semreg.core.model.SnapshotSetId;

import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for versioned registry snapshots.
 *
 * <p>Every registered object is a singly linked chain of immutable snapshots. The chain
 * head (the snapshot without a successor) is the <em>active</em> snapshot for its
 * {@link ObjectId}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Snapshot set creation for grouping the writes of one run</li>
 *   <li>Active snapshot lookup by a textual top-level definition field</li>
 *   <li>Fresh chain insertion and successor publication</li>
 *   <li>History and listing queries</li>
 * </ul>
 *
 * <p><strong>Version Chain:</strong></p>
 * <pre>
 * insertSnapshot(meta[1.0, CREATED])            → S1 (active)
 * publishSnapshot(meta[1.1, predecessor=S1])    → S2 (active), S1 superseded
 * publishSnapshot(meta[1.2, predecessor=S2])    → S3 (active), S2 superseded
 * </pre>
 *
 * <p><strong>Conflict Detection:</strong></p>
 * <ul>
 *   <li>insertSnapshot for an ObjectId that already has an active snapshot → {@link SnapshotConflictException}</li>
 *   <li>publishSnapshot whose predecessor is missing, superseded, or belongs to another object
 *       → {@link SnapshotConflictException}</li>
 * </ul>
 * <p>Callers read the active snapshot and write later without holding a lock, so two
 * concurrent publishers of the same object race. The conflict rules make the loser fail
 * loudly instead of forking the chain.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic writes: a successor and the supersession of its predecessor happen together</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Outage reporting: connectivity loss must surface as {@link StoreUnavailableException}</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * Creates a snapshot set that groups the snapshots written by one run.
     *
     * @param label optional human-readable label (may be null)
     * @param createdBy attribution of the run
     * @return the new snapshot set ID
     * @throws IllegalArgumentException if createdBy is null or blank
     * @throws StoreUnavailableException if the store cannot be reached
     */
    SnapshotSetId createSnapshotSet(String label, String createdBy);

    /**
     * Finds the active snapshot of the given type whose definition carries the textual
     * top-level field {@code fieldName} equal to {@code fieldValue}.
     *
     * <p>Always reflects the latest successor: once a successor is written, the
     * predecessor is no longer returned.</p>
     *
     * @param objectType the object type
     * @param fieldName top-level definition field name (typically "fqn")
     * @param fieldValue expected textual value
     * @return the active snapshot, or empty if none matches
     * @throws IllegalArgumentException if any argument is null
     * @throws StoreUnavailableException if the store cannot be reached
     */
    Optional<Snapshot> findActiveByDefinitionField(ObjectType objectType, String fieldName, String fieldValue);

    /**
     * Starts a new version chain.
     *
     * @param meta snapshot metadata without a predecessor
     * @param definition definition payload
     * @param snapshotSetId snapshot set to tag the snapshot with (may be null)
     * @return the persisted snapshot
     * @throws IllegalArgumentException if meta or definition is null, or meta has a predecessor
     * @throws SnapshotConflictException if the object already has an active snapshot
     * @throws StoreUnavailableException if the store cannot be reached
     */
    Snapshot insertSnapshot(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId);

    /**
     * Appends a successor to an existing chain.
     *
     * <p>The predecessor named by {@code meta.predecessorId()} is superseded the instant
     * the successor is durably written.</p>
     *
     * @param meta snapshot metadata with a predecessor
     * @param definition definition payload
     * @param snapshotSetId snapshot set to tag the snapshot with (may be null)
     * @return the persisted snapshot
     * @throws IllegalArgumentException if meta or definition is null, or meta has no predecessor
     * @throws SnapshotConflictException if the predecessor is missing, superseded,
     *                                   or belongs to a different object
     * @throws StoreUnavailableException if the store cannot be reached
     */
    Snapshot publishSnapshot(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId);

    /**
     * Resolves the active snapshot of an object.
     *
     * @param objectType the object type
     * @param objectId the object identity
     * @return the active snapshot, or empty if the object is unknown
     * @throws IllegalArgumentException if any argument is null
     */
    Optional<Snapshot> resolveActive(ObjectType objectType, ObjectId objectId);

    /**
     * Finds a snapshot by its ID, active or superseded.
     *
     * @param snapshotId the snapshot ID
     * @return the snapshot, or empty if unknown
     * @throws IllegalArgumentException if snapshotId is null
     */
    Optional<Snapshot> findById(SnapshotId snapshotId);

    /**
     * Returns the version chain of an object, newest first.
     *
     * @param objectId the object identity
     * @return snapshots from the active head back to the chain start (may be empty)
     * @throws IllegalArgumentException if objectId is null
     */
    List<Snapshot> history(ObjectId objectId);

    /**
     * Lists active snapshots of a type ordered by definition FQN.
     *
     * @param objectType the object type
     * @param limit maximum number of results
     * @param offset number of results to skip
     * @return active snapshots (may be empty)
     * @throws IllegalArgumentException if objectType is null, limit is not positive or offset is negative
     */
    List<Snapshot> listActive(ObjectType objectType, int limit, int offset);

    /**
     * Counts the active snapshots of a type.
     *
     * @param objectType the object type
     * @return number of active snapshots
     * @throws IllegalArgumentException if objectType is null
     */
    long countActive(ObjectType objectType);

    /**
     * Finds a snapshot set by its ID.
     *
     * @param snapshotSetId the snapshot set ID
     * @return the snapshot set, or empty if unknown
     * @throws IllegalArgumentException if snapshotSetId is null
     */
    Optional<SnapshotSet> findSnapshotSet(SnapshotSetId snapshotSetId);
}
