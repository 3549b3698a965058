package com.ryuqq.semreg.adapter.inmemory.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.model.SnapshotId;
import com.ryuqq.semreg.core.model.SnapshotMeta;
import com.ryuqq.semreg.core.model.SnapshotSet;
import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.spi.SnapshotConflictException;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import com.ryuqq.semreg.core.spi.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of {@link SnapshotStore} SPI for testing and reference purposes.
 *
 * <p>This implementation keeps every snapshot ever written plus an index from each
 * {@link ObjectId} to its chain head.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>snapshots:</strong> ConcurrentHashMap&lt;SnapshotId, Snapshot&gt; - all snapshots, active and superseded (O(1) access)</li>
 *   <li><strong>activeByObject:</strong> ConcurrentHashMap&lt;ObjectId, SnapshotId&gt; - chain head per object (O(1) access)</li>
 *   <li><strong>activeByFqn:</strong> ConcurrentHashMap&lt;FqnKey, SnapshotId&gt; - chain head per (object type, definition fqn) (O(1) access)</li>
 *   <li><strong>snapshotSets:</strong> ConcurrentHashMap&lt;SnapshotSetId, SnapshotSet&gt; - run groupings</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insertSnapshot / publishSnapshot:</strong> O(1), serialized on the store monitor</li>
 *   <li><strong>findActiveByDefinitionField:</strong> O(1) for {@code fqn}, O(A) over active snapshots for other fields</li>
 *   <li><strong>history:</strong> O(H) along the predecessor chain</li>
 *   <li><strong>listActive:</strong> O(A log A) sorted by FQN</li>
 * </ul>
 *
 * <p><strong>Isolation:</strong> definitions are deep-copied on the way in and on the way out,
 * so callers can never mutate stored state through a returned {@link JsonNode}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No actual ACID transactions (monitor-based simulation only)</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SnapshotStore store = new InMemorySnapshotStore();
 * IdempotentPublisher publisher = new IdempotentPublisher(store);
 *
 * SnapshotSetId setId = store.createSnapshotSet("onboarding:entity.test-widget", "tester");
 * publisher.publish(entityType, PublishContext.of("tester", setId));
 * </pre>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private static final String FQN_FIELD = "fqn";

    /**
     * All snapshots ever written.
     * Key: SnapshotId, Value: Snapshot (definition owned by the store)
     */
    private final ConcurrentHashMap<SnapshotId, Snapshot> snapshots;

    /**
     * Chain head per object.
     * Key: ObjectId, Value: SnapshotId of the snapshot without a successor
     */
    private final ConcurrentHashMap<ObjectId, SnapshotId> activeByObject;

    /**
     * Chain head per definition fqn.
     * Key: (ObjectType, fqn), Value: SnapshotId of the snapshot without a successor
     */
    private final ConcurrentHashMap<FqnKey, SnapshotId> activeByFqn;

    /**
     * Snapshot sets.
     */
    private final ConcurrentHashMap<SnapshotSetId, SnapshotSet> snapshotSets;

    private final Clock clock;

    /**
     * Creates a new store with empty storage and the system UTC clock.
     */
    public InMemorySnapshotStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a new store with empty storage.
     *
     * @param clock clock used for created_at timestamps
     * @throws IllegalArgumentException if clock is null
     */
    public InMemorySnapshotStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.snapshots = new ConcurrentHashMap<>();
        this.activeByObject = new ConcurrentHashMap<>();
        this.activeByFqn = new ConcurrentHashMap<>();
        this.snapshotSets = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    @Override
    public SnapshotSetId createSnapshotSet(String label, String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
        SnapshotSet set = new SnapshotSet(SnapshotSetId.random(), label, createdBy, clock.instant());
        snapshotSets.put(set.snapshotSetId(), set);
        log.debug("Created snapshot set {} ({})", set.snapshotSetId(), label);
        return set.snapshotSetId();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>{@code fqn} lookups go through the fqn index, other fields scan chain heads</li>
     *   <li>Superseded snapshots are never returned</li>
     *   <li>Non-textual field values never match</li>
     * </ul>
     */
    @Override
    public Optional<Snapshot> findActiveByDefinitionField(ObjectType objectType, String fieldName, String fieldValue) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        if (fieldName == null) {
            throw new IllegalArgumentException("fieldName cannot be null");
        }
        if (fieldValue == null) {
            throw new IllegalArgumentException("fieldValue cannot be null");
        }
        if (FQN_FIELD.equals(fieldName)) {
            SnapshotId head = activeByFqn.get(new FqnKey(objectType, fieldValue));
            return Optional.ofNullable(head == null ? null : snapshots.get(head))
                .map(InMemorySnapshotStore::detached);
        }
        return activeSnapshots()
            .filter(snapshot -> snapshot.objectType() == objectType)
            .filter(snapshot -> snapshot.definitionField(fieldName).map(fieldValue::equals).orElse(false))
            .findFirst()
            .map(InMemorySnapshotStore::detached);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Conflict check and write happen under the store monitor</li>
     *   <li>Unknown snapshot set IDs are rejected</li>
     * </ul>
     */
    @Override
    public synchronized Snapshot insertSnapshot(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId) {
        validateWrite(meta, definition, snapshotSetId);
        if (meta.hasPredecessor()) {
            throw new IllegalArgumentException("insertSnapshot requires meta without predecessor, but was: "
                + meta.predecessorId());
        }
        SnapshotId existing = activeByObject.get(meta.objectId());
        if (existing != null) {
            throw new SnapshotConflictException(meta.objectId(),
                "Object " + meta.objectId() + " already has active snapshot " + existing);
        }

        Snapshot snapshot = store(meta, definition, snapshotSetId);
        log.debug("Inserted snapshot {} for {} {}", snapshot.snapshotId(), meta.objectType(), meta.objectId());
        return detached(snapshot);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Predecessor must be the current chain head of the same object</li>
     *   <li>Version must move strictly forward</li>
     *   <li>Head replacement and snapshot write happen under the store monitor</li>
     * </ul>
     */
    @Override
    public synchronized Snapshot publishSnapshot(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId) {
        validateWrite(meta, definition, snapshotSetId);
        if (!meta.hasPredecessor()) {
            throw new IllegalArgumentException("publishSnapshot requires meta with predecessor");
        }

        Snapshot predecessor = snapshots.get(meta.predecessorId());
        if (predecessor == null) {
            throw new SnapshotConflictException(meta.objectId(),
                "Predecessor " + meta.predecessorId() + " not found");
        }
        if (!predecessor.objectId().equals(meta.objectId()) || predecessor.objectType() != meta.objectType()) {
            throw new SnapshotConflictException(meta.objectId(),
                "Predecessor " + meta.predecessorId() + " belongs to " + predecessor.objectType()
                    + " " + predecessor.objectId());
        }
        SnapshotId head = activeByObject.get(meta.objectId());
        if (!meta.predecessorId().equals(head)) {
            throw new SnapshotConflictException(meta.objectId(),
                "Predecessor " + meta.predecessorId() + " is no longer active (current: " + head + ")");
        }
        if (!isAfter(meta, predecessor)) {
            throw new IllegalArgumentException(String.format(
                "version must move forward from %s, but was: %d.%d",
                predecessor.version(), meta.versionMajor(), meta.versionMinor()));
        }

        Snapshot snapshot = store(meta, definition, snapshotSetId);
        log.debug("Published snapshot {} ({}) superseding {}",
            snapshot.snapshotId(), snapshot.version(), predecessor.snapshotId());
        return detached(snapshot);
    }

    @Override
    public Optional<Snapshot> resolveActive(ObjectType objectType, ObjectId objectId) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        if (objectId == null) {
            throw new IllegalArgumentException("objectId cannot be null");
        }
        SnapshotId head = activeByObject.get(objectId);
        if (head == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(head))
            .filter(snapshot -> snapshot.objectType() == objectType)
            .map(InMemorySnapshotStore::detached);
    }

    @Override
    public Optional<Snapshot> findById(SnapshotId snapshotId) {
        if (snapshotId == null) {
            throw new IllegalArgumentException("snapshotId cannot be null");
        }
        return Optional.ofNullable(snapshots.get(snapshotId)).map(InMemorySnapshotStore::detached);
    }

    @Override
    public List<Snapshot> history(ObjectId objectId) {
        if (objectId == null) {
            throw new IllegalArgumentException("objectId cannot be null");
        }
        List<Snapshot> chain = new ArrayList<>();
        SnapshotId cursor = activeByObject.get(objectId);
        while (cursor != null) {
            Snapshot snapshot = snapshots.get(cursor);
            if (snapshot == null) {
                throw new SnapshotStoreException("Broken chain for " + objectId + ": missing " + cursor);
            }
            chain.add(detached(snapshot));
            cursor = snapshot.predecessorId();
        }
        return chain;
    }

    @Override
    public List<Snapshot> listActive(ObjectType objectType, int limit, int offset) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative, but was: " + offset);
        }
        return activeSnapshots()
            .filter(snapshot -> snapshot.objectType() == objectType)
            .sorted(Comparator.comparing((Snapshot snapshot) -> snapshot.definitionField(FQN_FIELD).orElse("")))
            .skip(offset)
            .limit(limit)
            .map(InMemorySnapshotStore::detached)
            .collect(Collectors.toList());
    }

    @Override
    public long countActive(ObjectType objectType) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        return activeSnapshots().filter(snapshot -> snapshot.objectType() == objectType).count();
    }

    @Override
    public Optional<SnapshotSet> findSnapshotSet(SnapshotSetId snapshotSetId) {
        if (snapshotSetId == null) {
            throw new IllegalArgumentException("snapshotSetId cannot be null");
        }
        return Optional.ofNullable(snapshotSets.get(snapshotSetId));
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        snapshots.clear();
        activeByObject.clear();
        activeByFqn.clear();
        snapshotSets.clear();
    }

    /**
     * Returns the number of snapshots written, active and superseded.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return total snapshot count
     */
    public int snapshotCount() {
        return snapshots.size();
    }

    /**
     * Returns the number of snapshot sets created.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return snapshot set count
     */
    public int snapshotSetCount() {
        return snapshotSets.size();
    }

    private Stream<Snapshot> activeSnapshots() {
        return activeByObject.values().stream()
            .map(snapshots::get)
            .filter(Objects::nonNull);
    }

    private void validateWrite(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId) {
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (snapshotSetId != null && !snapshotSets.containsKey(snapshotSetId)) {
            throw new SnapshotStoreException("Unknown snapshot set: " + snapshotSetId);
        }
    }

    private Snapshot store(SnapshotMeta meta, JsonNode definition, SnapshotSetId snapshotSetId) {
        Snapshot snapshot = Snapshot.of(SnapshotId.random(), meta, definition.deepCopy(), snapshotSetId, clock.instant());
        snapshots.put(snapshot.snapshotId(), snapshot);
        SnapshotId previous = activeByObject.put(snapshot.objectId(), snapshot.snapshotId());
        if (previous != null) {
            Snapshot superseded = snapshots.get(previous);
            superseded.definitionField(FQN_FIELD)
                .ifPresent(fqn -> activeByFqn.remove(new FqnKey(superseded.objectType(), fqn), previous));
        }
        snapshot.definitionField(FQN_FIELD)
            .ifPresent(fqn -> activeByFqn.put(new FqnKey(snapshot.objectType(), fqn), snapshot.snapshotId()));
        return snapshot;
    }

    private static boolean isAfter(SnapshotMeta meta, Snapshot predecessor) {
        if (meta.versionMajor() != predecessor.versionMajor()) {
            return meta.versionMajor() > predecessor.versionMajor();
        }
        return meta.versionMinor() > predecessor.versionMinor();
    }

    private static Snapshot detached(Snapshot snapshot) {
        return new Snapshot(
            snapshot.snapshotId(),
            snapshot.objectType(),
            snapshot.objectId(),
            snapshot.versionMajor(),
            snapshot.versionMinor(),
            snapshot.predecessorId(),
            snapshot.changeType(),
            snapshot.changeRationale(),
            snapshot.createdBy(),
            snapshot.createdAt(),
            snapshot.snapshotSetId(),
            snapshot.definition().deepCopy()
        );
    }

    private record FqnKey(ObjectType objectType, String fqn) {
    }
}
