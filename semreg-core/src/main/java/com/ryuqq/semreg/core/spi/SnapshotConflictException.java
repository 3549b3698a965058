package com.ryuqq.semreg.core.spi;

import com.ryuqq.semreg.core.model.ObjectId;

/**
 * Thrown when a write would fork or orphan a version chain.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class SnapshotConflictException extends SnapshotStoreException {

    private final ObjectId objectId;

    /**
     * Creates a conflict exception.
     *
     * @param objectId the object whose chain was contended
     * @param message the detail message
     */
    public SnapshotConflictException(ObjectId objectId, String message) {
        super(message);
        this.objectId = objectId;
    }

    /**
     * Returns the contended object.
     *
     * @return the object ID
     */
    public ObjectId getObjectId() {
        return objectId;
    }
}
