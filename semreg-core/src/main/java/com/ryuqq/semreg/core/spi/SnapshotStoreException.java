package com.ryuqq.semreg.core.spi;

/**
 * Base exception for {@link SnapshotStore} failures.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class SnapshotStoreException extends RuntimeException {

    /**
     * Creates a store exception.
     *
     * @param message the detail message
     */
    public SnapshotStoreException(String message) {
        super(message);
    }

    /**
     * Creates a store exception with a cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
