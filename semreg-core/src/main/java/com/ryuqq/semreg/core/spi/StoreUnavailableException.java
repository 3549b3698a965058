package com.ryuqq.semreg.core.spi;

/**
 * Thrown when the backing store cannot be reached.
 *
 * <p>Always fatal. Neither the scanner nor the onboarding pipeline captures it as a
 * per-item error; it propagates to the caller and the run stops.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends SnapshotStoreException {

    /**
     * Creates an outage exception.
     *
     * @param message the detail message
     */
    public StoreUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an outage exception with a cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
