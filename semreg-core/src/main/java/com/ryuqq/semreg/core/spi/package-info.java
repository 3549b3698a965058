/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage contract that infrastructure adapters implement
 * for the registry core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.core.spi.SnapshotStore} - versioned snapshot chains and snapshot sets</li>
 * </ul>
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.core.spi.StoreUnavailableException} - fatal, never captured per item</li>
 *   <li>{@link com.ryuqq.semreg.core.spi.SnapshotConflictException} - a racing write lost</li>
 *   <li>{@link com.ryuqq.semreg.core.spi.SnapshotStoreException} - any other store failure</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., semreg-adapter-inmemory) provide concrete implementations.
 * Implementations should pass {@code AbstractSnapshotStoreContractTest} from semreg-testkit.</p>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.core.spi;
