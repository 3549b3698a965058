/**
 * In-memory SnapshotStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the SnapshotStore SPI
 * for tests, local tooling and contract verification.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.adapter.inmemory.store.InMemorySnapshotStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.semreg.core.spi.SnapshotStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> {@link java.util.concurrent.ConcurrentHashMap} for reads,
 *       the store monitor for conflict check plus write</li>
 *   <li><strong>Conflict Detection:</strong> forked or orphaned chains are rejected with
 *       {@link com.ryuqq.semreg.core.spi.SnapshotConflictException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.semreg.core.spi.SnapshotStore
 * @author Semantic Registry Team
 * @since 1.0.0
 */
package com.ryuqq.semreg.adapter.inmemory.store;
