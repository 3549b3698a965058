/**
 * Reusable Contract Tests for registry adapters.
 *
 * <h2>Base Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.testkit.contract.AbstractSnapshotStoreContractTest} - SnapshotStore SPI contract</li>
 *   <li>{@link com.ryuqq.semreg.testkit.contract.AbstractRegistryContractTest} - publish scenarios over any store</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.testkit.contract;
