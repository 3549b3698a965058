package com.ryuqq.semreg.testkit.contract;

import com.ryuqq.semreg.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.semreg.core.spi.SnapshotStore;

/**
 * Contract Tests for InMemorySnapshotStore.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class InMemorySnapshotStoreContractTest extends AbstractSnapshotStoreContractTest {

    @Override
    protected SnapshotStore createStore() {
        return new InMemorySnapshotStore();
    }
}
