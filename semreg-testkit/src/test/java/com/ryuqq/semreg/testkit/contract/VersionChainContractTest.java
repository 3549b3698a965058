package com.ryuqq.semreg.testkit.contract;

import com.ryuqq.semreg.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.semreg.core.model.ChangeType;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.model.Snapshot;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Version succession through the publisher.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class VersionChainContractTest extends AbstractRegistryContractTest {

    @Override
    protected SnapshotStore createStore() {
        return new InMemorySnapshotStore();
    }

    @Test
    void testChain_TenDrifts_MinorGrowsByOneEachTime() {
        // Given
        ObjectId objectId = ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.drifting");

        // When
        for (int i = 0; i <= 10; i++) {
            publisher.publish(attribute("test.drifting", "revision " + i), context);
        }

        // Then
        List<Snapshot> history = store.history(objectId);
        assertEquals(11, history.size());
        assertEquals("1.10", history.get(0).version());
        assertVersionChainMonotonic(objectId);
    }

    @Test
    void testChain_SuccessorsAreNonBreakingWithDriftRationale() {
        // Given
        publisher.publish(attribute("test.a", "one"), context);

        // When
        Snapshot successor = publisher.publish(
            attribute("test.a", "two"), context.withDriftRationale("Scanner drift update")
        ).snapshot();

        // Then
        assertEquals(ChangeType.NON_BREAKING, successor.changeType());
        assertEquals("Scanner drift update", successor.changeRationale());
        assertEquals(context.snapshotSetId(), successor.snapshotSetId());
    }

    @Test
    void testChain_SameFqnDifferentTypes_AreIndependentChains() {
        // When
        publisher.publish(attribute("shared.name", "attr"), context);
        publisher.publish(entityType("shared.name", List.of()), context);

        // Then
        assertActiveCount(ObjectType.ATTRIBUTE_DEF, 1);
        assertActiveCount(ObjectType.ENTITY_TYPE_DEF, 1);
        assertNotEquals(
            ObjectId.of(ObjectType.ATTRIBUTE_DEF, "shared.name"),
            ObjectId.of(ObjectType.ENTITY_TYPE_DEF, "shared.name")
        );
    }
}
