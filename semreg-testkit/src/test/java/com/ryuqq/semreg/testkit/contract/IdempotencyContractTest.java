package com.ryuqq.semreg.testkit.contract;

import com.ryuqq.semreg.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.model.ObjectId;
import com.ryuqq.semreg.core.model.ObjectType;
import com.ryuqq.semreg.core.publish.PublishOutcome;
import com.ryuqq.semreg.core.spi.SnapshotStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Idempotent publish.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Same definition twice → second publish skipped, no new snapshot</li>
 *   <li>Changed definition → successor with minor + 1</li>
 *   <li>Reverted definition → another successor, not a skip</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class IdempotencyContractTest extends AbstractRegistryContractTest {

    @Override
    protected SnapshotStore createStore() {
        return new InMemorySnapshotStore();
    }

    @Test
    void testIdempotency_SameDefinitionTwice_SecondIsSkipped() {
        // Given
        AttributeDefBody body = attribute("test.a", "first");

        // When
        PublishOutcome first = publisher.publish(body, context);
        PublishOutcome second = publisher.publish(body, context);

        // Then
        assertTrue(first.isInserted());
        assertTrue(second.isSkipped());
        assertEquals(first.snapshot().snapshotId(), second.snapshot().snapshotId());
        assertEquals(1, store.history(ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.a")).size());
    }

    @Test
    void testIdempotency_WholeBatchTwice_SecondRunOnlySkips() {
        // Given
        List<AttributeDefBody> batch = List.of(
            attribute("test.a", "a"), attribute("test.b", "b"), attribute("test.c", "c")
        );

        // When
        batch.forEach(body -> publisher.publish(body, context));
        long skipped = batch.stream().map(body -> publisher.publish(body, context)).filter(PublishOutcome::isSkipped).count();

        // Then
        assertEquals(3, skipped);
        assertActiveCount(ObjectType.ATTRIBUTE_DEF, 3);
    }

    @Test
    void testDrift_ChangedDefinition_PublishesSuccessor() {
        // Given
        publisher.publish(attribute("test.a", "first"), context);

        // When
        PublishOutcome outcome = publisher.publish(attribute("test.a", "second"), context);

        // Then
        assertTrue(outcome.isUpdated());
        assertEquals("1.1", outcome.snapshot().version());
        assertVersionChainMonotonic(ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.a"));
    }

    @Test
    void testDrift_RevertedDefinition_IsAnotherSuccessor() {
        // Given
        publisher.publish(attribute("test.a", "first"), context);
        publisher.publish(attribute("test.a", "second"), context);

        // When
        PublishOutcome outcome = publisher.publish(attribute("test.a", "first"), context);

        // Then
        assertTrue(outcome.isUpdated());
        assertEquals("1.2", outcome.snapshot().version());
        assertEquals(3, store.history(ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.a")).size());
    }
}
