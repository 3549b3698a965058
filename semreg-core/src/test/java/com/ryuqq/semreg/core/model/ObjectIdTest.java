package com.ryuqq.semreg.core.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ObjectId 파생 테스트.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class ObjectIdTest {

    @Test
    void of_SameTypeAndFqn_ReturnsSameId() {
        // When
        ObjectId first = ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.widget-name");
        ObjectId second = ObjectId.of(ObjectType.ATTRIBUTE_DEF, "test.widget-name");

        // Then
        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void of_DifferentType_ReturnsDifferentId() {
        // When
        ObjectId attribute = ObjectId.of(ObjectType.ATTRIBUTE_DEF, "entity.test-widget");
        ObjectId entity = ObjectId.of(ObjectType.ENTITY_TYPE_DEF, "entity.test-widget");

        // Then
        assertNotEquals(attribute, entity);
    }

    @Test
    void of_DifferentFqn_ReturnsDifferentId() {
        // When
        ObjectId a = ObjectId.of(ObjectType.VIEW_DEF, "view.test");
        ObjectId b = ObjectId.of(ObjectType.VIEW_DEF, "view.test2");

        // Then
        assertNotEquals(a, b);
    }

    @Test
    void of_SetsNameBasedVersionAndVariant() {
        // When
        UUID value = ObjectId.of(ObjectType.VERB_CONTRACT, "cbu.create").value();

        // Then
        assertEquals(5, value.version());
        assertEquals(2, value.variant());
    }

    @Test
    void of_NullType_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ObjectId.of(null, "entity.test-widget")
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankFqn_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ObjectId.of(ObjectType.ENTITY_TYPE_DEF, "  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void parse_ToStringValue_RestoresSameId() {
        // Given
        ObjectId original = ObjectId.of(ObjectType.TAXONOMY_DEF, "taxonomy.test");

        // When
        ObjectId parsed = ObjectId.parse(original.toString());

        // Then
        assertEquals(original, parsed);
    }

    @Test
    void parse_InvalidValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ObjectId.parse("not-a-uuid"));
    }
}
