package de.bsommerfeld.sysml.sql.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationTest {

    @Test
    void lowered_shouldDeriveStableIdentifier() {
        Relation first = Relation.lowered("B", "definition", "A", "PartDefinition");
        Relation second = Relation.lowered("B", "definition", "A", "PartDefinition");

        assertEquals(first.id(), second.id());
        assertEquals("PartDefinition", first.type());
        assertEquals("definition", first.name());
        assertEquals("B", first.originId());
        assertEquals("A", first.targetId());
    }

    @Test
    void lowered_shouldDistinguishRoles() {
        assertNotEquals(Relation.loweredId("B", "definition", "A"), Relation.loweredId("B", "owner", "A"));
    }

    @Test
    void loweredId_shouldNotCollideOnConcatenation() {
        assertNotEquals(Relation.loweredId("ab", "c", "d"), Relation.loweredId("a", "bc", "d"));
    }
}
