package com.hellblazer.kinetica.simulation.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SequentialLongIDGeneratorTest {

    @Test
    void testSequence() {
        var ids = new SequentialLongIDGenerator();
        assertEquals(new LongEntityID(1), ids.generateID());
        assertEquals(new LongEntityID(2), ids.generateID());
        assertEquals(3, ids.getCurrentValue());

        ids.reset();
        assertEquals(1, ids.generateID().getValue());
    }

    @Test
    void testIdsOrderAndPrint() {
        var low = new LongEntityID(4);
        var high = new LongEntityID(9);
        assertTrue(low.compareTo(high) < 0);
        assertEquals("Body[4]", low.toDebugString());

        var ship = new StringEntityID("p1");
        assertEquals("Ship[p1]", ship.toDebugString());
        assertEquals(new StringEntityID("p1"), ship);
        assertThrows(IllegalArgumentException.class, () -> new StringEntityID(" "));
    }
}
