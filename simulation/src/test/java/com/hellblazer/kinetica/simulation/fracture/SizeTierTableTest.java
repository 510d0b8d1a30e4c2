package com.hellblazer.kinetica.simulation.fracture;

import com.hellblazer.kinetica.common.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SizeTierTableTest {

    @Test
    void testDefaults() {
        var table = SizeTierTable.defaults();

        var large = table.get(3);
        assertEquals(8.0f, large.radius());
        assertEquals(20, large.points());
        assertEquals(2, large.childCount());
        assertEquals(2, large.childTier());
        assertTrue(table.get(1).isTerminal());
        assertEquals(large, table.largest());
        assertEquals(4, table.terminalDescendants(3));
        assertEquals(1, table.terminalDescendants(1));
    }

    @Test
    void testUnknownTier() {
        assertThrows(IllegalArgumentException.class, () -> SizeTierTable.defaults().get(7));
        assertFalse(SizeTierTable.defaults().contains(7));
    }

    @Test
    void testRejectsTableWithoutTerminalTier() {
        var rows = List.of(new SizeTier(2, 4, 2, 50, 2, 1), new SizeTier(1, 2, 1, 100, 2, 2));
        var e = assertThrows(InvalidConfigurationException.class, () -> new SizeTierTable(rows));
        assertTrue(e.getMessage().contains("terminal"));
    }

    @Test
    void testRejectsMissingChildTier() {
        var rows = List.of(new SizeTier(3, 8, 3, 20, 2, 2), SizeTier.terminal(1, 2, 1, 100));
        assertThrows(InvalidConfigurationException.class, () -> new SizeTierTable(rows));
    }

    @Test
    void testRejectsCycle() {
        var rows = List.of(new SizeTier(3, 8, 3, 20, 2, 2), new SizeTier(2, 4, 2, 50, 2, 3),
                           SizeTier.terminal(1, 2, 1, 100));
        assertThrows(InvalidConfigurationException.class, () -> new SizeTierTable(rows));
    }

    @Test
    void testRejectsMalformedRows() {
        assertThrows(InvalidConfigurationException.class, () -> new SizeTier(2, 4, 2, 50, 2, 2));
        assertThrows(InvalidConfigurationException.class, () -> new SizeTier(2, 0, 2, 50, 0, 0));
        assertThrows(InvalidConfigurationException.class, () -> new SizeTier(2, 4, 2, 50, -1, 0));
        assertThrows(InvalidConfigurationException.class, () -> new SizeTierTable(List.of()));
        assertThrows(InvalidConfigurationException.class,
                     () -> new SizeTierTable(List.of(SizeTier.terminal(1, 2, 1, 1), SizeTier.terminal(1, 3, 1, 1))));
    }
}
