package org.dxworks.mathframe.parser;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    @Test
    void standard_IsBuiltOnce() {
        assertSame(SymbolTable.standard(), SymbolTable.standard());
    }

    @Test
    void lookup_DistinguishesGreekCase() {
        SymbolTable table = SymbolTable.standard();
        assertEquals(Optional.of("ω"), table.lookup("omega"));
        assertEquals(Optional.of("Ω"), table.lookup("Omega"));
    }

    @Test
    void lookup_OperatorsAndSpacing() {
        SymbolTable table = SymbolTable.standard();
        assertEquals(Optional.of("∞"), table.lookup("infty"));
        assertEquals(Optional.of("≤"), table.lookup("le"));
        assertEquals(Optional.of("→"), table.lookup("to"));
        assertEquals(Optional.of("  "), table.lookup("quad"));
        assertEquals(Optional.of(""), table.lookup(","));
    }

    @Test
    void lookup_UnknownIsEmpty() {
        assertTrue(SymbolTable.standard().lookup("qwerty").isEmpty());
        assertTrue(SymbolTable.standard().lookup("").isEmpty());
    }

    @Test
    void customTable_CopiesItsSource() {
        Map<String, String> source = new HashMap<>();
        source.put("degree", "°");
        SymbolTable table = new SymbolTable(source);
        source.put("later", "x");

        assertEquals(1, table.size());
        assertEquals(Optional.of("°"), table.lookup("degree"));
        assertTrue(table.lookup("later").isEmpty());
    }
}
