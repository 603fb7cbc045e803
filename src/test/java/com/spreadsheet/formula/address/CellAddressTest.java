package com.spreadsheet.formula.address;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testParseSimpleAddress() {
        CellAddress address = CellAddress.parse("B10").orElseThrow();
        assertNull(address.getSheet());
        assertEquals(2, address.getColumn());
        assertEquals(10, address.getRow());
        assertFalse(address.isColumnAbsolute());
        assertFalse(address.isRowAbsolute());
    }

    @Test
    void testParseAnchorsAndSheets() {
        CellAddress anchored = CellAddress.parse("$C$3").orElseThrow();
        assertTrue(anchored.isColumnAbsolute());
        assertTrue(anchored.isRowAbsolute());

        CellAddress mixed = CellAddress.parse("C$3").orElseThrow();
        assertFalse(mixed.isColumnAbsolute());
        assertTrue(mixed.isRowAbsolute());

        CellAddress qualified = CellAddress.parse("Sheet2!AA1").orElseThrow();
        assertEquals("Sheet2", qualified.getSheet());
        assertEquals(27, qualified.getColumn());

        CellAddress quoted = CellAddress.parse("'My Sheet'!A1").orElseThrow();
        assertEquals("My Sheet", quoted.getSheet());

        CellAddress escaped = CellAddress.parse("'Bob''s'!A1").orElseThrow();
        assertEquals("Bob's", escaped.getSheet());
    }

    @Test
    void testLowerCaseColumnLetters() {
        assertEquals(CellAddress.of(28, 5), CellAddress.parse("ab5").orElseThrow());
    }

    /**
     * Malformed input is an empty result, never an exception.
     */
    @Test
    void testInvalidAddresses() {
        List<String> invalid = Arrays.asList("", "   ", "A0", "1A", "ABCD1", "A", "12", "A1B", "A-1",
                "A99999999999", "Sheet 2!A1", "'unterminated!A1", "!A1");
        for (String text : invalid) {
            assertEquals(Optional.empty(), CellAddress.parse(text), "should not parse: " + text);
        }
        assertEquals(Optional.empty(), CellAddress.parse(null));
    }

    @Test
    void testColumnNameConversions() {
        assertEquals(1, CellAddress.columnIndex("A"));
        assertEquals(26, CellAddress.columnIndex("Z"));
        assertEquals(27, CellAddress.columnIndex("AA"));
        assertEquals(703, CellAddress.columnIndex("AAA"));
        assertEquals("A", CellAddress.columnName(1));
        assertEquals("AZ", CellAddress.columnName(52));
        assertEquals("ZZZ", CellAddress.columnName(CellAddress.MAX_COLUMN));
    }

    @Test
    void testFormatRoundTrips() {
        List<String> texts = Arrays.asList("A1", "$B$2", "C$3", "$D4", "Sheet2!E5", "'My Sheet'!$F$6",
                "'Bob''s'!G7", "ZZZ1048576");
        for (String text : texts) {
            CellAddress parsed = CellAddress.parse(text).orElseThrow();
            assertEquals(text, parsed.format());
            assertEquals(parsed, CellAddress.parse(parsed.format()).orElseThrow());
        }
    }

    @Test
    void testFormatNormalizesCase() {
        assertEquals("AB12", CellAddress.parse("ab12").orElseThrow().format());
    }

    @Test
    void testPositionIgnoresAnchors() {
        CellAddress anchored = CellAddress.parse("$A$1").orElseThrow();
        CellAddress plain = CellAddress.parse("A1").orElseThrow();
        assertNotEquals(plain, anchored);
        assertEquals(plain, anchored.toPosition());
    }

    @Test
    void testInSheetOnlyFillsMissingSheet() {
        CellAddress plain = CellAddress.of(1, 1);
        assertEquals("Data", plain.inSheet("Data").getSheet());

        CellAddress qualified = CellAddress.of("Other", 1, 1);
        assertSame(qualified, qualified.inSheet("Data"));
    }

    @Test
    void testConstructorRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of(0, 1));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of(1, 0));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of(CellAddress.MAX_COLUMN + 1, 1));
    }
}
