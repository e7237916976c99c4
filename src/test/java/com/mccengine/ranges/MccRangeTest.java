package com.mccengine.ranges;

import com.mccengine.codes.Code;
import com.mccengine.common.exception.InvalidCodeFormatException;
import com.mccengine.common.exception.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MccRangeTest {

    private final MccRange agricultural = MccRange.of(700, 999, "Agricultural Services");

    @Test
    void testBounds_AreNormalized() {
        assertEquals("0700", agricultural.getStartCode());
        assertEquals("0999", agricultural.getEndCode());
        assertEquals("0700-0999", agricultural.toString());
        assertFalse(agricultural.isReserved());
    }

    @Test
    void testIncludes() {
        assertTrue(agricultural.includes(742));
        assertTrue(agricultural.includes("0700"));
        assertTrue(agricultural.includes("999"));
        assertTrue(agricultural.includes(Code.builder().mcc("0763").build()));
        assertFalse(agricultural.includes(1000));
        assertFalse(agricultural.includes("0699"));
    }

    @Test
    void testIncludes_MalformedValueIsOutside() {
        assertFalse(agricultural.includes("abc"));
        assertFalse(agricultural.includes(12345));
    }

    @Test
    void testSizeAndEnumerate() {
        List<String> codes = agricultural.enumerate();

        assertEquals(300, agricultural.size());
        assertEquals(300, codes.size());
        assertEquals("0700", codes.get(0));
        assertEquals("0999", codes.get(codes.size() - 1));
        assertNotSame(codes, agricultural.enumerate());
    }

    @Test
    void testSingleCodeRange() {
        MccRange range = MccRange.of("5411", "5411", "Grocery");

        assertEquals(1, range.size());
        assertEquals(List.of("5411"), range.enumerate());
    }

    @Test
    void testStartAfterEnd_Throws() {
        InvalidRangeException e = assertThrows(InvalidRangeException.class,
            () -> MccRange.of("5000", "4000", "Backwards"));

        assertEquals("Start code (5000) cannot be greater than end code (4000)", e.getMessage());
    }

    @Test
    void testMalformedBound_Throws() {
        assertThrows(InvalidCodeFormatException.class, () -> MccRange.of("12345", "9999", "Too long"));
    }

    @Test
    void testEquality_ByBoundsOnly() {
        MccRange renamed = MccRange.builder().start("0700").end("0999").name("Agriculture").reserved(true).build();

        assertEquals(agricultural, renamed);
        assertEquals(agricultural.hashCode(), renamed.hashCode());
        assertNotEquals(agricultural, MccRange.of(700, 998, "Agricultural Services"));
    }

    @Test
    void testToRecord() {
        MccRange reserved = MccRange.builder().start(0).end(699).name("Reserved").reserved(true).build();

        assertEquals("0000", reserved.toRecord().get("start_code"));
        assertEquals("0699", reserved.toRecord().get("end_code"));
        assertEquals(true, reserved.toRecord().get("reserved"));
        assertEquals("", reserved.toRecord().get("description"));
    }
}
