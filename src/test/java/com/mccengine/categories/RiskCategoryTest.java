package com.mccengine.categories;

import com.mccengine.codes.Code;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskCategoryTest {

    private final RiskCategory airlines = RiskCategory.builder()
        .id("airlines")
        .name("Airlines")
        .description("Air carriers")
        .codes(List.of("3000-3350", "4415", 4511))
        .build();

    @Test
    void testIncludes_SingleCodes() {
        assertTrue(airlines.includes("4511"));
        assertTrue(airlines.includes(4415));
        assertFalse(airlines.includes("4512"));
    }

    @Test
    void testIncludes_RangeEntries() {
        assertTrue(airlines.includes(3000));
        assertTrue(airlines.includes("3175"));
        assertTrue(airlines.includes(Code.builder().mcc("3350").build()));
        assertFalse(airlines.includes("3351"));
        assertFalse(airlines.includes("2999"));
    }

    @Test
    void testIncludes_MalformedValue() {
        assertFalse(airlines.includes("airline"));
    }

    @Test
    void testEntries_AreNormalized() {
        RiskCategory category = RiskCategory.builder()
            .id(" Agriculture ")
            .codes(Arrays.asList(742, " 763 ", null, "700-999"))
            .build();

        assertEquals("agriculture", category.getId());
        assertEquals(List.of("0742", "763", "700-999"), category.getCodes());
        assertTrue(category.includes("0763"));
        assertTrue(category.includes(850));
        assertThrows(UnsupportedOperationException.class, () -> category.getCodes().add("5411"));
    }

    @Test
    void testEmptyCategory() {
        RiskCategory empty = RiskCategory.builder().id("empty").build();

        assertTrue(empty.getCodes().isEmpty());
        assertFalse(empty.includes("5411"));
    }

    @Test
    void testEquality_ById() {
        RiskCategory other = RiskCategory.builder().id("AIRLINES").name("Carriers").build();

        assertEquals(airlines, other);
        assertEquals("Airlines", airlines.toString());
    }

    @Test
    void testToRecord() {
        assertEquals("airlines", airlines.toRecord().get("id"));
        assertEquals(List.of("3000-3350", "4415", "4511"), airlines.toRecord().get("codes"));
    }
}
