package com.mccengine.collection;

import com.mccengine.categories.RiskCategory;
import com.mccengine.codes.Code;
import com.mccengine.codes.CodeAttribute;
import com.mccengine.codes.DescriptionSource;
import com.mccengine.common.exception.CategoryNotFoundException;
import com.mccengine.common.exception.CodeNotFoundException;
import com.mccengine.common.exception.ConfigurationException;
import com.mccengine.config.MccConfiguration;
import com.mccengine.loader.JsonMccDataLoader;
import com.mccengine.ranges.MccRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Query tests against the bundled MCC dataset.
 */
class MccCollectionTest {

    private MccCollection collection;

    @BeforeEach
    void setUp() {
        collection = new MccCollection(MccConfiguration.defaults(), new JsonMccDataLoader());
    }

    private static List<String> mccs(List<Code> codes) {
        return codes.stream().map(Code::getMcc).collect(Collectors.toList());
    }

    @Test
    void testLazyLoading() {
        assertFalse(collection.isLoaded());

        assertTrue(collection.count() > 0);
        assertTrue(collection.isLoaded());
    }

    @Test
    void testAll_SameListWhileCached() {
        assertSame(collection.all(), collection.all());
        assertThrows(UnsupportedOperationException.class, () -> collection.all().clear());
    }

    @Test
    void testFind_AcceptsAnyCodeForm() {
        Code grocery = collection.find("5411").orElseThrow();

        assertEquals("Grocery Stores, Supermarkets", grocery.description());
        assertEquals(grocery, collection.find(5411).orElseThrow());
        assertEquals(grocery, collection.get(" 5411 ").orElseThrow());
        assertEquals("0742", collection.find(742).orElseThrow().getMcc());
    }

    @Test
    void testFind_UnknownOrMalformed() {
        assertTrue(collection.find("9999").isEmpty());
        assertTrue(collection.find("0000").isEmpty());
        assertTrue(collection.find(1).isEmpty());
        assertTrue(collection.find("grocery").isEmpty());
        assertTrue(collection.find(null).isEmpty());
    }

    @Test
    void testFind_EveryLoadedCodeRoundTrips() {
        for (Code code : collection.all()) {
            assertSame(code, collection.find(code.getMcc()).orElseThrow());
            assertSame(code, collection.find(code.toInt()).orElseThrow());
        }
    }

    @Test
    void testRanges_CoverEveryCodeExactlyOnce() {
        List<MccRange> ranges = collection.ranges();
        for (int value = 0; value <= 9999; value++) {
            int candidate = value;
            assertEquals(1, ranges.stream().filter(range -> range.includes(candidate)).count(),
                "ranges containing " + candidate);
        }
    }

    @Test
    void testFindOrThrow() {
        assertEquals("7995", collection.findOrThrow(7995).getMcc());

        CodeNotFoundException e = assertThrows(CodeNotFoundException.class, () -> collection.findOrThrow("9999"));
        assertEquals("MCC code not found: 9999", e.getMessage());
    }

    @Test
    void testValidAndExists() {
        assertTrue(collection.valid("5812"));
        assertTrue(collection.exists(8011));
        assertFalse(collection.valid("9999"));
        assertFalse(collection.exists("12345"));
    }

    @Test
    void testWhere_Equality() {
        List<Code> reportable = collection.where(Map.of(CodeAttribute.IRS_REPORTABLE, true));

        assertFalse(reportable.isEmpty());
        assertTrue(reportable.stream().allMatch(Code::isIrsReportable));
        assertTrue(mccs(reportable).contains("5411"));
        assertFalse(mccs(reportable).contains("7995"));
    }

    @Test
    void testWhere_CollectionMembership() {
        List<Code> codes = collection.where(Map.of(CodeAttribute.MCC, List.of("5411", "5812", "9999")));

        assertEquals(List.of("5411", "5812"), mccs(codes));
    }

    @Test
    void testWhere_CollectionMatchesAbsentValue() {
        List<Code> codes = collection.where(Map.of(CodeAttribute.IRS_REPORTABLE, Arrays.asList(Boolean.FALSE, null)));

        assertTrue(mccs(codes).contains("6211"));
        assertTrue(mccs(codes).contains("7995"));
        assertTrue(codes.stream().noneMatch(Code::isIrsReportable));
    }

    @Test
    void testWhere_Pattern() {
        List<Code> codes = collection.where(Map.of(CodeAttribute.ISO_DESCRIPTION, Pattern.compile("(?i)airline")));

        assertTrue(mccs(codes).contains("3000"));
        assertTrue(mccs(codes).contains("4511"));
        assertFalse(mccs(codes).contains("5411"));
    }

    @Test
    void testWhere_PatternOnAbsentAttribute() {
        List<Code> noAmex = collection.where(Map.of(CodeAttribute.AMEX_DESCRIPTION, Pattern.compile("^$")));

        assertTrue(mccs(noAmex).contains("0763"));
        assertFalse(mccs(noAmex).contains("5411"));
    }

    @Test
    void testWhere_Conjunction() {
        List<Code> codes = collection.where(Map.of(
            CodeAttribute.STRIPE_CODE, "airlines_air_carriers",
            CodeAttribute.IRS_REPORTABLE, false));

        assertTrue(mccs(codes).containsAll(List.of("3000", "4511")));
        assertTrue(codes.stream().allMatch(code -> "airlines_air_carriers".equals(code.getStripeCode())));
    }

    @Test
    void testWhere_NoConditionsReturnsAll() {
        assertSame(collection.all(), collection.where(Map.of()));
        assertSame(collection.all(), collection.whereAttributes(null));
    }

    @Test
    void testWhereAttributes() {
        List<Code> codes = collection.whereAttributes(Map.of("stripe_code", "veterinary_services"));

        assertEquals(List.of("0742"), mccs(codes));
        assertThrows(ConfigurationException.class, () -> collection.whereAttributes(Map.of("merchant", "x")));
    }

    @Test
    void testSearch_CaseInsensitiveAcrossFields() {
        assertTrue(mccs(collection.search("GROCERY")).contains("5411"));
        assertTrue(mccs(collection.search("veterinary_services")).contains("0742"));
        assertTrue(mccs(collection.search("BETTING/CASINO")).contains("7995"));
        assertEquals(List.of("5411"), mccs(collection.search("5411")));
    }

    @Test
    void testSearch_QueryCaseDoesNotMatter() {
        assertEquals(collection.search("grocery"), collection.search("GROCERY"));
        assertEquals(collection.search("veterinary services"), collection.search("Veterinary SERVICES"));
        assertFalse(collection.search("grocery").isEmpty());
    }

    @Test
    void testSearch_BlankReturnsAll() {
        assertSame(collection.all(), collection.search(""));
        assertSame(collection.all(), collection.search("   "));
        assertSame(collection.all(), collection.search(null));
        assertTrue(collection.search("no merchant is called this").isEmpty());
    }

    @Test
    void testInRange() {
        assertEquals(List.of("0742", "0763", "0780"), mccs(collection.inRange("Agricultural Services")));
        assertEquals(mccs(collection.inRange("Airlines")), mccs(collection.inRange("AIRLINES")));
        assertTrue(collection.inRange("Space Travel").isEmpty());
        assertTrue(collection.inRange(null).isEmpty());
    }

    @Test
    void testRanges_EligibleLeavesOutReserved() {
        List<MccRange> ranges = collection.ranges();
        List<MccRange> eligible = collection.eligibleRanges();

        assertTrue(ranges.stream().anyMatch(MccRange::isReserved));
        assertTrue(eligible.stream().noneMatch(MccRange::isReserved));
        assertEquals(ranges.size() - 2, eligible.size());
    }

    @Test
    void testRanges_EligibleIncludesReservedWhenConfigured() {
        MccCollection withReserved = new MccCollection(
            MccConfiguration.builder().includeReservedRanges(true).build(), new JsonMccDataLoader());

        assertEquals(withReserved.ranges(), withReserved.eligibleRanges());
    }

    @Test
    void testFindRange() {
        MccRange range = collection.findRange("agricultural services").orElseThrow();

        assertEquals("0700", range.getStartCode());
        assertEquals("0999", range.getEndCode());
    }

    @Test
    void testCode_Range() {
        assertEquals("Retail Outlet Services", collection.findOrThrow("5411").range().orElseThrow().getName());
        assertEquals("Car Rental", collection.findOrThrow("3351").range().orElseThrow().getName());
    }

    @Test
    void testInCategory() {
        assertEquals(List.of("7800", "7801", "7802", "7995", "9406"), mccs(collection.inCategory("gambling")));
        assertEquals(mccs(collection.inCategory("gambling")), mccs(collection.inCategory(" Gambling ")));
        assertTrue(collection.inCategory("unknown").isEmpty());
    }

    @Test
    void testInCategory_RangeEntries() {
        List<String> airlines = mccs(collection.inCategory("airlines"));

        assertTrue(airlines.containsAll(List.of("3000", "3001", "3005", "3058", "4415", "4511")));
        assertFalse(airlines.contains("3351"));
    }

    @Test
    void testCode_Categories() {
        Code betting = collection.findOrThrow("7995");

        List<String> ids = betting.categories().stream().map(RiskCategory::getId).collect(Collectors.toList());
        assertEquals(List.of("gambling", "high_risk"), ids);
        assertTrue(betting.inCategory("gambling"));
        assertTrue(betting.inCategory(collection.requireCategory("high_risk")));
        assertFalse(betting.inCategory("healthcare"));
        assertFalse(betting.inCategory("unknown"));
        assertTrue(collection.findOrThrow("8211").inCategory("education"));
        assertTrue(collection.findOrThrow("7273").inCategory("adult"));
        assertTrue(collection.findOrThrow("8011").inCategory("healthcare"));
    }

    @Test
    void testRequireCategory() {
        assertEquals("Gambling", collection.requireCategory("GAMBLING").getName());

        CategoryNotFoundException e = assertThrows(CategoryNotFoundException.class,
            () -> collection.requireCategory("crypto"));
        assertEquals("Category not found: crypto", e.getMessage());
    }

    @Test
    void testDefaultDescriptionSource_FromConfiguration() {
        MccCollection stripeFirst = new MccCollection(
            MccConfiguration.builder().defaultDescriptionSource(DescriptionSource.STRIPE).build(),
            new JsonMccDataLoader());

        assertEquals("Taxicabs/Limousines", stripeFirst.findOrThrow("4121").description());
        assertEquals("Taxicabs and Limousines", collection.findOrThrow("4121").description());
    }

    @Test
    void testDescription_FallsBackWhenPreferredSourceIsAbsent() {
        Code united = collection.findOrThrow("3000");

        assertNull(united.getIrsDescription());
        assertEquals("United Airlines", united.description(DescriptionSource.IRS));
    }

    @Test
    void testPublicView() {
        Map<String, Object> view = collection.findOrThrow("7995").toPublicView();

        assertEquals("7995", view.get("mcc"));
        assertEquals(List.of("gambling", "high_risk"), view.get("categories"));
        assertEquals("Business Services", view.get("range"));
        assertNotNull(view.get("description"));
    }
}
